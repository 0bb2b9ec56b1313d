package dev.lecturelens.rerank;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Cross-encoder reranking configuration, bound from {@code lecturelens.reranker.*}.
 *
 * <ul>
 *   <li>{@code model-path} / {@code tokenizer-path} - ONNX cross-encoder and its tokenizer
 *   <li>{@code top-k-results} - candidates kept after sorting (default 3)
 *   <li>{@code relevance-threshold} - minimum score to survive (default 0.4)
 *   <li>{@code apply-sigmoid} - map raw logits into [0, 1] (default true)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "lecturelens.reranker")
public class RerankerProperties {

  private String modelPath = "models/ms-marco-TinyBERT-L-2-v2/model.onnx";
  private String tokenizerPath = "models/ms-marco-TinyBERT-L-2-v2/tokenizer.json";
  private int topKResults = 3;
  private double relevanceThreshold = 0.4;
  private boolean applySigmoid = true;

  @PostConstruct
  void validate() {
    if (topKResults < 1) {
      throw new IllegalStateException(
          "lecturelens.reranker.top-k-results must be >= 1, got: " + topKResults);
    }
  }

  public String getModelPath() {
    return modelPath;
  }

  public void setModelPath(String modelPath) {
    this.modelPath = modelPath;
  }

  public String getTokenizerPath() {
    return tokenizerPath;
  }

  public void setTokenizerPath(String tokenizerPath) {
    this.tokenizerPath = tokenizerPath;
  }

  public int getTopKResults() {
    return topKResults;
  }

  public void setTopKResults(int topKResults) {
    this.topKResults = topKResults;
  }

  public double getRelevanceThreshold() {
    return relevanceThreshold;
  }

  public void setRelevanceThreshold(double relevanceThreshold) {
    this.relevanceThreshold = relevanceThreshold;
  }

  public boolean isApplySigmoid() {
    return applySigmoid;
  }

  public void setApplySigmoid(boolean applySigmoid) {
    this.applySigmoid = applySigmoid;
  }
}
