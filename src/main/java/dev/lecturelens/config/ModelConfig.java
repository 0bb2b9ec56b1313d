package dev.lecturelens.config;

import dev.lecturelens.model.LazyModel;
import dev.lecturelens.model.ModelRegistry;
import dev.lecturelens.rerank.RerankerProperties;
import dev.lecturelens.retrieval.EmbeddingStoreVectorIndex;
import dev.lecturelens.retrieval.RetrievalProperties;
import dev.lecturelens.retrieval.VectorIndex;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2q.AllMiniLmL6V2QuantizedEmbeddingModel;
import dev.langchain4j.model.embedding.onnx.bgesmallenv15q.BgeSmallEnV15QuantizedEmbeddingModel;
import dev.langchain4j.model.scoring.ScoringModel;
import dev.langchain4j.model.scoring.onnx.OnnxScoringModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.pgvector.PgVectorEmbeddingStore;
import java.util.List;
import java.util.Map;
import javax.sql.DataSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configures the model handles and the document vector store.
 *
 * <p>All three models run in-process on ONNX Runtime and are wrapped in {@link LazyModel}
 * handles, so nothing is loaded until first use (or warm-up):
 *
 * <ul>
 *   <li>{@code queryEmbeddingModel}: bge-small-en-v1.5 quantized, 384 dimensions
 *   <li>{@code keywordEmbeddingModel}: all-MiniLM-L6-v2 quantized, keyphrase backbone
 *   <li>{@code scoringModel}: ms-marco TinyBERT cross-encoder from the configured paths
 * </ul>
 *
 * <p>The {@link PgVectorEmbeddingStore} shares the application's HikariCP {@link DataSource}.
 */
@Configuration
public class ModelConfig {

  static final String DOCUMENT_PASSAGES_TABLE = "document_passages";

  @Bean
  public LazyModel<EmbeddingModel> queryEmbeddingModel() {
    return new LazyModel<>("bge-small-en-v1.5-q", BgeSmallEnV15QuantizedEmbeddingModel::new);
  }

  @Bean
  public LazyModel<EmbeddingModel> keywordEmbeddingModel() {
    return new LazyModel<>("all-minilm-l6-v2-q", AllMiniLmL6V2QuantizedEmbeddingModel::new);
  }

  @Bean
  public LazyModel<ScoringModel> scoringModel(RerankerProperties properties) {
    return new LazyModel<>(
        "ms-marco-cross-encoder",
        () -> new OnnxScoringModel(properties.getModelPath(), properties.getTokenizerPath()));
  }

  @Bean
  public ModelRegistry modelRegistry(
      LazyModel<EmbeddingModel> queryEmbeddingModel,
      LazyModel<EmbeddingModel> keywordEmbeddingModel,
      LazyModel<ScoringModel> scoringModel) {
    return new ModelRegistry(List.of(queryEmbeddingModel, keywordEmbeddingModel, scoringModel));
  }

  /**
   * Passage store over the Flyway-managed {@code document_passages} table. {@code createTable}
   * and {@code useIndex} are disabled; the V1 migration owns schema and index.
   */
  @Bean
  public EmbeddingStore<TextSegment> documentPassageStore(
      DataSource dataSource, RetrievalProperties properties) {
    return PgVectorEmbeddingStore.datasourceBuilder()
        .datasource(dataSource)
        .table(DOCUMENT_PASSAGES_TABLE)
        .dimension(properties.getDimension())
        .createTable(false)
        .useIndex(false)
        .build();
  }

  @Bean
  public VectorIndex vectorIndex(
      EmbeddingStore<TextSegment> documentPassageStore, RetrievalProperties properties) {
    return new EmbeddingStoreVectorIndex(Map.of(properties.getNamespace(), documentPassageStore));
  }
}
