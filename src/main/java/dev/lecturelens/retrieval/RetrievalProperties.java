package dev.lecturelens.retrieval;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for embedding and candidate retrieval.
 *
 * <p>Properties are bound from {@code lecturelens.retrieval.*}.
 *
 * <ul>
 *   <li>{@code namespace} - logical collection queried (default {@code documents})
 *   <li>{@code top-k-candidates} - candidates fetched per query (default 5, bounded [1, 10])
 *   <li>{@code distance-threshold} - early-exit cutoff on the best candidate distance (default 1.5)
 *   <li>{@code dimension} - vector dimension the index was built with (default 384)
 *   <li>{@code query-prefix} - instruction prepended to queries before embedding
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "lecturelens.retrieval")
public class RetrievalProperties {

  /** Retrieval instruction recommended for bge-small-en-v1.5 queries (not for passages). */
  public static final String BGE_QUERY_PREFIX =
      "Represent this sentence for searching relevant passages: ";

  private String namespace = "documents";
  private int topKCandidates = 5;
  private double distanceThreshold = 1.5;
  private int dimension = 384;
  private String queryPrefix = BGE_QUERY_PREFIX;

  @PostConstruct
  void validate() {
    if (namespace == null || namespace.isBlank()) {
      throw new IllegalStateException("lecturelens.retrieval.namespace must not be blank");
    }
    if (topKCandidates < 1 || topKCandidates > 10) {
      throw new IllegalStateException(
          "lecturelens.retrieval.top-k-candidates must be in [1, 10], got: " + topKCandidates);
    }
    if (distanceThreshold < 0.0) {
      throw new IllegalStateException(
          "lecturelens.retrieval.distance-threshold must be >= 0, got: " + distanceThreshold);
    }
    if (dimension < 1) {
      throw new IllegalStateException(
          "lecturelens.retrieval.dimension must be >= 1, got: " + dimension);
    }
  }

  public String getNamespace() {
    return namespace;
  }

  public void setNamespace(String namespace) {
    this.namespace = namespace;
  }

  public int getTopKCandidates() {
    return topKCandidates;
  }

  public void setTopKCandidates(int topKCandidates) {
    this.topKCandidates = topKCandidates;
  }

  public double getDistanceThreshold() {
    return distanceThreshold;
  }

  public void setDistanceThreshold(double distanceThreshold) {
    this.distanceThreshold = distanceThreshold;
  }

  public int getDimension() {
    return dimension;
  }

  public void setDimension(int dimension) {
    this.dimension = dimension;
  }

  public String getQueryPrefix() {
    return queryPrefix;
  }

  public void setQueryPrefix(String queryPrefix) {
    this.queryPrefix = queryPrefix == null ? "" : queryPrefix;
  }
}
