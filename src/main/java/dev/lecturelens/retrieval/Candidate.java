package dev.lecturelens.retrieval;

import java.util.Objects;

/**
 * A passage returned by the vector index for one query, before reranking.
 *
 * @param id passage id in the index
 * @param text passage text
 * @param metadata citation metadata
 * @param distance dissimilarity to the query; lower is more similar
 */
public record Candidate(String id, String text, CandidateMetadata metadata, double distance) {

  public Candidate {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(metadata, "metadata");
    text = Objects.requireNonNullElse(text, "");
    if (Double.isNaN(distance)) {
      throw new IllegalArgumentException("distance must not be NaN for candidate " + id);
    }
  }
}
