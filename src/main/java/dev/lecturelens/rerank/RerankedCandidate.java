package dev.lecturelens.rerank;

import dev.lecturelens.retrieval.Candidate;

/**
 * A candidate with its pairwise relevance score. Every instance returned by {@link
 * RerankerService} has a score at or above the configured relevance threshold.
 *
 * @param candidate the underlying retrieval candidate
 * @param relevanceScore reranker score, higher is more relevant
 */
public record RerankedCandidate(Candidate candidate, double relevanceScore) {

  public String text() {
    return candidate.text();
  }
}
