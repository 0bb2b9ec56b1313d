package dev.lecturelens.enrichment;

/** How keyphrases are diversified within the candidate pool. */
public enum DiversityStrategy {
  /** Pick the {@code topN} pool members with the smallest pairwise similarity sum. */
  MAX_SUM,
  /** Maximal marginal relevance, greedily trading document similarity against redundancy. */
  MMR
}
