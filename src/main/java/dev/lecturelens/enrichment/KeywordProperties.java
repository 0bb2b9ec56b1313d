package dev.lecturelens.enrichment;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Keyword extraction settings, bound from {@code lecturelens.keywords.*}.
 *
 * <p>Validated at startup via {@link #validate()}.
 */
@Configuration
@ConfigurationProperties(prefix = "lecturelens.keywords")
public class KeywordProperties {

  private int topN = 5;
  private int candidatePoolSize = 20;
  private int minTextLength = 10;
  private DiversityStrategy diversityStrategy = DiversityStrategy.MAX_SUM;
  private double diversity = 0.5;

  @PostConstruct
  void validate() {
    if (topN < 1) {
      throw new IllegalStateException("lecturelens.keywords.top-n must be >= 1, got: " + topN);
    }
    if (candidatePoolSize < topN || candidatePoolSize > 50) {
      throw new IllegalStateException(
          "lecturelens.keywords.candidate-pool-size must be in [top-n, 50], got: "
              + candidatePoolSize);
    }
    if (diversity < 0.0 || diversity > 1.0) {
      throw new IllegalStateException(
          "lecturelens.keywords.diversity must be in [0.0, 1.0], got: " + diversity);
    }
  }

  public int getTopN() {
    return topN;
  }

  public void setTopN(int topN) {
    this.topN = topN;
  }

  public int getCandidatePoolSize() {
    return candidatePoolSize;
  }

  public void setCandidatePoolSize(int candidatePoolSize) {
    this.candidatePoolSize = candidatePoolSize;
  }

  public int getMinTextLength() {
    return minTextLength;
  }

  public void setMinTextLength(int minTextLength) {
    this.minTextLength = minTextLength;
  }

  public DiversityStrategy getDiversityStrategy() {
    return diversityStrategy;
  }

  public void setDiversityStrategy(DiversityStrategy diversityStrategy) {
    this.diversityStrategy = diversityStrategy;
  }

  public double getDiversity() {
    return diversity;
  }

  public void setDiversity(double diversity) {
    this.diversity = diversity;
  }
}
