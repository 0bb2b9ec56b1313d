package dev.lecturelens.citation;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Citation assembly and persistence settings, bound from {@code lecturelens.citation.*}.
 *
 * <p>{@code snippet-length} caps the snippet text (default 200). {@code retry.*} bounds the
 * persistence retries on transient database errors.
 */
@Configuration
@ConfigurationProperties(prefix = "lecturelens.citation")
public class CitationProperties {

  private int snippetLength = 200;
  private final Retry retry = new Retry();

  @PostConstruct
  void validate() {
    if (snippetLength < 1) {
      throw new IllegalStateException(
          "lecturelens.citation.snippet-length must be >= 1, got: " + snippetLength);
    }
  }

  public int getSnippetLength() {
    return snippetLength;
  }

  public void setSnippetLength(int snippetLength) {
    this.snippetLength = snippetLength;
  }

  public Retry getRetry() {
    return retry;
  }

  public static class Retry {

    private int maxAttempts = 3;
    private long delayMs = 200;
    private double multiplier = 2.0;

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public long getDelayMs() {
      return delayMs;
    }

    public void setDelayMs(long delayMs) {
      this.delayMs = delayMs;
    }

    public double getMultiplier() {
      return multiplier;
    }

    public void setMultiplier(double multiplier) {
      this.multiplier = multiplier;
    }
  }
}
