package dev.lecturelens.transcript;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for per-session segment buffering, bound from {@code
 * lecturelens.buffer.*}.
 *
 * <ul>
 *   <li>{@code policy} - {@link BufferingPolicy#WINDOWED} (default) or {@link
 *       BufferingPolicy#PER_FRAGMENT}
 *   <li>{@code min-words} - minimum words before a sentence or fragment trigger fires (default 15)
 *   <li>{@code max-words} - hard cap that forces a trigger (default 150)
 *   <li>{@code min-segments} - fragment count for the no-punctuation trigger (default 2)
 *   <li>{@code target-sentences} - sentence count for the sentence trigger (default 3)
 * </ul>
 *
 * <p>Thresholds only apply to the windowed policy.
 */
@Configuration
@ConfigurationProperties(prefix = "lecturelens.buffer")
public class BufferProperties {

  static final int DEFAULT_MIN_WORDS = 15;
  static final int DEFAULT_MAX_WORDS = 150;
  static final int DEFAULT_MIN_SEGMENTS = 2;
  static final int DEFAULT_TARGET_SENTENCES = 3;

  private BufferingPolicy policy = BufferingPolicy.WINDOWED;
  private int minWords = DEFAULT_MIN_WORDS;
  private int maxWords = DEFAULT_MAX_WORDS;
  private int minSegments = DEFAULT_MIN_SEGMENTS;
  private int targetSentences = DEFAULT_TARGET_SENTENCES;

  @PostConstruct
  void validate() {
    if (minWords < 0) {
      throw new IllegalStateException(
          "lecturelens.buffer.min-words must be >= 0, got: " + minWords);
    }
    if (maxWords <= minWords) {
      throw new IllegalStateException(
          "lecturelens.buffer.max-words must exceed min-words, got: " + maxWords);
    }
    if (minSegments < 1 || targetSentences < 1) {
      throw new IllegalStateException(
          "lecturelens.buffer.min-segments and target-sentences must be >= 1");
    }
  }

  public BufferingPolicy getPolicy() {
    return policy;
  }

  public void setPolicy(BufferingPolicy policy) {
    this.policy = policy;
  }

  public int getMinWords() {
    return minWords;
  }

  public void setMinWords(int minWords) {
    this.minWords = minWords;
  }

  public int getMaxWords() {
    return maxWords;
  }

  public void setMaxWords(int maxWords) {
    this.maxWords = maxWords;
  }

  public int getMinSegments() {
    return minSegments;
  }

  public void setMinSegments(int minSegments) {
    this.minSegments = minSegments;
  }

  public int getTargetSentences() {
    return targetSentences;
  }

  public void setTargetSentences(int targetSentences) {
    this.targetSentences = targetSentences;
  }
}
