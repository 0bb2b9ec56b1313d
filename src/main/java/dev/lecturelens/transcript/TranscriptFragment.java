package dev.lecturelens.transcript;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * One piece of recognised speech as delivered by the speech-recognition collaborator. Immutable.
 *
 * @param id fragment identifier assigned by the producer (nullable when the producer has none)
 * @param text recognised text (never null, may be blank)
 * @param startTime start offset in seconds from the beginning of the session
 * @param endTime end offset in seconds
 * @param confidence recogniser confidence in [0, 1]
 * @param isFinal {@code false} for interim hypotheses that may still be revised
 */
public record TranscriptFragment(
    @Nullable String id,
    String text,
    double startTime,
    double endTime,
    double confidence,
    boolean isFinal) {

  public TranscriptFragment {
    Objects.requireNonNull(text, "text");
  }

  /** Convenience factory for a final fragment without timing information. */
  public static TranscriptFragment of(@Nullable String id, String text) {
    return new TranscriptFragment(id, text, 0.0, 0.0, 1.0, true);
  }

  public boolean isBlank() {
    return text.isBlank();
  }
}
