package dev.lecturelens.transcript;

import org.jspecify.annotations.Nullable;

/**
 * Per-session accumulator that decides when enough transcript text has arrived to issue one
 * retrieval query.
 *
 * <p>States: {@link Status#EMPTY} → {@link Status#ACCUMULATING} on the first {@link #add}, →
 * {@link Status#READY} once {@link #isReady()} holds, back to ACCUMULATING or EMPTY on {@link
 * #advance()}. An instance is owned by a single session and is not thread-safe; the owner must
 * serialise access.
 *
 * @see BufferingPolicy
 */
public interface SegmentBuffer {

  /** Observable state of a buffer. */
  enum Status {
    EMPTY,
    ACCUMULATING,
    READY
  }

  /** Adds a fragment to the current window. */
  void add(TranscriptFragment fragment);

  /** Whether the current window should be queried now. Pure; safe to call repeatedly. */
  boolean isReady();

  /** Buffered fragment texts in arrival order, joined by single spaces. */
  String getText();

  /**
   * Closes the current window: the buffer keeps whatever overlap its policy retains and the
   * window index is incremented, even when the buffer was empty.
   */
  void advance();

  /** Index of the window currently accumulating. Strictly increases, starting at 0. */
  int windowIndex();

  /** Number of fragments currently buffered. */
  int fragmentCount();

  /** Id of the most recently added fragment still buffered, or null when empty. */
  @Nullable String lastFragmentId();

  default Status status() {
    if (fragmentCount() == 0) {
      return Status.EMPTY;
    }
    return isReady() ? Status.READY : Status.ACCUMULATING;
  }
}
