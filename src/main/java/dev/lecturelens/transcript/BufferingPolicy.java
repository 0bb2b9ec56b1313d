package dev.lecturelens.transcript;

/** Selects the {@link SegmentBuffer} implementation created for each session. */
public enum BufferingPolicy {
  /** Multi-sentence window with word/sentence/fragment triggers and one-fragment overlap. */
  WINDOWED,
  /** Every non-blank fragment is its own window; nothing is retained on advance. */
  PER_FRAGMENT
}
