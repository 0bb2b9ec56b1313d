package dev.lecturelens.transcript;

import org.jspecify.annotations.Nullable;

/** Treats every non-blank fragment as a complete window. A new fragment replaces the old one. */
public class PerFragmentSegmentBuffer implements SegmentBuffer {

  private @Nullable TranscriptFragment current;
  private int windowIndex;

  @Override
  public void add(TranscriptFragment fragment) {
    this.current = fragment;
  }

  @Override
  public boolean isReady() {
    return current != null && !current.isBlank();
  }

  @Override
  public String getText() {
    return current == null ? "" : current.text();
  }

  @Override
  public void advance() {
    current = null;
    windowIndex++;
  }

  @Override
  public int windowIndex() {
    return windowIndex;
  }

  @Override
  public int fragmentCount() {
    return current == null ? 0 : 1;
  }

  @Override
  public @Nullable String lastFragmentId() {
    return current == null ? null : current.id();
  }
}
