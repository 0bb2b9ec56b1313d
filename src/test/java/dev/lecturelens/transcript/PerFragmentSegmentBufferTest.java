package dev.lecturelens.transcript;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class PerFragmentSegmentBufferTest {

  private final PerFragmentSegmentBuffer buffer = new PerFragmentSegmentBuffer();

  @Test
  void everyNonBlankFragmentIsReady() {
    buffer.add(TranscriptFragment.of("f1", "gradient"));

    assertThat(buffer.isReady()).isTrue();
    assertThat(buffer.getText()).isEqualTo("gradient");
    assertThat(buffer.lastFragmentId()).isEqualTo("f1");
  }

  @Test
  void blankFragmentIsNotReady() {
    buffer.add(TranscriptFragment.of("f1", "   "));

    assertThat(buffer.isReady()).isFalse();
  }

  @Test
  void addReplacesCurrentFragment() {
    buffer.add(TranscriptFragment.of("f1", "first"));
    buffer.add(TranscriptFragment.of("f2", "second"));

    assertThat(buffer.getText()).isEqualTo("second");
    assertThat(buffer.fragmentCount()).isEqualTo(1);
  }

  @Test
  void advanceClearsAndIncrementsIndex() {
    buffer.add(TranscriptFragment.of("f1", "first"));

    buffer.advance();

    assertThat(buffer.fragmentCount()).isZero();
    assertThat(buffer.getText()).isEmpty();
    assertThat(buffer.windowIndex()).isEqualTo(1);
    assertThat(buffer.status()).isEqualTo(SegmentBuffer.Status.EMPTY);
  }
}
