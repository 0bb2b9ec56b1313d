package dev.lecturelens.transcript;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.From;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.Size;

/**
 * Property-based tests for {@link SlidingWindowSegmentBuffer} invariants: the window index only
 * grows, advance leaves at most the last fragment, and readiness is monotone in the hard word cap.
 */
class SegmentBufferPropertyTest {

  @Provide
  Arbitrary<String> fragmentTexts() {
    Arbitrary<String> word = Arbitraries.strings().alpha().ofMinLength(1).ofMaxLength(8);
    Arbitrary<String> terminal = Arbitraries.of("", "", ".", "?", "!");
    return word.list()
        .ofMinSize(0)
        .ofMaxSize(30)
        .flatMap(words -> terminal.map(t -> String.join(" ", words) + t));
  }

  @Property
  void advanceKeepsAtMostLastFragment(
      @ForAll @Size(max = 10) List<@From("fragmentTexts") String> texts) {
    SlidingWindowSegmentBuffer buffer = new SlidingWindowSegmentBuffer();
    for (int i = 0; i < texts.size(); i++) {
      buffer.add(TranscriptFragment.of("f" + i, texts.get(i)));
    }

    buffer.advance();

    assertThat(buffer.fragmentCount()).isLessThanOrEqualTo(1);
    if (!texts.isEmpty()) {
      assertThat(buffer.lastFragmentId()).isEqualTo("f" + (texts.size() - 1));
    }
    assertThat(buffer.windowIndex()).isEqualTo(1);
  }

  @Property
  void windowIndexIncrementsOncePerAdvance(@ForAll @IntRange(min = 0, max = 50) int advances) {
    SlidingWindowSegmentBuffer buffer = new SlidingWindowSegmentBuffer();
    for (int i = 0; i < advances; i++) {
      buffer.add(TranscriptFragment.of("f" + i, "text " + i));
      buffer.advance();
    }

    assertThat(buffer.windowIndex()).isEqualTo(advances);
  }

  @Property
  void alwaysReadyAtOrAboveMaxWords(
      @ForAll @Size(max = 10) List<@From("fragmentTexts") String> texts) {
    SlidingWindowSegmentBuffer buffer = new SlidingWindowSegmentBuffer(15, 40, 2, 3);
    texts.forEach(t -> buffer.add(TranscriptFragment.of(null, t)));

    if (SentenceCounter.countWords(buffer.getText()) >= 40) {
      assertThat(buffer.isReady()).isTrue();
    }
    if (SentenceCounter.countWords(buffer.getText()) < 15) {
      assertThat(buffer.isReady()).isFalse();
    }
  }
}
