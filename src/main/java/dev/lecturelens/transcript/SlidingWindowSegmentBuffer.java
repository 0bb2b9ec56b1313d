package dev.lecturelens.transcript;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Accumulates fragments into a multi-sentence window.
 *
 * <p>The window is ready when any one of these holds:
 *
 * <ol>
 *   <li>word count ≥ {@code maxWords} (hard cap)
 *   <li>sentence count ≥ {@code targetSentences} and word count ≥ {@code minWords}
 *   <li>fragment count ≥ {@code minSegments} and word count ≥ {@code minWords}, for recognisers
 *       that never emit punctuation
 * </ol>
 *
 * <p>{@link #advance()} keeps the last fragment so the next window starts with the previous
 * window's closing context.
 */
public class SlidingWindowSegmentBuffer implements SegmentBuffer {

  private static final Logger log = LoggerFactory.getLogger(SlidingWindowSegmentBuffer.class);

  private final int minWords;
  private final int maxWords;
  private final int minSegments;
  private final int targetSentences;

  private final List<TranscriptFragment> fragments = new ArrayList<>();
  private int windowIndex;

  public SlidingWindowSegmentBuffer(
      int minWords, int maxWords, int minSegments, int targetSentences) {
    if (minWords < 0 || maxWords < 1 || minSegments < 1 || targetSentences < 1) {
      throw new IllegalArgumentException(
          "Invalid window thresholds: minWords=%d maxWords=%d minSegments=%d targetSentences=%d"
              .formatted(minWords, maxWords, minSegments, targetSentences));
    }
    this.minWords = minWords;
    this.maxWords = maxWords;
    this.minSegments = minSegments;
    this.targetSentences = targetSentences;
  }

  /** Window with the default thresholds (15 / 150 / 2 / 3). */
  public SlidingWindowSegmentBuffer() {
    this(
        BufferProperties.DEFAULT_MIN_WORDS,
        BufferProperties.DEFAULT_MAX_WORDS,
        BufferProperties.DEFAULT_MIN_SEGMENTS,
        BufferProperties.DEFAULT_TARGET_SENTENCES);
  }

  @Override
  public void add(TranscriptFragment fragment) {
    fragments.add(fragment);
  }

  @Override
  public boolean isReady() {
    String text = getText();
    int words = SentenceCounter.countWords(text);
    if (words >= maxWords) {
      log.debug("Window {} ready: {} words >= max {}", windowIndex, words, maxWords);
      return true;
    }
    if (words < minWords) {
      return false;
    }
    int sentences = SentenceCounter.countSentences(text);
    if (sentences >= targetSentences) {
      log.debug("Window {} ready: {} sentences, {} words", windowIndex, sentences, words);
      return true;
    }
    if (fragments.size() >= minSegments) {
      log.debug("Window {} ready: {} fragments, {} words", windowIndex, fragments.size(), words);
      return true;
    }
    return false;
  }

  @Override
  public String getText() {
    return fragments.stream().map(TranscriptFragment::text).collect(Collectors.joining(" "));
  }

  @Override
  public void advance() {
    if (!fragments.isEmpty()) {
      TranscriptFragment last = fragments.get(fragments.size() - 1);
      fragments.clear();
      fragments.add(last);
    }
    windowIndex++;
  }

  @Override
  public int windowIndex() {
    return windowIndex;
  }

  @Override
  public int fragmentCount() {
    return fragments.size();
  }

  @Override
  public @Nullable String lastFragmentId() {
    return fragments.isEmpty() ? null : fragments.get(fragments.size() - 1).id();
  }

  /** Snapshot of the buffered fragments, oldest first. */
  public List<TranscriptFragment> fragments() {
    return List.copyOf(fragments);
  }
}
