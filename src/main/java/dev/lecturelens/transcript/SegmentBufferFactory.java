package dev.lecturelens.transcript;

import org.springframework.stereotype.Component;

/** Creates a fresh {@link SegmentBuffer} per session according to the configured policy. */
@Component
public class SegmentBufferFactory {

  private final BufferProperties properties;

  public SegmentBufferFactory(BufferProperties properties) {
    this.properties = properties;
  }

  public SegmentBuffer create() {
    return switch (properties.getPolicy()) {
      case PER_FRAGMENT -> new PerFragmentSegmentBuffer();
      case WINDOWED ->
          new SlidingWindowSegmentBuffer(
              properties.getMinWords(),
              properties.getMaxWords(),
              properties.getMinSegments(),
              properties.getTargetSentences());
    };
  }
}
