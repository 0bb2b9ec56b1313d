package dev.lecturelens.stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

import dev.lecturelens.rag.CitationQueryService;
import dev.lecturelens.transcript.BufferProperties;
import dev.lecturelens.transcript.SegmentBufferFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SessionStreamRegistryTest {

  private SessionStreamRegistry registry;
  private final SessionStreamListener listener = mock(SessionStreamListener.class);

  @BeforeEach
  void setUp() {
    registry =
        new SessionStreamRegistry(
            new SegmentBufferFactory(new BufferProperties()),
            mock(CitationQueryService.class),
            Runnable::run,
            new StreamProperties());
  }

  @Test
  void openRegistersStreamUnderConnectionId() {
    SessionStream stream = registry.open("conn-1", "s1", listener);

    assertThat(registry.get("conn-1")).isSameAs(stream);
    assertThat(stream.sessionId()).isEqualTo("s1");
    assertThat(registry.activeCount()).isEqualTo(1);
  }

  @Test
  void connectionsOfSameSessionGetIndependentStreams() {
    SessionStream first = registry.open("conn-1", "s1", listener);
    SessionStream second = registry.open("conn-2", "s1", listener);

    assertThat(first).isNotSameAs(second);
    assertThat(registry.activeCount()).isEqualTo(2);
  }

  @Test
  void closeRemovesAndClosesStream() {
    SessionStream stream = registry.open("conn-1", "s1", listener);

    registry.close("conn-1");

    assertThat(stream.isClosed()).isTrue();
    assertThat(registry.get("conn-1")).isNull();
    assertThat(registry.activeCount()).isZero();
  }

  @Test
  void closingUnknownConnectionIsNoOp() {
    registry.close("missing");

    assertThat(registry.activeCount()).isZero();
  }

  @Test
  void duplicateConnectionIdIsRejected() {
    registry.open("conn-1", "s1", listener);

    assertThatThrownBy(() -> registry.open("conn-1", "s2", listener))
        .isInstanceOf(IllegalStateException.class);
  }
}
