package dev.lecturelens.retrieval;

import static org.assertj.core.api.Assertions.assertThat;

import dev.lecturelens.fixture.CandidateBuilder;
import java.util.List;
import org.junit.jupiter.api.Test;

class EarlyExitGateTest {

  private final EarlyExitGate gate = new EarlyExitGate(new RetrievalProperties());

  @Test
  void exitsOnEmptyCandidateList() {
    assertThat(gate.shouldExit(List.of())).isTrue();
  }

  @Test
  void continuesWhenBestCandidateIsWithinThreshold() {
    assertThat(gate.shouldExit(CandidateBuilder.withDistances(0.3, 0.6, 1.9))).isFalse();
  }

  @Test
  void exitsWhenEveryCandidateIsTooFar() {
    assertThat(gate.shouldExit(CandidateBuilder.withDistances(1.6, 1.9))).isTrue();
  }

  @Test
  void thresholdItselfDoesNotExit() {
    assertThat(gate.shouldExit(CandidateBuilder.withDistances(1.5))).isFalse();
  }

  @Test
  void usesMinimumRegardlessOfOrder() {
    assertThat(EarlyExitGate.minDistance(CandidateBuilder.withDistances(1.9, 0.2, 0.8)))
        .isEqualTo(0.2);
  }

  @Test
  void honoursConfiguredThreshold() {
    RetrievalProperties properties = new RetrievalProperties();
    properties.setDistanceThreshold(0.5);

    assertThat(new EarlyExitGate(properties).shouldExit(CandidateBuilder.withDistances(0.6)))
        .isTrue();
  }
}
