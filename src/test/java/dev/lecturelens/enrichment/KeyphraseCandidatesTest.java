package dev.lecturelens.enrichment;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class KeyphraseCandidatesTest {

  @Test
  void unigramsAndBigramsInFirstAppearanceOrder() {
    assertThat(KeyphraseCandidates.from("The gradient descent algorithm"))
        .containsExactly(
            "gradient", "gradient descent", "descent", "descent algorithm", "algorithm");
  }

  @Test
  void dropsStopWordsBeforeBuildingBigrams() {
    assertThat(KeyphraseCandidates.from("entropy of the system"))
        .containsExactly("entropy", "entropy system", "system");
  }

  @Test
  void lowercasesAndDeduplicates() {
    assertThat(KeyphraseCandidates.from("Entropy entropy ENTROPY"))
        .containsExactly("entropy", "entropy entropy");
  }

  @Test
  void ignoresSingleCharacterTokensAndPunctuation() {
    assertThat(KeyphraseCandidates.from("x = y, and z!")).isEmpty();
  }
}
