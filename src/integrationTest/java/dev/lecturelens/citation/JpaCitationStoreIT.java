package dev.lecturelens.citation;

import static org.assertj.core.api.Assertions.assertThat;

import dev.lecturelens.BaseIntegrationTest;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

/**
 * Runs against the Flyway schema with ddl-auto=validate, so entity and migration drift fails the
 * context before any assertion.
 */
class JpaCitationStoreIT extends BaseIntegrationTest {

  @Autowired private CitationStore citationStore;

  @Test
  void appendedCitationsAreReadBackInWindowAndRankOrder() {
    citationStore.append("s1", 1, List.of(citation("s1", 1, 1, "doc-b")));
    List<String> ids =
        citationStore.append(
            "s1", 0, List.of(citation("s1", 0, 1, "doc-a"), citation("s1", 0, 2, "doc-c")));
    citationStore.append("s2", 0, List.of(citation("s2", 0, 1, "doc-z")));

    List<Citation> history = citationStore.findBySession("s1");

    assertThat(ids).hasSize(2).doesNotContainNull();
    assertThat(history)
        .extracting(Citation::documentId)
        .containsExactly("doc-a", "doc-c", "doc-b");
    assertThat(history.get(0).sectionHeading()).isEqualTo("Heading doc-a");
    assertThat(history.get(0).transcriptFragmentId()).isEqualTo("t1");
  }

  @Test
  void unknownSessionHasNoHistory() {
    assertThat(citationStore.findBySession("nobody")).isEmpty();
  }

  private static Citation citation(String session, int window, int rank, String documentId) {
    return new Citation(
        rank,
        documentId,
        documentId + ".pdf",
        3,
        "Heading " + documentId,
        "snippet of " + documentId,
        0.8,
        window,
        session,
        "t1");
  }
}
