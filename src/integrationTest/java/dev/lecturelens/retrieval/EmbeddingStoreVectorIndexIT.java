package dev.lecturelens.retrieval;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.lecturelens.BaseIntegrationTest;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.segment.TextSegment;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class EmbeddingStoreVectorIndexIT extends BaseIntegrationTest {

  @Autowired private VectorIndex vectorIndex;
  @Autowired private EmbeddingService embeddingService;
  @Autowired private RetrievalProperties properties;

  @Test
  void queryIsScopedToSessionAndOrderedByDistance() {
    index("s1", "doc-thermo", "Entropy measures the disorder of a thermodynamic system.");
    index("s1", "doc-bio", "Mitochondria produce ATP through cellular respiration.");
    index("s2", "doc-other", "Entropy always increases in an isolated system.");

    List<Candidate> candidates =
        vectorIndex.query(
            properties.getNamespace(),
            embeddingService.embedQuery("what is entropy in thermodynamics"),
            10,
            metadataKey(CandidateMetadata.SESSION_ID).isEqualTo("s1"));

    assertThat(candidates).hasSize(2);
    assertThat(candidates.get(0).metadata().documentId()).isEqualTo("doc-thermo");
    assertThat(candidates.get(0).metadata().documentName()).isEqualTo("doc-thermo.pdf");
    assertThat(candidates.get(0).metadata().pageNumber()).isEqualTo(7);
    assertThat(candidates.get(0).distance())
        .isGreaterThanOrEqualTo(0.0)
        .isLessThanOrEqualTo(candidates.get(1).distance());
  }

  @Test
  void unknownNamespaceFails() {
    assertThatThrownBy(
            () ->
                vectorIndex.query("missing", embeddingService.embedQuery("entropy"), 5, null))
        .isInstanceOf(VectorIndexException.class);
  }

  private void index(String session, String documentId, String text) {
    Metadata metadata =
        new Metadata()
            .put(CandidateMetadata.SESSION_ID, session)
            .put(CandidateMetadata.DOCUMENT_ID, documentId)
            .put(CandidateMetadata.DOCUMENT_NAME, documentId + ".pdf")
            .put(CandidateMetadata.PAGE_NUMBER, 7);
    vectorIndex.upsert(
        properties.getNamespace(),
        UUID.randomUUID().toString(),
        embeddingService.embedQuery(text),
        TextSegment.from(text, metadata));
  }
}
