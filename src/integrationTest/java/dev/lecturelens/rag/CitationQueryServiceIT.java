package dev.lecturelens.rag;

import static org.assertj.core.api.Assertions.assertThat;

import dev.lecturelens.BaseIntegrationTest;
import dev.lecturelens.retrieval.CandidateMetadata;
import dev.lecturelens.retrieval.EmbeddingService;
import dev.lecturelens.retrieval.RetrievalProperties;
import dev.lecturelens.retrieval.VectorIndex;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.segment.TextSegment;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

/**
 * End-to-end query with the real embedding models. No cross-encoder files are configured, so
 * reranking runs in fallback mode on vector distances.
 */
class CitationQueryServiceIT extends BaseIntegrationTest {

  @Autowired private CitationQueryService citationQueryService;
  @Autowired private VectorIndex vectorIndex;
  @Autowired private EmbeddingService embeddingService;
  @Autowired private RetrievalProperties properties;

  @Test
  void lectureWindowIsAnsweredWithCitationFromItsSession() {
    String passage =
        "The second law of thermodynamics states that the entropy of an isolated system never"
            + " decreases.";
    Metadata metadata =
        new Metadata()
            .put(CandidateMetadata.SESSION_ID, "lecture-1")
            .put(CandidateMetadata.DOCUMENT_ID, "doc-thermo")
            .put(CandidateMetadata.DOCUMENT_NAME, "Thermodynamics.pdf")
            .put(CandidateMetadata.PAGE_NUMBER, 12)
            .put(CandidateMetadata.SECTION_HEADING, "Second Law");
    vectorIndex.upsert(
        properties.getNamespace(),
        UUID.randomUUID().toString(),
        embeddingService.embedQuery(passage),
        TextSegment.from(passage, metadata));

    CitationQueryResponse response =
        citationQueryService.query(
            "lecture-1",
            "So today we look at the second law of thermodynamics and why entropy grows.",
            0,
            "frag-1");

    assertThat(response.windowIndex()).isZero();
    assertThat(response.queryMetadata().keywords()).isNotEmpty();
    assertThat(response.citations()).isNotEmpty();
    assertThat(response.citations().get(0).rank()).isEqualTo(1);
    assertThat(response.citations().get(0).documentName()).isEqualTo("Thermodynamics.pdf");
    assertThat(response.citations().get(0).pageNumber()).isEqualTo(12);
    assertThat(response.citations().get(0).sessionId()).isEqualTo("lecture-1");
  }

  @Test
  void otherSessionsPassagesAreNeverCited() {
    String passage = "Entropy of an isolated system never decreases.";
    vectorIndex.upsert(
        properties.getNamespace(),
        UUID.randomUUID().toString(),
        embeddingService.embedQuery(passage),
        TextSegment.from(
            passage,
            new Metadata()
                .put(CandidateMetadata.SESSION_ID, "lecture-2")
                .put(CandidateMetadata.DOCUMENT_ID, "doc-x")));

    CitationQueryResponse response =
        citationQueryService.query("lecture-1", "entropy of an isolated system", 0, null);

    assertThat(response.citations()).isEmpty();
  }
}
