package dev.lecturelens.retrieval;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;

import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EmbeddingStoreVectorIndexTest {

  private static final Embedding QUERY = Embedding.from(new float[] {1f, 0f});

  private InMemoryEmbeddingStore<TextSegment> store;
  private EmbeddingStoreVectorIndex index;

  @BeforeEach
  void setUp() {
    store = new InMemoryEmbeddingStore<>();
    index = new EmbeddingStoreVectorIndex(Map.of("documents", store));
  }

  @Test
  void returnsCandidatesAscendingByCosineDistance() {
    index.upsert("documents", "far", vector(-1f, 0f), passage("opposite", "s1", "doc-3"));
    index.upsert("documents", "near", vector(1f, 0f), passage("same", "s1", "doc-1"));
    index.upsert("documents", "mid", vector(0f, 1f), passage("orthogonal", "s1", "doc-2"));

    List<Candidate> candidates = index.query("documents", QUERY, 5, null);

    assertThat(candidates).extracting(Candidate::id).containsExactly("near", "mid", "far");
    assertThat(candidates.get(0).distance()).isCloseTo(0.0, within(1e-6));
    assertThat(candidates.get(1).distance()).isCloseTo(1.0, within(1e-6));
    assertThat(candidates.get(2).distance()).isCloseTo(2.0, within(1e-6));
  }

  @Test
  void mapsPassageMetadata() {
    Metadata metadata =
        Metadata.from("session_id", "s1")
            .put("document_id", "doc-1")
            .put("document_name", "Thermodynamics.pdf")
            .put("page_number", 12)
            .put("section_heading", "Entropy");
    index.upsert("documents", "p1", vector(1f, 0f), TextSegment.from("entropy text", metadata));

    Candidate candidate = index.query("documents", QUERY, 1, null).get(0);

    assertThat(candidate.text()).isEqualTo("entropy text");
    assertThat(candidate.metadata())
        .isEqualTo(new CandidateMetadata("doc-1", "Thermodynamics.pdf", 12, "Entropy"));
  }

  @Test
  void missingNameAndPageFallBackToDefaults() {
    index.upsert(
        "documents",
        "p1",
        vector(1f, 0f),
        TextSegment.from("text", Metadata.from("document_id", "doc-1")));

    CandidateMetadata metadata = index.query("documents", QUERY, 1, null).get(0).metadata();

    assertThat(metadata.documentName()).isEqualTo("Unknown");
    assertThat(metadata.pageNumber()).isZero();
    assertThat(metadata.sectionHeading()).isNull();
  }

  @Test
  void filterRestrictsToSession() {
    index.upsert("documents", "mine", vector(0.5f, 0.5f), passage("mine", "s1", "doc-1"));
    index.upsert("documents", "theirs", vector(1f, 0f), passage("theirs", "s2", "doc-2"));

    List<Candidate> candidates =
        index.query("documents", QUERY, 5, metadataKey("session_id").isEqualTo("s1"));

    assertThat(candidates).extracting(Candidate::id).containsExactly("mine");
  }

  @Test
  void respectsTopK() {
    for (int i = 0; i < 8; i++) {
      index.upsert("documents", "p" + i, vector(1f, i / 10f), passage("p" + i, "s1", "d" + i));
    }

    assertThat(index.query("documents", QUERY, 5, null)).hasSize(5);
  }

  @Test
  void unknownNamespaceIsVectorIndexError() {
    assertThatThrownBy(() -> index.query("slides", QUERY, 5, null))
        .isInstanceOf(VectorIndexException.class)
        .hasMessageContaining("slides");
  }

  @Test
  void storeFailureIsWrapped() {
    @SuppressWarnings("unchecked")
    EmbeddingStore<TextSegment> failing = mock(EmbeddingStore.class);
    given(failing.search(any(EmbeddingSearchRequest.class)))
        .willThrow(new IllegalStateException("connection refused"));
    EmbeddingStoreVectorIndex failingIndex =
        new EmbeddingStoreVectorIndex(Map.of("documents", failing));

    assertThatThrownBy(() -> failingIndex.query("documents", QUERY, 5, null))
        .isInstanceOf(VectorIndexException.class)
        .hasRootCauseMessage("connection refused");
  }

  @Test
  void scoreToDistanceConversion() {
    assertThat(EmbeddingStoreVectorIndex.toDistance(1.0)).isZero();
    assertThat(EmbeddingStoreVectorIndex.toDistance(0.5)).isEqualTo(1.0);
    assertThat(EmbeddingStoreVectorIndex.toDistance(0.0)).isEqualTo(2.0);
  }

  private static Embedding vector(float x, float y) {
    return Embedding.from(new float[] {x, y});
  }

  private static TextSegment passage(String text, String sessionId, String documentId) {
    return TextSegment.from(
        text, Metadata.from("session_id", sessionId).put("document_id", documentId));
  }
}
