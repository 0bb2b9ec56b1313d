package dev.lecturelens.citation;

import static org.assertj.core.api.Assertions.assertThat;

import dev.lecturelens.fixture.CandidateBuilder;
import dev.lecturelens.rerank.RerankedCandidate;
import java.util.List;
import org.junit.jupiter.api.Test;

class CitationAssemblerTest {

  private final CitationAssembler assembler = new CitationAssembler(new CitationProperties());

  @Test
  void assignsDenseRanksFromOne() {
    List<RerankedCandidate> reranked =
        List.of(
            new RerankedCandidate(new CandidateBuilder().id("a").documentId("d1").build(), 0.9),
            new RerankedCandidate(new CandidateBuilder().id("b").documentId("d2").build(), 0.7));

    List<Citation> citations = assembler.assemble("s1", 4, "frag-9", reranked);

    assertThat(citations).extracting(Citation::rank).containsExactly(1, 2);
    assertThat(citations).extracting(Citation::documentId).containsExactly("d1", "d2");
    assertThat(citations).allSatisfy(c -> {
      assertThat(c.sessionId()).isEqualTo("s1");
      assertThat(c.windowIndex()).isEqualTo(4);
      assertThat(c.transcriptFragmentId()).isEqualTo("frag-9");
    });
  }

  @Test
  void copiesMetadataAndScore() {
    RerankedCandidate reranked =
        new RerankedCandidate(
            new CandidateBuilder()
                .documentId("doc-7")
                .documentName("Genetics.pdf")
                .pageNumber(33)
                .sectionHeading("Mendel")
                .text("Alleles segregate.")
                .build(),
            0.81);

    Citation citation = assembler.assemble("s1", 0, null, List.of(reranked)).get(0);

    assertThat(citation)
        .isEqualTo(
            new Citation(
                1, "doc-7", "Genetics.pdf", 33, "Mendel", "Alleles segregate.", 0.81, 0, "s1",
                null));
  }

  @Test
  void dropsCandidatesWithoutDocumentIdWithoutLeavingGaps() {
    List<RerankedCandidate> reranked =
        List.of(
            new RerankedCandidate(new CandidateBuilder().id("a").documentId("d1").build(), 0.9),
            new RerankedCandidate(new CandidateBuilder().id("b").documentId(null).build(), 0.8),
            new RerankedCandidate(new CandidateBuilder().id("c").documentId("d3").build(), 0.7));

    List<Citation> citations = assembler.assemble("s1", 0, null, reranked);

    assertThat(citations).extracting(Citation::rank).containsExactly(1, 2);
    assertThat(citations).extracting(Citation::documentId).containsExactly("d1", "d3");
  }

  @Test
  void truncatesSnippetToConfiguredLength() {
    String longText = "x".repeat(500);
    RerankedCandidate reranked =
        new RerankedCandidate(new CandidateBuilder().text(longText).build(), 0.9);

    Citation citation = assembler.assemble("s1", 0, null, List.of(reranked)).get(0);

    assertThat(citation.snippet()).hasSize(200);
  }

  @Test
  void shortSnippetIsKeptWhole() {
    assertThat(assembler.snippet("short passage")).isEqualTo("short passage");
  }

  @Test
  void emptyInputGivesNoCitations() {
    assertThat(assembler.assemble("s1", 0, null, List.of())).isEmpty();
  }
}
