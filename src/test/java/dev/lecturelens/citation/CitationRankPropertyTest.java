package dev.lecturelens.citation;

import static org.assertj.core.api.Assertions.assertThat;

import dev.lecturelens.fixture.CandidateBuilder;
import dev.lecturelens.rerank.RerankedCandidate;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.Size;

class CitationRankPropertyTest {

  private final CitationAssembler assembler = new CitationAssembler(new CitationProperties());

  @Property
  void ranksAreDenseFromOneWhateverIsDropped(@ForAll @Size(max = 12) List<Boolean> citable) {
    List<RerankedCandidate> reranked = new ArrayList<>();
    for (int i = 0; i < citable.size(); i++) {
      String documentId = citable.get(i) ? "doc-" + i : "";
      reranked.add(
          new RerankedCandidate(
              new CandidateBuilder().id("c" + i).documentId(documentId).build(), 0.9 - i * 0.01));
    }

    List<Citation> citations = assembler.assemble("s1", 0, null, reranked);

    long expected = citable.stream().filter(Boolean::booleanValue).count();
    assertThat(citations).hasSize((int) expected);
    assertThat(citations)
        .extracting(Citation::rank)
        .containsExactlyElementsOf(IntStream.rangeClosed(1, (int) expected).boxed().toList());
    assertThat(citations)
        .extracting(Citation::relevanceScore)
        .isSortedAccordingTo((a, b) -> Double.compare(b, a));
  }
}
