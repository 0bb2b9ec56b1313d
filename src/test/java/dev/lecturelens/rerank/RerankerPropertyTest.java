package dev.lecturelens.rerank;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import dev.lecturelens.model.LazyModel;
import dev.lecturelens.retrieval.Candidate;
import dev.lecturelens.retrieval.CandidateMetadata;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.scoring.ScoringModel;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.DoubleRange;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.Size;

/**
 * Property-based tests for {@link RerankerService} output invariants: bounded size, threshold,
 * descending order, and no survivor from outside the top {@code k} of its own sort.
 */
class RerankerPropertyTest {

  @Property
  void scoredOutputInvariants(
      @ForAll @Size(min = 1, max = 10) List<@DoubleRange(min = 0.0, max = 1.0) Double> scores,
      @ForAll @IntRange(min = 1, max = 5) int topK,
      @ForAll @DoubleRange(min = 0.0, max = 1.0) double threshold) {
    List<Candidate> candidates = candidates(scores.size());
    ScoringModel model = mock(ScoringModel.class);
    when(model.scoreAll(anyList(), anyString())).thenReturn(Response.from(scores));
    RerankerService service =
        new RerankerService(LazyModel.ready("ce", model), properties(threshold));

    List<RerankedCandidate> results = service.rerank("query", candidates, topK);

    assertThat(results).hasSizeLessThanOrEqualTo(topK);
    assertThat(results).allMatch(r -> r.relevanceScore() >= threshold);
    assertThat(results)
        .isSortedAccordingTo(
            Comparator.comparingDouble(RerankedCandidate::relevanceScore).reversed());

    Set<String> topKIds =
        IntStream.range(0, scores.size())
            .boxed()
            .sorted(Comparator.comparingDouble((Integer i) -> scores.get(i)).reversed())
            .limit(topK)
            .map(i -> "c" + i)
            .collect(Collectors.toSet());
    List<Double> topKScores =
        scores.stream().sorted(Comparator.reverseOrder()).limit(topK).toList();
    assertThat(results)
        .allMatch(
            r ->
                topKIds.contains(r.candidate().id())
                    || topKScores.contains(r.relevanceScore()));
  }

  @Property
  void fallbackNeverLetsCandidateBeyondTopKThrough(
      @ForAll @Size(min = 1, max = 10) List<@DoubleRange(min = 0.0, max = 2.0) Double> distances,
      @ForAll @IntRange(min = 1, max = 5) int topK) {
    List<Candidate> candidates = new ArrayList<>();
    for (int i = 0; i < distances.size(); i++) {
      candidates.add(
          new Candidate(
              "c" + i, "text " + i, new CandidateMetadata("d", "Doc", 1, null), distances.get(i)));
    }
    LazyModel<ScoringModel> unavailable =
        new LazyModel<>(
            "ce",
            () -> {
              throw new IllegalStateException("missing");
            });
    RerankerService service = new RerankerService(unavailable, properties(0.4));

    List<RerankedCandidate> results = service.rerank("query", candidates, topK);

    Set<String> firstK =
        candidates.stream().limit(topK).map(Candidate::id).collect(Collectors.toSet());
    assertThat(results).allMatch(r -> firstK.contains(r.candidate().id()));
    assertThat(results).allMatch(r -> r.relevanceScore() >= 0.4);
  }

  private static RerankerProperties properties(double threshold) {
    RerankerProperties properties = new RerankerProperties();
    properties.setApplySigmoid(false);
    properties.setRelevanceThreshold(threshold);
    return properties;
  }

  private static List<Candidate> candidates(int count) {
    List<Candidate> candidates = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      candidates.add(
          new Candidate(
              "c" + i, "text " + i, new CandidateMetadata("d" + i, "Doc", 1, null), 0.1 * i));
    }
    return candidates;
  }
}
