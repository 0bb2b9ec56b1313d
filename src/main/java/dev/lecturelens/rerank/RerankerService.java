package dev.lecturelens.rerank;

import dev.lecturelens.model.LazyModel;
import dev.lecturelens.model.ModelUnavailableException;
import dev.lecturelens.retrieval.Candidate;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.scoring.ScoringModel;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Cross-encoder reranking that re-scores retrieval candidates using an ONNX scoring model
 * (ms-marco TinyBERT).
 *
 * <p>Scores every (query, passage) pair, sorts descending, truncates to {@code topK}, then drops
 * anything under the relevance threshold. Truncation happens before thresholding and the order is
 * kept afterwards, so a candidate ranked below {@code topK} never survives even when its score
 * clears the threshold.
 *
 * <p>When the model cannot be loaded or scoring throws, scores are derived from distance as {@code
 * max(0, 1 - distance / 2)}; candidates keep their retrieval order and go through the same
 * truncate-then-threshold step. The failure is logged, not raised.
 */
@Service
public class RerankerService {

  private static final Logger log = LoggerFactory.getLogger(RerankerService.class);

  private final LazyModel<ScoringModel> scoringModel;
  private final RerankerProperties properties;

  public RerankerService(LazyModel<ScoringModel> scoringModel, RerankerProperties properties) {
    this.scoringModel = scoringModel;
    this.properties = properties;
  }

  /** Reranks with the configured {@code top-k-results}. */
  public List<RerankedCandidate> rerank(String query, List<Candidate> candidates) {
    return rerank(query, candidates, properties.getTopKResults());
  }

  /**
   * Reranks candidates against the query text.
   *
   * @param query the transcript text the candidates were retrieved for
   * @param candidates retrieval candidates, ascending by distance
   * @param topK maximum number of results
   * @return surviving candidates, highest score first
   */
  public List<RerankedCandidate> rerank(String query, List<Candidate> candidates, int topK) {
    if (candidates.isEmpty()) {
      return List.of();
    }

    List<RerankedCandidate> ranked;
    try {
      List<Double> scores = score(query, candidates);
      ranked =
          IntStream.range(0, candidates.size())
              .mapToObj(i -> new RerankedCandidate(candidates.get(i), scores.get(i)))
              .sorted(Comparator.comparingDouble(RerankedCandidate::relevanceScore).reversed())
              .toList();
    } catch (ModelUnavailableException e) {
      log.warn("Cross-encoder unavailable, using distance fallback");
      ranked = fallback(candidates);
    } catch (RuntimeException e) {
      log.error("Cross-encoder scoring failed, using distance fallback: {}", e.getMessage());
      ranked = fallback(candidates);
    }

    double threshold = properties.getRelevanceThreshold();
    List<RerankedCandidate> results =
        ranked.stream().limit(topK).filter(r -> r.relevanceScore() >= threshold).toList();
    log.info("Reranked: {}/{} passed threshold {}", results.size(), candidates.size(), threshold);
    return results;
  }

  private List<Double> score(String query, List<Candidate> candidates) {
    List<TextSegment> segments = candidates.stream().map(c -> TextSegment.from(c.text())).toList();
    List<Double> raw = scoringModel.get().scoreAll(segments, query).content();
    if (raw.size() != candidates.size()) {
      throw new IllegalStateException(
          "Scoring model returned "
              + raw.size()
              + " scores for "
              + candidates.size()
              + " passages");
    }
    if (log.isDebugEnabled()) {
      log.debug("Raw rerank scores: {}", raw);
    }
    return properties.isApplySigmoid() ? raw.stream().map(RerankerService::sigmoid).toList() : raw;
  }

  static List<RerankedCandidate> fallback(List<Candidate> candidates) {
    return candidates.stream()
        .map(c -> new RerankedCandidate(c, distanceToRelevance(c.distance())))
        .toList();
  }

  static double distanceToRelevance(double distance) {
    return Math.max(0.0, 1.0 - distance / 2.0);
  }

  static double sigmoid(double logit) {
    return 1.0 / (1.0 + Math.exp(-logit));
  }
}
