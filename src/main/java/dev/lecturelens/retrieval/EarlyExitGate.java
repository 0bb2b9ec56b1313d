package dev.lecturelens.retrieval;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Skips reranking when no candidate is plausibly relevant.
 *
 * <p>Exits when the candidate list is empty or when the smallest distance exceeds the configured
 * distance threshold. This only avoids compute; precision filtering is the reranker's job.
 */
@Component
public class EarlyExitGate {

  private static final Logger log = LoggerFactory.getLogger(EarlyExitGate.class);

  private final RetrievalProperties properties;

  public EarlyExitGate(RetrievalProperties properties) {
    this.properties = properties;
  }

  public boolean shouldExit(List<Candidate> candidates) {
    if (candidates.isEmpty()) {
      log.debug("Early exit: no candidates");
      return true;
    }
    double minDistance = minDistance(candidates);
    boolean exit = minDistance > properties.getDistanceThreshold();
    if (exit) {
      log.debug(
          "Early exit: min distance {} > threshold {}",
          String.format("%.3f", minDistance),
          properties.getDistanceThreshold());
    }
    return exit;
  }

  static double minDistance(List<Candidate> candidates) {
    return candidates.stream()
        .mapToDouble(Candidate::distance)
        .min()
        .orElse(Double.POSITIVE_INFINITY);
  }
}
