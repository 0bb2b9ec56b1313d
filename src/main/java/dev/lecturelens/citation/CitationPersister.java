package dev.lecturelens.citation;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Fire-and-forget persistence of a window's citations.
 *
 * <p>Runs on the {@code citationPersistenceExecutor} so the query response never waits for the
 * write. Failures are logged and absorbed.
 */
@Component
public class CitationPersister {

  private static final Logger log = LoggerFactory.getLogger(CitationPersister.class);

  private final CitationStore citationStore;

  public CitationPersister(CitationStore citationStore) {
    this.citationStore = citationStore;
  }

  @Async("citationPersistenceExecutor")
  public void persist(String sessionId, int windowIndex, List<Citation> citations) {
    if (citations.isEmpty()) {
      return;
    }
    try {
      List<String> ids = citationStore.append(sessionId, windowIndex, citations);
      log.debug(
          "Persisted {} citations for session {} window {}", ids.size(), sessionId, windowIndex);
    } catch (RuntimeException e) {
      log.error(
          "Failed to persist {} citations for session {} window {}: {}",
          citations.size(),
          sessionId,
          windowIndex,
          e.getMessage());
    }
  }
}
