package dev.lecturelens.citation;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@link CitationStore} backed by the {@code citations} table.
 *
 * <p>Each window is written in one transaction. Transient database errors are retried with
 * exponential backoff; the last failure propagates to the caller.
 */
@Service
public class JpaCitationStore implements CitationStore {

  private static final Logger log = LoggerFactory.getLogger(JpaCitationStore.class);

  private final CitationRepository repository;

  public JpaCitationStore(CitationRepository repository) {
    this.repository = repository;
  }

  @Override
  @Transactional
  @Retryable(
      retryFor = TransientDataAccessException.class,
      maxAttemptsExpression = "${lecturelens.citation.retry.max-attempts:3}",
      backoff =
          @Backoff(
              delayExpression = "${lecturelens.citation.retry.delay-ms:200}",
              multiplierExpression = "${lecturelens.citation.retry.multiplier:2.0}"))
  public List<String> append(String sessionId, int windowIndex, List<Citation> citations) {
    for (Citation citation : citations) {
      if (!citation.sessionId().equals(sessionId) || citation.windowIndex() != windowIndex) {
        throw new IllegalArgumentException(
            "Citation rank " + citation.rank() + " does not belong to window " + windowIndex);
      }
    }
    List<CitationEntity> saved =
        repository.saveAll(citations.stream().map(CitationEntity::from).toList());
    log.debug("Stored {} citations for session {} window {}", saved.size(), sessionId, windowIndex);
    return saved.stream().map(e -> e.getId().toString()).toList();
  }

  @Override
  @Transactional(readOnly = true)
  public List<Citation> findBySession(String sessionId) {
    return repository.findBySessionIdOrderByWindowIndexAscRankAsc(sessionId).stream()
        .map(CitationEntity::toCitation)
        .toList();
  }
}
