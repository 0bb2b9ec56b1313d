package dev.lecturelens.stream;

import dev.lecturelens.rag.CitationQueryResponse;
import dev.lecturelens.rag.CitationQueryService;
import dev.lecturelens.retrieval.EmbeddingException;
import dev.lecturelens.retrieval.VectorIndexException;
import dev.lecturelens.transcript.SegmentBuffer;
import dev.lecturelens.transcript.TranscriptFragment;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Live transcript stream of one connection. Owns exactly one {@link SegmentBuffer}.
 *
 * <p>Fragments are processed one at a time, in arrival order, on the query executor: each
 * submission is chained behind the previous one, so window N's query finishes before window N+1
 * is evaluated. A failed window is reported to the listener and skipped; the buffer advances
 * either way. A fragment the executor rejects is logged and reported as {@link
 * StreamErrorCode#PROCESSING_ERROR}; the chain continues with the next submission.
 *
 * <p>After {@link #close()} queued fragments are dropped and results of a query still in flight
 * are discarded.
 */
public class SessionStream {

  private static final Logger log = LoggerFactory.getLogger(SessionStream.class);

  private final String sessionId;
  private final SegmentBuffer buffer;
  private final CitationQueryService queryService;
  private final Executor executor;
  private final boolean finalFragmentsOnly;
  private final SessionStreamListener listener;

  private final Object chainLock = new Object();
  private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);
  private volatile boolean closed;

  public SessionStream(
      String sessionId,
      SegmentBuffer buffer,
      CitationQueryService queryService,
      Executor executor,
      boolean finalFragmentsOnly,
      SessionStreamListener listener) {
    this.sessionId = sessionId;
    this.buffer = buffer;
    this.queryService = queryService;
    this.executor = executor;
    this.finalFragmentsOnly = finalFragmentsOnly;
    this.listener = listener;
  }

  /**
   * Queues a fragment for processing. Blank fragments, interim fragments (when configured) and
   * fragments arriving after {@link #close()} are ignored.
   *
   * @return completes once this fragment has been processed
   */
  public CompletableFuture<Void> submit(TranscriptFragment fragment) {
    if (closed || fragment.isBlank() || (finalFragmentsOnly && !fragment.isFinal())) {
      synchronized (chainLock) {
        return tail;
      }
    }
    synchronized (chainLock) {
      tail =
          tail.handle((ignored, error) -> null)
              .thenRunAsync(() -> process(fragment), executor)
              .whenComplete(
                  (ignored, error) -> {
                    if (error != null) {
                      dropped(fragment, error);
                    }
                  });
      return tail;
    }
  }

  private void process(TranscriptFragment fragment) {
    if (closed) {
      return;
    }
    buffer.add(fragment);
    if (!buffer.isReady()) {
      return;
    }
    int windowIndex = buffer.windowIndex();
    @Nullable String segmentId = buffer.lastFragmentId();
    try {
      CitationQueryResponse response =
          queryService.query(sessionId, buffer.getText(), windowIndex, segmentId);
      if (closed) {
        log.debug("Session {} closed, discarding window {}", sessionId, windowIndex);
        return;
      }
      listener.onCitations(response, segmentId);
    } catch (EmbeddingException | VectorIndexException e) {
      log.error("Window {} of session {} skipped: {}", windowIndex, sessionId, e.getMessage());
      notifyError(StreamErrorCode.QUERY_FAILED, e.getMessage());
    } catch (RuntimeException e) {
      log.error("Window {} of session {} failed", windowIndex, sessionId, e);
      notifyError(StreamErrorCode.PROCESSING_ERROR, e.getMessage());
    } finally {
      buffer.advance();
    }
  }

  private void dropped(TranscriptFragment fragment, Throwable error) {
    Throwable cause = error;
    if (error instanceof CompletionException && error.getCause() != null) {
      cause = error.getCause();
    }
    if (cause instanceof RejectedExecutionException) {
      log.error(
          "Fragment {} of session {} dropped, query executor saturated: {}",
          fragment.id(),
          sessionId,
          cause.getMessage());
      notifyError(StreamErrorCode.PROCESSING_ERROR, "Server busy, transcript fragment dropped");
    } else {
      log.error("Fragment {} of session {} dropped", fragment.id(), sessionId, cause);
      notifyError(StreamErrorCode.PROCESSING_ERROR, cause.getMessage());
    }
  }

  private void notifyError(StreamErrorCode code, @Nullable String message) {
    if (!closed) {
      listener.onError(code, message != null ? message : code.name());
    }
  }

  /** Stops emitting results. Idempotent. */
  public void close() {
    closed = true;
  }

  public boolean isClosed() {
    return closed;
  }

  public String sessionId() {
    return sessionId;
  }

  /** Completes when every fragment submitted so far has been processed. */
  public CompletableFuture<Void> idle() {
    synchronized (chainLock) {
      return tail.handle((ignored, error) -> null);
    }
  }
}
