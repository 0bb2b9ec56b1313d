package dev.lecturelens.stream;

import dev.lecturelens.rag.CitationQueryService;
import dev.lecturelens.transcript.SegmentBufferFactory;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Live {@link SessionStream}s keyed by connection id. A stream is registered when its connection
 * opens and removed and closed when it ends, so nothing outlives its connection.
 */
@Component
public class SessionStreamRegistry {

  private static final Logger log = LoggerFactory.getLogger(SessionStreamRegistry.class);

  private final Map<String, SessionStream> streams = new ConcurrentHashMap<>();
  private final SegmentBufferFactory bufferFactory;
  private final CitationQueryService queryService;
  private final Executor queryExecutor;
  private final StreamProperties properties;

  public SessionStreamRegistry(
      SegmentBufferFactory bufferFactory,
      CitationQueryService queryService,
      @Qualifier("ragQueryExecutor") Executor queryExecutor,
      StreamProperties properties) {
    this.bufferFactory = bufferFactory;
    this.queryService = queryService;
    this.queryExecutor = queryExecutor;
    this.properties = properties;
  }

  /**
   * Creates and registers a stream for a new connection.
   *
   * @throws IllegalStateException if the connection already has a stream
   */
  public SessionStream open(String connectionId, String sessionId, SessionStreamListener listener) {
    SessionStream stream =
        new SessionStream(
            sessionId,
            bufferFactory.create(),
            queryService,
            queryExecutor,
            properties.isFinalFragmentsOnly(),
            listener);
    if (streams.putIfAbsent(connectionId, stream) != null) {
      throw new IllegalStateException("Connection " + connectionId + " already has a stream");
    }
    log.info("Stream opened for session {} ({} active)", sessionId, streams.size());
    return stream;
  }

  public @Nullable SessionStream get(String connectionId) {
    return streams.get(connectionId);
  }

  /** Closes and removes the connection's stream, if any. */
  public void close(String connectionId) {
    SessionStream stream = streams.remove(connectionId);
    if (stream != null) {
      stream.close();
      log.info("Stream closed for session {} ({} active)", stream.sessionId(), streams.size());
    }
  }

  public int activeCount() {
    return streams.size();
  }
}
