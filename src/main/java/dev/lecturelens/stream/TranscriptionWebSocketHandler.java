package dev.lecturelens.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.lecturelens.rag.CitationQueryResponse;
import java.io.IOException;
import java.net.URI;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * WebSocket endpoint for live transcripts: {@code /api/transcribe/stream?session_id=...}.
 *
 * <p>Client messages are {@code {"type":"segment","segment":{...}}} and {@code {"type":"ping"}}.
 * The server answers with {@code citations} per processed window, {@code pong}, or {@code error}
 * carrying a {@link StreamErrorCode}. Windows are processed by the connection's {@link
 * SessionStream} off the socket thread, so every outbound frame of a connection, including pong
 * and error replies sent from the socket thread, goes through one {@link
 * ConcurrentWebSocketSessionDecorator}.
 */
@Component
public class TranscriptionWebSocketHandler extends TextWebSocketHandler {

  private static final Logger log = LoggerFactory.getLogger(TranscriptionWebSocketHandler.class);

  static final String SESSION_ID_PARAM = "session_id";
  private static final int SEND_TIME_LIMIT_MS = 10_000;
  private static final int SEND_BUFFER_LIMIT_BYTES = 512 * 1024;

  private final SessionStreamRegistry registry;
  private final ObjectMapper objectMapper;
  private final Map<String, WebSocketSession> outboundSessions = new ConcurrentHashMap<>();

  public TranscriptionWebSocketHandler(SessionStreamRegistry registry, ObjectMapper objectMapper) {
    this.registry = registry;
    this.objectMapper = objectMapper;
  }

  @Override
  public void afterConnectionEstablished(WebSocketSession session) throws IOException {
    String sessionId = sessionIdOf(session.getUri());
    if (sessionId == null || sessionId.isBlank()) {
      log.warn("Rejecting stream {}: missing {}", session.getId(), SESSION_ID_PARAM);
      session.close(CloseStatus.POLICY_VIOLATION.withReason("session_id is required"));
      return;
    }
    WebSocketSession outbound =
        new ConcurrentWebSocketSessionDecorator(
            session, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT_BYTES);
    outboundSessions.put(session.getId(), outbound);
    try {
      registry.open(session.getId(), sessionId, new SocketListener(outbound));
    } catch (IllegalStateException e) {
      outboundSessions.remove(session.getId());
      throw e;
    }
  }

  @Override
  protected void handleTextMessage(WebSocketSession session, TextMessage message)
      throws IOException {
    SessionStream stream = registry.get(session.getId());
    WebSocketSession outbound = outboundSessions.get(session.getId());
    if (stream == null || outbound == null) {
      return;
    }
    JsonNode root;
    try {
      root = objectMapper.readTree(message.getPayload());
    } catch (JsonProcessingException e) {
      sendError(outbound, StreamErrorCode.INVALID_MESSAGE, "Malformed JSON");
      return;
    }
    String type = root.path("type").asText("");
    switch (type) {
      case StreamMessages.SEGMENT -> {
        JsonNode segment = root.get("segment");
        if (segment == null || !segment.isObject()) {
          sendError(outbound, StreamErrorCode.INVALID_MESSAGE, "segment message without segment");
          return;
        }
        StreamMessages.SegmentPayload payload;
        try {
          payload = objectMapper.treeToValue(segment, StreamMessages.SegmentPayload.class);
        } catch (JsonProcessingException e) {
          sendError(
              outbound,
              StreamErrorCode.INVALID_MESSAGE,
              "Invalid segment: " + e.getOriginalMessage());
          return;
        }
        stream.submit(payload.toFragment());
      }
      case StreamMessages.PING -> send(outbound, StreamMessages.PongMessage.INSTANCE);
      default ->
          sendError(outbound, StreamErrorCode.INVALID_MESSAGE, "Unknown message type: " + type);
    }
  }

  @Override
  public void handleTransportError(WebSocketSession session, Throwable exception) {
    log.warn("Transport error on stream {}: {}", session.getId(), exception.getMessage());
  }

  @Override
  public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
    outboundSessions.remove(session.getId());
    registry.close(session.getId());
  }

  /** The decorated session all frames of a connection are sent through. */
  @Nullable WebSocketSession outboundOf(String connectionId) {
    return outboundSessions.get(connectionId);
  }

  static @Nullable String sessionIdOf(@Nullable URI uri) {
    if (uri == null) {
      return null;
    }
    return UriComponentsBuilder.fromUri(uri).build().getQueryParams().getFirst(SESSION_ID_PARAM);
  }

  private void sendError(WebSocketSession session, StreamErrorCode code, String message)
      throws IOException {
    send(session, StreamMessages.ErrorMessage.of(code, message));
  }

  private void send(WebSocketSession session, Object payload) throws IOException {
    if (session.isOpen()) {
      session.sendMessage(new TextMessage(objectMapper.writeValueAsString(payload)));
    }
  }

  private final class SocketListener implements SessionStreamListener {

    private final WebSocketSession session;

    SocketListener(WebSocketSession session) {
      this.session = session;
    }

    @Override
    public void onCitations(CitationQueryResponse response, @Nullable String segmentId) {
      trySend(StreamMessages.CitationsMessage.of(response, segmentId));
    }

    @Override
    public void onError(StreamErrorCode code, String message) {
      trySend(StreamMessages.ErrorMessage.of(code, message));
    }

    private void trySend(Object payload) {
      try {
        send(session, payload);
      } catch (IOException e) {
        log.warn("Failed to send to stream {}: {}", session.getId(), e.getMessage());
      }
    }
  }
}
