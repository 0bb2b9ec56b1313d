package dev.lecturelens.stream;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/** Registers the transcript stream endpoint. */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

  static final String STREAM_PATH = "/api/transcribe/stream";

  private final TranscriptionWebSocketHandler handler;

  public WebSocketConfig(TranscriptionWebSocketHandler handler) {
    this.handler = handler;
  }

  @Override
  public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
    registry.addHandler(handler, STREAM_PATH).setAllowedOriginPatterns("*");
  }
}
