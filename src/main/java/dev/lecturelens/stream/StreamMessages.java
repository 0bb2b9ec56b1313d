package dev.lecturelens.stream;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.lecturelens.citation.Citation;
import dev.lecturelens.rag.CitationQueryResponse;
import dev.lecturelens.rag.QueryMetadata;
import dev.lecturelens.transcript.TranscriptFragment;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** JSON messages exchanged on the transcript stream. */
public final class StreamMessages {

  private StreamMessages() {}

  static final String SEGMENT = "segment";
  static final String PING = "ping";

  /** Fragment as sent by the client; absent timing fields default to 0, is_final to true. */
  public record SegmentPayload(
      @Nullable String id,
      @Nullable String text,
      @JsonProperty("start_time") @Nullable Double startTime,
      @JsonProperty("end_time") @Nullable Double endTime,
      @Nullable Double confidence,
      @JsonProperty("is_final") @Nullable Boolean isFinal) {

    TranscriptFragment toFragment() {
      return new TranscriptFragment(
          id,
          text != null ? text : "",
          startTime != null ? startTime : 0.0,
          endTime != null ? endTime : 0.0,
          confidence != null ? confidence : 1.0,
          isFinal == null || isFinal);
    }
  }

  public record CitationsMessage(
      String type,
      @JsonProperty("window_index") int windowIndex,
      @JsonProperty("segment_id") @Nullable String segmentId,
      List<Citation> citations,
      @JsonProperty("query_metadata") QueryMetadata queryMetadata) {

    static CitationsMessage of(CitationQueryResponse response, @Nullable String segmentId) {
      return new CitationsMessage(
          "citations",
          response.windowIndex(),
          segmentId,
          response.citations(),
          response.queryMetadata());
    }
  }

  public record PongMessage(String type) {
    static final PongMessage INSTANCE = new PongMessage("pong");
  }

  public record ErrorMessage(String type, StreamErrorCode code, String message) {
    static ErrorMessage of(StreamErrorCode code, String message) {
      return new ErrorMessage("error", code, message);
    }
  }
}
