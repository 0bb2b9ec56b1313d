package dev.lecturelens.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.jspecify.annotations.Nullable;

/** Body of {@code POST /api/rag/query}. */
public record RagQueryRequest(
    @JsonProperty("session_id") @NotBlank String sessionId,
    @JsonProperty("transcript_text") @NotNull String transcriptText,
    @JsonProperty("window_index") @Min(0) int windowIndex,
    @JsonProperty("transcript_id") @Nullable String transcriptId) {}
