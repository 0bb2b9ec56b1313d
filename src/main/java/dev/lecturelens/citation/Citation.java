package dev.lecturelens.citation;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A ranked, citation-ready reference to a document passage. Immutable once created.
 *
 * @param rank 1-based position within its window, dense with no gaps
 * @param documentId id of the cited document
 * @param documentName display name of the cited document
 * @param pageNumber page the passage starts on
 * @param sectionHeading heading of the enclosing section, if known
 * @param snippet leading passage text, truncated to the configured snippet length
 * @param relevanceScore reranker score, at or above the relevance threshold
 * @param windowIndex transcript window that produced the citation
 * @param sessionId owning session
 * @param transcriptFragmentId fragment that closed the window, if known
 */
public record Citation(
    int rank,
    @JsonProperty("document_id") String documentId,
    @JsonProperty("document_name") String documentName,
    @JsonProperty("page_number") int pageNumber,
    @JsonProperty("section_heading") @Nullable String sectionHeading,
    String snippet,
    @JsonProperty("relevance_score") double relevanceScore,
    @JsonProperty("window_index") int windowIndex,
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("transcript_fragment_id") @Nullable String transcriptFragmentId) {

  public Citation {
    if (rank < 1) {
      throw new IllegalArgumentException("rank must be >= 1, got: " + rank);
    }
    Objects.requireNonNull(documentId, "documentId");
    Objects.requireNonNull(documentName, "documentName");
    Objects.requireNonNull(snippet, "snippet");
    Objects.requireNonNull(sessionId, "sessionId");
  }
}
