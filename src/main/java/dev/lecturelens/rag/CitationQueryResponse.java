package dev.lecturelens.rag;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.lecturelens.citation.Citation;
import java.util.List;

/** Result of one {@link CitationQueryService#query} call. */
public record CitationQueryResponse(
    @JsonProperty("window_index") int windowIndex,
    List<Citation> citations,
    @JsonProperty("query_metadata") QueryMetadata queryMetadata) {

  public CitationQueryResponse {
    citations = List.copyOf(citations);
  }

  public static CitationQueryResponse empty(int windowIndex, QueryMetadata metadata) {
    return new CitationQueryResponse(windowIndex, List.of(), metadata);
  }
}
