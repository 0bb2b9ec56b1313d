package dev.lecturelens.rag;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Diagnostic metadata reported with every query result, including early exits.
 *
 * @param keywords keyphrases appended to the query, possibly empty
 * @param processingTimeMs wall-clock time spent in the pipeline
 */
public record QueryMetadata(
    List<String> keywords, @JsonProperty("processing_time_ms") long processingTimeMs) {

  public QueryMetadata {
    keywords = List.copyOf(keywords);
  }
}
