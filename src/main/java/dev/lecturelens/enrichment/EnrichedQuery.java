package dev.lecturelens.enrichment;

import java.util.List;

/**
 * Result of query enrichment.
 *
 * @param keywords extracted keyphrases (empty when extraction was skipped or failed)
 * @param enrichedQuery original text followed by the space-joined keywords, or the original text
 *     unchanged when there are none
 */
public record EnrichedQuery(List<String> keywords, String enrichedQuery) {

  public EnrichedQuery {
    keywords = List.copyOf(keywords);
  }

  public static EnrichedQuery unchanged(String text) {
    return new EnrichedQuery(List.of(), text);
  }
}
