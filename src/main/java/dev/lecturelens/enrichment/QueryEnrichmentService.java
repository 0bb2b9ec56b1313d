package dev.lecturelens.enrichment;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Improves retrieval recall by appending salient keyphrases to the raw transcript text before it
 * is embedded. The keyword list is appended once, space-joined, never repeated or weighted.
 *
 * <p>Degrades gracefully: short text, a missing model or an extraction error all return the
 * original text with no keywords.
 */
@Service
public class QueryEnrichmentService {

  private static final Logger log = LoggerFactory.getLogger(QueryEnrichmentService.class);

  private final KeywordExtractor keywordExtractor;
  private final KeywordProperties properties;

  public QueryEnrichmentService(KeywordExtractor keywordExtractor, KeywordProperties properties) {
    this.keywordExtractor = keywordExtractor;
    this.properties = properties;
  }

  public EnrichedQuery enrich(String text) {
    if (text == null || text.strip().length() < properties.getMinTextLength()) {
      return EnrichedQuery.unchanged(text);
    }
    List<String> keywords;
    try {
      keywords = keywordExtractor.extract(text, properties.getTopN());
    } catch (RuntimeException e) {
      log.error("Keyword extraction failed, using raw text: {}", e.getMessage());
      keywords = List.of();
    }
    if (keywords.isEmpty()) {
      return EnrichedQuery.unchanged(text);
    }
    log.debug("Enriching query with keywords {}", keywords);
    return new EnrichedQuery(keywords, text + " " + String.join(" ", keywords));
  }
}
