package dev.lecturelens.enrichment;

import java.util.List;

/** Extracts salient terms from transcript text for query enrichment. */
public interface KeywordExtractor {

  /**
   * Returns up to {@code topN} keyphrases, most salient first.
   *
   * @param text the text to analyse
   * @param topN maximum number of keyphrases
   * @return keyphrases, or an empty list when extraction is not possible
   */
  List<String> extract(String text, int topN);
}
