package dev.lecturelens.enrichment;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Candidate keyphrase generation: lower-cased word tokens of at least two characters, stop-words
 * removed, then distinct unigrams and bigrams over the remaining sequence in first-appearance
 * order.
 */
final class KeyphraseCandidates {

  private static final Pattern TOKEN =
      Pattern.compile("\\b\\w\\w+\\b", Pattern.UNICODE_CHARACTER_CLASS);

  private KeyphraseCandidates() {}

  static List<String> from(String text) {
    List<String> tokens = new ArrayList<>();
    Matcher matcher = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
    while (matcher.find()) {
      String token = matcher.group();
      if (!StopWords.contains(token)) {
        tokens.add(token);
      }
    }
    Set<String> candidates = new LinkedHashSet<>();
    for (int i = 0; i < tokens.size(); i++) {
      candidates.add(tokens.get(i));
      if (i + 1 < tokens.size()) {
        candidates.add(tokens.get(i) + " " + tokens.get(i + 1));
      }
    }
    return List.copyOf(candidates);
  }
}
