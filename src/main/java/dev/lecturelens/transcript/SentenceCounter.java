package dev.lecturelens.transcript;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Word and sentence counting for transcript windows.
 *
 * <p>A sentence terminal is a whitespace-delimited token ending in a run of {@code .}, {@code !} or
 * {@code ?} (closing quotes and brackets after the run are ignored). A run is not counted when it
 * is an ellipsis (two or more periods, or {@code …}) or when it is a single period closing a known
 * abbreviation such as {@code Dr.} or {@code e.g.}. Periods inside a token ({@code 3.5}, {@code
 * v2.1}) are never terminals.
 */
public final class SentenceCounter {

  static final Set<String> ABBREVIATIONS =
      Set.of(
          "dr.", "prof.", "mr.", "mrs.", "ms.", "jr.", "sr.", "etc.", "e.g.", "i.e.", "vs.", "fig.",
          "eq.", "ch.", "vol.", "no.", "p.", "pp.", "ed.", "eds.");

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern TERMINAL_RUN = Pattern.compile("([.!?]+)[\"')\\]”’]*$");

  private SentenceCounter() {}

  public static int countWords(String text) {
    String trimmed = text.strip();
    return trimmed.isEmpty() ? 0 : WHITESPACE.split(trimmed).length;
  }

  public static int countSentences(String text) {
    String trimmed = text.strip();
    if (trimmed.isEmpty()) {
      return 0;
    }
    int count = 0;
    for (String token : WHITESPACE.split(trimmed)) {
      if (endsSentence(token)) {
        count++;
      }
    }
    return count;
  }

  static boolean endsSentence(String token) {
    if (token.endsWith("…")) {
      return false;
    }
    Matcher matcher = TERMINAL_RUN.matcher(token);
    if (!matcher.find()) {
      return false;
    }
    String run = matcher.group(1);
    if (run.length() > 1 && run.chars().allMatch(c -> c == '.')) {
      return false;
    }
    if (run.length() > 2) {
      return false;
    }
    if (run.equals(".")) {
      String word = token.substring(0, matcher.end(1)).toLowerCase(Locale.ROOT);
      return !ABBREVIATIONS.contains(word);
    }
    return true;
  }
}
