package dev.lecturelens.citation;

import java.util.List;

/** Append-only citation history, keyed by session and window. */
public interface CitationStore {

  /**
   * Persists one window's citations.
   *
   * @return ids assigned by the store, in input order
   */
  List<String> append(String sessionId, int windowIndex, List<Citation> citations);

  /** A session's citation history ordered by window index, then rank. */
  List<Citation> findBySession(String sessionId);
}
