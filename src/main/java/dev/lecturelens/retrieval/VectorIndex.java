package dev.lecturelens.retrieval;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.filter.Filter;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Namespace-scoped nearest-neighbour search over indexed document passages. */
public interface VectorIndex {

  /**
   * Returns up to {@code topK} passages nearest to {@code vector}, ordered by ascending distance.
   *
   * @throws VectorIndexException if the namespace is unknown or the backing store fails
   */
  List<Candidate> query(String namespace, Embedding vector, int topK, @Nullable Filter filter);

  /** Adds or replaces one passage. Used by the indexing collaborator, not by the query path. */
  void upsert(String namespace, String id, Embedding vector, TextSegment passage);
}
