package dev.lecturelens.retrieval;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.filter.Filter;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link VectorIndex} over LangChain4j embedding stores, one store per namespace.
 *
 * <p>Stores report a cosine-derived relevance score in [0, 1] (higher is better). It is converted
 * to cosine distance {@code 2 * (1 - score)} in [0, 2] so that lower means more similar.
 */
public class EmbeddingStoreVectorIndex implements VectorIndex {

  private static final Logger log = LoggerFactory.getLogger(EmbeddingStoreVectorIndex.class);

  private final Map<String, EmbeddingStore<TextSegment>> stores;

  public EmbeddingStoreVectorIndex(Map<String, EmbeddingStore<TextSegment>> stores) {
    this.stores = Map.copyOf(stores);
  }

  @Override
  public List<Candidate> query(
      String namespace, Embedding vector, int topK, @Nullable Filter filter) {
    EmbeddingStore<TextSegment> store = storeFor(namespace);
    EmbeddingSearchRequest.EmbeddingSearchRequestBuilder builder =
        EmbeddingSearchRequest.builder().queryEmbedding(vector).maxResults(topK);
    if (filter != null) {
      builder.filter(filter);
    }

    List<EmbeddingMatch<TextSegment>> matches;
    try {
      matches = store.search(builder.build()).matches();
    } catch (RuntimeException e) {
      throw new VectorIndexException(
          "Vector search failed in namespace '" + namespace + "': " + e.getMessage(), e);
    }

    List<Candidate> candidates =
        matches.stream()
            .filter(m -> m.embedded() != null)
            .map(EmbeddingStoreVectorIndex::toCandidate)
            .sorted(Comparator.comparingDouble(Candidate::distance))
            .toList();
    if (log.isDebugEnabled()) {
      candidates.stream()
          .limit(3)
          .forEach(
              c ->
                  log.debug(
                      "Candidate {} distance={} doc={}",
                      c.id(),
                      String.format("%.3f", c.distance()),
                      c.metadata().documentName()));
    }
    return candidates;
  }

  @Override
  public void upsert(String namespace, String id, Embedding vector, TextSegment passage) {
    try {
      storeFor(namespace).addAll(List.of(id), List.of(vector), List.of(passage));
    } catch (RuntimeException e) {
      throw new VectorIndexException("Upsert failed in namespace '" + namespace + "'", e);
    }
  }

  static double toDistance(double relevanceScore) {
    return Math.max(0.0, 2.0 * (1.0 - relevanceScore));
  }

  private EmbeddingStore<TextSegment> storeFor(String namespace) {
    EmbeddingStore<TextSegment> store = stores.get(namespace);
    if (store == null) {
      throw new VectorIndexException("Unknown vector index namespace: " + namespace);
    }
    return store;
  }

  private static Candidate toCandidate(EmbeddingMatch<TextSegment> match) {
    TextSegment segment = match.embedded();
    return new Candidate(
        match.embeddingId(),
        segment.text(),
        CandidateMetadata.from(segment.metadata()),
        toDistance(match.score()));
  }
}
