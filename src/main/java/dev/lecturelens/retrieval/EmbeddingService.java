package dev.lecturelens.retrieval;

import dev.lecturelens.model.LazyModel;
import dev.lecturelens.model.ModelUnavailableException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Embeds enriched queries with the query embedding model (bge-small-en-v1.5, 384 dimensions).
 *
 * <p>Unlike keyword extraction and reranking there is no fallback here: without a vector nothing
 * can be retrieved, so model and inference failures surface as {@link EmbeddingException}. A vector
 * of the wrong dimension raises {@link EmbeddingDimensionMismatchException}; {@link
 * #verifyDimension()} runs the same check once at startup.
 */
@Service
public class EmbeddingService {

  private static final Logger log = LoggerFactory.getLogger(EmbeddingService.class);

  private final LazyModel<EmbeddingModel> queryModel;
  private final RetrievalProperties properties;

  public EmbeddingService(
      @Qualifier("queryEmbeddingModel") LazyModel<EmbeddingModel> queryModel,
      RetrievalProperties properties) {
    this.queryModel = queryModel;
    this.properties = properties;
  }

  /**
   * Checks the query model's output dimension against {@code lecturelens.retrieval.dimension}.
   * Loads the model if needed. An unavailable model is not a configuration error and is left to
   * surface per query.
   *
   * @return false if the model could not be loaded, so nothing was checked
   * @throws EmbeddingDimensionMismatchException if the dimensions differ
   */
  public boolean verifyDimension() {
    int actual;
    try {
      actual = queryModel.get().dimension();
    } catch (ModelUnavailableException e) {
      log.warn("Query embedding model unavailable, dimension not verified: {}", e.getMessage());
      return false;
    }
    if (actual != properties.getDimension()) {
      throw new EmbeddingDimensionMismatchException(properties.getDimension(), actual);
    }
    log.info("Query embedding dimension {} matches the vector index", actual);
    return true;
  }

  public Embedding embedQuery(String query) {
    Embedding embedding;
    try {
      embedding = queryModel.get().embed(properties.getQueryPrefix() + query).content();
    } catch (ModelUnavailableException e) {
      throw new EmbeddingException("Query embedding model unavailable", e);
    } catch (RuntimeException e) {
      throw new EmbeddingException("Query embedding failed: " + e.getMessage(), e);
    }
    if (embedding.dimension() != properties.getDimension()) {
      throw new EmbeddingDimensionMismatchException(
          properties.getDimension(), embedding.dimension());
    }
    return embedding;
  }
}
