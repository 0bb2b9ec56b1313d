package dev.lecturelens.retrieval;

/**
 * The embedding model produced vectors of a different dimension than the index was built with.
 * This is a deployment error, not a per-query failure.
 */
public class EmbeddingDimensionMismatchException extends IllegalStateException {

  public EmbeddingDimensionMismatchException(int expected, int actual) {
    super(
        "Embedding dimension mismatch: index expects "
            + expected
            + " but model produced "
            + actual
            + ". Check lecturelens.retrieval.dimension and the configured embedding model.");
  }
}
