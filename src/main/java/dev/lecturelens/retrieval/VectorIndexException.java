package dev.lecturelens.retrieval;

/** The vector index could not answer a query. Propagated as a query failure; never masked. */
public class VectorIndexException extends RuntimeException {

  public VectorIndexException(String message) {
    super(message);
  }

  public VectorIndexException(String message, Throwable cause) {
    super(message, cause);
  }
}
