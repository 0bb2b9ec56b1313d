package dev.lecturelens.retrieval;

/** The query could not be embedded. Fatal to the current query; there is no fallback vector. */
public class EmbeddingException extends RuntimeException {

  public EmbeddingException(String message, Throwable cause) {
    super(message, cause);
  }
}
