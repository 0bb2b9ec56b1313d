package dev.lecturelens.model;

/**
 * Thrown when an inference model failed to load or initialise.
 *
 * <p>Keyword extraction and reranking catch this and degrade to their deterministic fallbacks;
 * the query embedding path wraps it into a query failure.
 */
public class ModelUnavailableException extends RuntimeException {

  private final String modelName;

  public ModelUnavailableException(String modelName, Throwable cause) {
    super("Model unavailable: " + modelName + " (" + cause + ")", cause);
    this.modelName = modelName;
  }

  public String getModelName() {
    return modelName;
  }
}
