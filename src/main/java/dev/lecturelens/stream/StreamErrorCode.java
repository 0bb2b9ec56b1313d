package dev.lecturelens.stream;

/** Error codes sent to stream clients. */
public enum StreamErrorCode {
  /** The client message could not be parsed or had an unknown type. */
  INVALID_MESSAGE,
  /** Embedding or vector search failed; the window was skipped. */
  QUERY_FAILED,
  /** Any other failure while processing a window. */
  PROCESSING_ERROR
}
