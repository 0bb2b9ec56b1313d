package dev.lecturelens.config;

import dev.lecturelens.retrieval.EmbeddingDimensionMismatchException;
import dev.lecturelens.retrieval.EmbeddingException;
import dev.lecturelens.retrieval.VectorIndexException;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global REST error handler that maps application exceptions to RFC 9457 Problem Detail responses.
 *
 * <p>Invalid input maps to 400. Embedding and vector index failures map to 503: the window could
 * not be processed, and the client may retry it. A saturated query executor also maps to 503; an
 * embedding dimension mismatch is a deployment error and maps to 500.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(IllegalArgumentException.class)
  ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  ProblemDetail handleInvalidBody(MethodArgumentNotValidException ex) {
    String detail =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .collect(Collectors.joining("; "));
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail);
  }

  @ExceptionHandler({EmbeddingException.class, VectorIndexException.class})
  ProblemDetail handleRetrievalFailure(RuntimeException ex) {
    log.error("Citation query failed: {}", ex.getMessage());
    return ProblemDetail.forStatusAndDetail(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
  }

  @ExceptionHandler(RejectedExecutionException.class)
  ProblemDetail handleRejected(RejectedExecutionException ex) {
    log.warn("Citation query rejected, executor saturated: {}", ex.getMessage());
    return ProblemDetail.forStatusAndDetail(
        HttpStatus.SERVICE_UNAVAILABLE, "Query capacity exhausted, retry the window later");
  }

  @ExceptionHandler(EmbeddingDimensionMismatchException.class)
  ProblemDetail handleDimensionMismatch(EmbeddingDimensionMismatchException ex) {
    log.error(ex.getMessage());
    return ProblemDetail.forStatusAndDetail(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage());
  }
}
