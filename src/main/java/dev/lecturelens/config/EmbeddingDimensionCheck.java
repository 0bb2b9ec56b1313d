package dev.lecturelens.config;

import dev.lecturelens.retrieval.EmbeddingService;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Fails startup when the query embedding model and {@code lecturelens.retrieval.dimension}
 * disagree. Runs before model warm-up.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class EmbeddingDimensionCheck implements ApplicationRunner {

  private final EmbeddingService embeddingService;

  public EmbeddingDimensionCheck(EmbeddingService embeddingService) {
    this.embeddingService = embeddingService;
  }

  @Override
  public void run(ApplicationArguments args) {
    embeddingService.verifyDimension();
  }
}
