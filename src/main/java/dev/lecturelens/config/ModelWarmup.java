package dev.lecturelens.config;

import dev.lecturelens.model.ModelRegistry;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Loads every model at startup when {@code lecturelens.models.warm-up=true}, so the first window
 * does not pay the model load cost. Load failures leave the application running.
 */
@Component
@ConditionalOnProperty(prefix = "lecturelens.models", name = "warm-up", havingValue = "true")
public class ModelWarmup implements ApplicationRunner {

  private final ModelRegistry modelRegistry;

  public ModelWarmup(ModelRegistry modelRegistry) {
    this.modelRegistry = modelRegistry;
  }

  @Override
  public void run(ApplicationArguments args) {
    modelRegistry.warmUp();
  }
}
