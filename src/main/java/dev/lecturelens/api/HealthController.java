package dev.lecturelens.api;

import dev.lecturelens.model.LazyModel;
import dev.lecturelens.model.ModelRegistry;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** Liveness plus per-model load state. Never triggers a model load. */
@RestController
public class HealthController {

  private final ModelRegistry modelRegistry;

  public HealthController(ModelRegistry modelRegistry) {
    this.modelRegistry = modelRegistry;
  }

  @GetMapping("/api/health")
  public HealthResponse health() {
    Map<String, LazyModel.State> states = modelRegistry.states();
    String status = states.containsValue(LazyModel.State.UNAVAILABLE) ? "degraded" : "ok";
    return new HealthResponse(status, states);
  }
}
