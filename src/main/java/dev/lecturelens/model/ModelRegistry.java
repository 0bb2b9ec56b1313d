package dev.lecturelens.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-only view over every {@link LazyModel} in the application, used for warm-up and health
 * reporting.
 */
public class ModelRegistry {

  private static final Logger log = LoggerFactory.getLogger(ModelRegistry.class);

  private final List<LazyModel<?>> models;

  public ModelRegistry(List<LazyModel<?>> models) {
    this.models = List.copyOf(models);
  }

  /**
   * Forces every model to load. Failures are logged and recorded in the handle; they never
   * propagate, so a missing reranker does not prevent startup.
   *
   * @return number of models that ended up {@link LazyModel.State#READY}
   */
  public int warmUp() {
    int ready = 0;
    for (LazyModel<?> model : models) {
      try {
        model.get();
        ready++;
      } catch (ModelUnavailableException e) {
        log.warn("Warm-up: {} unavailable, dependent stages will use their fallback", model.name());
      }
    }
    log.info("Warm-up complete: {}/{} models ready", ready, models.size());
    return ready;
  }

  /** Snapshot of model name to load state, in registration order. */
  public Map<String, LazyModel.State> states() {
    Map<String, LazyModel.State> states = new LinkedHashMap<>();
    models.forEach(m -> states.put(m.name(), m.state()));
    return states;
  }
}
