package dev.lecturelens.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

import java.util.List;
import org.junit.jupiter.api.Test;

class ModelRegistryTest {

  @Test
  void warmUpLoadsEveryModelAndSurvivesFailures() {
    LazyModel<String> good = new LazyModel<>("good", () -> "ok");
    LazyModel<String> bad =
        new LazyModel<>(
            "bad",
            () -> {
              throw new IllegalStateException("no onnx file");
            });
    ModelRegistry registry = new ModelRegistry(List.of(good, bad));

    int ready = registry.warmUp();

    assertThat(ready).isEqualTo(1);
    assertThat(registry.states())
        .containsExactly(
            entry("good", LazyModel.State.READY),
            entry("bad", LazyModel.State.UNAVAILABLE));
  }

  @Test
  void statesDoNotTriggerLoading() {
    LazyModel<String> model = new LazyModel<>("lazy", () -> "ok");
    ModelRegistry registry = new ModelRegistry(List.of(model));

    assertThat(registry.states()).containsEntry("lazy", LazyModel.State.NOT_LOADED);
    assertThat(model.state()).isEqualTo(LazyModel.State.NOT_LOADED);
  }
}
