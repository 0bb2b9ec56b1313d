package dev.lecturelens.model;

import java.util.Objects;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide handle that owns one inference model and constructs it on first use.
 *
 * <p>Construction is guarded by double-checked locking: concurrent first callers block on the same
 * monitor and the factory runs exactly once. Once built, the model is treated as an immutable,
 * thread-safe inference engine and handed out without locking.
 *
 * <p>A factory failure is remembered. Every later {@link #get()} throws {@link
 * ModelUnavailableException} without re-running the factory, so callers with a deterministic
 * fallback degrade immediately instead of paying the load cost on every request. Native load
 * failures ({@link LinkageError}, including {@code UnsatisfiedLinkError} and {@code
 * ExceptionInInitializerError}) are treated the same as runtime exceptions.
 *
 * @param <T> the model type (e.g. {@code EmbeddingModel}, {@code ScoringModel})
 */
public final class LazyModel<T> {

  private static final Logger log = LoggerFactory.getLogger(LazyModel.class);

  /** Load state of a model handle. */
  public enum State {
    NOT_LOADED,
    READY,
    UNAVAILABLE
  }

  private final String name;
  private final Supplier<? extends T> factory;
  private final Object lock = new Object();

  private volatile @Nullable T instance;
  private volatile @Nullable Throwable failure;

  public LazyModel(String name, Supplier<? extends T> factory) {
    this.name = Objects.requireNonNull(name, "name");
    this.factory = Objects.requireNonNull(factory, "factory");
  }

  /** Creates a handle around an already constructed model (tests, pre-loaded models). */
  public static <T> LazyModel<T> ready(String name, T model) {
    Objects.requireNonNull(model, "model");
    LazyModel<T> handle = new LazyModel<>(name, () -> model);
    handle.instance = model;
    return handle;
  }

  /**
   * Returns the model, constructing it on the first call.
   *
   * @return the loaded model
   * @throws ModelUnavailableException if construction failed, now or on an earlier call
   */
  public T get() {
    T model = instance;
    if (model != null) {
      return model;
    }
    synchronized (lock) {
      model = instance;
      if (model != null) {
        return model;
      }
      Throwable previous = failure;
      if (previous != null) {
        throw new ModelUnavailableException(name, previous);
      }
      long start = System.nanoTime();
      try {
        log.info("Loading model {}", name);
        model = Objects.requireNonNull(factory.get(), "factory returned null for " + name);
      } catch (RuntimeException | LinkageError e) {
        failure = e;
        log.error("Failed to load model {}", name, e);
        throw new ModelUnavailableException(name, e);
      }
      instance = model;
      log.info("Model {} loaded in {}ms", name, (System.nanoTime() - start) / 1_000_000);
      return model;
    }
  }

  /** Current load state; never triggers construction. */
  public State state() {
    if (instance != null) {
      return State.READY;
    }
    return failure != null ? State.UNAVAILABLE : State.NOT_LOADED;
  }

  public String name() {
    return name;
  }
}
