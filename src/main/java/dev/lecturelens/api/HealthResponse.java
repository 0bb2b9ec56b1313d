package dev.lecturelens.api;

import dev.lecturelens.model.LazyModel;
import java.util.Map;

/**
 * Body of {@code GET /api/health}.
 *
 * @param status {@code ok} when no model is unavailable, {@code degraded} otherwise
 * @param models load state per model name
 */
public record HealthResponse(String status, Map<String, LazyModel.State> models) {}
