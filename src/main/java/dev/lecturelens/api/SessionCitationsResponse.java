package dev.lecturelens.api;

import dev.lecturelens.citation.Citation;
import java.util.List;

/** Body of {@code GET /api/rag/sessions/{sessionId}/citations}. */
public record SessionCitationsResponse(List<Citation> citations) {}
