package dev.lecturelens.api;

import dev.lecturelens.citation.CitationStore;
import dev.lecturelens.rag.CitationQueryResponse;
import dev.lecturelens.rag.CitationQueryService;
import jakarta.validation.Valid;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST entry point for single-window citation queries and session citation history.
 *
 * <p>Queries run on the {@code ragQueryExecutor} so model inference never holds a servlet thread.
 */
@RestController
@RequestMapping("/api/rag")
public class RagController {

  private final CitationQueryService citationQueryService;
  private final CitationStore citationStore;
  private final Executor queryExecutor;

  public RagController(
      CitationQueryService citationQueryService,
      CitationStore citationStore,
      @Qualifier("ragQueryExecutor") Executor queryExecutor) {
    this.citationQueryService = citationQueryService;
    this.citationStore = citationStore;
    this.queryExecutor = queryExecutor;
  }

  @PostMapping("/query")
  public CompletableFuture<CitationQueryResponse> query(
      @Valid @RequestBody RagQueryRequest request) {
    return CompletableFuture.supplyAsync(
        () ->
            citationQueryService.query(
                request.sessionId(),
                request.transcriptText(),
                request.windowIndex(),
                request.transcriptId()),
        queryExecutor);
  }

  @GetMapping("/sessions/{sessionId}/citations")
  public SessionCitationsResponse sessionCitations(@PathVariable String sessionId) {
    return new SessionCitationsResponse(citationStore.findBySession(sessionId));
  }
}
