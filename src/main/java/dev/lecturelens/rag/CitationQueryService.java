package dev.lecturelens.rag;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

import dev.lecturelens.citation.Citation;
import dev.lecturelens.citation.CitationAssembler;
import dev.lecturelens.citation.CitationPersister;
import dev.lecturelens.enrichment.EnrichedQuery;
import dev.lecturelens.enrichment.QueryEnrichmentService;
import dev.lecturelens.rerank.RerankedCandidate;
import dev.lecturelens.rerank.RerankerService;
import dev.lecturelens.retrieval.Candidate;
import dev.lecturelens.retrieval.CandidateMetadata;
import dev.lecturelens.retrieval.EarlyExitGate;
import dev.lecturelens.retrieval.EmbeddingService;
import dev.lecturelens.retrieval.RetrievalProperties;
import dev.lecturelens.retrieval.VectorIndex;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.store.embedding.filter.Filter;
import java.time.Clock;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns one transcript window into a ranked list of citations.
 *
 * <p>Pipeline:
 *
 * <ol>
 *   <li>enrich the window text with extracted keyphrases
 *   <li>embed the enriched query
 *   <li>fetch the nearest passages of the session's documents
 *   <li>exit early when even the closest passage is too far away
 *   <li>rerank against the raw window text, keep the top results above the relevance threshold
 *   <li>assemble citations and hand them to the persister without waiting
 * </ol>
 *
 * <p>Keyword extraction, reranking and persistence degrade locally. Embedding and vector index
 * failures propagate; the caller decides whether to skip the window.
 */
@Service
public class CitationQueryService {

  private static final Logger log = LoggerFactory.getLogger(CitationQueryService.class);

  private final QueryEnrichmentService enrichmentService;
  private final EmbeddingService embeddingService;
  private final VectorIndex vectorIndex;
  private final EarlyExitGate earlyExitGate;
  private final RerankerService rerankerService;
  private final CitationAssembler citationAssembler;
  private final CitationPersister citationPersister;
  private final RetrievalProperties retrievalProperties;
  private final Clock clock;

  public CitationQueryService(
      QueryEnrichmentService enrichmentService,
      EmbeddingService embeddingService,
      VectorIndex vectorIndex,
      EarlyExitGate earlyExitGate,
      RerankerService rerankerService,
      CitationAssembler citationAssembler,
      CitationPersister citationPersister,
      RetrievalProperties retrievalProperties,
      Clock clock) {
    this.enrichmentService = enrichmentService;
    this.embeddingService = embeddingService;
    this.vectorIndex = vectorIndex;
    this.earlyExitGate = earlyExitGate;
    this.rerankerService = rerankerService;
    this.citationAssembler = citationAssembler;
    this.citationPersister = citationPersister;
    this.retrievalProperties = retrievalProperties;
    this.clock = clock;
  }

  /**
   * Runs the citation pipeline for one window.
   *
   * @param sessionId session whose documents are searched
   * @param transcriptText accumulated window text
   * @param windowIndex non-negative window index, echoed in the response
   * @param transcriptFragmentId fragment that closed the window, if known
   * @return citations ranked from 1, possibly empty
   * @throws IllegalArgumentException if {@code sessionId} is blank or {@code windowIndex} negative
   * @throws dev.lecturelens.retrieval.EmbeddingException if the query cannot be embedded
   * @throws dev.lecturelens.retrieval.VectorIndexException if the vector index query fails
   */
  public CitationQueryResponse query(
      String sessionId,
      @Nullable String transcriptText,
      int windowIndex,
      @Nullable String transcriptFragmentId) {
    if (sessionId == null || sessionId.isBlank()) {
      throw new IllegalArgumentException("session_id must not be blank");
    }
    if (windowIndex < 0) {
      throw new IllegalArgumentException("window_index must be >= 0, got: " + windowIndex);
    }
    long start = clock.millis();
    if (transcriptText == null || transcriptText.isBlank()) {
      log.debug("Window {} of session {} is blank, skipping", windowIndex, sessionId);
      return CitationQueryResponse.empty(windowIndex, new QueryMetadata(List.of(), 0));
    }

    EnrichedQuery enriched = enrichmentService.enrich(transcriptText);
    Embedding vector = embeddingService.embedQuery(enriched.enrichedQuery());
    Filter sessionFilter = metadataKey(CandidateMetadata.SESSION_ID).isEqualTo(sessionId);
    List<Candidate> candidates =
        vectorIndex.query(
            retrievalProperties.getNamespace(),
            vector,
            retrievalProperties.getTopKCandidates(),
            sessionFilter);
    log.info("Window {}: retrieved {} candidates", windowIndex, candidates.size());

    if (earlyExitGate.shouldExit(candidates)) {
      long elapsed = clock.millis() - start;
      log.info("Window {}: early exit after {}ms", windowIndex, elapsed);
      return CitationQueryResponse.empty(
          windowIndex, new QueryMetadata(enriched.keywords(), elapsed));
    }

    List<RerankedCandidate> reranked = rerankerService.rerank(transcriptText, candidates);
    List<Citation> citations =
        citationAssembler.assemble(sessionId, windowIndex, transcriptFragmentId, reranked);
    if (!citations.isEmpty()) {
      try {
        citationPersister.persist(sessionId, windowIndex, citations);
      } catch (RuntimeException e) {
        log.error("Could not hand off citations of window {}: {}", windowIndex, e.getMessage());
      }
    }

    long elapsed = clock.millis() - start;
    log.info("Window {}: {} citations in {}ms", windowIndex, citations.size(), elapsed);
    return new CitationQueryResponse(
        windowIndex, citations, new QueryMetadata(enriched.keywords(), elapsed));
  }
}
