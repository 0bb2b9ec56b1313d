package dev.lecturelens.citation;

import dev.lecturelens.rerank.RerankedCandidate;
import dev.lecturelens.retrieval.CandidateMetadata;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns the reranked list into {@link Citation} records.
 *
 * <p>Ranks are assigned over the citations actually produced, starting at 1, so dropping a
 * candidate without a document id never leaves a gap.
 */
@Component
public class CitationAssembler {

  private static final Logger log = LoggerFactory.getLogger(CitationAssembler.class);

  private final CitationProperties properties;

  public CitationAssembler(CitationProperties properties) {
    this.properties = properties;
  }

  public List<Citation> assemble(
      String sessionId,
      int windowIndex,
      @Nullable String transcriptFragmentId,
      List<RerankedCandidate> reranked) {
    List<Citation> citations = new ArrayList<>(reranked.size());
    for (RerankedCandidate candidate : reranked) {
      CandidateMetadata metadata = candidate.candidate().metadata();
      if (!metadata.isCitable()) {
        log.warn(
            "No document_id in metadata for candidate {}, dropped", candidate.candidate().id());
        continue;
      }
      Citation citation =
          new Citation(
              citations.size() + 1,
              metadata.documentId(),
              metadata.documentName(),
              metadata.pageNumber(),
              metadata.sectionHeading(),
              snippet(candidate.text()),
              candidate.relevanceScore(),
              windowIndex,
              sessionId,
              transcriptFragmentId);
      citations.add(citation);
      log.debug(
          "Citation {}: {} p.{} (score {})",
          citation.rank(),
          citation.documentName(),
          citation.pageNumber(),
          String.format("%.3f", citation.relevanceScore()));
    }
    return citations;
  }

  String snippet(String text) {
    int limit = properties.getSnippetLength();
    if (text.length() <= limit) {
      return text;
    }
    int end = limit;
    if (Character.isHighSurrogate(text.charAt(end - 1))) {
      end--;
    }
    return text.substring(0, end);
  }
}
