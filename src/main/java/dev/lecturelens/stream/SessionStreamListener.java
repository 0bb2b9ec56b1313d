package dev.lecturelens.stream;

import dev.lecturelens.rag.CitationQueryResponse;
import org.jspecify.annotations.Nullable;

/** Receives the outcome of each processed window of a {@link SessionStream}. */
public interface SessionStreamListener {

  void onCitations(CitationQueryResponse response, @Nullable String segmentId);

  void onError(StreamErrorCode code, String message);
}
