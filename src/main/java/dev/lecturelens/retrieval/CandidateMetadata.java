package dev.lecturelens.retrieval;

import dev.langchain4j.data.document.Metadata;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Citation-relevant metadata carried by an indexed passage.
 *
 * @param documentId id of the source document; null when the indexer did not record one, in which
 *     case the passage cannot be cited
 * @param documentName display name of the document ("Unknown" when absent)
 * @param pageNumber page the passage starts on (0 when absent)
 * @param sectionHeading heading of the enclosing section, if known
 */
public record CandidateMetadata(
    @Nullable String documentId,
    String documentName,
    int pageNumber,
    @Nullable String sectionHeading) {

  public static final String SESSION_ID = "session_id";
  public static final String DOCUMENT_ID = "document_id";
  public static final String DOCUMENT_NAME = "document_name";
  public static final String PAGE_NUMBER = "page_number";
  public static final String SECTION_HEADING = "section_heading";

  static final String UNKNOWN_DOCUMENT = "Unknown";

  public CandidateMetadata {
    documentName = Objects.requireNonNullElse(documentName, UNKNOWN_DOCUMENT);
  }

  public boolean isCitable() {
    return documentId != null && !documentId.isBlank();
  }

  /** Reads the passage metadata keys written by the indexing collaborator. */
  public static CandidateMetadata from(Metadata metadata) {
    Integer page = metadata.getInteger(PAGE_NUMBER);
    return new CandidateMetadata(
        metadata.getString(DOCUMENT_ID),
        metadata.getString(DOCUMENT_NAME),
        page == null ? 0 : page,
        metadata.getString(SECTION_HEADING));
  }
}
