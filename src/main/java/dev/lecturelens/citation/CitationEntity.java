package dev.lecturelens.citation;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * Persisted form of a {@link Citation}. Rows are written once and never updated.
 *
 * <p>Maps to the {@code citations} table managed by Flyway migrations.
 */
@Entity
@Table(name = "citations")
public class CitationEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "session_id", nullable = false, updatable = false)
  private String sessionId;

  @Column(name = "window_index", nullable = false, updatable = false)
  private int windowIndex;

  @Column(nullable = false, updatable = false)
  private int rank;

  @Column(name = "document_id", nullable = false, updatable = false)
  private String documentId;

  @Column(name = "document_name", nullable = false, updatable = false)
  private String documentName;

  @Column(name = "page_number", nullable = false, updatable = false)
  private int pageNumber;

  @Column(name = "section_heading", updatable = false)
  private String sectionHeading;

  @Column(nullable = false, updatable = false, columnDefinition = "TEXT")
  private String snippet;

  @Column(name = "relevance_score", nullable = false, updatable = false)
  private double relevanceScore;

  @Column(name = "transcript_fragment_id", updatable = false)
  private String transcriptFragmentId;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected CitationEntity() {
    // JPA requires no-arg constructor
  }

  static CitationEntity from(Citation citation) {
    CitationEntity entity = new CitationEntity();
    entity.sessionId = citation.sessionId();
    entity.windowIndex = citation.windowIndex();
    entity.rank = citation.rank();
    entity.documentId = citation.documentId();
    entity.documentName = citation.documentName();
    entity.pageNumber = citation.pageNumber();
    entity.sectionHeading = citation.sectionHeading();
    entity.snippet = citation.snippet();
    entity.relevanceScore = citation.relevanceScore();
    entity.transcriptFragmentId = citation.transcriptFragmentId();
    return entity;
  }

  Citation toCitation() {
    return new Citation(
        rank,
        documentId,
        documentName,
        pageNumber,
        sectionHeading,
        snippet,
        relevanceScore,
        windowIndex,
        sessionId,
        transcriptFragmentId);
  }

  @PrePersist
  protected void onCreate() {
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getSessionId() {
    return sessionId;
  }

  public int getWindowIndex() {
    return windowIndex;
  }

  public int getRank() {
    return rank;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
