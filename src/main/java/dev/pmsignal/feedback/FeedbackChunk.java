package dev.pmsignal.feedback;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * A stored feedback chunk in pgvector.
 *
 * <p>Rows are written by LangChain4j's {@code PgVectorEmbeddingStore}; the embedding column is not
 * mapped here and is read back through the native queries of {@link FeedbackChunkRepository}.
 *
 * <p>Maps to the {@code feedback_chunks} table managed by Flyway migrations.
 */
@Entity
@Table(name = "feedback_chunks")
public class FeedbackChunk {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  @Column(name = "embedding_id")
  private UUID id;

  @Column(nullable = false, columnDefinition = "TEXT")
  private String text;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(columnDefinition = "JSONB")
  private String metadata;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected FeedbackChunk() {
    // JPA requires no-arg constructor
  }

  @PrePersist
  protected void onCreate() {
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getText() {
    return text;
  }

  public String getMetadata() {
    return metadata;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
