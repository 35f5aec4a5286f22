package dev.pmsignal.feedback;

import java.util.Objects;

/**
 * A stored feedback chunk with its embedding, as read back for clustering.
 *
 * <p>Immutable once stored. The {@code embedding} array is shared, not copied; callers must not
 * modify it.
 *
 * @param id embedding id in the vector store
 * @param embedding the chunk's embedding vector
 * @param text the chunk text
 * @param sourceFile name of the uploaded file the chunk came from
 * @param sourceType channel the chunk came from
 * @param sessionId upload session the chunk belongs to
 */
public record FeedbackRecord(
    String id,
    float[] embedding,
    String text,
    String sourceFile,
    SourceType sourceType,
    String sessionId) {

  public FeedbackRecord {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(embedding, "embedding must not be null");
    text = text == null ? "" : text;
    sourceFile = sourceFile == null ? "" : sourceFile;
    sourceType = sourceType == null ? SourceType.UNKNOWN : sourceType;
    Objects.requireNonNull(sessionId, "sessionId must not be null");
  }
}
