package dev.pmsignal.feedback;

import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.segment.TextSegment;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Text and metadata of one feedback chunk about to be embedded and stored.
 *
 * @param text the chunk body
 * @param sessionId upload session the chunk belongs to
 * @param sourceFile name of the uploaded file
 * @param sourceType channel the chunk came from
 * @param author message or ticket author; null if not known
 * @param timestamp source timestamp as provided by the upstream parser; null if not known
 */
public record FeedbackChunkData(
    String text,
    String sessionId,
    String sourceFile,
    SourceType sourceType,
    @Nullable String author,
    @Nullable String timestamp) {

  static final String SESSION_ID = "session_id";
  static final String SOURCE_FILE = "source_file";
  static final String SOURCE_TYPE = "source_type";
  static final String AUTHOR = "author";
  static final String TIMESTAMP = "timestamp";

  public FeedbackChunkData {
    Objects.requireNonNull(text, "text must not be null");
    Objects.requireNonNull(sessionId, "sessionId must not be null");
    Objects.requireNonNull(sourceFile, "sourceFile must not be null");
    Objects.requireNonNull(sourceType, "sourceType must not be null");
  }

  /** Metadata with the snake_case keys the store filters on. */
  public Metadata toMetadata() {
    Metadata metadata =
        Metadata.from(SESSION_ID, sessionId)
            .put(SOURCE_FILE, sourceFile)
            .put(SOURCE_TYPE, sourceType.value());
    if (author != null && !author.isBlank()) {
      metadata.put(AUTHOR, author);
    }
    if (timestamp != null && !timestamp.isBlank()) {
      metadata.put(TIMESTAMP, timestamp);
    }
    return metadata;
  }

  public TextSegment toTextSegment() {
    return TextSegment.from(text, toMetadata());
  }
}
