package dev.pmsignal.feedback;

import jakarta.validation.constraints.NotNull;

/**
 * One extracted piece of feedback text in an ingestion request.
 *
 * @param text the feedback text
 * @param author message or ticket author; may be null
 * @param timestamp source timestamp as emitted by the extracting parser; may be null
 */
public record FeedbackIngestChunk(@NotNull String text, String author, String timestamp) {

  public static FeedbackIngestChunk of(String text) {
    return new FeedbackIngestChunk(text, null, null);
  }
}
