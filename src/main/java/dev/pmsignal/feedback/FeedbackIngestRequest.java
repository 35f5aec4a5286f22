package dev.pmsignal.feedback;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import java.util.List;

/**
 * Feedback chunks extracted from one uploaded file.
 *
 * @param sessionId session to add the chunks to; null starts a new session
 * @param sourceFile name of the uploaded file
 * @param sourceType channel the file came from
 * @param chunks extracted chunks (must not be empty)
 */
public record FeedbackIngestRequest(
    @Pattern(regexp = "[A-Za-z0-9_-]{1,64}") String sessionId,
    @NotBlank String sourceFile,
    @NotNull SourceType sourceType,
    @NotEmpty @Valid List<FeedbackIngestChunk> chunks) {
  public FeedbackIngestRequest {
    chunks = chunks == null ? List.of() : List.copyOf(chunks);
  }
}
