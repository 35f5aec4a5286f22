package dev.pmsignal.feedback;

import org.jspecify.annotations.Nullable;

/**
 * A feedback chunk returned by similarity search.
 *
 * @param id embedding id in the vector store
 * @param text the chunk text
 * @param sourceFile name of the uploaded file the chunk came from
 * @param sourceType channel the chunk came from
 * @param author author recorded at ingestion; null when unknown
 * @param score cosine relevance score reported by the store
 */
public record FeedbackMatch(
    String id,
    String text,
    String sourceFile,
    SourceType sourceType,
    @Nullable String author,
    double score) {}
