package dev.pmsignal.query;

import dev.pmsignal.feedback.SourceType;
import org.jspecify.annotations.Nullable;

/**
 * A feedback chunk retrieved for a question.
 *
 * @param text the chunk text
 * @param sourceFile file the chunk came from
 * @param sourceType channel the chunk came from
 * @param author author if known
 * @param similarity raw cosine relevance from the vector store
 * @param weightedScore similarity multiplied by the source-type weight
 * @param rerankScore cross-encoder score; null if reranking did not run
 */
public record RetrievedFeedback(
    String text,
    String sourceFile,
    SourceType sourceType,
    @Nullable String author,
    double similarity,
    double weightedScore,
    @Nullable Double rerankScore) {

  public RetrievedFeedback withRerankScore(double score) {
    return new RetrievedFeedback(
        text, sourceFile, sourceType, author, similarity, weightedScore, score);
  }
}
