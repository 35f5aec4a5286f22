package dev.pmsignal.feedback;

import dev.langchain4j.data.embedding.Embedding;
import java.util.List;

/**
 * Session-scoped vector storage for feedback chunks.
 *
 * @see PgVectorFeedbackStore
 */
public interface FeedbackStore {

  /**
   * Stores embedded chunks. {@code chunks} and {@code embeddings} are parallel lists.
   *
   * @return ids assigned to the stored chunks, in input order
   */
  List<String> addAll(List<FeedbackChunkData> chunks, List<Embedding> embeddings);

  /**
   * Returns every stored chunk of a session with its embedding, in no particular order.
   *
   * @return the session's records; empty (never an error) when the session has no data
   */
  List<FeedbackRecord> fetchAll(String sessionId);

  /**
   * Similarity search restricted to one session.
   *
   * @return at most {@code maxResults} matches, most similar first
   */
  List<FeedbackMatch> search(String sessionId, Embedding queryEmbedding, int maxResults);
}
