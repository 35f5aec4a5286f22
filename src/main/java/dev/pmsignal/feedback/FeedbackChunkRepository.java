package dev.pmsignal.feedback;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/** Spring Data repository for {@link FeedbackChunk} entities. */
public interface FeedbackChunkRepository extends JpaRepository<FeedbackChunk, UUID> {

  /**
   * Returns every chunk of a session with its embedding in pgvector text form.
   *
   * @param sessionId the upload session
   * @return rows of [embedding_id, embedding ("[x,y,...]"), text, metadata JSON]
   */
  @Query(
      value =
          """
            SELECT CAST(embedding_id AS text), CAST(embedding AS text), text, CAST(metadata AS text)
            FROM feedback_chunks
            WHERE metadata->>'session_id' = :sessionId
            ORDER BY created_at, embedding_id
            """,
      nativeQuery = true)
  List<Object[]> findRowsBySessionId(@Param("sessionId") String sessionId);

  /**
   * Counts the chunks stored for a session.
   *
   * @param sessionId the upload session
   * @return chunk count
   */
  @Query(
      value = "SELECT COUNT(*) FROM feedback_chunks WHERE metadata->>'session_id' = :sessionId",
      nativeQuery = true)
  long countBySessionId(@Param("sessionId") String sessionId);
}
