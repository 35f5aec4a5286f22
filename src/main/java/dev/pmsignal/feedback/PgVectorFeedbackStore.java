package dev.pmsignal.feedback;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

/**
 * {@link FeedbackStore} on PostgreSQL/pgvector.
 *
 * <p>Writes and similarity search go through LangChain4j's {@link EmbeddingStore}. Reading back all
 * vectors of a session is not something the embedding store offers, so {@link #fetchAll(String)}
 * uses a native query and parses the pgvector text representation itself.
 */
@Repository
public class PgVectorFeedbackStore implements FeedbackStore {

  private static final Logger log = LoggerFactory.getLogger(PgVectorFeedbackStore.class);

  private final EmbeddingStore<TextSegment> embeddingStore;
  private final FeedbackChunkRepository chunkRepository;
  private final ObjectMapper objectMapper;

  public PgVectorFeedbackStore(
      EmbeddingStore<TextSegment> embeddingStore,
      FeedbackChunkRepository chunkRepository,
      ObjectMapper objectMapper) {
    this.embeddingStore = embeddingStore;
    this.chunkRepository = chunkRepository;
    this.objectMapper = objectMapper;
  }

  @Override
  public List<String> addAll(List<FeedbackChunkData> chunks, List<Embedding> embeddings) {
    if (chunks.size() != embeddings.size()) {
      throw new IllegalArgumentException(
          "chunks and embeddings differ in size: " + chunks.size() + " vs " + embeddings.size());
    }
    if (chunks.isEmpty()) {
      return List.of();
    }
    List<TextSegment> segments = chunks.stream().map(FeedbackChunkData::toTextSegment).toList();
    return embeddingStore.addAll(embeddings, segments);
  }

  @Override
  public List<FeedbackRecord> fetchAll(String sessionId) {
    List<Object[]> rows = chunkRepository.findRowsBySessionId(sessionId);
    List<FeedbackRecord> records = new ArrayList<>(rows.size());
    for (Object[] row : rows) {
      records.add(toRecord(row, sessionId));
    }
    log.debug("Fetched {} feedback records for session {}", records.size(), sessionId);
    return records;
  }

  @Override
  public List<FeedbackMatch> search(String sessionId, Embedding queryEmbedding, int maxResults) {
    EmbeddingSearchRequest request =
        EmbeddingSearchRequest.builder()
            .queryEmbedding(queryEmbedding)
            .maxResults(maxResults)
            .filter(metadataKey(FeedbackChunkData.SESSION_ID).isEqualTo(sessionId))
            .build();
    return embeddingStore.search(request).matches().stream().map(this::toMatch).toList();
  }

  private FeedbackMatch toMatch(EmbeddingMatch<TextSegment> match) {
    TextSegment segment = match.embedded();
    return new FeedbackMatch(
        match.embeddingId(),
        segment.text(),
        Objects.requireNonNullElse(segment.metadata().getString(FeedbackChunkData.SOURCE_FILE), ""),
        SourceType.fromValue(segment.metadata().getString(FeedbackChunkData.SOURCE_TYPE)),
        segment.metadata().getString(FeedbackChunkData.AUTHOR),
        match.score());
  }

  private FeedbackRecord toRecord(Object[] row, String sessionId) {
    String id = String.valueOf(row[0]);
    float[] embedding = parseVector((String) row[1]);
    String text = (String) row[2];
    JsonNode metadata = parseMetadata(id, (String) row[3]);
    return new FeedbackRecord(
        id,
        embedding,
        text,
        metadata.path(FeedbackChunkData.SOURCE_FILE).asText(""),
        SourceType.fromValue(metadata.path(FeedbackChunkData.SOURCE_TYPE).asText(null)),
        sessionId);
  }

  private JsonNode parseMetadata(String id, String json) {
    if (json == null || json.isBlank()) {
      return objectMapper.createObjectNode();
    }
    try {
      return objectMapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unreadable metadata on feedback chunk " + id, e);
    }
  }

  /**
   * Parses pgvector's text form ({@code [0.1,0.2,...]}).
   *
   * @throws IllegalArgumentException if the text is not a bracketed list of numbers
   */
  static float[] parseVector(String text) {
    if (text == null) {
      throw new IllegalArgumentException("Vector text must not be null");
    }
    String trimmed = text.strip();
    if (trimmed.length() < 2 || trimmed.charAt(0) != '[' || trimmed.charAt(trimmed.length() - 1) != ']') {
      throw new IllegalArgumentException("Not a pgvector literal: " + text);
    }
    String body = trimmed.substring(1, trimmed.length() - 1).strip();
    if (body.isEmpty()) {
      return new float[0];
    }
    String[] parts = body.split(",");
    float[] vector = new float[parts.length];
    for (int i = 0; i < parts.length; i++) {
      vector[i] = Float.parseFloat(parts[i].strip());
    }
    return vector;
  }
}
