package dev.pmsignal.feedback;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Embeds extracted feedback chunks and stores them under an upload session.
 *
 * <p>Validation is all-or-nothing: if any part of the request is invalid nothing is stored.
 * Embeddings are computed for every chunk before the store is touched, so a model failure leaves
 * the session unchanged.
 */
@Service
public class FeedbackIngestionService {

    private static final Logger log = LoggerFactory.getLogger(FeedbackIngestionService.class);

    static final int EMBED_BATCH_SIZE = 256;

    /** Chunks whose stripped text is shorter than this carry no usable signal. */
    static final int MIN_CHUNK_LENGTH = 10;

    private final FeedbackStore feedbackStore;
    private final EmbeddingModel embeddingModel;
    private final Validator validator;

    public FeedbackIngestionService(FeedbackStore feedbackStore,
                                    EmbeddingModel embeddingModel,
                                    Validator validator) {
        this.feedbackStore = feedbackStore;
        this.embeddingModel = embeddingModel;
        this.validator = validator;
    }

    /**
     * Validates, embeds and stores the chunks of one uploaded file.
     *
     * @param request the chunks and their source
     * @return the session id used and how many chunks were stored
     * @throws IllegalArgumentException if the request fails validation
     */
    public IngestionReceipt ingest(FeedbackIngestRequest request) {
        Set<ConstraintViolation<FeedbackIngestRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            String messages = violations.stream()
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining(", "));
            throw new IllegalArgumentException("Validation failed: " + messages);
        }

        String sessionId = request.sessionId() != null ? request.sessionId() : newSessionId();

        List<FeedbackChunkData> chunks = new ArrayList<>();
        for (FeedbackIngestChunk chunk : request.chunks()) {
            String text = chunk.text().strip();
            if (text.length() < MIN_CHUNK_LENGTH) {
                continue;
            }
            chunks.add(new FeedbackChunkData(text, sessionId, request.sourceFile(),
                    request.sourceType(), chunk.author(), chunk.timestamp()));
        }
        int skipped = request.chunks().size() - chunks.size();

        if (chunks.isEmpty()) {
            log.info("No storable chunks in {} for session {} ({} skipped)",
                    request.sourceFile(), sessionId, skipped);
            return new IngestionReceipt(sessionId, 0, skipped);
        }

        List<TextSegment> segments = chunks.stream().map(FeedbackChunkData::toTextSegment).toList();
        List<Embedding> embeddings = embedAll(segments);
        feedbackStore.addAll(chunks, embeddings);

        log.info("Stored {} chunks from {} ({}) in session {} ({} skipped)",
                chunks.size(), request.sourceFile(), request.sourceType().value(), sessionId, skipped);
        return new IngestionReceipt(sessionId, chunks.size(), skipped);
    }

    private List<Embedding> embedAll(List<TextSegment> segments) {
        if (segments.size() <= EMBED_BATCH_SIZE) {
            return embeddingModel.embedAll(segments).content();
        }
        List<Embedding> all = new ArrayList<>();
        for (int i = 0; i < segments.size(); i += EMBED_BATCH_SIZE) {
            List<TextSegment> batch = segments.subList(i, Math.min(i + EMBED_BATCH_SIZE, segments.size()));
            all.addAll(embeddingModel.embedAll(batch).content());
        }
        return all;
    }

    static String newSessionId() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}
