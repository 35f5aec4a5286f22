package dev.pmsignal.config;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.bgesmallenv15q.BgeSmallEnV15QuantizedEmbeddingModel;
import dev.langchain4j.model.scoring.ScoringModel;
import dev.langchain4j.model.scoring.onnx.OnnxScoringModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.pgvector.DefaultMetadataStorageConfig;
import dev.langchain4j.store.embedding.pgvector.MetadataStorageMode;
import dev.langchain4j.store.embedding.pgvector.PgVectorEmbeddingStore;
import java.util.List;
import javax.sql.DataSource;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configures the embedding model, the cross-encoder and the feedback vector store.
 *
 * <p>Feedback chunks are embedded in-process with the ONNX bge-small-en-v1.5 quantized model (384
 * dimensions). The {@link PgVectorEmbeddingStore} writes to the {@code feedback_chunks} table and
 * shares the application's HikariCP {@link DataSource}.
 */
@Configuration
public class EmbeddingConfig {

    /** Dimension of the bge-small-en-v1.5 vectors; must match the V1 migration. */
    public static final int EMBEDDING_DIMENSION = 384;

    @Bean
    public EmbeddingModel embeddingModel() {
        return new BgeSmallEnV15QuantizedEmbeddingModel();
    }

    /**
     * Provides the in-process ONNX cross-encoder (ms-marco-MiniLM-L-6-v2) used to rerank retrieved
     * feedback before answer generation.
     *
     * @param modelPath     path to the ONNX model file
     * @param tokenizerPath path to the tokenizer JSON file
     * @return a ready-to-use scoring model
     */
    @Bean
    public ScoringModel scoringModel(
            @Value("${pmsignal.reranker.model-path}") String modelPath,
            @Value("${pmsignal.reranker.tokenizer-path}") String tokenizerPath) {
        return new OnnxScoringModel(modelPath, tokenizerPath);
    }

    /**
     * Configures the pgvector store over {@code feedback_chunks}.
     *
     * <p>Schema and HNSW index are owned by Flyway, so {@code createTable} and {@code useIndex} are
     * disabled. Metadata is a single JSONB column, matching the V1 migration and the session
     * queries in {@link dev.pmsignal.feedback.FeedbackChunkRepository}.
     *
     * @param dataSource the shared HikariCP data source
     * @return an embedding store scoped to feedback chunks
     */
    @Bean
    public EmbeddingStore<TextSegment> embeddingStore(DataSource dataSource) {
        return PgVectorEmbeddingStore.datasourceBuilder()
                .datasource(dataSource)
                .table("feedback_chunks")
                .dimension(EMBEDDING_DIMENSION)
                .createTable(false)
                .useIndex(false)
                .metadataStorageConfig(DefaultMetadataStorageConfig.builder()
                        .storageMode(MetadataStorageMode.COMBINED_JSONB)
                        .columnDefinitions(List.of("metadata JSONB NULL"))
                        .build())
                .build();
    }
}
