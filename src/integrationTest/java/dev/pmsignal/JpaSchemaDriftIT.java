package dev.pmsignal;

import static org.assertj.core.api.Assertions.assertThat;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.pmsignal.feedback.FeedbackChunk;
import dev.pmsignal.feedback.FeedbackChunkData;
import dev.pmsignal.feedback.FeedbackChunkRepository;
import dev.pmsignal.feedback.SourceType;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.annotation.Transactional;

/**
 * Compensates for ddl-auto=none by verifying the JPA entity reads rows written by LangChain4j
 * against the Flyway schema.
 */
@Transactional
class JpaSchemaDriftIT extends BaseIntegrationTest {

  @Autowired private FeedbackChunkRepository chunkRepository;

  @Autowired private EmbeddingModel embeddingModel;

  @Test
  void feedbackChunkReadableViaJpaAfterLangchain4jInsert() {
    var data =
        new FeedbackChunkData(
            "Checkout page freezes on submit",
            "drift-session",
            "tickets.csv",
            SourceType.JIRA,
            "dana",
            null);
    Embedding embedding = embeddingModel.embed(data.text()).content();
    String storedId = embeddingStore.add(embedding, data.toTextSegment());

    FeedbackChunk found = chunkRepository.findById(UUID.fromString(storedId)).orElseThrow();

    assertThat(found.getText()).isEqualTo("Checkout page freezes on submit");
    assertThat(found.getMetadata())
        .contains("\"session_id\"")
        .contains("drift-session")
        .contains("\"author\"");
    assertThat(found.getCreatedAt()).isNotNull();
  }
}
