package dev.pmsignal;

import static org.assertj.core.api.Assertions.assertThat;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.pmsignal.keypool.KeyPool;
import dev.pmsignal.mcp.McpToolService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class ApplicationContextIT extends BaseIntegrationTest {

  @Autowired EmbeddingModel embeddingModel;

  @Autowired KeyPool keyPool;

  @Autowired McpToolService mcpToolService;

  @Test
  void embeddingModelProduces384DimensionVectors() {
    float[] vector = embeddingModel.embed("The export button does nothing").content().vector();

    assertThat(vector).hasSize(384);
    assertThat(vector).isNotEqualTo(new float[384]);
  }

  @Test
  void keyPoolIsRegisteredFromConfiguration() {
    assertThat(keyPool.providers()).contains("groq");
    assertThat(keyPool.status("groq")).hasSize(2);
  }

  @Test
  void toolsAnswerAgainstEmptyDatabase() {
    assertThat(mcpToolService.clusterFeedback("nobody", null))
        .isEqualTo("No feedback found for session nobody.");
    assertThat(mcpToolService.sessionStatistics("nobody"))
        .isEqualTo("Session nobody: 0 chunks stored, 4 questions remaining.");
  }
}
