package dev.pmsignal.feedback;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.pmsignal.BaseIntegrationTest;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class FeedbackIngestionServiceIT extends BaseIntegrationTest {

  @Autowired FeedbackIngestionService ingestionService;

  @Autowired FeedbackStore feedbackStore;

  @Test
  void ingestedChunksAreFetchableWithEmbeddings() {
    IngestionReceipt receipt =
        ingestionService.ingest(
            new FeedbackIngestRequest(
                null,
                "support-call.txt",
                SourceType.TRANSCRIPT,
                List.of(
                    FeedbackIngestChunk.of("The onboarding checklist never marks steps as done"),
                    FeedbackIngestChunk.of("ok"),
                    new FeedbackIngestChunk(
                        "Customers want SAML login for the admin console", "sam", "00:14:03"))));

    assertThat(receipt.chunksStored()).isEqualTo(2);
    assertThat(receipt.chunksSkipped()).isEqualTo(1);
    List<FeedbackRecord> records = feedbackStore.fetchAll(receipt.sessionId());
    assertThat(records).hasSize(2);
    assertThat(records).allSatisfy(r -> assertThat(r.embedding()).hasSize(384));
    assertThat(records).allSatisfy(r -> assertThat(r.sourceType()).isEqualTo(SourceType.TRANSCRIPT));
  }

  @Test
  void ingestingIntoExistingSessionAppends() {
    ingestionService.ingest(request("appended", "slack.json", "Search results are always stale"));
    ingestionService.ingest(request("appended", "tickets.csv", "Bulk edit drops custom fields"));

    assertThat(feedbackStore.fetchAll("appended"))
        .extracting(FeedbackRecord::sourceFile)
        .containsExactly("slack.json", "tickets.csv");
  }

  @Test
  void invalidRequestStoresNothing() {
    assertThatThrownBy(() -> ingestionService.ingest(request("bad id!", "slack.json", "Some text here")))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(feedbackStore.fetchAll("bad id!")).isEmpty();
  }

  private static FeedbackIngestRequest request(String sessionId, String file, String text) {
    return new FeedbackIngestRequest(
        sessionId, file, SourceType.SLACK, List.of(FeedbackIngestChunk.of(text)));
  }
}
