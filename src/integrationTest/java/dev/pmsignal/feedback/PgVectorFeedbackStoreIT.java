package dev.pmsignal.feedback;

import static org.assertj.core.api.Assertions.assertThat;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.pmsignal.BaseIntegrationTest;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class PgVectorFeedbackStoreIT extends BaseIntegrationTest {

  @Autowired FeedbackStore feedbackStore;

  @Autowired FeedbackChunkRepository chunkRepository;

  @Autowired EmbeddingModel embeddingModel;

  @Test
  void fetchAllReturnsSessionRecordsInInsertionOrder() {
    store("session-a", "slack.json", SourceType.SLACK, "Login page hangs after SSO redirect");
    store("session-a", "tickets.csv", SourceType.JIRA, "CSV export times out for large projects");
    store("session-b", "call.txt", SourceType.TRANSCRIPT, "Pricing page is confusing");

    List<FeedbackRecord> records = feedbackStore.fetchAll("session-a");

    assertThat(records)
        .extracting(FeedbackRecord::text)
        .containsExactly(
            "Login page hangs after SSO redirect", "CSV export times out for large projects");
    FeedbackRecord ticket = records.get(1);
    assertThat(ticket.sourceFile()).isEqualTo("tickets.csv");
    assertThat(ticket.sourceType()).isEqualTo(SourceType.JIRA);
    assertThat(ticket.sessionId()).isEqualTo("session-a");
    assertThat(ticket.embedding()).hasSize(384);
  }

  @Test
  void fetchAllOfUnknownSessionIsEmpty() {
    store("session-a", "slack.json", SourceType.SLACK, "Login page hangs after SSO redirect");

    assertThat(feedbackStore.fetchAll("missing")).isEmpty();
  }

  @Test
  void searchOnlyReturnsMatchesFromRequestedSession() {
    store("session-a", "slack.json", SourceType.SLACK, "Dark mode resets after every reload");
    store("session-b", "slack.json", SourceType.SLACK, "Dark mode resets after every reload");
    store("session-b", "call.txt", SourceType.TRANSCRIPT, "Invoices show the wrong currency");

    Embedding query = embeddingModel.embed("dark mode setting is lost").content();
    List<FeedbackMatch> matches = feedbackStore.search("session-a", query, 10);

    assertThat(matches).hasSize(1);
    assertThat(matches.get(0).text()).isEqualTo("Dark mode resets after every reload");
    assertThat(matches.get(0).sourceType()).isEqualTo(SourceType.SLACK);
    assertThat(matches.get(0).score()).isGreaterThan(0.5);
  }

  @Test
  void countBySessionIdCountsOnlyThatSession() {
    store("session-a", "slack.json", SourceType.SLACK, "Login page hangs after SSO redirect");
    store("session-a", "slack.json", SourceType.SLACK, "Search results are stale");
    store("session-b", "slack.json", SourceType.SLACK, "Search results are stale");

    assertThat(chunkRepository.countBySessionId("session-a")).isEqualTo(2);
  }

  private void store(String sessionId, String file, SourceType type, String text) {
    var data = new FeedbackChunkData(text, sessionId, file, type, null, null);
    feedbackStore.addAll(List.of(data), List.of(embeddingModel.embed(text).content()));
  }
}
