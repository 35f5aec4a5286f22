package dev.pmsignal.clustering;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;

import dev.pmsignal.BaseIntegrationTest;
import dev.pmsignal.feedback.FeedbackIngestChunk;
import dev.pmsignal.feedback.FeedbackIngestRequest;
import dev.pmsignal.feedback.FeedbackIngestionService;
import dev.pmsignal.feedback.SourceType;
import dev.pmsignal.generation.GenerationOptions;
import dev.pmsignal.generation.RateLimitedException;
import dev.pmsignal.generation.TextGenerator;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

class ClusteringServiceIT extends BaseIntegrationTest {

  private static final String SESSION = "clustering-it";

  @MockitoBean TextGenerator textGenerator;

  @Autowired FeedbackIngestionService ingestionService;

  @Autowired ClusteringService clusteringService;

  @Test
  void clustersIngestedFeedbackIntoNamedGroups() {
    ingestSampleSession();
    given(textGenerator.generate(anyString(), anyString(), any(GenerationOptions.class)))
        .willReturn(
            "```json\n[\"Login Problems\", \"Export Failures\", \"Billing Confusion\", \"Spare\"]\n```");

    ClusteringOutcome outcome = clusteringService.runClustering(SESSION, null);

    assertThat(outcome).isInstanceOf(ClusteringOutcome.Success.class);
    ClusteringOutcome.Success success = (ClusteringOutcome.Success) outcome;
    assertThat(success.totalRecords()).isEqualTo(18);
    assertThat(success.clusters()).isNotEmpty().hasSizeLessThanOrEqualTo(3);
    assertThat(success.clusters())
        .extracting(IssueCluster::count)
        .isSortedAccordingTo((a, b) -> Integer.compare(b, a));
    assertThat(success.clusters()).allSatisfy(cluster -> {
      assertThat(cluster.name()).isNotBlank();
      assertThat(cluster.excerpts()).isNotEmpty().hasSizeLessThanOrEqualTo(3);
      assertThat(cluster.sourceHistogram().values().stream().mapToInt(Integer::intValue).sum())
          .isEqualTo(cluster.count());
    });
  }

  @Test
  void unknownSessionGivesEmptySuccess() {
    assertThat(clusteringService.runClustering("no-such-session", null))
        .isEqualTo(new ClusteringOutcome.Success(List.of()));
  }

  @Test
  @DirtiesContext(methodMode = DirtiesContext.MethodMode.AFTER_METHOD)
  void rateLimitedCredentialsEndInPoolExhaustedOutcome() {
    ingestSampleSession();
    given(textGenerator.generate(anyString(), anyString(), any(GenerationOptions.class)))
        .willThrow(new RateLimitedException("429 Too Many Requests"));

    ClusteringOutcome outcome = clusteringService.runClustering(SESSION, null);

    assertThat(outcome).isInstanceOf(ClusteringOutcome.PoolExhausted.class);
    assertThat(((ClusteringOutcome.PoolExhausted) outcome).provider()).isEqualTo("groq");
  }

  private void ingestSampleSession() {
    ingest("slack-export.json", SourceType.SLACK,
        "I can't log in with Google SSO since this morning",
        "Password reset emails never arrive in my inbox",
        "Two factor codes are rejected even when typed correctly",
        "Login page spins forever after entering credentials",
        "Session expires every few minutes and kicks me out",
        "The sign in button does nothing on Safari");
    ingest("jira-export.csv", SourceType.JIRA,
        "CSV export times out for projects with many rows",
        "Exported spreadsheet is missing the custom field columns",
        "PDF report download fails with a server error",
        "Export to Excel garbles non English characters",
        "Scheduled export job silently stops running overnight",
        "Downloaded report has dates in the wrong timezone");
    ingest("sales-call.txt", SourceType.TRANSCRIPT,
        "The invoice total does not match the pricing page",
        "We were charged twice for the annual subscription",
        "Nobody understands which plan includes API access",
        "Upgrading mid cycle produced a confusing prorated bill",
        "Refund request has been pending for three weeks",
        "Tax is added at checkout without any warning");
  }

  private void ingest(String file, SourceType type, String... texts) {
    List<FeedbackIngestChunk> chunks =
        Arrays.stream(texts).map(FeedbackIngestChunk::of).toList();
    ingestionService.ingest(new FeedbackIngestRequest(SESSION, file, type, chunks));
  }
}
