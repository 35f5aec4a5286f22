package dev.pmsignal.clustering;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.fasterxml.jackson.databind.ObjectMapper;

import dev.pmsignal.feedback.FeedbackRecord;
import dev.pmsignal.feedback.FeedbackStore;
import dev.pmsignal.feedback.SourceType;
import dev.pmsignal.fixture.FeedbackRecordBuilder;
import dev.pmsignal.fixture.MutableClock;
import dev.pmsignal.generation.GenerationOptions;
import dev.pmsignal.generation.KeyRotatingGenerator;
import dev.pmsignal.generation.TextGenerator;
import dev.pmsignal.keypool.ExhaustedPoolException;
import dev.pmsignal.keypool.KeyPool;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ClusteringServiceTest {

  private static final String SESSION = "session-1";

  @Mock FeedbackStore feedbackStore;
  @Mock ClusterNamer namer;
  @Mock TextGenerator textGenerator;

  private ClusteringService service;

  @BeforeEach
  void setUp() {
    service = serviceNamingWith(namer);
  }

  @Test
  void emptySessionSucceedsWithoutClusters() {
    given(feedbackStore.fetchAll(SESSION)).willReturn(List.of());

    ClusteringOutcome outcome = service.runClustering(SESSION, null);

    assertThat(outcome).isEqualTo(new ClusteringOutcome.Success(List.of()));
    verifyNoInteractions(namer);
  }

  @Test
  void groupsSeparatedFeedbackIntoNamedClusters() {
    List<FeedbackRecord> records = new ArrayList<>();
    records.addAll(blob("login", "slack.json", SourceType.SLACK, 1, 0, 0));
    records.addAll(blob("export", "tickets.csv", SourceType.JIRA, 0, 1, 0));
    records.addAll(blob("billing", "call.txt", SourceType.TRANSCRIPT, 0, 0, 1));
    given(feedbackStore.fetchAll(SESSION)).willReturn(records);
    givenSequentialNames();

    ClusteringOutcome outcome = service.runClustering(SESSION, null);

    assertThat(outcome).isInstanceOf(ClusteringOutcome.Success.class);
    List<IssueCluster> clusters = ((ClusteringOutcome.Success) outcome).clusters();
    assertThat(clusters).hasSize(3);
    assertThat(clusters).extracting(IssueCluster::count).containsExactly(5, 5, 5);
    assertThat(clusters)
        .extracting(IssueCluster::name)
        .containsExactly("Theme A", "Theme B", "Theme C");
    for (IssueCluster cluster : clusters) {
      assertThat(cluster.excerpts()).hasSize(3);
      assertThat(cluster.sourceHistogram()).containsOnlyKeys(SourceType.values());
      assertThat(cluster.sourceHistogram().values()).containsOnly(0, 5);
    }
  }

  @Test
  void countsCoverEveryDeduplicatedRecord() {
    List<FeedbackRecord> records = new ArrayList<>();
    records.addAll(blob("login", "slack.json", SourceType.SLACK, 1, 0, 0));
    records.addAll(blob("export", "tickets.csv", SourceType.JIRA, 0, 1, 0));
    records.add(
        new FeedbackRecordBuilder().text("login issue 0").sourceFile("other.json").build());
    given(feedbackStore.fetchAll(SESSION)).willReturn(records);
    givenSequentialNames();

    ClusteringOutcome.Success outcome =
        (ClusteringOutcome.Success) service.runClustering(SESSION, null);

    assertThat(outcome.totalRecords()).isEqualTo(10);
  }

  @Test
  void syntheticCopiesNeverReachTheResult() {
    List<FeedbackRecord> records = new ArrayList<>();
    for (int i = 0; i < 19; i++) {
      records.add(
          new FeedbackRecordBuilder()
              .text("chat message " + i)
              .sourceFile("slack.json")
              .sourceType(SourceType.SLACK)
              .vector(1.0f, 0.05f * i, 0.0f)
              .build());
    }
    records.add(
        new FeedbackRecordBuilder()
            .text("crash when exporting to pdf")
            .sourceFile("tickets.csv")
            .sourceType(SourceType.JIRA)
            .vector(0.0f, 0.0f, 1.0f)
            .build());
    given(feedbackStore.fetchAll(SESSION)).willReturn(records);
    givenSequentialNames();

    ClusteringOutcome.Success outcome =
        (ClusteringOutcome.Success) service.runClustering(SESSION, null);

    assertThat(outcome.totalRecords()).isEqualTo(20);
    int jiraMembers =
        outcome.clusters().stream()
            .mapToInt(cluster -> cluster.sourceHistogram().get(SourceType.JIRA))
            .sum();
    assertThat(jiraMembers).isEqualTo(1);
  }

  @Test
  void clustersAreOrderedBySize() {
    List<FeedbackRecord> records = new ArrayList<>();
    records.addAll(blob("login", "slack.json", SourceType.SLACK, 1, 0, 0));
    records.addAll(blob("export", "tickets.csv", SourceType.JIRA, 0, 1, 0).subList(0, 3));
    records.addAll(blob("billing", "call.txt", SourceType.TRANSCRIPT, 0, 0, 1).subList(0, 4));
    given(feedbackStore.fetchAll(SESSION)).willReturn(records);
    givenSequentialNames();

    ClusteringOutcome.Success outcome =
        (ClusteringOutcome.Success) service.runClustering(SESSION, null);

    assertThat(outcome.clusters()).extracting(IssueCluster::count).containsExactly(5, 4, 3);
  }

  @Test
  void hintCapsNumberOfClusters() {
    List<FeedbackRecord> records = new ArrayList<>();
    records.addAll(blob("login", "slack.json", SourceType.SLACK, 1, 0, 0));
    records.addAll(blob("export", "tickets.csv", SourceType.JIRA, 0, 1, 0));
    records.addAll(blob("billing", "call.txt", SourceType.TRANSCRIPT, 0, 0, 1));
    given(feedbackStore.fetchAll(SESSION)).willReturn(records);
    givenSequentialNames();

    ClusteringOutcome.Success outcome =
        (ClusteringOutcome.Success) service.runClustering(SESSION, 2);

    assertThat(outcome.clusters()).hasSizeLessThanOrEqualTo(2);
    assertThat(outcome.totalRecords()).isEqualTo(15);
  }

  @Test
  void lookAlikeNamesAreReplacedAfterRanking() {
    List<FeedbackRecord> records = new ArrayList<>();
    records.addAll(blob("login", "slack.json", SourceType.SLACK, 1, 0, 0));
    records.addAll(blob("export", "tickets.csv", SourceType.JIRA, 0, 1, 0).subList(0, 4));
    given(feedbackStore.fetchAll(SESSION)).willReturn(records);
    given(namer.name(anyList(), anyList()))
        .willReturn(List.of("Slow Page Load Times", "Slow Page Load Errors"));

    ClusteringOutcome.Success outcome =
        (ClusteringOutcome.Success) service.runClustering(SESSION, 2);

    assertThat(outcome.clusters())
        .extracting(IssueCluster::name)
        .containsExactly("Slow Page Load Times", "Unclassified Theme 2");
  }

  @Test
  void exhaustedNamingPoolIsReportedAsOutcome() {
    given(feedbackStore.fetchAll(SESSION))
        .willReturn(blob("login", "slack.json", SourceType.SLACK, 1, 0, 0));
    given(namer.name(anyList(), anyList()))
        .willThrow(new ExhaustedPoolException("groq", Duration.ofSeconds(30)));

    ClusteringOutcome outcome = service.runClustering(SESSION, null);

    assertThat(outcome).isInstanceOf(ClusteringOutcome.PoolExhausted.class);
    ClusteringOutcome.PoolExhausted exhausted = (ClusteringOutcome.PoolExhausted) outcome;
    assertThat(exhausted.provider()).isEqualTo("groq");
    assertThat(exhausted.retryAfter()).isEqualTo(Duration.ofSeconds(30));
  }

  @Test
  void unparsableNamingResponsesLeaveCompleteGroupsWithPlaceholderNames() {
    KeyPool keyPool =
        new KeyPool(MutableClock.startingAt("2026-01-01T00:00:00Z"), Duration.ofSeconds(65));
    keyPool.register("groq", List.of("key-a", "key-b", "key-c", "key-d"));
    ClusterNamer realNamer =
        new ClusterNamer(
            new KeyRotatingGenerator(keyPool, textGenerator),
            new ClusteringProperties(),
            new ObjectMapper());
    ClusteringService pipeline = serviceNamingWith(realNamer);
    List<FeedbackRecord> records = new ArrayList<>();
    records.addAll(blob("login", "slack.json", SourceType.SLACK, 1, 0, 0));
    records.addAll(blob("export", "tickets.csv", SourceType.JIRA, 0, 1, 0));
    records.addAll(blob("billing", "call.txt", SourceType.TRANSCRIPT, 0, 0, 1));
    given(feedbackStore.fetchAll(SESSION)).willReturn(records);
    given(textGenerator.generate(anyString(), anyString(), any(GenerationOptions.class)))
        .willReturn("Sorry, I cannot do that.");

    ClusteringOutcome.Success outcome =
        (ClusteringOutcome.Success) pipeline.runClustering(SESSION, null);

    // two framings, two rotations each
    verify(textGenerator, times(4))
        .generate(anyString(), anyString(), any(GenerationOptions.class));
    assertThat(outcome.clusters())
        .extracting(IssueCluster::name)
        .containsExactly("Unclassified Theme 1", "Unclassified Theme 2", "Unclassified Theme 3");
    assertThat(outcome.totalRecords()).isEqualTo(15);
    for (IssueCluster cluster : outcome.clusters()) {
      assertThat(cluster.excerpts())
          .isNotEmpty()
          .allSatisfy(excerpt -> assertThat(excerpt).hasSizeLessThanOrEqualTo(100));
      int histogramTotal =
          cluster.sourceHistogram().values().stream().mapToInt(Integer::intValue).sum();
      assertThat(histogramTotal).isEqualTo(cluster.count());
    }
  }

  @Test
  void duplicatesAreRemovedBeforeClustering() {
    List<FeedbackRecord> records =
        new ArrayList<>(blob("login", "slack.json", SourceType.SLACK, 1, 0, 0));
    records.add(
        new FeedbackRecordBuilder()
            .text("LOGIN ISSUE 0")
            .sourceFile("copy.json")
            .vector(1, 0, 0)
            .build());
    given(feedbackStore.fetchAll(SESSION)).willReturn(records);
    givenSequentialNames();

    ClusteringOutcome.Success outcome =
        (ClusteringOutcome.Success) service.runClustering(SESSION, null);

    assertThat(outcome.totalRecords()).isEqualTo(5);
  }

  private ClusteringService serviceNamingWith(ClusterNamer clusterNamer) {
    ClusteringProperties properties = new ClusteringProperties();
    return new ClusteringService(
        feedbackStore,
        new Deduplicator(properties),
        new ClusterCountSelector(),
        new MinoritySourceBalancer(properties),
        new Partitioner(properties),
        new TinyClusterMerger(properties),
        new RepresentativeSelector(properties),
        clusterNamer,
        new DuplicateNameFlagger());
  }

  private void givenSequentialNames() {
    given(namer.name(anyList(), anyList()))
        .willAnswer(
            invocation -> {
              List<?> groups = invocation.getArgument(0);
              return IntStream.range(0, groups.size())
                  .mapToObj(i -> "Theme " + (char) ('A' + i))
                  .toList();
            });
  }

  /** Five distinct records from one file, tightly packed around the given direction. */
  private static List<FeedbackRecord> blob(
      String topic, String file, SourceType type, float x, float y, float z) {
    List<FeedbackRecord> records = new ArrayList<>();
    for (int i = 0; i < 5; i++) {
      float jitter = 0.01f * i;
      records.add(
          new FeedbackRecordBuilder()
              .text(topic + " issue " + i)
              .sourceFile(file)
              .sourceType(type)
              .vector(x + jitter, y + jitter, z + jitter)
              .build());
    }
    return records;
  }
}
