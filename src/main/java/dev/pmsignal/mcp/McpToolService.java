package dev.pmsignal.mcp;

import dev.pmsignal.clustering.ClusteringOutcome;
import dev.pmsignal.clustering.ClusteringService;
import dev.pmsignal.clustering.IssueCluster;
import dev.pmsignal.feedback.FeedbackChunkRepository;
import dev.pmsignal.feedback.FeedbackIngestChunk;
import dev.pmsignal.feedback.FeedbackIngestRequest;
import dev.pmsignal.feedback.FeedbackIngestionService;
import dev.pmsignal.feedback.IngestionReceipt;
import dev.pmsignal.feedback.SourceType;
import dev.pmsignal.keypool.ExhaustedPoolException;
import dev.pmsignal.keypool.KeyPool;
import dev.pmsignal.keypool.KeyStatus;
import dev.pmsignal.query.FeedbackQueryService;
import dev.pmsignal.query.QueryAnswer;
import dev.pmsignal.query.QueryCapReachedException;
import dev.pmsignal.query.QueryQuotaTracker;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

/**
 * MCP adapter exposing feedback ingestion, clustering and question answering as tool methods.
 *
 * <p>Each method is annotated with {@code @Tool} and registered via {@link McpToolConfig}. Tool
 * methods follow the structured error pattern: all exceptions are caught and returned as
 * descriptive error strings, never thrown.
 *
 * <p>Tools: {@code ingest_feedback}, {@code cluster_feedback}, {@code ask_feedback}, {@code
 * session_statistics}, {@code key_pool_status}.
 *
 * @see TokenBudgetTruncator
 */
@Service
public class McpToolService {

  private static final Logger log = LoggerFactory.getLogger(McpToolService.class);

  private final FeedbackIngestionService ingestionService;
  private final ClusteringService clusteringService;
  private final FeedbackQueryService queryService;
  private final QueryQuotaTracker quotaTracker;
  private final FeedbackChunkRepository chunkRepository;
  private final KeyPool keyPool;
  private final TokenBudgetTruncator truncator;

  public McpToolService(
      FeedbackIngestionService ingestionService,
      ClusteringService clusteringService,
      FeedbackQueryService queryService,
      QueryQuotaTracker quotaTracker,
      FeedbackChunkRepository chunkRepository,
      KeyPool keyPool,
      TokenBudgetTruncator truncator) {
    this.ingestionService = ingestionService;
    this.clusteringService = clusteringService;
    this.queryService = queryService;
    this.quotaTracker = quotaTracker;
    this.chunkRepository = chunkRepository;
    this.keyPool = keyPool;
    this.truncator = truncator;
  }

  /**
   * Embeds and stores chunks extracted from one uploaded file. A successful upload restores the
   * session's full question allowance.
   */
  @Tool(
      name = "ingest_feedback",
      description =
          "Store already-extracted feedback text from one file (Slack export, Jira export or call transcript). "
              + "Returns the session ID to use with cluster_feedback and ask_feedback.")
  public String ingestFeedback(
      @ToolParam(
              description = "Existing session ID to add to; omit to start a new session",
              required = false)
          @Nullable String sessionId,
      @ToolParam(description = "Name of the uploaded file") @Nullable String sourceFile,
      @ToolParam(description = "Source type: slack, jira or transcript") @Nullable String sourceType,
      @ToolParam(description = "Extracted feedback text chunks") @Nullable List<String> chunks) {
    try {
      if (sourceFile == null || sourceFile.isBlank()) {
        return "Error: sourceFile must not be empty.";
      }
      if (chunks == null || chunks.isEmpty()) {
        return "Error: Provide at least one feedback chunk.";
      }
      List<FeedbackIngestChunk> ingestChunks =
          chunks.stream().map(c -> FeedbackIngestChunk.of(c == null ? "" : c)).toList();
      IngestionReceipt receipt =
          ingestionService.ingest(
              new FeedbackIngestRequest(
                  sessionId, sourceFile, SourceType.fromValue(sourceType), ingestChunks));
      quotaTracker.reset(receipt.sessionId());
      return "Stored %d chunks from '%s' in session %s (%d too short, skipped)."
          .formatted(
              receipt.chunksStored(), sourceFile, receipt.sessionId(), receipt.chunksSkipped());
    } catch (IllegalArgumentException e) {
      return "Error: " + e.getMessage();
    } catch (Exception e) {
      log.error("Ingestion of {} failed", sourceFile, e);
      return "Error ingesting feedback: " + e.getMessage();
    }
  }

  /** Groups a session's feedback into named issue clusters. */
  @Tool(
      name = "cluster_feedback",
      description =
          "Group a session's feedback into named issue clusters, largest first, "
              + "with member counts, representative excerpts and per-source counts.")
  public String clusterFeedback(
      @ToolParam(description = "Session ID returned by ingest_feedback") @Nullable String sessionId,
      @ToolParam(description = "Maximum number of clusters (optional)", required = false)
          @Nullable Integer maxClusters) {
    try {
      if (sessionId == null || sessionId.isBlank()) {
        return "Error: sessionId must not be empty.";
      }
      ClusteringOutcome outcome = clusteringService.runClustering(sessionId, maxClusters);
      if (outcome instanceof ClusteringOutcome.PoolExhausted exhausted) {
        return "Error: %s Retry later.".formatted(exhausted.message());
      }
      List<IssueCluster> clusters = ((ClusteringOutcome.Success) outcome).clusters();
      if (clusters.isEmpty()) {
        return "No feedback found for session %s.".formatted(sessionId);
      }
      return formatClusters(clusters);
    } catch (Exception e) {
      log.error("Clustering of session {} failed", sessionId, e);
      return "Error clustering feedback: " + e.getMessage();
    }
  }

  /** Answers a question using only the session's feedback, citing the chunks used. */
  @Tool(
      name = "ask_feedback",
      description =
          "Ask a question answered strictly from a session's feedback. "
              + "Each point cites its source as [CHUNK N]. Limited number of questions per session.")
  public String askFeedback(
      @ToolParam(description = "Session ID returned by ingest_feedback") @Nullable String sessionId,
      @ToolParam(description = "The question to answer") @Nullable String question,
      @ToolParam(description = "Chunks to retrieve before reranking (optional)", required = false)
          @Nullable Integer topK) {
    try {
      if (sessionId == null || sessionId.isBlank()) {
        return "Error: sessionId must not be empty.";
      }
      if (question == null || question.isBlank()) {
        return "Error: Question must not be empty.";
      }
      QueryAnswer answer = queryService.ask(sessionId, question, topK);
      String sources = truncator.truncate(answer.sources());
      StringBuilder sb = new StringBuilder(answer.answer()).append("\n\n");
      if (!sources.isEmpty()) {
        sb.append("Sources:\n").append(sources);
      }
      sb.append("Questions remaining: ").append(answer.queriesRemaining());
      return sb.toString();
    } catch (QueryCapReachedException e) {
      return "Error: All %d questions for this session have been used.".formatted(e.getCap());
    } catch (ExhaustedPoolException e) {
      return "Error: %s".formatted(e.getMessage());
    } catch (IllegalArgumentException e) {
      return "Error: " + e.getMessage();
    } catch (Exception e) {
      log.error("Question for session {} failed", sessionId, e);
      return "Error answering question: " + e.getMessage();
    }
  }

  /** Reports stored chunk count and remaining questions for a session. */
  @Tool(
      name = "session_statistics",
      description = "Show how many feedback chunks a session holds and how many questions remain.")
  public String sessionStatistics(
      @ToolParam(description = "Session ID returned by ingest_feedback") @Nullable String sessionId) {
    try {
      if (sessionId == null || sessionId.isBlank()) {
        return "Error: sessionId must not be empty.";
      }
      long chunks = chunkRepository.countBySessionId(sessionId);
      return String.format(
          Locale.ROOT,
          "Session %s: %,d chunks stored, %d questions remaining.",
          sessionId,
          chunks,
          quotaTracker.remaining(sessionId));
    } catch (Exception e) {
      return "Error reading session statistics: " + e.getMessage();
    }
  }

  /** Shows credential availability for one or all providers without revealing full keys. */
  @Tool(
      name = "key_pool_status",
      description =
          "Show API credential availability and usage per provider (credentials shown by prefix only).")
  public String keyPoolStatus(
      @ToolParam(description = "Provider name, e.g. groq (optional, default all)", required = false)
          @Nullable String provider) {
    try {
      List<String> providers =
          provider == null || provider.isBlank()
              ? List.copyOf(new TreeSet<>(keyPool.providers()))
              : List.of(provider);
      if (providers.isEmpty()) {
        return "No key pools registered.";
      }
      StringBuilder sb = new StringBuilder();
      for (String name : providers) {
        List<KeyStatus> statuses = keyPool.status(name);
        long available = statuses.stream().filter(KeyStatus::available).count();
        sb.append("%s: %d/%d available%n".formatted(name, available, statuses.size()));
        for (KeyStatus status : statuses) {
          sb.append(
              "  - %s... %s, used %d times%n"
                  .formatted(
                      status.keyPrefix(),
                      status.available() ? "available" : "cooling down",
                      status.useCount()));
        }
      }
      return sb.toString();
    } catch (Exception e) {
      return "Error reading key pool status: " + e.getMessage();
    }
  }

  private String formatClusters(List<IssueCluster> clusters) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < clusters.size(); i++) {
      IssueCluster cluster = clusters.get(i);
      sb.append("%d. %s (%d items)%n".formatted(i + 1, cluster.name(), cluster.count()));
      sb.append("   Sources: ").append(formatHistogram(cluster.sourceHistogram())).append('\n');
      for (String excerpt : cluster.excerpts()) {
        sb.append("   - \"").append(excerpt).append("\"\n");
      }
    }
    return sb.toString();
  }

  private static String formatHistogram(Map<SourceType, Integer> histogram) {
    return histogram.entrySet().stream()
        .filter(e -> e.getValue() > 0)
        .map(e -> e.getKey().value() + " " + e.getValue())
        .collect(Collectors.joining(", "));
  }
}
