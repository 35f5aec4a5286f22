package dev.pmsignal.query;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.pmsignal.feedback.FeedbackMatch;
import dev.pmsignal.feedback.FeedbackStore;
import dev.pmsignal.generation.GenerationOptions;
import dev.pmsignal.generation.KeyRotatingGenerator;
import dev.pmsignal.generation.MalformedResponseException;
import dev.pmsignal.keypool.ExhaustedPoolException;
import java.util.List;
import java.util.Locale;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Answers a question from a session's feedback only.
 *
 * <p>Pipeline: reserve a question slot -> embed the question with the BGE query prefix -> session
 * filtered similarity search -> source weighting -> cross-encoder rerank to the top few -> grounded
 * generation citing {@code [CHUNK N]}. A slot is handed back if anything after the reservation
 * fails.
 */
@Service
public class FeedbackQueryService {

  private static final Logger log = LoggerFactory.getLogger(FeedbackQueryService.class);

  /**
   * BGE query prefix recommended by the bge-small-en-v1.5 model documentation. Prepended to
   * questions only, never to stored chunks.
   */
  static final String BGE_QUERY_PREFIX =
      "Represent this sentence for searching relevant passages: ";

  static final String NO_CONTEXT_ANSWER =
      "No relevant context found in your uploaded files for this query. "
          + "Try rephrasing or uploading more data.";

  static final String INSUFFICIENT_DATA_ANSWER =
      "The uploaded data doesn't contain enough information to answer this question.";

  static final String SYSTEM_PROMPT =
      """
      You are a strict evidence-based assistant helping a Product Manager analyze uploaded data.

      Rules:
      1. Answer ONLY using the retrieved chunks provided. Nothing else.
      2. If the chunks do not contain sufficient information, respond with exactly this sentence: \
      "%s"
      3. Do not infer, generalize or use any knowledge outside the provided chunks.
      4. Every insight must cite its chunk number as [CHUNK N].
      5. Indicate the source type for every point: (Slack), (Jira) or (Transcript).
      6. If only partial information exists, state what is found and what is missing.
      7. Be concise. Use bullet points for multiple insights.
      """
          .formatted(INSUFFICIENT_DATA_ANSWER);

  private final FeedbackStore feedbackStore;
  private final EmbeddingModel embeddingModel;
  private final RerankerService rerankerService;
  private final KeyRotatingGenerator generator;
  private final QueryQuotaTracker quotaTracker;
  private final QueryProperties properties;

  public FeedbackQueryService(
      FeedbackStore feedbackStore,
      EmbeddingModel embeddingModel,
      RerankerService rerankerService,
      KeyRotatingGenerator generator,
      QueryQuotaTracker quotaTracker,
      QueryProperties properties) {
    this.feedbackStore = feedbackStore;
    this.embeddingModel = embeddingModel;
    this.rerankerService = rerankerService;
    this.generator = generator;
    this.quotaTracker = quotaTracker;
    this.properties = properties;
  }

  /**
   * Answers {@code question} from the feedback stored under {@code sessionId}.
   *
   * @param topK chunks to retrieve before reranking; null uses the configured default
   * @throws IllegalArgumentException if the question is blank or topK is out of range
   * @throws QueryCapReachedException if the session has used all its questions
   * @throws ExhaustedPoolException if no generation credential is usable
   * @throws dev.pmsignal.generation.GenerationException if every generation rotation failed
   */
  public QueryAnswer ask(String sessionId, String question, @Nullable Integer topK) {
    if (question == null || question.isBlank()) {
      throw new IllegalArgumentException("Question must not be blank");
    }
    int k = topK == null ? properties.getDefaultTopK() : topK;
    if (k < 1 || k > properties.getMaxTopK()) {
      throw new IllegalArgumentException(
          "topK must be in [1, " + properties.getMaxTopK() + "], got: " + k);
    }

    int remaining = quotaTracker.reserve(sessionId);
    try {
      List<RetrievedFeedback> sources = retrieve(sessionId, question.strip(), k);
      String answer = sources.isEmpty() ? NO_CONTEXT_ANSWER : generateAnswer(question.strip(), sources);
      log.info(
          "Answered question for session {} from {} chunks ({} questions left)",
          sessionId,
          sources.size(),
          remaining);
      return new QueryAnswer(answer, sources, remaining);
    } catch (RuntimeException e) {
      quotaTracker.release(sessionId);
      throw e;
    }
  }

  private List<RetrievedFeedback> retrieve(String sessionId, String question, int topK) {
    Embedding queryEmbedding = embeddingModel.embed(BGE_QUERY_PREFIX + question).content();
    List<FeedbackMatch> matches = feedbackStore.search(sessionId, queryEmbedding, topK);
    List<RetrievedFeedback> weighted = SourceWeighting.apply(matches);
    int topN = properties.getRerankTopN();
    if (weighted.size() <= topN) {
      return weighted;
    }
    try {
      return rerankerService.rerank(question, weighted, topN);
    } catch (RuntimeException e) {
      log.warn("Reranking failed, keeping weighted similarity order: {}", e.getMessage());
      return weighted.subList(0, topN);
    }
  }

  private String generateAnswer(String question, List<RetrievedFeedback> sources) {
    GenerationOptions options =
        new GenerationOptions(SYSTEM_PROMPT, properties.getMaxTokens(), properties.getTemperature());
    return generator.generate(
        properties.getProvider(),
        answerPrompt(question, sources),
        options,
        properties.getRotations(),
        FeedbackQueryService::requireText);
  }

  static String answerPrompt(String question, List<RetrievedFeedback> sources) {
    StringBuilder prompt = new StringBuilder("Retrieved chunks (use ONLY these to answer):\n---\n");
    for (int i = 0; i < sources.size(); i++) {
      RetrievedFeedback source = sources.get(i);
      prompt
          .append("[CHUNK ")
          .append(i + 1)
          .append("] Source: [")
          .append(source.sourceType().value().toUpperCase(Locale.ROOT))
          .append("] ")
          .append(source.sourceFile())
          .append("\n\"")
          .append(source.text())
          .append("\"\n\n");
    }
    prompt.append("---\n\nPM Question: ").append(question).append("\n\n");
    prompt.append("Answer only from the chunks above and cite every point as [CHUNK N].\n\nAnswer:");
    return prompt.toString();
  }

  private static String requireText(String raw) {
    if (raw.isBlank()) {
      throw new MalformedResponseException("Empty answer");
    }
    return raw.strip();
  }
}
