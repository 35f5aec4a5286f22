package dev.pmsignal.query;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.scoring.ScoringModel;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;
import org.springframework.stereotype.Service;

/**
 * Cross-encoder reranking service that re-scores retrieved feedback using an ONNX-based scoring
 * model (ms-marco-MiniLM-L-6-v2).
 *
 * <p>Scores each question-passage pair, then returns the candidates sorted by reranking score
 * descending, limited to {@code maxResults}. Model failures propagate to the caller.
 *
 * @see dev.langchain4j.model.scoring.ScoringModel
 */
@Service
public class RerankerService {

  private final ScoringModel scoringModel;

  public RerankerService(ScoringModel scoringModel) {
    this.scoringModel = scoringModel;
  }

  /**
   * @param question the question text
   * @param candidates weighted retrieval candidates
   * @param maxResults maximum number of results to return
   * @return candidates with {@code rerankScore} set, best first
   */
  public List<RetrievedFeedback> rerank(
      String question, List<RetrievedFeedback> candidates, int maxResults) {
    if (candidates.isEmpty()) {
      return List.of();
    }

    List<TextSegment> segments =
        candidates.stream().map(c -> TextSegment.from(c.text())).toList();

    Response<List<Double>> scores = scoringModel.scoreAll(segments, question);

    return IntStream.range(0, candidates.size())
        .mapToObj(i -> candidates.get(i).withRerankScore(scores.content().get(i)))
        .sorted(
            Comparator.comparingDouble((RetrievedFeedback r) -> r.rerankScore()).reversed())
        .limit(maxResults)
        .toList();
  }
}
