package dev.pmsignal.query;

import dev.pmsignal.feedback.FeedbackMatch;
import dev.pmsignal.feedback.SourceType;
import java.util.Comparator;
import java.util.List;

/**
 * Boosts retrieval scores of lower-volume, higher-signal sources.
 *
 * <p>Chat exports tend to outnumber tickets and call transcripts, so unweighted similarity lets
 * them crowd out everything else. Jira scores are multiplied by 1.25 and transcript scores by
 * 1.20.
 */
final class SourceWeighting {

  private SourceWeighting() {}

  static double weight(SourceType type) {
    return switch (type) {
      case JIRA -> 1.25;
      case TRANSCRIPT -> 1.20;
      case SLACK, UNKNOWN -> 1.0;
    };
  }

  /** Weights every match and sorts by weighted score, highest first (stable on ties). */
  static List<RetrievedFeedback> apply(List<FeedbackMatch> matches) {
    return matches.stream()
        .map(
            m ->
                new RetrievedFeedback(
                    m.text(),
                    m.sourceFile(),
                    m.sourceType(),
                    m.author(),
                    m.score(),
                    m.score() * weight(m.sourceType()),
                    null))
        .sorted(Comparator.comparingDouble(RetrievedFeedback::weightedScore).reversed())
        .toList();
  }
}
