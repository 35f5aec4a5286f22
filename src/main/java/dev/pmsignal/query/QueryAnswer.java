package dev.pmsignal.query;

import java.util.List;

/**
 * A grounded answer.
 *
 * @param answer generated answer citing sources as {@code [CHUNK N]}
 * @param sources the chunks given to the generator, {@code [CHUNK 1]} first
 * @param queriesRemaining questions left for the session
 */
public record QueryAnswer(String answer, List<RetrievedFeedback> sources, int queriesRemaining) {

  public QueryAnswer {
    sources = List.copyOf(sources);
  }
}
