package dev.pmsignal.query;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * In-memory per-session question counter.
 *
 * <p>A question reserves a slot before any work and gives it back with {@link #release(String)} if
 * it fails, so only answered questions count. A new upload into a session starts its allowance
 * over through {@link #reset(String)}. Counters live for the process lifetime.
 */
@Component
public class QueryQuotaTracker {

  private final Map<String, Integer> used = new ConcurrentHashMap<>();
  private final QueryProperties properties;

  public QueryQuotaTracker(QueryProperties properties) {
    this.properties = properties;
  }

  /**
   * Reserves one question for the session.
   *
   * @return questions left after this one
   * @throws QueryCapReachedException if the session has no questions left
   */
  public int reserve(String sessionId) {
    int cap = properties.getCapPerSession();
    int count =
        used.compute(
            sessionId,
            (id, current) -> {
              int value = current == null ? 0 : current;
              if (value >= cap) {
                throw new QueryCapReachedException(sessionId, cap);
              }
              return value + 1;
            });
    return cap - count;
  }

  /** Returns a slot taken by {@link #reserve(String)} for a question that was not answered. */
  public void release(String sessionId) {
    used.computeIfPresent(sessionId, (id, current) -> current <= 1 ? null : current - 1);
  }

  /** Gives the session its full allowance again. */
  public void reset(String sessionId) {
    used.remove(sessionId);
  }

  public int remaining(String sessionId) {
    return Math.max(0, properties.getCapPerSession() - used.getOrDefault(sessionId, 0));
  }
}
