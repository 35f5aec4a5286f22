package dev.pmsignal.query;

/** Thrown when a session has used all of its questions. */
public class QueryCapReachedException extends RuntimeException {

  private final String sessionId;
  private final int cap;

  public QueryCapReachedException(String sessionId, int cap) {
    super("All " + cap + " questions for session " + sessionId + " have been used");
    this.sessionId = sessionId;
    this.cap = cap;
  }

  public String getSessionId() {
    return sessionId;
  }

  public int getCap() {
    return cap;
  }
}
