package dev.pmsignal.generation;

/** The provider rejected the credential with a rate-limit response (HTTP 429). */
public class RateLimitedException extends GenerationException {

  public RateLimitedException(String message) {
    super(message);
  }
}
