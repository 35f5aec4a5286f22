package dev.pmsignal.generation;

/**
 * Base type for failures of a single text-generation call. Subtypes tell the caller whether to
 * penalise the credential ({@link RateLimitedException}) or simply try again.
 */
public class GenerationException extends RuntimeException {

  public GenerationException(String message) {
    super(message);
  }

  public GenerationException(String message, Throwable cause) {
    super(message, cause);
  }
}
