package dev.pmsignal.keypool;

import java.time.Duration;

/**
 * Thrown when no credential of a provider can be handed out, either because every one is cooling
 * down or because none is configured. Callers should surface it as a retry-later condition.
 */
public class ExhaustedPoolException extends RuntimeException {

  private final String provider;
  private final Duration retryAfter;

  public ExhaustedPoolException(String provider, Duration retryAfter) {
    this(
        provider,
        retryAfter,
        "All %s credentials are cooling down. Try again in %ds."
            .formatted(provider, Math.max(1, retryAfter.toSeconds())));
  }

  private ExhaustedPoolException(String provider, Duration retryAfter, String message) {
    super(message);
    this.provider = provider;
    this.retryAfter = retryAfter;
  }

  /**
   * The provider was registered without any credential. Waiting does not help, so {@link
   * #getRetryAfter()} is zero.
   */
  public static ExhaustedPoolException noCredentials(String provider) {
    return new ExhaustedPoolException(
        provider, Duration.ZERO, "No %s credentials configured.".formatted(provider));
  }

  public String getProvider() {
    return provider;
  }

  /** Time until the earliest credential leaves its cooldown window. */
  public Duration getRetryAfter() {
    return retryAfter;
  }
}
