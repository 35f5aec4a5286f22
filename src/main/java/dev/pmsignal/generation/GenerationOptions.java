package dev.pmsignal.generation;

/**
 * Per-call generation parameters.
 *
 * @param systemPrompt instruction sent as the system message
 * @param maxTokens upper bound on generated tokens (must be >= 1)
 * @param temperature sampling temperature in [0.0, 2.0]
 */
public record GenerationOptions(String systemPrompt, int maxTokens, double temperature) {

  public GenerationOptions {
    if (systemPrompt == null || systemPrompt.isBlank()) {
      throw new IllegalArgumentException("systemPrompt must not be blank");
    }
    if (maxTokens < 1) {
      throw new IllegalArgumentException("maxTokens must be at least 1");
    }
    if (temperature < 0.0 || temperature > 2.0) {
      throw new IllegalArgumentException("temperature must be in [0.0, 2.0], got: " + temperature);
    }
  }
}
