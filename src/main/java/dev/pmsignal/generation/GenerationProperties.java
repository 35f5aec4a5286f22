package dev.pmsignal.generation;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Endpoint settings for the OpenAI-compatible chat-completions provider, bound from {@code
 * pmsignal.generation.*}.
 *
 * @param baseUrl API base URL, without the {@code /chat/completions} suffix
 * @param model model identifier sent with every request
 * @param connectTimeoutMs TCP connect timeout in milliseconds
 * @param readTimeoutMs response read timeout in milliseconds; acts as the per-call deadline
 */
@ConfigurationProperties(prefix = "pmsignal.generation")
public record GenerationProperties(
    @DefaultValue("https://api.groq.com/openai/v1") String baseUrl,
    @DefaultValue("llama-3.3-70b-versatile") String model,
    @DefaultValue("5000") int connectTimeoutMs,
    @DefaultValue("45000") int readTimeoutMs) {

  public GenerationProperties {
    if (connectTimeoutMs < 1 || readTimeoutMs < 1) {
      throw new IllegalStateException(
          "pmsignal.generation timeouts must be positive, got connect="
              + connectTimeoutMs
              + ", read="
              + readTimeoutMs);
    }
  }
}
