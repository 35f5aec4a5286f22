package dev.pmsignal.generation;

/**
 * Sends one prompt to a text-generation provider with a caller-supplied credential.
 *
 * <p>Implementations never retry; rotation and retry belong to {@link KeyRotatingGenerator}.
 */
public interface TextGenerator {

  /**
   * Generates a completion for {@code prompt}.
   *
   * @param credential API credential to authenticate with
   * @param prompt the user prompt
   * @param options system prompt and sampling parameters
   * @return the raw generated text
   * @throws RateLimitedException if the provider throttled this credential
   * @throws GenerationUnavailableException on transport errors, timeouts and other error statuses
   * @throws MalformedResponseException if the response carried no usable text
   */
  String generate(String credential, String prompt, GenerationOptions options);
}
