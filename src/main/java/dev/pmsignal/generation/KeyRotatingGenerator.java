package dev.pmsignal.generation;

import dev.pmsignal.keypool.ExhaustedPoolException;
import dev.pmsignal.keypool.KeyPool;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

/**
 * Runs a generation call under a bounded credential-rotation budget.
 *
 * <p>Each rotation acquires a fresh credential from the {@link KeyPool}, calls the {@link
 * TextGenerator} and hands the raw text to a parser. A {@link RateLimitedException} penalises the
 * credential before the next rotation. Unavailable and malformed outcomes (including parser
 * rejections) use up a rotation without a penalty. When the budget is spent the last {@link
 * GenerationException} is rethrown.
 *
 * <p>{@link ExhaustedPoolException} is never retried: it means no credential is usable right now.
 */
@Service
public class KeyRotatingGenerator {

  private static final Logger log = LoggerFactory.getLogger(KeyRotatingGenerator.class);

  private final KeyPool keyPool;
  private final TextGenerator textGenerator;

  public KeyRotatingGenerator(KeyPool keyPool, TextGenerator textGenerator) {
    this.keyPool = keyPool;
    this.textGenerator = textGenerator;
  }

  /**
   * Generates and parses a completion, rotating credentials on failure.
   *
   * @param provider key-pool provider to draw credentials from
   * @param prompt user prompt
   * @param options system prompt and sampling parameters
   * @param rotations maximum number of credentials to try (>= 1)
   * @param parser converts raw text to the result; throws {@link MalformedResponseException} to
   *     reject it
   * @return the parsed result of the first successful rotation
   * @throws GenerationException the failure of the last rotation when every rotation failed
   * @throws ExhaustedPoolException if no credential could be acquired
   */
  public <T> T generate(
      String provider,
      String prompt,
      GenerationOptions options,
      int rotations,
      Function<String, T> parser) {
    if (rotations < 1) {
      throw new IllegalArgumentException("rotations must be at least 1");
    }
    RetryTemplate retryTemplate =
        RetryTemplate.builder().maxAttempts(rotations).retryOn(GenerationException.class).build();

    return retryTemplate.execute(
        context -> {
          String credential = keyPool.acquire(provider);
          try {
            return parser.apply(textGenerator.generate(credential, prompt, options));
          } catch (RateLimitedException e) {
            keyPool.penalize(provider, credential);
            throw e;
          } catch (GenerationException e) {
            log.warn(
                "Generation rotation {}/{} on {} failed: {}",
                context.getRetryCount() + 1,
                rotations,
                provider,
                e.getMessage());
            throw e;
          }
        });
  }
}
