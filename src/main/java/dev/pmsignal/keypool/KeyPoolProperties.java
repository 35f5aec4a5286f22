package dev.pmsignal.keypool;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Credentials and cooldown for the provider key pools, bound from {@code pmsignal.key-pool.*}.
 *
 * <p>{@code providers} maps a provider name to its credentials; a comma-separated value such as
 * {@code ${GROQ_KEYS:}} binds to a list. {@code cooldown} defaults to 65 seconds, a margin over
 * the usual 60-second provider throttle window.
 *
 * @param cooldown how long a rate-limited credential stays out of rotation
 * @param providers provider name to credential list
 */
@ConfigurationProperties(prefix = "pmsignal.key-pool")
public record KeyPoolProperties(
    @DefaultValue("65s") Duration cooldown, Map<String, List<String>> providers) {

  public KeyPoolProperties {
    if (cooldown.isNegative() || cooldown.isZero()) {
      throw new IllegalStateException(
          "pmsignal.key-pool.cooldown must be positive, got: " + cooldown);
    }
    providers = providers == null ? Map.of() : Map.copyOf(providers);
  }
}
