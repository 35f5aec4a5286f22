package dev.pmsignal.keypool;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Composition root for the process-wide {@link KeyPool}.
 *
 * <p>Every provider listed under {@code pmsignal.key-pool.providers} is registered once here;
 * consumers receive the same instance through constructor injection.
 */
@Configuration
public class KeyPoolConfig {

  @Bean
  public KeyPool keyPool(KeyPoolProperties properties, Clock clock) {
    KeyPool keyPool = new KeyPool(clock, properties.cooldown());
    properties.providers().forEach(keyPool::register);
    return keyPool;
  }
}
