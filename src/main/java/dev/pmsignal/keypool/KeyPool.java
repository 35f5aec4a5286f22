package dev.pmsignal.keypool;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-safe rotating pool of API credentials, one pool per external provider.
 *
 * <p>{@link #acquire(String)} hands out the least-used credential whose cooldown has expired, so
 * credentials sharing a provider rate limit receive roughly equal load. {@link #penalize(String,
 * String)} takes a credential out of rotation for the configured cooldown after the provider
 * signals a rate limit.
 *
 * <p>Each provider has its own {@link ReentrantLock}. Only {@code acquire} and {@code penalize}
 * take it, and both only scan or update the small in-memory entry list; callers perform network
 * I/O with the returned credential after the lock is released. {@link #status(String)} reads
 * volatile fields and never locks.
 *
 * <p>{@link #register(String, List)} replaces the provider's pool and is meant to be called at
 * startup, before any concurrent {@code acquire}.
 *
 * @see KeyPoolConfig
 */
public class KeyPool {

  private static final Logger log = LoggerFactory.getLogger(KeyPool.class);

  private static final int KEY_PREFIX_LENGTH = 8;

  private final Clock clock;
  private final Duration cooldown;
  private final Map<String, ProviderPool> pools = new ConcurrentHashMap<>();

  public KeyPool(Clock clock, Duration cooldown) {
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    if (cooldown.isNegative() || cooldown.isZero()) {
      throw new IllegalArgumentException("cooldown must be positive, got: " + cooldown);
    }
    this.cooldown = cooldown;
  }

  /**
   * Registers (or replaces) the credential set of a provider. Blank and repeated credentials are
   * dropped; pool order follows first occurrence.
   *
   * @param provider provider name, e.g. {@code "groq"}
   * @param credentials credentials in rotation order
   */
  public void register(String provider, List<String> credentials) {
    Set<String> unique = new LinkedHashSet<>();
    for (String credential : credentials) {
      if (credential != null && !credential.isBlank()) {
        unique.add(credential.strip());
      }
    }
    List<KeyEntry> entries = unique.stream().map(KeyEntry::new).toList();
    pools.put(provider, new ProviderPool(entries, new ReentrantLock()));
    if (entries.isEmpty()) {
      log.warn("Key pool '{}' registered without credentials; every acquire will fail", provider);
    } else {
      log.info("Key pool '{}' registered with {} credential(s)", provider, entries.size());
    }
  }

  /**
   * Hands out the eligible credential with the fewest prior uses (ties go to the earliest in pool
   * order) and counts the use.
   *
   * @param provider a registered provider
   * @return the selected credential
   * @throws ExhaustedPoolException if every credential is cooling down or the pool is empty
   * @throws IllegalArgumentException if the provider was never registered
   */
  public String acquire(String provider) {
    ProviderPool pool = requirePool(provider);
    if (pool.entries().isEmpty()) {
      throw ExhaustedPoolException.noCredentials(provider);
    }
    pool.lock().lock();
    try {
      Instant now = clock.instant();
      KeyEntry chosen = null;
      Instant earliestExpiry = null;
      for (KeyEntry entry : pool.entries()) {
        if (entry.isEligible(now)) {
          if (chosen == null || entry.useCount() < chosen.useCount()) {
            chosen = entry;
          }
        } else if (earliestExpiry == null || entry.cooldownUntil().isBefore(earliestExpiry)) {
          earliestExpiry = entry.cooldownUntil();
        }
      }
      if (chosen == null) {
        Duration retryAfter =
            earliestExpiry == null ? cooldown : Duration.between(now, earliestExpiry);
        throw new ExhaustedPoolException(provider, retryAfter);
      }
      chosen.recordUse();
      return chosen.credential();
    } finally {
      pool.lock().unlock();
    }
  }

  /**
   * Puts a credential into cooldown until {@code now + cooldown}. Repeated calls simply restart the
   * window; unknown providers and credentials are ignored.
   */
  public void penalize(String provider, String credential) {
    ProviderPool pool = pools.get(provider);
    if (pool == null) {
      return;
    }
    pool.lock().lock();
    try {
      for (KeyEntry entry : pool.entries()) {
        if (entry.credential().equals(credential)) {
          entry.coolDownUntil(clock.instant().plus(cooldown));
          log.warn(
              "Rate limit on {} key {}..., cooling down for {}s",
              provider,
              prefix(credential),
              cooldown.toSeconds());
          return;
        }
      }
    } finally {
      pool.lock().unlock();
    }
  }

  /**
   * Lock-free snapshot of a provider's credentials for health reporting.
   *
   * @return one status per credential in pool order, or an empty list for unknown providers
   */
  public List<KeyStatus> status(String provider) {
    ProviderPool pool = pools.get(provider);
    if (pool == null) {
      return List.of();
    }
    Instant now = clock.instant();
    List<KeyStatus> snapshot = new ArrayList<>(pool.entries().size());
    for (KeyEntry entry : pool.entries()) {
      snapshot.add(
          new KeyStatus(prefix(entry.credential()), entry.isEligible(now), entry.useCount()));
    }
    return snapshot;
  }

  /** Names of all registered providers. */
  public Set<String> providers() {
    return Set.copyOf(pools.keySet());
  }

  private ProviderPool requirePool(String provider) {
    ProviderPool pool = pools.get(provider);
    if (pool == null) {
      throw new IllegalArgumentException("No key pool registered for provider: " + provider);
    }
    return pool;
  }

  private static String prefix(String credential) {
    return credential.substring(0, Math.min(KEY_PREFIX_LENGTH, credential.length()));
  }

  private record ProviderPool(List<KeyEntry> entries, ReentrantLock lock) {}
}
