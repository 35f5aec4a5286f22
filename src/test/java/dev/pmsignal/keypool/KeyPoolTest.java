package dev.pmsignal.keypool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.pmsignal.fixture.MutableClock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class KeyPoolTest {

  private static final Duration COOLDOWN = Duration.ofSeconds(65);

  private MutableClock clock;
  private KeyPool pool;

  @BeforeEach
  void setUp() {
    clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
    pool = new KeyPool(clock, COOLDOWN);
  }

  // --- Selection ---

  @Test
  void acquireRotatesLeastUsedFirstInPoolOrder() {
    pool.register("groq", List.of("key-a", "key-b", "key-c"));

    List<String> handedOut = new ArrayList<>();
    for (int i = 0; i < 6; i++) {
      handedOut.add(pool.acquire("groq"));
    }

    assertThat(handedOut).containsExactly("key-a", "key-b", "key-c", "key-a", "key-b", "key-c");
  }

  @Test
  void acquireCountsUses() {
    pool.register("groq", List.of("key-a", "key-b"));

    pool.acquire("groq");
    pool.acquire("groq");
    pool.acquire("groq");

    assertThat(pool.status("groq"))
        .extracting(KeyStatus::useCount)
        .containsExactly(2, 1);
  }

  @Test
  void registerDropsBlankAndRepeatedCredentials() {
    pool.register("groq", List.of(" key-a ", "", "key-a", "key-b"));

    assertThat(pool.status("groq")).extracting(KeyStatus::keyPrefix).containsExactly("key-a", "key-b");
  }

  @Test
  void registerReplacesExistingPool() {
    pool.register("groq", List.of("old-key"));
    pool.register("groq", List.of("new-key"));

    assertThat(pool.acquire("groq")).isEqualTo("new-key");
  }

  // --- Cooldown ---

  @Test
  void penalisedFirstKeyFallsBackToSecondThenExhausts() {
    pool.register("groq", List.of("key-a", "key-b"));

    pool.penalize("groq", "key-a");
    assertThat(pool.acquire("groq")).isEqualTo("key-b");

    pool.penalize("groq", "key-b");
    assertThatThrownBy(() -> pool.acquire("groq"))
        .isInstanceOf(ExhaustedPoolException.class)
        .hasMessageContaining("groq");
  }

  @Test
  void penalisedKeyReturnsAfterCooldownExpires() {
    pool.register("groq", List.of("key-a"));
    pool.penalize("groq", "key-a");

    clock.advance(COOLDOWN.minusSeconds(1));
    assertThatThrownBy(() -> pool.acquire("groq")).isInstanceOf(ExhaustedPoolException.class);

    clock.advance(Duration.ofSeconds(1));
    assertThat(pool.acquire("groq")).isEqualTo("key-a");
  }

  @Test
  void exhaustionReportsTimeUntilEarliestExpiry() {
    pool.register("groq", List.of("key-a", "key-b"));
    pool.penalize("groq", "key-a");
    clock.advance(Duration.ofSeconds(20));
    pool.penalize("groq", "key-b");

    assertThatThrownBy(() -> pool.acquire("groq"))
        .isInstanceOfSatisfying(
            ExhaustedPoolException.class,
            e -> {
              assertThat(e.getProvider()).isEqualTo("groq");
              assertThat(e.getRetryAfter()).isEqualTo(Duration.ofSeconds(45));
            });
  }

  @Test
  void penaliseIsIdempotentAndRestartsWindow() {
    pool.register("groq", List.of("key-a"));
    pool.penalize("groq", "key-a");
    clock.advance(Duration.ofSeconds(30));
    pool.penalize("groq", "key-a");

    clock.advance(Duration.ofSeconds(40));
    assertThatThrownBy(() -> pool.acquire("groq")).isInstanceOf(ExhaustedPoolException.class);

    clock.advance(Duration.ofSeconds(25));
    assertThat(pool.acquire("groq")).isEqualTo("key-a");
  }

  @Test
  void penaliseIgnoresUnknownProviderAndCredential() {
    pool.register("groq", List.of("key-a"));

    assertThatCode(() -> pool.penalize("gemini", "key-a")).doesNotThrowAnyException();
    assertThatCode(() -> pool.penalize("groq", "missing")).doesNotThrowAnyException();
    assertThat(pool.acquire("groq")).isEqualTo("key-a");
  }

  // --- Edge cases ---

  @Test
  void emptyPoolReportsMissingConfigurationRatherThanCooldown() {
    pool.register("groq", List.of());

    assertThatThrownBy(() -> pool.acquire("groq"))
        .isInstanceOfSatisfying(
            ExhaustedPoolException.class,
            e -> {
              assertThat(e).hasMessage("No groq credentials configured.");
              assertThat(e.getProvider()).isEqualTo("groq");
              assertThat(e.getRetryAfter()).isZero();
            });
  }

  @Test
  void blankOnlyCredentialsCountAsNotConfigured() {
    pool.register("groq", List.of(" ", ""));

    assertThatThrownBy(() -> pool.acquire("groq"))
        .isInstanceOf(ExhaustedPoolException.class)
        .hasMessageNotContaining("cooling down");
  }

  @Test
  void unknownProviderIsRejected() {
    assertThatThrownBy(() -> pool.acquire("nobody"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("nobody");
  }

  @Test
  void statusShowsPrefixAndAvailabilityOnly() {
    pool.register("groq", List.of("gsk_1234567890abcdef", "gsk_abcdefghijkl"));
    pool.penalize("groq", "gsk_abcdefghijkl");

    assertThat(pool.status("groq"))
        .containsExactly(new KeyStatus("gsk_1234", true, 0), new KeyStatus("gsk_abcd", false, 0));
    assertThat(pool.status("unknown")).isEmpty();
  }

  @Test
  void rejectsNonPositiveCooldown() {
    assertThatThrownBy(() -> new KeyPool(clock, Duration.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
  }

  // --- Concurrency ---

  @Test
  void concurrentAcquiresSpreadLoadEvenly() throws Exception {
    pool.register("groq", List.of("key-a", "key-b", "key-c", "key-d"));
    int threads = 8;
    int perThread = 250;
    Map<String, AtomicInteger> counts = new ConcurrentHashMap<>();
    CountDownLatch start = new CountDownLatch(1);
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int t = 0; t < threads; t++) {
        Callable<Void> task =
            () -> {
              start.await();
              for (int i = 0; i < perThread; i++) {
                String key = pool.acquire("groq");
                counts.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
              }
              return null;
            };
        futures.add(executor.submit(task));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get(10, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    assertThat(counts.values())
        .extracting(AtomicInteger::get)
        .containsOnly(threads * perThread / 4);
    assertThat(pool.status("groq")).extracting(KeyStatus::useCount).containsOnly(500);
  }

  @Test
  void concurrentPenaltiesNeverHandOutCoolingKey() throws Exception {
    pool.register("groq", List.of("key-a", "key-b"));
    pool.penalize("groq", "key-a");
    ExecutorService executor = Executors.newFixedThreadPool(4);
    try {
      List<Future<String>> futures = new ArrayList<>();
      for (int i = 0; i < 100; i++) {
        futures.add(
            executor.submit(
                () -> {
                  pool.penalize("groq", "key-a");
                  return pool.acquire("groq");
                }));
      }
      for (Future<String> future : futures) {
        assertThat(future.get(10, TimeUnit.SECONDS)).isEqualTo("key-b");
      }
    } finally {
      executor.shutdownNow();
    }
  }
}
