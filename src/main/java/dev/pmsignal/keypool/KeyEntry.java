package dev.pmsignal.keypool;

import java.time.Instant;

/**
 * One credential inside a provider pool.
 *
 * <p>Mutated only while the owning pool's lock is held. Fields are volatile so {@link
 * KeyPool#status(String)} can read a snapshot without taking the lock.
 */
final class KeyEntry {

  private final String credential;
  private volatile Instant cooldownUntil = Instant.EPOCH;
  private volatile int useCount;

  KeyEntry(String credential) {
    this.credential = credential;
  }

  String credential() {
    return credential;
  }

  Instant cooldownUntil() {
    return cooldownUntil;
  }

  int useCount() {
    return useCount;
  }

  boolean isEligible(Instant now) {
    return !now.isBefore(cooldownUntil);
  }

  void recordUse() {
    useCount = useCount + 1;
  }

  void coolDownUntil(Instant until) {
    this.cooldownUntil = until;
  }
}
