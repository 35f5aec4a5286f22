package dev.pmsignal.keypool;

/**
 * Observability snapshot of a single pooled credential.
 *
 * @param keyPrefix first eight characters of the credential
 * @param available whether the credential is currently outside its cooldown window
 * @param useCount number of times the credential has been handed out
 */
public record KeyStatus(String keyPrefix, boolean available, int useCount) {}
