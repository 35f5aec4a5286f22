package dev.pmsignal.feedback;

/**
 * Result of an ingestion call.
 *
 * @param sessionId the session the chunks were stored under (generated when none was supplied)
 * @param chunksStored number of chunks embedded and stored
 * @param chunksSkipped number of chunks dropped for being too short
 */
public record IngestionReceipt(String sessionId, int chunksStored, int chunksSkipped) {}
