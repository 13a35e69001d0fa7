package org.bibliosync.ingestion.service;

/**
 * Final tally of one catalog sync, as shown to the operator.
 */
public record SyncReport(
		int downloaded,
		int skipped,
		int failed,
		int total,
		long durationMs,
		String startedAt,
		String finishedAt
) {}
