package org.bibliosync.ingestion.service;

/**
 * Result of processing one book. {@code message} is only set on failure.
 */
public record FetchOutcome(
		boolean success,
		boolean skipped,
		String message
) {
	public static FetchOutcome downloaded() {
		return new FetchOutcome(true, false, null);
	}

	public static FetchOutcome alreadyPresent() {
		return new FetchOutcome(true, true, null);
	}

	public static FetchOutcome failed(String message) {
		return new FetchOutcome(false, false, message);
	}
}
