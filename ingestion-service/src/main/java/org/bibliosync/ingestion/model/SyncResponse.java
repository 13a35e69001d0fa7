package org.bibliosync.ingestion.model;

public record SyncResponse(
		String status,
		String message
) {
	public static SyncResponse started() {
		return new SyncResponse("started", null);
	}

	public static SyncResponse alreadyRunning() {
		return new SyncResponse("already_running", "A catalog sync is already in progress");
	}
}
