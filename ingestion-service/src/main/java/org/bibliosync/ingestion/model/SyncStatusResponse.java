package org.bibliosync.ingestion.model;

import org.bibliosync.ingestion.service.SyncReport;

public record SyncStatusResponse(
		boolean running,
		SyncReport lastReport,
		String lastError
) {}
