package org.bibliosync.ingestion.sink;

import org.bibliosync.core.model.RunSummary;

import java.io.IOException;

public interface ProgressSink {
	/**
	 * Persist the catalog, replacing any previous one
	 */
	void write(RunSummary summary) throws IOException;

	/**
	 * Load the last persisted catalog, or null if none was written yet
	 */
	RunSummary read() throws IOException;
}
