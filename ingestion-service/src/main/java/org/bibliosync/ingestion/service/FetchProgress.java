package org.bibliosync.ingestion.service;

import org.bibliosync.core.model.BookRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The single aggregation point for a fetch run. Workers report each finished book exactly once; all state
 * changes happen under this object's lock.
 */
class FetchProgress {
	private static final Logger logger = LoggerFactory.getLogger(FetchProgress.class);

	private final int total;
	private final int logInterval;

	private int downloaded;
	private int skipped;
	private int failed;
	private int completed;
	private final SortedMap<Integer, BookRecord> successful = new TreeMap<>();

	FetchProgress(int total, int logInterval) {
		this.total = total;
		this.logInterval = logInterval;
	}

	synchronized void record(int index, BookRecord book, FetchOutcome outcome) {
		if (outcome.success()) {
			if (outcome.skipped()) {
				skipped++;
			} else {
				downloaded++;
			}
			successful.put(index, book);
		} else {
			failed++;
		}
		completed++;

		if (completed % logInterval == 0 || completed == total) {
			logger.info("[{}/{}] downloaded {} | skipped {} | failed {}", completed, total, downloaded, skipped, failed);
		}
	}

	synchronized FetchReport snapshot() {
		return new FetchReport(downloaded, skipped, failed, new ArrayList<>(successful.values()));
	}
}
