package org.bibliosync.ingestion.service;

import org.bibliosync.core.model.BookRecord;

import java.util.List;

/**
 * Tally of one fetch run. {@code successfulBooks} holds downloaded and skipped books in index order.
 */
public record FetchReport(
		int downloaded,
		int skipped,
		int failed,
		List<BookRecord> successfulBooks
) {
	public int completed() {
		return downloaded + skipped + failed;
	}
}
