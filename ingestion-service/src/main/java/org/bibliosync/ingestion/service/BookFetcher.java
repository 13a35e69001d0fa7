package org.bibliosync.ingestion.service;

import org.bibliosync.core.model.BookRecord;
import org.bibliosync.ingestion.resolver.CandidateResolver;
import org.bibliosync.ingestion.storage.BookStorage;
import org.bibliosync.ingestion.transport.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Brings one book onto local disk: skip if present, otherwise try each candidate location in order.
 */
public class BookFetcher {
	private static final Logger logger = LoggerFactory.getLogger(BookFetcher.class);

	private final Transport transport;
	private final CandidateResolver resolver;
	private final BookStorage storage;

	public BookFetcher(Transport transport, CandidateResolver resolver, BookStorage storage) {
		this.transport = transport;
		this.resolver = resolver;
		this.storage = storage;
	}

	public FetchOutcome fetch(BookRecord book) {
		int bookId = book.id();

		if (storage.exists(bookId)) {
			return FetchOutcome.alreadyPresent();
		}

		try {
			storage.prepareDirectory(bookId);
		} catch (IOException e) {
			logger.warn("[{}] Error: {}", bookId, e.getMessage());
			return FetchOutcome.failed(e.getMessage());
		}

		List<String> candidates = resolver.resolve(bookId);
		IOException lastException = null;

		for (String url : candidates) {
			String content;
			try {
				logger.debug("[{}] Trying URL: {}", bookId, url);
				content = transport.fetch(url);
			} catch (IOException e) {
				logger.debug("[{}] Failed to download from {}: {}", bookId, url, e.getMessage());
				lastException = e;
				continue;
			}

			try {
				storage.save(bookId, content);
				return FetchOutcome.downloaded();
			} catch (IOException e) {
				logger.warn("[{}] Error saving {}: {}", bookId, storage.bookPath(bookId), e.getMessage());
				return FetchOutcome.failed(e.getMessage());
			}
		}

		String message = lastException == null
				? "No candidate locations for book " + bookId
				: lastException.getMessage();
		logger.warn("[{}] error: {}", bookId, message);
		return FetchOutcome.failed(message);
	}
}
