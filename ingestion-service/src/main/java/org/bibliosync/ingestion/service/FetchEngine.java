package org.bibliosync.ingestion.service;

import org.bibliosync.core.model.BookRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fetches a list of books with at most {@code concurrency} in flight.
 *
 * <p>A fixed set of workers pulls the next pending index from a shared cursor as soon as it finishes its
 * current book, so one slow download never holds back the rest of the list.</p>
 */
public class FetchEngine {
	private static final Logger logger = LoggerFactory.getLogger(FetchEngine.class);

	private final BookFetcher fetcher;
	private final int progressInterval;

	public FetchEngine(BookFetcher fetcher, int progressInterval) {
		if (progressInterval < 1) {
			throw new IllegalArgumentException("Progress interval must be positive, got " + progressInterval);
		}
		this.fetcher = fetcher;
		this.progressInterval = progressInterval;
	}

	public FetchReport run(List<BookRecord> books, int concurrency) {
		if (concurrency < 1) {
			throw new IllegalArgumentException("Concurrency must be positive, got " + concurrency);
		}

		FetchProgress progress = new FetchProgress(books.size(), progressInterval);
		if (books.isEmpty()) {
			return progress.snapshot();
		}

		int workers = Math.min(concurrency, books.size());
		AtomicInteger cursor = new AtomicInteger(0);
		ExecutorService pool = Executors.newFixedThreadPool(workers, workerThreads());
		logger.info("Fetching {} books with {} workers", books.size(), workers);

		try {
			List<Future<?>> running = new ArrayList<>(workers);
			for (int i = 0; i < workers; i++) {
				running.add(pool.submit(() -> drain(books, cursor, progress)));
			}
			awaitAll(running);
		} finally {
			pool.shutdownNow();
		}

		return progress.snapshot();
	}

	private void drain(List<BookRecord> books, AtomicInteger cursor, FetchProgress progress) {
		int index;
		while ((index = cursor.getAndIncrement()) < books.size()) {
			BookRecord book = books.get(index);
			progress.record(index, book, fetchOne(book));
		}
	}

	private FetchOutcome fetchOne(BookRecord book) {
		try {
			return fetcher.fetch(book);
		} catch (RuntimeException e) {
			logger.error("[{}] Unexpected failure", book.id(), e);
			return FetchOutcome.failed(String.valueOf(e.getMessage()));
		}
	}

	private static void awaitAll(List<Future<?>> running) {
		for (Future<?> future : running) {
			try {
				future.get();
			} catch (ExecutionException e) {
				throw new IllegalStateException("Fetch worker crashed", e.getCause());
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				throw new IllegalStateException("Interrupted while waiting for fetch workers", e);
			}
		}
	}

	private static ThreadFactory workerThreads() {
		AtomicInteger counter = new AtomicInteger(0);
		return r -> {
			Thread thread = new Thread(r, "fetch-worker-" + counter.getAndIncrement());
			thread.setDaemon(true);
			return thread;
		};
	}
}
