package org.bibliosync.ingestion.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs syncs in the background for the HTTP API, one at a time.
 */
public class SyncJob {
	private static final Logger logger = LoggerFactory.getLogger(SyncJob.class);

	private final CatalogSyncService syncService;
	private final ExecutorService executor;
	private final AtomicBoolean running = new AtomicBoolean(false);

	private volatile SyncReport lastReport;
	private volatile String lastError;

	public SyncJob(CatalogSyncService syncService) {
		this.syncService = syncService;
		this.executor = Executors.newSingleThreadExecutor(r -> {
			Thread thread = new Thread(r, "catalog-sync");
			thread.setDaemon(true);
			return thread;
		});
	}

	/**
	 * Starts a sync unless one is already running.
	 *
	 * @return {@code true} if a new sync was started, {@code false} if one is running or the job is shut down
	 */
	public boolean trigger() {
		if (!running.compareAndSet(false, true)) {
			return false;
		}
		try {
			executor.execute(this::runOnce);
		} catch (RejectedExecutionException e) {
			running.set(false);
			logger.warn("Sync not started, executor is shut down");
			return false;
		}
		return true;
	}

	private void runOnce() {
		try {
			lastReport = syncService.sync();
			lastError = null;
		} catch (Exception e) {
			lastError = e.getMessage();
			logger.error("Catalog sync failed", e);
		} finally {
			running.set(false);
		}
	}

	public boolean isRunning() {
		return running.get();
	}

	public SyncReport lastReport() {
		return lastReport;
	}

	public String lastError() {
		return lastError;
	}

	public void shutdown() {
		logger.info("Shutting down sync executor");
		executor.shutdown();
		try {
			if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
				logger.warn("Sync executor did not terminate in time, forcing shutdown");
				executor.shutdownNow();
			}
		} catch (InterruptedException e) {
			logger.error("Interrupted while waiting for sync executor to terminate", e);
			executor.shutdownNow();
			Thread.currentThread().interrupt();
		}
	}
}
