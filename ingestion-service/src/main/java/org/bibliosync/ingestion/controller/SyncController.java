package org.bibliosync.ingestion.controller;

import com.google.gson.Gson;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.bibliosync.core.model.RunSummary;
import org.bibliosync.ingestion.model.SyncResponse;
import org.bibliosync.ingestion.model.SyncStatusResponse;
import org.bibliosync.ingestion.service.SyncJob;
import org.bibliosync.ingestion.sink.ProgressSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

public class SyncController {
	private static final Logger logger = LoggerFactory.getLogger(SyncController.class);
	private static final Gson gson = new Gson();
	private final SyncJob job;
	private final ProgressSink sink;

	public SyncController(SyncJob job, ProgressSink sink) {
		this.job = job;
		this.sink = sink;
	}

	/**
	 * Register all routes with the Javalin app
	 */
	public void registerRoutes(Javalin app) {
		app.get("/health", this::handleHealth);

		app.post("/sync", this::handleSync);

		app.get("/sync/status", this::handleStatus);

		app.get("/catalog", this::handleCatalog);

		logger.info("Sync routes registered");
	}

	/**
	 * GET /health
	 */
	private void handleHealth(Context ctx) {
		Map<String, Object> health = new HashMap<>();
		health.put("service", "ingestion-service");
		health.put("status", "running");
		health.put("timestamp", System.currentTimeMillis());
		health.put("sync_running", job.isRunning());

		ctx.contentType("application/json").result(gson.toJson(health));
	}

	/**
	 * POST /sync
	 * Start a catalog sync in the background
	 */
	private void handleSync(Context ctx) {
		if (job.trigger()) {
			logger.info("Catalog sync started via API");
			ctx.status(202).contentType("application/json").result(gson.toJson(SyncResponse.started()));
		} else {
			logger.info("Rejected sync request: a sync is already running");
			ctx.status(409).contentType("application/json").result(gson.toJson(SyncResponse.alreadyRunning()));
		}
	}

	/**
	 * GET /sync/status
	 */
	private void handleStatus(Context ctx) {
		SyncStatusResponse response = new SyncStatusResponse(job.isRunning(), job.lastReport(), job.lastError());
		ctx.contentType("application/json").result(gson.toJson(response));
	}

	/**
	 * GET /catalog
	 * The last persisted catalog
	 */
	private void handleCatalog(Context ctx) {
		try {
			RunSummary summary = sink.read();
			if (summary == null) {
				Map<String, String> error = new HashMap<>();
				error.put("error", "No catalog has been written yet");
				ctx.status(404).contentType("application/json").result(gson.toJson(error));
				return;
			}
			ctx.contentType("application/json").result(gson.toJson(summary));
		} catch (IOException e) {
			Map<String, String> error = new HashMap<>();
			error.put("error", "Failed to read catalog: " + e.getMessage());
			ctx.status(500).contentType("application/json").result(gson.toJson(error));
			logger.error("Failed to read catalog: {}", e.getMessage());
		}
	}
}
