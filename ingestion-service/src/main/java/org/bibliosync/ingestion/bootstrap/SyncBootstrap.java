package org.bibliosync.ingestion.bootstrap;

import org.bibliosync.ingestion.catalog.GutindexParser;
import org.bibliosync.ingestion.catalog.LanguageLookahead;
import org.bibliosync.ingestion.config.SyncConfig;
import org.bibliosync.ingestion.controller.SyncController;
import org.bibliosync.ingestion.resolver.GutenbergMirrorResolver;
import org.bibliosync.ingestion.service.BookFetcher;
import org.bibliosync.ingestion.service.CatalogSyncService;
import org.bibliosync.ingestion.service.FetchEngine;
import org.bibliosync.ingestion.service.SyncJob;
import org.bibliosync.ingestion.sink.JsonMetadataSink;
import org.bibliosync.ingestion.sink.ProgressSink;
import org.bibliosync.ingestion.storage.MirrorLayoutStorage;
import org.bibliosync.ingestion.transport.HttpTransport;
import org.bibliosync.ingestion.transport.Transport;
import org.bibliosync.ingestion.web.SyncHttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.javalin.Javalin;

import java.time.Clock;

/**
 * Application bootstrapper for the catalog sync.
 *
 * <p>Loads configuration and wires the pipeline. In {@code once} mode it runs a single sync and exits; in
 * {@code serve} mode it starts the HTTP API and registers a JVM shutdown hook.</p>
 */
public final class SyncBootstrap {
    private static final Logger logger = LoggerFactory.getLogger(SyncBootstrap.class);

    private SyncBootstrap() {}

    /**
     * Starts the application.
     *
     * <p>On failure, logs the error and exits with code {@code 1}.</p>
     */
    public static void run() {
        try {
            SyncConfig cfg = SyncConfig.load();
            CatalogSyncService syncService = wire(cfg);
            if (cfg.mode() == SyncConfig.Mode.SERVE) {
                serve(cfg, syncService);
            } else {
                syncService.sync();
            }
        } catch (Exception e) {
            logger.error("Catalog sync failed", e);
            System.exit(1);
        }
    }

    static CatalogSyncService wire(SyncConfig cfg) {
        Transport transport = new HttpTransport(cfg.http().timeout(), cfg.http().maxRedirects(), cfg.http().userAgent());
        GutindexParser parser = new GutindexParser(
            new LanguageLookahead(cfg.catalog().languageMarker(), cfg.catalog().lookaheadLines()),
            cfg.catalog().languageTag()
        );
        MirrorLayoutStorage storage = new MirrorLayoutStorage(cfg.storage().filesPath());
        GutenbergMirrorResolver resolver = new GutenbergMirrorResolver(cfg.mirror().baseUrl());
        FetchEngine engine = new FetchEngine(new BookFetcher(transport, resolver, storage), cfg.download().progressInterval());
        ProgressSink sink = new JsonMetadataSink(cfg.storage().metadataFile());

        return new CatalogSyncService(
            transport,
            parser,
            storage,
            engine,
            sink,
            cfg.mirror().baseUrl(),
            cfg.mirror().indexUrl(),
            cfg.download().concurrency(),
            Clock.systemUTC()
        );
    }

    private static void serve(SyncConfig cfg, CatalogSyncService syncService) {
        SyncJob job = new SyncJob(syncService);
        SyncController controller = new SyncController(job, new JsonMetadataSink(cfg.storage().metadataFile()));
        Javalin app = SyncHttpServer.start(cfg.serverPort(), controller);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> shutdown(app, job)));
        logger.info("Sync API started on port {}", app.port());
    }

    private static void shutdown(Javalin app, SyncJob job) {
        logger.info("Shutting down sync API...");
        job.shutdown();
        app.stop();
        logger.info("Sync API stopped.");
    }
}
