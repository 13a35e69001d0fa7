package org.bibliosync.ingestion.web;

import org.bibliosync.ingestion.controller.SyncController;

import io.javalin.Javalin;

/** HTTP server wiring for the sync API. */
public final class SyncHttpServer {
    private SyncHttpServer() {}

    /**
     * Starts the Javalin HTTP server and registers routes.
     *
     * @param port port to bind, {@code 0} for an ephemeral port
     * @param controller controller that registers routes
     * @return started {@link Javalin} instance
     */
    public static Javalin start(int port, SyncController controller) {
        Javalin app = Javalin.create(cfg -> cfg.showJavalinBanner = false);
        controller.registerRoutes(app);
        return app.start(port);
    }
}
