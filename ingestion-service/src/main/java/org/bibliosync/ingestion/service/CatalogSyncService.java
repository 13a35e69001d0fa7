package org.bibliosync.ingestion.service;

import org.bibliosync.core.model.BookRecord;
import org.bibliosync.core.model.RunSummary;
import org.bibliosync.ingestion.catalog.GutindexParser;
import org.bibliosync.ingestion.sink.ProgressSink;
import org.bibliosync.ingestion.storage.MirrorLayoutStorage;
import org.bibliosync.ingestion.transport.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * One end-to-end sync: index → records → artifacts → catalog.
 */
public class CatalogSyncService {
    private static final Logger logger = LoggerFactory.getLogger(CatalogSyncService.class);

    private final Transport transport;
    private final GutindexParser parser;
    private final MirrorLayoutStorage storage;
    private final FetchEngine engine;
    private final ProgressSink sink;
    private final String mirrorUrl;
    private final String indexUrl;
    private final int concurrency;
    private final Clock clock;

    public CatalogSyncService(
        Transport transport,
        GutindexParser parser,
        MirrorLayoutStorage storage,
        FetchEngine engine,
        ProgressSink sink,
        String mirrorUrl,
        String indexUrl,
        int concurrency,
        Clock clock
    ) {
        this.transport = transport;
        this.parser = parser;
        this.storage = storage;
        this.engine = engine;
        this.sink = sink;
        this.mirrorUrl = mirrorUrl;
        this.indexUrl = indexUrl;
        this.concurrency = concurrency;
        this.clock = clock;
    }

    /**
     * Runs a full sync.
     *
     * @return final tally
     * @throws IOException if the index cannot be fetched or the catalog cannot be written; per-book failures
     *                     are counted, not thrown
     */
    public SyncReport sync() throws IOException {
        Instant start = clock.instant();

        storage.initialize();

        List<BookRecord> books = fetchIndex();
        logger.info("{} books found", books.size());

        FetchReport report = engine.run(books, concurrency);

        logger.info("Saving metadata...");
        sink.write(RunSummary.of(clock.instant(), mirrorUrl, report.successfulBooks()));

        Instant end = clock.instant();
        SyncReport result = new SyncReport(
            report.downloaded(),
            report.skipped(),
            report.failed(),
            books.size(),
            Duration.between(start, end).toMillis(),
            start.toString(),
            end.toString()
        );

        logger.info("=== Result === downloaded: {} | skipped: {} | failed: {} | total: {} | duration: {}s",
            result.downloaded(), result.skipped(), result.failed(), result.total(),
            String.format("%.2f", result.durationMs() / 1000.0));
        return result;
    }

    private List<BookRecord> fetchIndex() throws IOException {
        logger.info("Fetching index from {}", indexUrl);
        String content;
        try {
            content = transport.fetch(indexUrl);
        } catch (IOException e) {
            logger.error("Error while fetching index: {}", e.getMessage());
            throw e;
        }
        logger.info("Parsing index ({} chars)...", content.length());
        return parser.parse(content);
    }
}
