package org.bibliosync.core.model;

import org.jetbrains.annotations.NotNull;

import java.io.Serial;
import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * The durable catalog written at the end of a sync: every book that is present on disk.
 *
 * @param generatedAt ISO-8601 instant the catalog was built
 * @param source mirror root the books were fetched from
 * @param mirrorUrl mirror root, kept alongside {@code source} for readers of older catalogs
 * @param totalBooks number of entries in {@code books}
 * @param books successfully ingested books
 */
public record RunSummary(
        String generatedAt,
        String source,
        String mirrorUrl,
        int totalBooks,
        List<BookRecord> books
) implements Serializable {

    public static RunSummary of(Instant generatedAt, String source, List<BookRecord> books) {
        List<BookRecord> copy = List.copyOf(books);
        return new RunSummary(generatedAt.toString(), source, source, copy.size(), copy);
    }

    @NotNull
    @Override
    public String toString() {
        return String.format("RunSummary{generatedAt=%s, source='%s', totalBooks=%d}",
                generatedAt, source, totalBooks);
    }

    @Serial
    private static final long serialVersionUID = 1L;
}
