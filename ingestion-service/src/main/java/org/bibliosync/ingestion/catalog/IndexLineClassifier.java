package org.bibliosync.ingestion.catalog;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * First stage of index parsing: decides whether a single line opens a catalog entry.
 */
public final class IndexLineClassifier {
    private IndexLineClassifier() {}

    static final int MIN_LINE_LENGTH = 10;

    private static final Pattern ENTRY_PATTERN = Pattern.compile("^(.+?)\\s{2,}(\\d+)([A-Z]?)$");

    /**
     * Classifies a raw index line.
     *
     * @param rawLine line as read from the index, untrimmed
     * @return the entry parts, or {@code null} if the line is noise or not an entry
     */
    public static IndexLine classifyOrNull(String rawLine) {
        if (rawLine == null) {
            return null;
        }
        String line = rawLine.trim();
        if (!isCandidate(line)) {
            return null;
        }
        Matcher m = ENTRY_PATTERN.matcher(line);
        if (!m.matches()) {
            return null;
        }
        return new IndexLine(m.group(1).trim(), m.group(2), m.group(3));
    }

    /**
     * Whether the line has the entry shape, without the length and separator filtering. Used by the lookahead
     * to detect where the next entry starts.
     */
    static boolean looksLikeEntry(String trimmedLine) {
        return ENTRY_PATTERN.matcher(trimmedLine).matches();
    }

    private static boolean isCandidate(String line) {
        return line.length() >= MIN_LINE_LENGTH && !line.startsWith("~") && !line.startsWith("=");
    }
}
