package org.bibliosync.ingestion.catalog;

import java.util.List;
import java.util.Locale;

/**
 * Second stage of index parsing: looks at the lines following an entry for its language annotation.
 *
 * <p>The annotation sits on one of the next few lines. The scan stops at the first line that starts another
 * entry, so an annotation belonging to the next entry is never attributed to this one.</p>
 */
public class LanguageLookahead {
    private final String marker;
    private final int window;

    /**
     * @param marker annotation to look for, e.g. {@code [language: french]}; compared case-insensitively
     * @param window maximum number of following lines to inspect
     */
    public LanguageLookahead(String marker, int window) {
        if (marker == null || marker.isBlank()) {
            throw new IllegalArgumentException("Language marker must not be blank");
        }
        if (window < 1) {
            throw new IllegalArgumentException("Lookahead window must be positive, got " + window);
        }
        this.marker = marker.trim().toLowerCase(Locale.ROOT);
        this.window = window;
    }

    public boolean qualifies(List<String> lines, int entryIndex) {
        int last = (int) Math.min(lines.size() - 1L, (long) entryIndex + window);
        for (int i = entryIndex + 1; i <= last; i++) {
            String next = lines.get(i).trim();
            if (next.toLowerCase(Locale.ROOT).contains(marker)) {
                return true;
            }
            if (IndexLineClassifier.looksLikeEntry(next)) {
                return false;
            }
        }
        return false;
    }
}
