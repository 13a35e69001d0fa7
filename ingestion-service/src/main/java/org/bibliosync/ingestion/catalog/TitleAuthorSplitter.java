package org.bibliosync.ingestion.catalog;

/**
 * Splits the title column of an index entry into title and author.
 *
 * <p>Separators are tried in a fixed order: {@code ", by "}, then {@code ", par "} (both on their first
 * occurrence), then the last {@code " by "}. Existing catalogs depend on this order.</p>
 */
public final class TitleAuthorSplitter {
    private TitleAuthorSplitter() {}

    private static final String COMMA_BY = ", by ";
    private static final String COMMA_PAR = ", par ";
    private static final String BY = " by ";

    public static TitleAuthor split(String titleText) {
        String text = titleText == null ? "" : titleText.trim();

        int idx = text.indexOf(COMMA_BY);
        if (idx >= 0) {
            return parts(text, idx, COMMA_BY.length());
        }
        idx = text.indexOf(COMMA_PAR);
        if (idx >= 0) {
            return parts(text, idx, COMMA_PAR.length());
        }
        idx = text.lastIndexOf(BY);
        if (idx >= 0) {
            return parts(text, idx, BY.length());
        }
        return new TitleAuthor(text, "");
    }

    private static TitleAuthor parts(String text, int separatorStart, int separatorLength) {
        return new TitleAuthor(
                text.substring(0, separatorStart).trim(),
                text.substring(separatorStart + separatorLength).trim());
    }

    public record TitleAuthor(String title, String author) {}
}
