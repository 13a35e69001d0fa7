package org.bibliosync.core.model;

import org.jetbrains.annotations.NotNull;

import java.io.Serial;
import java.io.Serializable;

/**
 * One catalog entry extracted from the Gutenberg index. Identity is {@code id}.
 */
public record BookRecord(
        int id,
        String title,
        String author,
        String language
) implements Serializable {

    public BookRecord {
        if (id <= 0) {
            throw new IllegalArgumentException("Book id must be positive: " + id);
        }
        title = title == null ? "" : title;
        author = author == null ? "" : author;
    }

    @NotNull
    @Override
    public String toString() {
        return String.format("BookRecord{id=%d, title='%s', author='%s', lang='%s'}",
                id, title, author, language);
    }

    @Serial
    private static final long serialVersionUID = 1L;
}
