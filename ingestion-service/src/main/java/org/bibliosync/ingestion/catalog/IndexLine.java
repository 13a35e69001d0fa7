package org.bibliosync.ingestion.catalog;

/**
 * A GUTINDEX line that has the shape of a catalog entry.
 *
 * @param titleText everything before the identifier column, trimmed
 * @param digits numeric part of the identifier
 * @param suffix optional volume/part letter, empty when absent
 */
public record IndexLine(String titleText, String digits, String suffix) {}
