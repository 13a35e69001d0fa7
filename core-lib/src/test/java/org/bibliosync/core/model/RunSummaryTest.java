package org.bibliosync.core.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RunSummaryTest {

	@Test
	public void testSummaryCountsAndTimestamp() {
		List<BookRecord> books = new ArrayList<>();
		books.add(new BookRecord(11, "Le Petit Prince", "Antoine", "fr"));
		books.add(new BookRecord(1234, "Candide", "", "fr"));

		RunSummary summary = RunSummary.of(Instant.parse("2026-10-19T08:30:00Z"), "https://aleph.pglaf.org/", books);

		assertEquals("2026-10-19T08:30:00Z", summary.generatedAt());
		assertEquals(2, summary.totalBooks());
		assertEquals("https://aleph.pglaf.org/", summary.mirrorUrl());

		books.clear();
		assertEquals(2, summary.books().size(), "Summary must not see later changes to the source list");
	}

	@Test
	public void testBookRecordRejectsNonPositiveId() {
		assertThrows(IllegalArgumentException.class, () -> new BookRecord(0, "Title", "", "fr"));
		assertThrows(IllegalArgumentException.class, () -> new BookRecord(-3, "Title", "", "fr"));
	}

	@Test
	public void testBookRecordNormalizesMissingAuthor() {
		BookRecord book = new BookRecord(7, "Title", null, "fr");
		assertEquals("", book.author());
	}
}
