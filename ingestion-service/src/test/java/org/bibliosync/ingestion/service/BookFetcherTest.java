package org.bibliosync.ingestion.service;

import org.bibliosync.core.model.BookRecord;
import org.bibliosync.ingestion.resolver.GutenbergMirrorResolver;
import org.bibliosync.ingestion.storage.MirrorLayoutStorage;
import org.bibliosync.ingestion.testsupport.FakeTransport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class BookFetcherTest {
	private static final String MIRROR = "https://mirror.test";
	private static final BookRecord BOOK = new BookRecord(1234, "Candide", "Voltaire", "fr");

	@Test
	public void testFallsBackToThirdCandidate(@TempDir Path tempDir) throws Exception {
		FakeTransport transport = new FakeTransport()
				.serve(MIRROR + "/1/2/3/1234/1234.txt", "Plain text body\nwith two lines");
		MirrorLayoutStorage storage = new MirrorLayoutStorage(tempDir.toString());
		BookFetcher fetcher = new BookFetcher(transport, new GutenbergMirrorResolver(MIRROR), storage);

		FetchOutcome outcome = fetcher.fetch(BOOK);

		assertEquals(FetchOutcome.downloaded(), outcome);
		assertEquals(List.of(
				MIRROR + "/1/2/3/1234/1234-0.txt",
				MIRROR + "/1/2/3/1234/1234-8.txt",
				MIRROR + "/1/2/3/1234/1234.txt"
		), transport.requested());
		assertEquals("Plain text body\nwith two lines", Files.readString(storage.bookPath(1234), StandardCharsets.UTF_8));
	}

	@Test
	public void testStopsAtFirstSuccessfulCandidate(@TempDir Path tempDir) {
		FakeTransport transport = new FakeTransport()
				.serve(MIRROR + "/1/2/3/1234/1234-0.txt", "utf-8 body")
				.serve(MIRROR + "/1/2/3/1234/1234.txt", "plain body");
		BookFetcher fetcher = new BookFetcher(transport, new GutenbergMirrorResolver(MIRROR),
				new MirrorLayoutStorage(tempDir.toString()));

		assertTrue(fetcher.fetch(BOOK).success());
		assertEquals(1, transport.calls());
	}

	@Test
	public void testAllCandidatesFailingReportsLastError(@TempDir Path tempDir) {
		FakeTransport transport = new FakeTransport();
		MirrorLayoutStorage storage = new MirrorLayoutStorage(tempDir.toString());
		BookFetcher fetcher = new BookFetcher(transport, new GutenbergMirrorResolver(MIRROR), storage);

		FetchOutcome outcome = fetcher.fetch(BOOK);

		assertFalse(outcome.success());
		assertFalse(outcome.skipped());
		assertTrue(outcome.message().contains("1234.txt"), outcome.message());
		assertEquals(3, transport.calls());
		assertFalse(storage.exists(1234));
	}

	@Test
	public void testExistingArtifactIsSkippedWithoutNetwork(@TempDir Path tempDir) throws Exception {
		MirrorLayoutStorage storage = new MirrorLayoutStorage(tempDir.toString());
		storage.prepareDirectory(1234);
		storage.save(1234, "already here");
		FakeTransport transport = new FakeTransport();

		FetchOutcome outcome = new BookFetcher(transport, new GutenbergMirrorResolver(MIRROR), storage).fetch(BOOK);

		assertEquals(FetchOutcome.alreadyPresent(), outcome);
		assertEquals(0, transport.calls());
	}

	@Test
	public void testDirectoryFailureFailsTheBookWithoutFetching(@TempDir Path tempDir) throws Exception {
		Files.createDirectories(tempDir.resolve("1/2/3"));
		Files.writeString(tempDir.resolve("1/2/3/1234"), "in the way");
		FakeTransport transport = new FakeTransport().serve(MIRROR + "/1/2/3/1234/1234-0.txt", "body");

		FetchOutcome outcome = new BookFetcher(transport, new GutenbergMirrorResolver(MIRROR),
				new MirrorLayoutStorage(tempDir.toString())).fetch(BOOK);

		assertFalse(outcome.success());
		assertEquals(0, transport.calls());
	}
}
