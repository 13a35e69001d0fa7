package org.bibliosync.ingestion.storage;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores artifacts in the same layout the mirror uses: {@code <root>/1/2/3/1234/1234.txt}.
 *
 * <p>The skip check of a re-run depends on this layout, so it must stay stable across releases.</p>
 */
public class MirrorLayoutStorage implements BookStorage {
	private static final Logger logger = LoggerFactory.getLogger(MirrorLayoutStorage.class);
	private static final String EXTENSION = ".txt";
	private static final String PARTIAL_SUFFIX = ".part";

	private final Path root;

	public MirrorLayoutStorage(String filesPath) {
		this.root = Paths.get(filesPath);
	}

	/**
	 * Creates the artifact root. Called once per run, before any record is fetched.
	 */
	public void initialize() throws IOException {
		Files.createDirectories(root);
		logger.info("Artifact tree initialized at: {}", root.toAbsolutePath());
	}

	public Path root() {
		return root;
	}

	private Path bookDirectory(int bookId) {
		if (bookId <= 0) {
			throw new IllegalArgumentException("Book id must be positive: " + bookId);
		}
		String digits = Integer.toString(bookId);
		Path dir = root;
		for (int i = 0; i < digits.length() - 1; i++) {
			dir = dir.resolve(String.valueOf(digits.charAt(i)));
		}
		return dir.resolve(digits);
	}

	@Override
	public Path bookPath(int bookId) {
		return bookDirectory(bookId).resolve(bookId + EXTENSION);
	}

	@Override
	public boolean exists(int bookId) {
		return Files.exists(bookPath(bookId));
	}

	@Override
	public void prepareDirectory(int bookId) throws IOException {
		Path dir = bookDirectory(bookId);
		try {
			Files.createDirectories(dir);
		} catch (FileAlreadyExistsException e) {
			// another record sharing this parent may have won the race
			if (!Files.isDirectory(dir)) {
				throw e;
			}
		}
	}

	@Override
	public Path save(int bookId, String content) throws IOException {
		Path target = bookPath(bookId);
		Path partial = target.resolveSibling(target.getFileName() + PARTIAL_SUFFIX);

		Files.writeString(partial, content, StandardCharsets.UTF_8);
		try {
			Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
		} catch (AtomicMoveNotSupportedException e) {
			Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
		}

		logger.debug("Saved book {} to {}", bookId, target);
		return target;
	}
}
