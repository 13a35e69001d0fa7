package org.bibliosync.ingestion.storage;

import java.io.IOException;
import java.nio.file.Path;

public interface BookStorage {
	/**
	 * Local artifact path for a book
	 */
	Path bookPath(int bookId);

	/**
	 * Check if the artifact for a book is already on disk
	 */
	boolean exists(int bookId);

	/**
	 * Create the directory that will hold the artifact. An existing directory is not an error.
	 */
	void prepareDirectory(int bookId) throws IOException;

	/**
	 * Persist the artifact. A partially written file is never visible under the artifact path
	 */
	Path save(int bookId, String content) throws IOException;
}
