package org.bibliosync.ingestion.resolver;

import java.util.List;

public interface CandidateResolver {
	/**
	 * Candidate locations for a book, most preferred first
	 * @param bookId The book identifier
	 * @return ordered, non-empty list of absolute URLs
	 */
	List<String> resolve(int bookId);
}
