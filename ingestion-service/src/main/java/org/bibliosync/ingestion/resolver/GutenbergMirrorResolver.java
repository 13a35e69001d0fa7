package org.bibliosync.ingestion.resolver;

import java.util.List;

/**
 * Resolves books against the Gutenberg mirror directory convention: every digit of the id except the last
 * is a directory level, e.g. book {@code 1234} lives under {@code 1/2/3/1234/}.
 *
 * <p>Text variants are tried UTF-8 first ({@code -0}), then Latin-1 ({@code -8}), then the plain file.</p>
 */
public class GutenbergMirrorResolver implements CandidateResolver {
	private final String baseUrl;

	public GutenbergMirrorResolver(String baseUrl) {
		this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
	}

	@Override
	public List<String> resolve(int bookId) {
		String base = baseDirectory(bookId);
		return List.of(
				String.format("%s%d-0.txt", base, bookId),
				String.format("%s%d-8.txt", base, bookId),
				String.format("%s%d.txt", base, bookId)
		);
	}

	/**
	 * Base directory URL for a book, with a trailing slash.
	 */
	public String baseDirectory(int bookId) {
		if (bookId <= 0) {
			throw new IllegalArgumentException("Book id must be positive: " + bookId);
		}
		String digits = Integer.toString(bookId);
		StringBuilder url = new StringBuilder(baseUrl).append('/');
		for (int i = 0; i < digits.length() - 1; i++) {
			url.append(digits.charAt(i)).append('/');
		}
		return url.append(digits).append('/').toString();
	}
}
