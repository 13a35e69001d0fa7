package org.bibliosync.ingestion.catalog;

import org.bibliosync.core.model.BookRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns the GUTINDEX listing into catalog records for one language.
 *
 * <p>Malformed or unannotated lines are skipped; parsing never fails. When several lines carry the same
 * numeric id (volume letters are dropped) the first one wins.</p>
 */
public class GutindexParser {
	private static final Logger logger = LoggerFactory.getLogger(GutindexParser.class);

	private final LanguageLookahead lookahead;
	private final String languageTag;

	public GutindexParser(LanguageLookahead lookahead, String languageTag) {
		this.lookahead = lookahead;
		this.languageTag = languageTag;
	}

	/**
	 * Parse the full index text
	 * @param content raw index content
	 * @return records in order of first appearance, unique by id
	 */
	public List<BookRecord> parse(String content) {
		if (content == null || content.isEmpty()) {
			return List.of();
		}

		List<String> lines = content.lines().toList();
		Map<Integer, BookRecord> books = new LinkedHashMap<>();
		int entries = 0;

		for (int i = 0; i < lines.size(); i++) {
			IndexLine line = IndexLineClassifier.classifyOrNull(lines.get(i));
			if (line == null) {
				continue;
			}
			entries++;

			if (!lookahead.qualifies(lines, i)) {
				continue;
			}

			int id = parseIdOrZero(line.digits());
			if (id <= 0 || books.containsKey(id)) {
				continue;
			}

			TitleAuthorSplitter.TitleAuthor parts = TitleAuthorSplitter.split(line.titleText());
			books.put(id, new BookRecord(id, parts.title(), parts.author(), languageTag));
		}

		logger.debug("Scanned {} lines, {} entry lines, {} qualifying books", lines.size(), entries, books.size());
		return new ArrayList<>(books.values());
	}

	private static int parseIdOrZero(String digits) {
		try {
			return Integer.parseInt(digits);
		} catch (NumberFormatException e) {
			return 0;
		}
	}
}
