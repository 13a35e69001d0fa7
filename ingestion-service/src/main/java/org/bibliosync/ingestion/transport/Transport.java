package org.bibliosync.ingestion.transport;

import java.io.IOException;

public interface Transport {
	/**
	 * Fetch a remote document as text, following redirects.
	 * @param url absolute location
	 * @return the response body
	 * @throws IOException on a non-2xx status, a timeout or a connection error
	 */
	String fetch(String url) throws IOException;
}
