package org.bibliosync.ingestion.transport;

import java.io.IOException;

/**
 * Indicates the mirror did not answer within the configured timeout.
 */
public class FetchTimeoutException extends IOException {
	public FetchTimeoutException(String message, Throwable cause) {
		super(message, cause);
	}
}
