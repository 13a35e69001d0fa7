package org.bibliosync.ingestion.transport;

import java.io.IOException;

/**
 * Thrown when the mirror answers with a status other than 2xx (after redirects are followed).
 */
public class HttpStatusException extends IOException {
    private final int statusCode;
    private final String url;

    public HttpStatusException(int statusCode, String url) {
        super("HTTP " + statusCode + " for URL: " + url);
        this.statusCode = statusCode;
        this.url = url;
    }

    public int statusCode() {
        return statusCode;
    }

    public String url() {
        return url;
    }
}
