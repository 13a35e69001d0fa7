package org.bibliosync.ingestion.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link Transport} over {@link HttpClient}.
 *
 * <p>Redirects are followed here rather than by the client, so that relative {@code Location} headers are
 * resolved against the request that produced them and the chain length stays bounded.</p>
 *
 * <p>The timeout bounds each request/response exchange as a whole, body included, so a peer that stalls
 * after sending headers fails with {@link FetchTimeoutException} like one that never answers.</p>
 */
public class HttpTransport implements Transport {
	private static final Logger logger = LoggerFactory.getLogger(HttpTransport.class);
	private static final Set<Integer> REDIRECT_CODES = Set.of(301, 302, 303, 307, 308);
	private static final Set<String> SCHEMES = Set.of("http", "https");

	private final HttpClient client;
	private final Duration timeout;
	private final int maxRedirects;
	private final String userAgent;

	public HttpTransport(Duration timeout, int maxRedirects, String userAgent) {
		this(HttpClient.newBuilder()
				.connectTimeout(timeout)
				.followRedirects(HttpClient.Redirect.NEVER)
				.build(), timeout, maxRedirects, userAgent);
	}

	HttpTransport(HttpClient client, Duration timeout, int maxRedirects, String userAgent) {
		this.client = Objects.requireNonNull(client);
		this.timeout = Objects.requireNonNull(timeout);
		this.maxRedirects = maxRedirects;
		this.userAgent = Objects.requireNonNull(userAgent);
	}

	@Override
	public String fetch(String url) throws IOException {
		URI uri = toUri(url);
		for (int redirects = 0; ; redirects++) {
			HttpResponse<byte[]> response = send(uri);
			int status = response.statusCode();

			if (REDIRECT_CODES.contains(status)) {
				if (redirects >= maxRedirects) {
					throw new IOException("Too many redirects (" + maxRedirects + ") starting from " + url);
				}
				uri = redirectTarget(uri, response);
				logger.debug("HTTP {} redirect to {}", status, uri);
				continue;
			}

			if (status < 200 || status >= 300) {
				throw new HttpStatusException(status, uri.toString());
			}
			return new String(response.body(), charsetOf(response));
		}
	}

	private HttpResponse<byte[]> send(URI uri) throws IOException {
		HttpRequest request;
		try {
			request = HttpRequest.newBuilder(uri)
					.timeout(timeout)
					.header("User-Agent", userAgent)
					.GET()
					.build();
		} catch (IllegalArgumentException e) {
			throw new IOException("Cannot request " + uri, e);
		}

		CompletableFuture<HttpResponse<byte[]>> exchange =
				client.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray());
		try {
			return exchange.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
		} catch (TimeoutException e) {
			exchange.cancel(true);
			throw new FetchTimeoutException("Request timeout after " + timeout.toMillis() + " ms: " + uri, e);
		} catch (ExecutionException e) {
			Throwable cause = e.getCause();
			if (cause instanceof HttpTimeoutException) {
				throw new FetchTimeoutException("Request timeout after " + timeout.toMillis() + " ms: " + uri, cause);
			}
			if (cause instanceof IOException) {
				throw new IOException(cause.getMessage() + " (" + uri + ")", cause);
			}
			throw new IOException("Failed to fetch " + uri, cause);
		} catch (InterruptedException e) {
			exchange.cancel(true);
			Thread.currentThread().interrupt();
			throw new IOException("Interrupted while fetching " + uri, e);
		}
	}

	private static URI redirectTarget(URI current, HttpResponse<?> response) throws IOException {
		Optional<String> location = response.headers().firstValue("Location");
		if (location.isEmpty() || location.get().isBlank()) {
			throw new IOException("HTTP " + response.statusCode() + " without Location header for URL: " + current);
		}
		URI target;
		try {
			target = current.resolve(location.get().trim());
		} catch (IllegalArgumentException e) {
			throw new IOException("Invalid redirect location '" + location.get() + "' from " + current, e);
		}
		if (!isHttp(target)) {
			throw new IOException("Unsupported redirect target '" + target + "' from " + current);
		}
		return target;
	}

	private static boolean isHttp(URI uri) {
		return uri.getScheme() != null
				&& SCHEMES.contains(uri.getScheme().toLowerCase(Locale.ROOT))
				&& uri.getHost() != null;
	}

	private static URI toUri(String url) throws IOException {
		try {
			URI uri = URI.create(url.trim());
			if (!isHttp(uri)) {
				throw new IOException("Not an absolute http(s) URL: " + url);
			}
			return uri;
		} catch (IllegalArgumentException e) {
			throw new IOException("Invalid URL: " + url, e);
		}
	}

	static Charset charsetOf(HttpResponse<?> response) {
		return response.headers().firstValue("Content-Type")
				.map(HttpTransport::charsetFromContentType)
				.orElse(StandardCharsets.UTF_8);
	}

	static Charset charsetFromContentType(String contentType) {
		for (String part : contentType.split(";")) {
			String param = part.trim();
			if (param.regionMatches(true, 0, "charset=", 0, 8)) {
				String name = param.substring(8).replace("\"", "").trim();
				try {
					return Charset.forName(name);
				} catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
					logger.debug("Unknown charset '{}', falling back to UTF-8", name);
					return StandardCharsets.UTF_8;
				}
			}
		}
		return StandardCharsets.UTF_8;
	}
}
