package org.bibliosync.ingestion.transport;

import io.javalin.Javalin;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class HttpTransportTest {
	private Javalin server;
	private String base;
	private HttpTransport transport;

	@BeforeEach
	public void startServer() {
		server = Javalin.create(cfg -> cfg.showJavalinBanner = false);
		server.get("/text", ctx -> ctx.contentType("text/plain; charset=utf-8").result("Le Petit Prince"));
		server.get("/latin1", ctx -> ctx.contentType("text/plain; charset=iso-8859-1")
				.result("Les Misérables".getBytes(StandardCharsets.ISO_8859_1)));
		server.get("/moved", ctx -> {
			ctx.status(301);
			ctx.header("Location", "/text");
		});
		server.get("/found", ctx -> {
			ctx.status(302);
			ctx.header("Location", base + "/moved");
		});
		server.get("/loop", ctx -> {
			ctx.status(302);
			ctx.header("Location", "/loop");
		});
		server.get("/ftp", ctx -> {
			ctx.status(302);
			ctx.header("Location", "ftp://mirror.test/1/1.txt");
		});
		server.get("/missing", ctx -> ctx.status(404).result("not here"));
		server.get("/slow", ctx -> {
			Thread.sleep(1500);
			ctx.result("too late");
		});
		server.start(0);

		base = "http://localhost:" + server.port();
		transport = new HttpTransport(Duration.ofMillis(300), 5, "bibliosync-test");
	}

	@AfterEach
	public void stopServer() {
		server.stop();
	}

	@Test
	public void testPlainFetch() throws Exception {
		assertEquals("Le Petit Prince", transport.fetch(base + "/text"));
	}

	@Test
	public void testBodyIsDecodedWithDeclaredCharset() throws Exception {
		assertEquals("Les Misérables", transport.fetch(base + "/latin1"));
	}

	@Test
	public void testRelativeAndAbsoluteRedirectsAreFollowed() throws Exception {
		assertEquals("Le Petit Prince", transport.fetch(base + "/moved"));
		assertEquals("Le Petit Prince", transport.fetch(base + "/found"));
	}

	@Test
	public void testRedirectLoopIsCut() {
		IOException e = assertThrows(IOException.class, () -> transport.fetch(base + "/loop"));

		assertTrue(e.getMessage().contains("Too many redirects"), e.getMessage());
	}

	@Test
	public void testNon2xxStatusFailsWithStatusCode() {
		HttpStatusException e = assertThrows(HttpStatusException.class, () -> transport.fetch(base + "/missing"));

		assertEquals(404, e.statusCode());
		assertTrue(e.url().endsWith("/missing"));
	}

	@Test
	public void testSlowResponseTimesOut() {
		assertThrows(FetchTimeoutException.class, () -> transport.fetch(base + "/slow"));
	}

	@Test
	public void testStalledBodyTimesOut() throws Exception {
		try (ServerSocket stalling = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
			Thread peer = new Thread(() -> {
				try (Socket socket = stalling.accept()) {
					OutputStream out = socket.getOutputStream();
					out.write(("HTTP/1.1 200 OK\r\nContent-Type: text/plain\r\nContent-Length: 100\r\n\r\n0123456789")
							.getBytes(StandardCharsets.US_ASCII));
					out.flush();
					Thread.sleep(3000);
				} catch (IOException | InterruptedException ignored) {
					// peer goes away when the test ends
				}
			}, "stalling-peer");
			peer.setDaemon(true);
			peer.start();

			long start = System.nanoTime();
			assertThrows(FetchTimeoutException.class,
					() -> transport.fetch("http://127.0.0.1:" + stalling.getLocalPort() + "/stalled"));
			long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

			assertTrue(elapsedMs < 2000, "gave up after " + elapsedMs + " ms");
		}
	}

	@Test
	public void testRedirectToNonHttpSchemeIsAnIoFailure() {
		IOException e = assertThrows(IOException.class, () -> transport.fetch(base + "/ftp"));

		assertTrue(e.getMessage().contains("ftp://mirror.test/1/1.txt"), e.getMessage());
	}

	@Test
	public void testMalformedUrlIsAnIoFailure() {
		assertThrows(IOException.class, () -> transport.fetch("not a url"));
		assertThrows(IOException.class, () -> transport.fetch("/relative/only"));
		assertThrows(IOException.class, () -> transport.fetch("ftp://mirror.test/GUTINDEX.ALL"));
	}

	@Test
	public void testCharsetParsing() {
		assertEquals(StandardCharsets.ISO_8859_1, HttpTransport.charsetFromContentType("text/plain; Charset=\"ISO-8859-1\""));
		assertEquals(StandardCharsets.UTF_8, HttpTransport.charsetFromContentType("text/plain"));
		assertEquals(StandardCharsets.UTF_8, HttpTransport.charsetFromContentType("text/plain; charset=x-unknown-42"));
	}
}
