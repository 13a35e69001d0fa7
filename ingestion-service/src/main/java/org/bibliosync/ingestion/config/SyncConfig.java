package org.bibliosync.ingestion.config;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Properties;

/**
 * Typed configuration for the catalog sync.
 *
 * <p>Loads {@code application.properties}, then overlays environment variables. If {@code DATA_VOLUME_PATH}
 * is set, it overrides {@code storage.files.path}. Missing required keys fail fast with
 * {@link IllegalStateException}.</p>
 */
public record SyncConfig(
    Mode mode,
    int serverPort,
    Mirror mirror,
    Http http,
    Download download,
    Storage storage,
    Catalog catalog
) {
    /** {@code once} runs a single sync and exits, {@code serve} exposes the HTTP API. */
    public enum Mode { ONCE, SERVE }

    /** Remote mirror root and the index document under it. */
    public record Mirror(String baseUrl, String indexPath) {
        public String indexUrl() {
            String root = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
            return root + indexPath;
        }
    }

    /** Transport settings. */
    public record Http(Duration timeout, int maxRedirects, String userAgent) {}

    /** Fetch engine settings. */
    public record Download(int concurrency, int progressInterval) {}

    /** Local artifact tree and catalog file. */
    public record Storage(String filesPath, String metadataFile) {}

    /** Index parsing settings: which language annotation qualifies an entry. */
    public record Catalog(String languageMarker, String languageTag, int lookaheadLines) {}

    /**
     * Loads configuration from classpath properties plus environment variables.
     *
     * @return a fully-initialized {@link SyncConfig}
     */
    public static SyncConfig load() {
        Properties properties = loadProperties("application.properties");
        overlayEnvironment(properties);
        normalizeFilesPath(properties);
        return from(properties);
    }

    static SyncConfig from(Properties p) {
        return new SyncConfig(
            readMode(p),
            requireInt(p, "server.port"),
            new Mirror(requireString(p, "mirror.base.url"), requireString(p, "mirror.index.path")),
            readHttp(p),
            readDownload(p),
            new Storage(requireString(p, "storage.files.path"), requireString(p, "storage.metadata.file")),
            readCatalog(p)
        );
    }

    private static Mode readMode(Properties p) {
        String mode = requireString(p, "app.mode");
        return switch (mode.toLowerCase()) {
            case "once" -> Mode.ONCE;
            case "serve" -> Mode.SERVE;
            default -> throw new IllegalStateException("Unsupported app.mode: " + mode);
        };
    }

    private static Http readHttp(Properties p) {
        return new Http(
            Duration.ofMillis(requirePositiveInt(p, "http.timeout.ms")),
            requireInt(p, "http.max.redirects"),
            requireString(p, "http.user.agent")
        );
    }

    private static Download readDownload(Properties p) {
        return new Download(
            requirePositiveInt(p, "download.concurrency"),
            requirePositiveInt(p, "download.progress.interval")
        );
    }

    private static Catalog readCatalog(Properties p) {
        return new Catalog(
            requireString(p, "catalog.language.marker").toLowerCase(),
            requireString(p, "catalog.language.tag"),
            requirePositiveInt(p, "catalog.lookahead.lines")
        );
    }

    private static Properties loadProperties(String resourceName) {
        Properties properties = new Properties();
        try (InputStream in = SyncConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load " + resourceName, e);
        }
        return properties;
    }

    private static void overlayEnvironment(Properties properties) {
        properties.putAll(System.getenv());
    }

    private static void normalizeFilesPath(Properties properties) {
        String volume = trimToNull(properties.getProperty("DATA_VOLUME_PATH"));
        if (volume != null) {
            properties.setProperty("storage.files.path", volume);
        }
    }

    private static String requireString(Properties properties, String key) {
        String value = trimToNull(properties.getProperty(key));
        if (value == null) {
            throw new IllegalStateException("Missing required configuration: " + key);
        }
        return value;
    }

    private static int requireInt(Properties properties, String key) {
        String value = requireString(properties, key);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for configuration '" + key + "': '" + value + "'", e);
        }
    }

    private static int requirePositiveInt(Properties properties, String key) {
        int value = requireInt(properties, key);
        if (value < 1) {
            throw new IllegalStateException("Configuration '" + key + "' must be positive, got " + value);
        }
        return value;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
