package org.bibliosync.ingestion.sink;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.bibliosync.core.model.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * Writes the catalog as pretty-printed JSON ({@code metadata.json}).
 */
public class JsonMetadataSink implements ProgressSink {
	private static final Logger logger = LoggerFactory.getLogger(JsonMetadataSink.class);

	private final Path metadataPath;
	private final Gson gson;

	public JsonMetadataSink(String metadataFile) {
		this.metadataPath = Paths.get(metadataFile);
		this.gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
	}

	@Override
	public void write(RunSummary summary) throws IOException {
		Path parent = metadataPath.toAbsolutePath().getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}

		Path temp = metadataPath.resolveSibling(metadataPath.getFileName() + ".tmp");
		Files.writeString(temp, gson.toJson(summary), StandardCharsets.UTF_8);
		try {
			Files.move(temp, metadataPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
		} catch (AtomicMoveNotSupportedException e) {
			Files.move(temp, metadataPath, StandardCopyOption.REPLACE_EXISTING);
		}

		logger.info("Saved catalog to {} ({} books)", metadataPath, summary.totalBooks());
	}

	@Override
	public RunSummary read() throws IOException {
		if (!Files.exists(metadataPath)) {
			logger.debug("Catalog file does not exist: {}", metadataPath);
			return null;
		}

		String json = Files.readString(metadataPath, StandardCharsets.UTF_8);
		try {
			return gson.fromJson(json, RunSummary.class);
		} catch (JsonParseException e) {
			throw new IOException("Corrupt catalog file " + metadataPath + ": " + e.getMessage(), e);
		}
	}
}
