package com.ospicorp.forecastapi.forecast.service;

import com.ospicorp.forecastapi.forecast.error.ErrorKind;
import com.ospicorp.forecastapi.forecast.error.InputException;
import com.ospicorp.forecastapi.forecast.model.DataTable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Keeps normalized uploads as {@code clean_<name>.csv} under the configured directory so they can
 * be analyzed again without re-uploading.
 */
@Component
public class UploadStore {
  private static final Logger log = LoggerFactory.getLogger(UploadStore.class);
  static final String PREFIX = "clean_";

  private final CsvTableReader csv;
  private final Path directory;
  private final boolean enabled;

  public UploadStore(CsvTableReader csv,
      @Value("${forecast.storage.dir}") Path directory,
      @Value("${forecast.storage.enabled:true}") boolean enabled) {
    this.csv = csv;
    this.directory = directory.toAbsolutePath().normalize();
    this.enabled = enabled;
  }

  public Optional<Path> store(String originalFilename, DataTable normalized) {
    if (!enabled) {
      return Optional.empty();
    }
    Path target = directory.resolve(PREFIX + sanitize(originalFilename));
    try {
      Files.createDirectories(directory);
      try (Writer out = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
        csv.write(normalized, out);
      }
    } catch (IOException ex) {
      throw new UncheckedIOException("Could not store upload at " + target, ex);
    }
    log.info("Stored normalized upload ({} rows) at {}", normalized.rowCount(), target);
    return Optional.of(target);
  }

  public Path resolve(String storedName) {
    Path path = directory.resolve(storedName).normalize();
    if (!path.startsWith(directory) || !path.getFileName().toString().startsWith(PREFIX)) {
      throw new InputException(ErrorKind.MISSING_SOURCE, "Unknown stored upload: " + storedName);
    }
    return path;
  }

  static String sanitize(String filename) {
    String name = filename == null ? "" : filename;
    int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
    name = name.substring(slash + 1).replaceAll("[^A-Za-z0-9._-]", "_");
    if (name.isBlank() || name.chars().allMatch(c -> c == '.')) {
      name = "upload.csv";
    }
    return name;
  }
}
