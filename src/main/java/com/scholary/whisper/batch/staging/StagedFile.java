package com.scholary.whisper.batch.staging;

import com.scholary.whisper.batch.catalog.AudioFile;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A temporary, ASCII-named copy of an audio file.
 *
 * <p>Holds a reference to the original but never owns it. Closing removes the copy together with
 * the directory created for it, including anything an engine left next to the copy. Close is
 * idempotent.
 */
public final class StagedFile implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(StagedFile.class);

  private final AudioFile original;
  private final Path stagedPath;
  private final Path directory;
  private boolean closed;

  StagedFile(AudioFile original, Path stagedPath, Path directory) {
    this.original = original;
    this.stagedPath = stagedPath;
    this.directory = directory;
  }

  public AudioFile original() {
    return original;
  }

  public Path stagedPath() {
    return stagedPath;
  }

  public Path directory() {
    return directory;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    try {
      deleteRecursively(directory);
      LOGGER.debug("Removed staging directory {}", directory);
    } catch (IOException | UncheckedIOException e) {
      // The job outcome is already decided; a leftover temp dir must not change it.
      LOGGER.warn("Failed to remove staging directory {}: {}", directory, e.getMessage());
    }
  }

  static void deleteRecursively(Path root) throws IOException {
    if (!Files.exists(root)) {
      return;
    }
    try (Stream<Path> paths = Files.walk(root)) {
      for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
        Files.deleteIfExists(path);
      }
    }
  }
}
