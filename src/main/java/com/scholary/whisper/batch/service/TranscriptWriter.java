package com.scholary.whisper.batch.service;

import com.scholary.whisper.batch.catalog.AudioFile;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Writes transcripts as UTF-8 text files.
 *
 * <p>The output name is always {@code <stem of the original file>.txt}; a previous transcript with
 * the same name is replaced, never appended to.
 *
 * <p>With atomic writes enabled the text goes to a temporary file in the output directory first and
 * is then moved over the target, so a crash mid-write never leaves a truncated transcript behind.
 */
@Component
public class TranscriptWriter {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptWriter.class);

  static final String EXTENSION = ".txt";
  private static final String TEMP_PREFIX = ".transcript-";
  private static final String TEMP_SUFFIX = ".tmp";

  private final boolean atomicWrites;

  public TranscriptWriter(@Value("${batch.atomic-writes:true}") boolean atomicWrites) {
    this.atomicWrites = atomicWrites;
  }

  /** Where the transcript for the given file goes. */
  public Path outputPathFor(Path outputDir, AudioFile audioFile) {
    return outputDir.resolve(audioFile.stem() + EXTENSION);
  }

  /**
   * Write the transcript for an audio file.
   *
   * @param outputDir the output directory, which must exist
   * @param audioFile the original audio file; its stem names the output
   * @param text the transcript
   * @return the path written
   * @throws WriteException if the file cannot be written
   */
  public Path write(Path outputDir, AudioFile audioFile, String text) {
    Path target = outputPathFor(outputDir, audioFile);
    byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
    try {
      if (atomicWrites) {
        writeAtomically(outputDir, target, bytes);
      } else {
        Files.write(
            target,
            bytes,
            StandardOpenOption.CREATE,
            StandardOpenOption.TRUNCATE_EXISTING,
            StandardOpenOption.WRITE);
      }
    } catch (IOException e) {
      throw new WriteException("Failed to write " + target + ": " + e.getMessage(), e);
    }
    LOGGER.debug("Wrote {} bytes to {}", bytes.length, target);
    return target;
  }

  private void writeAtomically(Path outputDir, Path target, byte[] bytes) throws IOException {
    // CREATE_NEW honours the umask; Files.createTempFile would force owner-only access
    Path temp = outputDir.resolve(TEMP_PREFIX + UUID.randomUUID() + TEMP_SUFFIX);
    try {
      Files.write(temp, bytes, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
      copyPermissions(target, temp);
      try {
        Files.move(
            temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        LOGGER.debug("Atomic move not supported in {}, replacing directly", outputDir);
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(temp);
    }
  }

  /** A replaced transcript keeps its mode, as it would when truncated in place. */
  private static void copyPermissions(Path from, Path to) throws IOException {
    PosixFileAttributeView view = Files.getFileAttributeView(from, PosixFileAttributeView.class);
    if (view == null || !Files.isRegularFile(from)) {
      return;
    }
    Files.setPosixFilePermissions(to, view.readAttributes().permissions());
  }
}
