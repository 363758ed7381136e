package com.scholary.whisper.batch.staging;

import com.scholary.whisper.batch.catalog.AudioFile;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Copies audio files to safely named temporary locations before they reach the engine.
 *
 * <p>Some engines and their decoders mishandle non-ASCII paths. Each call creates a fresh
 * directory and places a copy named {@code audio_<16 hex chars>.<ext>} inside it, so the engine
 * only ever sees ASCII paths regardless of the source name. Callers use the returned {@link
 * StagedFile} in try-with-resources so the copy is removed on every exit path.
 */
@Component
public class IsolationStager {

  private static final Logger LOGGER = LoggerFactory.getLogger(IsolationStager.class);

  static final String DIRECTORY_PREFIX = "whisper-stage-";
  static final String FILE_PREFIX = "audio_";
  private static final int TOKEN_LENGTH = 16;

  private final Path stagingRoot;

  /**
   * @param stagingDir parent for staging directories; blank means the JVM temp directory
   */
  public IsolationStager(@Value("${batch.staging-dir:}") String stagingDir) {
    this.stagingRoot =
        stagingDir == null || stagingDir.isBlank()
            ? Paths.get(System.getProperty("java.io.tmpdir"))
            : Paths.get(stagingDir);
  }

  Path stagingRoot() {
    return stagingRoot;
  }

  /**
   * Stage a copy of the given file.
   *
   * @param audioFile the original file
   * @return the staged copy; close it to release the temporary storage
   * @throws StagingException if the directory cannot be created or the copy fails
   */
  public StagedFile stage(AudioFile audioFile) {
    Path directory;
    try {
      Files.createDirectories(stagingRoot);
      directory = Files.createTempDirectory(stagingRoot, DIRECTORY_PREFIX);
    } catch (IOException e) {
      throw new StagingException("Failed to create staging directory under " + stagingRoot, e);
    }

    Path stagedPath = directory.resolve(stagedName(audioFile));
    try {
      Files.copy(audioFile.sourcePath(), stagedPath);
    } catch (IOException e) {
      discard(directory);
      throw new StagingException(
          "Failed to copy " + audioFile.name() + " to staging: " + e.getMessage(), e);
    }

    LOGGER.info("Staged {} as {}", audioFile.name(), stagedPath.getFileName());
    return new StagedFile(audioFile, stagedPath, directory);
  }

  static String stagedName(AudioFile audioFile) {
    String token = UUID.randomUUID().toString().replace("-", "").substring(0, TOKEN_LENGTH);
    String extension = audioFile.extension();
    return extension.isEmpty() ? FILE_PREFIX + token : FILE_PREFIX + token + "." + extension;
  }

  private void discard(Path directory) {
    try {
      StagedFile.deleteRecursively(directory);
    } catch (IOException e) {
      LOGGER.warn("Failed to remove staging directory {}: {}", directory, e.getMessage());
    }
  }
}
