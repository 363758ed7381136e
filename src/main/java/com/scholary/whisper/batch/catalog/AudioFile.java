package com.scholary.whisper.batch.catalog;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * An audio file found in the input directory.
 *
 * <p>The source path is kept exactly as the filesystem returned it, so names in any script survive
 * untouched. The size is the one observed at discovery; the job re-reads it before processing.
 */
public record AudioFile(Path sourcePath, String name, long sizeBytes, String extension) {

  public AudioFile {
    Objects.requireNonNull(sourcePath, "sourcePath");
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(extension, "extension");
    if (sizeBytes < 0) {
      throw new IllegalArgumentException("Size cannot be negative");
    }
  }

  /**
   * Build an AudioFile from a path, splitting the name at its last dot.
   *
   * @param path the file path; made absolute
   * @param sizeBytes the size observed on disk
   */
  public static AudioFile of(Path path, long sizeBytes) {
    Path absolute = path.toAbsolutePath();
    String name = absolute.getFileName().toString();
    return new AudioFile(absolute, name, sizeBytes, extensionOf(name));
  }

  /** The file name without its final extension. */
  public String stem() {
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(0, dot) : name;
  }

  static String extensionOf(String fileName) {
    int dot = fileName.lastIndexOf('.');
    if (dot <= 0 || dot == fileName.length() - 1) {
      return "";
    }
    return fileName.substring(dot + 1);
  }

  /** Extension in lower case, for matching against the allowed set. */
  public String normalizedExtension() {
    return extension.toLowerCase(Locale.ROOT);
  }
}
