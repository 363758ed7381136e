package com.scholary.whisper.batch.catalog;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Discovers audio files in an input directory.
 *
 * <p>Only regular files directly inside the directory are considered. The result is sorted by
 * file name so repeated runs over the same directory log and process files in the same order.
 *
 * <p>File names are decoded with the JVM's filesystem encoding. A name that does not decode aborts
 * discovery rather than producing a transcript under a garbled name.
 */
@Component
public class FileCatalog {

  private static final Logger LOGGER = LoggerFactory.getLogger(FileCatalog.class);

  public static final Set<String> DEFAULT_EXTENSIONS =
      Set.of("mp3", "m4a", "wav", "flac", "ogg", "mp4");

  private static final char UNDECODABLE = '\uFFFD';

  private static final Comparator<AudioFile> ORDER =
      Comparator.comparing(AudioFile::name).thenComparing(AudioFile::sourcePath);

  /** Discover files with one of the default audio extensions. */
  public List<AudioFile> discover(Path inputDir) {
    return discover(inputDir, DEFAULT_EXTENSIONS);
  }

  /**
   * Discover files whose extension matches one of the given extensions, ignoring case.
   *
   * @param inputDir the directory to scan (non-recursive)
   * @param extensions allowed extensions without the leading dot
   * @return the matching files in a stable order; empty if none match
   * @throws DiscoveryException if the directory is missing or cannot be read
   */
  public List<AudioFile> discover(Path inputDir, Set<String> extensions) {
    if (!Files.isDirectory(inputDir)) {
      throw new DiscoveryException("Input directory does not exist: " + inputDir.toAbsolutePath());
    }

    Set<String> allowed =
        extensions.stream().map(e -> e.toLowerCase(Locale.ROOT)).collect(Collectors.toSet());

    List<AudioFile> found = new ArrayList<>();
    try (DirectoryStream<Path> entries = Files.newDirectoryStream(inputDir)) {
      for (Path entry : entries) {
        if (!Files.isRegularFile(entry)) {
          continue;
        }
        String name = entry.getFileName().toString();
        String extension = AudioFile.extensionOf(name).toLowerCase(Locale.ROOT);
        if (extension.isEmpty() || !allowed.contains(extension)) {
          continue;
        }
        requireDecodable(name, inputDir);
        try {
          found.add(AudioFile.of(entry, Files.size(entry)));
        } catch (NoSuchFileException e) {
          LOGGER.warn("File disappeared during discovery: {}", name);
        }
      }
    } catch (IOException e) {
      throw new DiscoveryException("Failed to list input directory: " + inputDir, e);
    }

    found.sort(ORDER);
    LOGGER.debug("Discovered {} audio files in {}", found.size(), inputDir);
    return List.copyOf(found);
  }

  /**
   * Reject names the JVM could not decode with its filesystem encoding.
   *
   * <p>Under a non-UTF-8 locale every undecodable byte becomes U+FFFD, so distinct source names
   * collapse into the same garbled string and cannot be turned back into an output path.
   */
  static void requireDecodable(String name, Path inputDir) {
    if (name.indexOf(UNDECODABLE) >= 0) {
      throw new DiscoveryException(
          String.format(
              "Cannot decode a file name in %s with filesystem encoding %s; "
                  + "run with a UTF-8 locale, e.g. LC_ALL=C.UTF-8",
              inputDir.toAbsolutePath(), System.getProperty("sun.jnu.encoding")));
    }
  }
}
