package com.scholary.whisper.batch.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import com.scholary.whisper.batch.catalog.AudioFile;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TranscriptWriterTest {

  @TempDir Path outputDir;

  private final AudioFile source = AudioFile.of(Path.of("in", "meeting.final.mp3"), 1);

  @Test
  void write_shouldUseStemOfOriginalFile() {
    Path written = new TranscriptWriter(true).write(outputDir, source, "hello");

    assertThat(written).isEqualTo(outputDir.resolve("meeting.final.txt"));
  }

  @Test
  void write_shouldEncodeAsUtf8() throws IOException {
    String text = "こんにちは、世界。Grüße";

    Path written = new TranscriptWriter(true).write(outputDir, source, text);

    assertThat(Files.readAllBytes(written)).isEqualTo(text.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  void write_shouldReplaceLongerPreviousContent() throws IOException {
    Files.writeString(outputDir.resolve("meeting.final.txt"), "a much longer old transcript");

    Path written = new TranscriptWriter(true).write(outputDir, source, "new");

    assertThat(Files.readString(written)).isEqualTo("new");
  }

  @Test
  void write_shouldLeaveNoTemporaryFilesBehind() throws IOException {
    new TranscriptWriter(true).write(outputDir, source, "text");

    try (Stream<Path> entries = Files.list(outputDir)) {
      assertThat(entries.map(p -> p.getFileName().toString())).containsExactly("meeting.final.txt");
    }
  }

  @Test
  void write_shouldGiveNewTranscriptSameModeAsPlainWrite() throws IOException {
    assumePosix();
    Path plain = Files.writeString(outputDir.resolve("plain.txt"), "reference");

    Path written = new TranscriptWriter(true).write(outputDir, source, "text");

    assertThat(Files.getPosixFilePermissions(written))
        .isEqualTo(Files.getPosixFilePermissions(plain));
  }

  @Test
  void write_shouldKeepModeOfReplacedTranscript() throws IOException {
    assumePosix();
    Path existing = Files.writeString(outputDir.resolve("meeting.final.txt"), "old");
    Files.setPosixFilePermissions(existing, PosixFilePermissions.fromString("rw-rw----"));

    Path written = new TranscriptWriter(true).write(outputDir, source, "new");

    assertThat(PosixFilePermissions.toString(Files.getPosixFilePermissions(written)))
        .isEqualTo("rw-rw----");
  }

  @Test
  void write_shouldTruncateInPlaceWhenAtomicWritesDisabled() throws IOException {
    Files.writeString(outputDir.resolve("meeting.final.txt"), "previous content here");

    Path written = new TranscriptWriter(false).write(outputDir, source, "short");

    assertThat(Files.readString(written)).isEqualTo("short");
  }

  @Test
  void write_shouldFailWhenOutputDirectoryIsMissing() {
    Path missing = outputDir.resolve("missing");

    assertThatThrownBy(() -> new TranscriptWriter(true).write(missing, source, "x"))
        .isInstanceOf(WriteException.class)
        .hasMessageContaining("meeting.final.txt");
  }

  @Test
  void write_shouldFailWhenTargetIsADirectory() throws IOException {
    Files.createDirectories(outputDir.resolve("meeting.final.txt"));

    assertThatThrownBy(() -> new TranscriptWriter(false).write(outputDir, source, "x"))
        .isInstanceOf(WriteException.class);
  }

  private static void assumePosix() {
    assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
  }
}
