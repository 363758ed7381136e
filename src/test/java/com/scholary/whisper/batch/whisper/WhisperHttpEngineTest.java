package com.scholary.whisper.batch.whisper;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.whisper.batch.engine.EngineLoadException;
import com.scholary.whisper.batch.engine.ModelSize;
import com.scholary.whisper.batch.engine.TranscriptionEngine;
import com.scholary.whisper.batch.engine.TranscriptionException;
import com.scholary.whisper.batch.engine.TranscriptionResult;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WhisperHttpEngineTest {

  @TempDir Path tempDir;

  private HttpServer server;
  private final AtomicInteger healthStatus = new AtomicInteger(200);
  private final AtomicInteger transcribeStatus = new AtomicInteger(200);
  private final AtomicReference<String> transcribeBody =
      new AtomicReference<>("{\"text\":\"こんにちは\",\"language\":\"ja\",\"segments\":[]}");
  private final AtomicReference<String> receivedContentType = new AtomicReference<>();
  private final AtomicReference<byte[]> receivedBody = new AtomicReference<>();

  private final ObjectMapper objectMapper = new ObjectMapper();

  @BeforeEach
  void startServer() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext(
        WhisperHttpEngineLoader.HEALTH_PATH,
        exchange -> respond(exchange, healthStatus.get(), "{\"status\":\"ok\"}"));
    server.createContext(
        WhisperHttpEngine.TRANSCRIBE_PATH,
        exchange -> {
          receivedContentType.set(exchange.getRequestHeaders().getFirst("Content-Type"));
          receivedBody.set(exchange.getRequestBody().readAllBytes());
          respond(exchange, transcribeStatus.get(), transcribeBody.get());
        });
    server.start();
  }

  @AfterEach
  void stopServer() {
    server.stop(0);
  }

  @Test
  void load_shouldSucceedWhenServiceIsHealthy() throws IOException {
    TranscriptionEngine engine = loader(baseUrl()).load(ModelSize.SMALL);

    assertThat(engine).isInstanceOf(WhisperHttpEngine.class);
    engine.transcribe(stagedFile(), "en");
    assertThat(new String(receivedBody.get(), StandardCharsets.ISO_8859_1))
        .contains("name=\"model\"\r\n\r\nsmall\r\n");
  }

  @Test
  void load_shouldFailWhenHealthCheckReturnsError() {
    healthStatus.set(503);

    assertThatThrownBy(() -> loader(baseUrl()).load(ModelSize.MEDIUM))
        .isInstanceOf(EngineLoadException.class)
        .hasMessageContaining("not healthy")
        .hasMessageContaining("503");
  }

  @Test
  void load_shouldFailWhenServiceIsUnreachable() throws IOException {
    int freePort;
    try (ServerSocket socket = new ServerSocket(0)) {
      freePort = socket.getLocalPort();
    }

    assertThatThrownBy(() -> loader("http://127.0.0.1:" + freePort).load(ModelSize.MEDIUM))
        .isInstanceOf(EngineLoadException.class)
        .hasMessageContaining("unreachable");
  }

  @Test
  void load_shouldRejectMalformedUrl() {
    assertThatThrownBy(() -> loader("not a url").load(ModelSize.MEDIUM))
        .isInstanceOf(EngineLoadException.class);
  }

  @Test
  void load_shouldAcceptTrailingSlashInBaseUrl() throws IOException {
    TranscriptionEngine engine = loader(baseUrl() + "/").load(ModelSize.BASE);

    TranscriptionResult result = engine.transcribe(stagedFile(), "ja");

    assertThat(result.text()).isEqualTo("こんにちは");
  }

  @Test
  void transcribe_shouldUploadFileWithModelAndLanguage() throws IOException {
    Path staged = stagedFile();
    TranscriptionEngine engine = loader(baseUrl()).load(ModelSize.MEDIUM);

    TranscriptionResult result = engine.transcribe(staged, "ja");

    assertThat(result.text()).isEqualTo("こんにちは");
    assertThat(result.language()).isEqualTo("ja");
    assertThat(receivedContentType.get()).startsWith("multipart/form-data; boundary=");

    String body = new String(receivedBody.get(), StandardCharsets.ISO_8859_1);
    assertThat(body)
        .contains("name=\"file\"; filename=\"audio_0123456789abcdef.mp3\"")
        .contains("name=\"model\"\r\n\r\nmedium\r\n")
        .contains("name=\"language\"\r\n\r\nja\r\n")
        .contains("ID3-fake-audio");
  }

  @Test
  void transcribe_shouldStreamBinaryAudioUnchanged() throws IOException {
    byte[] audio = new byte[3 * 1024 * 1024 + 17];
    new Random(42).nextBytes(audio);
    Path staged = Files.write(tempDir.resolve("audio_00000000000000aa.m4a"), audio);
    TranscriptionEngine engine = loader(baseUrl()).load(ModelSize.MEDIUM);

    engine.transcribe(staged, "ja");

    byte[] body = receivedBody.get();
    byte[] partHeaderEnd =
        "Content-Type: application/octet-stream\r\n\r\n".getBytes(StandardCharsets.US_ASCII);
    int start = indexOf(body, partHeaderEnd);
    assertThat(start).isNotNegative();
    byte[] uploaded = Arrays.copyOfRange(body, start, start + audio.length);
    assertThat(uploaded).isEqualTo(audio);
    assertThat(new String(body, start + audio.length, 2, StandardCharsets.ISO_8859_1))
        .isEqualTo("\r\n");
  }

  @Test
  void transcribe_shouldFailWhenStagedFileIsGone() {
    TranscriptionEngine engine = loader(baseUrl()).load(ModelSize.MEDIUM);
    Path missing = tempDir.resolve("audio_ffffffffffffffff.wav");

    assertThatThrownBy(() -> engine.transcribe(missing, "ja"))
        .isInstanceOf(TranscriptionException.class);
    assertThat(receivedBody.get()).isNull();
  }

  @Test
  void transcribe_shouldRebuildTextFromSegmentsWhenTextIsAbsent() throws IOException {
    transcribeBody.set(
        "{\"segments\":[{\"start\":0.0,\"end\":1.5,\"text\":\" 一つ目 \"},"
            + "{\"start\":1.5,\"end\":3.0,\"text\":\"二つ目\"}],\"duration\":3.0}");
    TranscriptionEngine engine = loader(baseUrl()).load(ModelSize.MEDIUM);

    TranscriptionResult result = engine.transcribe(stagedFile(), "ja");

    assertThat(result.text()).isEqualTo("一つ目 二つ目");
    assertThat(result.segments()).hasSize(2);
  }

  @Test
  void transcribe_shouldFailOnErrorStatus() throws IOException {
    transcribeStatus.set(500);
    transcribeBody.set("{\"detail\":\"decoder crashed\"}");
    TranscriptionEngine engine = loader(baseUrl()).load(ModelSize.MEDIUM);
    Path staged = stagedFile();

    assertThatThrownBy(() -> engine.transcribe(staged, "ja"))
        .isInstanceOf(TranscriptionException.class)
        .hasMessageContaining("500")
        .hasMessageContaining("decoder crashed");
  }

  @Test
  void transcribe_shouldFailOnMalformedJson() throws IOException {
    transcribeBody.set("<html>gateway</html>");
    TranscriptionEngine engine = loader(baseUrl()).load(ModelSize.MEDIUM);
    Path staged = stagedFile();

    assertThatThrownBy(() -> engine.transcribe(staged, "ja"))
        .isInstanceOf(TranscriptionException.class);
  }

  @Test
  void normalizeBaseUrl_shouldStripTrailingSlashAndWhitespace() {
    assertThat(WhisperHttpEngineLoader.normalizeBaseUrl(" http://host:8090/ "))
        .isEqualTo("http://host:8090");
    assertThat(WhisperHttpEngineLoader.normalizeBaseUrl("http://host")).isEqualTo("http://host");
  }

  private WhisperHttpEngineLoader loader(String baseUrl) {
    return new WhisperHttpEngineLoader(new WhisperProperties.Http(baseUrl, 2), objectMapper);
  }

  private String baseUrl() {
    return "http://127.0.0.1:" + server.getAddress().getPort();
  }

  private Path stagedFile() throws IOException {
    return Files.writeString(tempDir.resolve("audio_0123456789abcdef.mp3"), "ID3-fake-audio");
  }

  /** Offset just past the first occurrence of {@code marker}, or -1. */
  private static int indexOf(byte[] haystack, byte[] marker) {
    outer:
    for (int i = 0; i <= haystack.length - marker.length; i++) {
      for (int j = 0; j < marker.length; j++) {
        if (haystack[i + j] != marker[j]) {
          continue outer;
        }
      }
      return i + marker.length;
    }
    return -1;
  }

  private static void respond(HttpExchange exchange, int status, String body) throws IOException {
    byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    exchange.getResponseHeaders().set("Content-Type", "application/json");
    exchange.sendResponseHeaders(status, bytes.length);
    try (OutputStream out = exchange.getResponseBody()) {
      out.write(bytes);
    }
  }
}
