package com.scholary.whisper.batch.whisper;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.whisper.batch.engine.ModelSize;
import com.scholary.whisper.batch.engine.TranscriptionEngine;
import com.scholary.whisper.batch.engine.TranscriptionException;
import com.scholary.whisper.batch.engine.TranscriptionResult;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Engine backed by a faster-whisper style HTTP service.
 *
 * <p>Each call uploads the staged file as multipart/form-data together with the model and language
 * and waits for the complete transcript. No request timeout is set: long recordings can take tens
 * of minutes. Failures are not retried; the job is failed and the batch moves on.
 */
public class WhisperHttpEngine implements TranscriptionEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(WhisperHttpEngine.class);

  static final String TRANSCRIBE_PATH = "/api/v1/transcribe";

  private final HttpClient httpClient;
  private final String baseUrl;
  private final ObjectMapper objectMapper;
  private final ModelSize modelSize;

  public WhisperHttpEngine(
      HttpClient httpClient, String baseUrl, ObjectMapper objectMapper, ModelSize modelSize) {
    this.httpClient = httpClient;
    this.baseUrl = baseUrl;
    this.objectMapper = objectMapper;
    this.modelSize = modelSize;
  }

  /**
   * Transcribe an audio file.
   *
   * @param audioFile the staged audio file
   * @param languageHint the language code sent to the service
   * @return the transcription
   * @throws TranscriptionException if the request fails or the service returns an error
   */
  @Override
  public TranscriptionResult transcribe(Path audioFile, String languageHint) {
    LOGGER.info(
        "Transcribing: file={}, model={}, language={}",
        audioFile.getFileName(),
        modelSize.modelName(),
        languageHint);

    try {
      String boundary = UUID.randomUUID().toString();
      HttpRequest request =
          HttpRequest.newBuilder()
              .uri(URI.create(baseUrl + TRANSCRIBE_PATH))
              .header("Content-Type", "multipart/form-data; boundary=" + boundary)
              .POST(multipartBody(audioFile, languageHint, boundary))
              .build();

      LOGGER.debug("Sending transcription request to {}", request.uri());

      HttpResponse<String> response =
          httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));

      if (response.statusCode() != 200) {
        throw new TranscriptionException(
            String.format(
                "Whisper API returned status %d: %s", response.statusCode(), response.body()));
      }

      WhisperResponse whisperResponse =
          objectMapper.readValue(response.body(), WhisperResponse.class);
      TranscriptionResult result = whisperResponse.toResult();

      LOGGER.info(
          "Transcription successful: {} segments, {} chars, language={}",
          result.segments().size(),
          result.text().length(),
          result.language());
      return result;

    } catch (IOException e) {
      throw new TranscriptionException("Whisper request failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TranscriptionException("Transcription interrupted", e);
    }
  }

  /**
   * Streams the staged file between the multipart head and tail so the audio is never held in
   * memory. Parts: {@code file}, then the {@code model} and {@code language} fields.
   */
  private BodyPublisher multipartBody(Path audioFile, String languageHint, String boundary)
      throws FileNotFoundException {
    String head =
        "--"
            + boundary
            + "\r\n"
            + "Content-Disposition: form-data; name=\"file\"; filename=\""
            + audioFile.getFileName()
            + "\"\r\n"
            + "Content-Type: application/octet-stream\r\n\r\n";
    String tail =
        "\r\n"
            + formField(boundary, "model", modelSize.modelName())
            + formField(boundary, "language", languageHint)
            + "--"
            + boundary
            + "--\r\n";

    return BodyPublishers.concat(
        BodyPublishers.ofString(head, StandardCharsets.UTF_8),
        BodyPublishers.ofFile(audioFile),
        BodyPublishers.ofString(tail, StandardCharsets.UTF_8));
  }

  private static String formField(String boundary, String name, String value) {
    return "--"
        + boundary
        + "\r\n"
        + "Content-Disposition: form-data; name=\""
        + name
        + "\"\r\n\r\n"
        + value
        + "\r\n";
  }
}
