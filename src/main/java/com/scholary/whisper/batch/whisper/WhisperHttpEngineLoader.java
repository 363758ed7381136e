package com.scholary.whisper.batch.whisper;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.whisper.batch.engine.EngineLoadException;
import com.scholary.whisper.batch.engine.EngineLoader;
import com.scholary.whisper.batch.engine.ModelSize;
import com.scholary.whisper.batch.engine.TranscriptionEngine;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads a {@link WhisperHttpEngine} after checking that the service answers its health endpoint.
 */
public class WhisperHttpEngineLoader implements EngineLoader {

  private static final Logger LOGGER = LoggerFactory.getLogger(WhisperHttpEngineLoader.class);

  static final String HEALTH_PATH = "/health";

  private final WhisperProperties.Http properties;
  private final ObjectMapper objectMapper;

  public WhisperHttpEngineLoader(WhisperProperties.Http properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  @Override
  public TranscriptionEngine load(ModelSize modelSize) {
    String baseUrl = normalizeBaseUrl(properties.baseUrl());
    HttpClient httpClient =
        HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    try {
      HttpRequest probe =
          HttpRequest.newBuilder()
              .uri(URI.create(baseUrl + HEALTH_PATH))
              .timeout(Duration.ofSeconds(properties.connectTimeout()))
              .GET()
              .build();
      HttpResponse<Void> response = httpClient.send(probe, HttpResponse.BodyHandlers.discarding());
      if (response.statusCode() / 100 != 2) {
        throw new EngineLoadException(
            String.format(
                "Whisper service at %s is not healthy (status %d)",
                baseUrl, response.statusCode()));
      }
    } catch (IOException e) {
      throw new EngineLoadException("Whisper service unreachable at " + baseUrl, e);
    } catch (IllegalArgumentException e) {
      throw new EngineLoadException("Invalid Whisper service URL: " + baseUrl, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new EngineLoadException("Interrupted while loading Whisper engine", e);
    }

    LOGGER.info(
        "Initialized Whisper HTTP engine: baseUrl={}, model={}", baseUrl, modelSize.modelName());
    return new WhisperHttpEngine(httpClient, baseUrl, objectMapper, modelSize);
  }

  static String normalizeBaseUrl(String baseUrl) {
    String trimmed = baseUrl.trim();
    return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
  }
}
