package com.scholary.whisper.batch.whisper;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the Whisper engine.
 *
 * <p>{@code engine} selects the backend: a faster-whisper style HTTP service or a local
 * whisper.cpp binary. Only the selected backend's settings are used.
 */
@ConfigurationProperties(prefix = "whisper")
@Validated
public record WhisperProperties(
    @NotNull EngineType engine, @Valid @NotNull Http http, @Valid @NotNull Cli cli) {

  public enum EngineType {
    HTTP,
    CLI
  }

  /**
   * @param baseUrl root URL of the service, without a trailing slash
   * @param connectTimeout connect timeout in seconds
   */
  public record Http(@NotBlank String baseUrl, @Positive int connectTimeout) {}

  /**
   * @param binaryPath the whisper.cpp executable
   * @param modelDir directory holding {@code ggml-<size>.bin} model files
   * @param threads CPU threads passed to whisper.cpp
   */
  public record Cli(@NotBlank String binaryPath, @NotBlank String modelDir, @Positive int threads) {}
}
