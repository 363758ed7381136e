package com.scholary.whisper.batch.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.whisper.batch.engine.EngineLoader;
import com.scholary.whisper.batch.whisper.WhisperCliEngineLoader;
import com.scholary.whisper.batch.whisper.WhisperHttpEngineLoader;
import com.scholary.whisper.batch.whisper.WhisperProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the Whisper engine.
 *
 * <p>Wires up the EngineLoader for the backend selected by {@code whisper.engine}. The loader is
 * cheap; the engine itself is only loaded when a batch starts.
 */
@Configuration
@EnableConfigurationProperties(WhisperProperties.class)
public class WhisperConfig {

  @Bean
  public EngineLoader engineLoader(WhisperProperties properties, ObjectMapper objectMapper) {
    return switch (properties.engine()) {
      case HTTP -> new WhisperHttpEngineLoader(properties.http(), objectMapper);
      case CLI -> new WhisperCliEngineLoader(properties.cli());
    };
  }
}
