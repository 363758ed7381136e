package com.scholary.whisper.batch.config;

import com.scholary.whisper.batch.engine.ModelSize;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Default run settings.
 *
 * <p>Maps to the "batch.*" keys in application.yml. Positional arguments and {@code --model} /
 * {@code --language} on the command line take precedence.
 */
@ConfigurationProperties(prefix = "batch")
@Validated
public record BatchProperties(
    @NotBlank String inputDir,
    @NotBlank String outputDir,
    @NotNull ModelSize model,
    @NotBlank String language) {}
