package com.scholary.whisper.batch.service;

import com.scholary.whisper.batch.engine.ModelSize;
import java.nio.file.Path;
import java.util.Objects;

/** Inputs for one batch run. */
public record BatchOptions(Path inputDir, Path outputDir, ModelSize model, String language) {

  public BatchOptions {
    Objects.requireNonNull(inputDir, "inputDir");
    Objects.requireNonNull(outputDir, "outputDir");
    Objects.requireNonNull(model, "model");
    if (language == null || language.isBlank()) {
      throw new IllegalArgumentException("Language must not be blank");
    }
  }
}
