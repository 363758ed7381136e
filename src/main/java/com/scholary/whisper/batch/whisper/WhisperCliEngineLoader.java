package com.scholary.whisper.batch.whisper;

import com.scholary.whisper.batch.engine.EngineLoadException;
import com.scholary.whisper.batch.engine.EngineLoader;
import com.scholary.whisper.batch.engine.ModelSize;
import com.scholary.whisper.batch.engine.TranscriptionEngine;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads a {@link WhisperCliEngine} after resolving the binary and the GGML model file.
 *
 * <p>Models are looked up as {@code <modelDir>/ggml-<size>.bin}, the naming used by whisper.cpp's
 * download script.
 */
public class WhisperCliEngineLoader implements EngineLoader {

  private static final Logger LOGGER = LoggerFactory.getLogger(WhisperCliEngineLoader.class);

  private final WhisperProperties.Cli properties;
  private final ProcessFactory processFactory;

  public WhisperCliEngineLoader(WhisperProperties.Cli properties) {
    this(properties, new DefaultProcessFactory());
  }

  WhisperCliEngineLoader(WhisperProperties.Cli properties, ProcessFactory processFactory) {
    this.properties = properties;
    this.processFactory = processFactory;
  }

  @Override
  public TranscriptionEngine load(ModelSize modelSize) {
    Path binary = resolvePath(properties.binaryPath());
    if (!Files.isRegularFile(binary) || !Files.isExecutable(binary)) {
      throw new EngineLoadException("whisper.cpp binary not found or not executable: " + binary);
    }

    Path model = modelPath(modelSize);
    if (!Files.isRegularFile(model) || !Files.isReadable(model)) {
      throw new EngineLoadException(
          String.format("Model '%s' not found: %s", modelSize.modelName(), model));
    }

    LOGGER.info("Initialized whisper.cpp engine: binary={}, model={}", binary, model);
    return new WhisperCliEngine(binary, model, properties.threads(), modelSize, processFactory);
  }

  Path modelPath(ModelSize modelSize) {
    return resolvePath(properties.modelDir()).resolve("ggml-" + modelSize.modelName() + ".bin");
  }

  /** Resolve to an absolute path so the process working directory does not matter. */
  private static Path resolvePath(String pathString) {
    return Path.of(pathString).toAbsolutePath().normalize();
  }
}
