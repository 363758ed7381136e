package com.scholary.whisper.batch.engine;

/**
 * Creates a {@link TranscriptionEngine} for a model size.
 *
 * <p>This abstraction allows the batch to run against different Whisper backends (an HTTP service,
 * a local whisper.cpp binary) without changing the pipeline.
 */
public interface EngineLoader {

  /**
   * Load the engine. Called once per run, before the first file is processed.
   *
   * @param modelSize the model to load
   * @return a ready engine
   * @throws EngineLoadException if the model cannot be obtained or initialized
   */
  TranscriptionEngine load(ModelSize modelSize);
}
