package com.scholary.whisper.batch.engine;

import java.nio.file.Path;

/**
 * A loaded speech-to-text engine bound to one model.
 *
 * <p>Implementations are expensive to build and are created once per run by an {@link
 * EngineLoader}. They are not assumed to be thread-safe: callers must not invoke {@link
 * #transcribe} concurrently. A call must not change the engine's configuration.
 */
public interface TranscriptionEngine {

  /**
   * Transcribe an audio file. Blocks until the engine is done, which may take minutes.
   *
   * @param audioFile the audio file; always an ASCII-named staged copy
   * @param languageHint language code such as {@code ja} or {@code en}
   * @return the transcription
   * @throws TranscriptionException if the engine rejects or fails on the file
   */
  TranscriptionResult transcribe(Path audioFile, String languageHint);
}
