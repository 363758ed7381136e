package com.scholary.whisper.batch.engine;

import com.scholary.whisper.batch.service.BatchAbortedException;

/** Exception thrown when the engine cannot be loaded. Aborts the run before any file. */
public class EngineLoadException extends BatchAbortedException {

  public static final int EXIT_CODE = 4;

  public EngineLoadException(String message) {
    super(message, EXIT_CODE);
  }

  public EngineLoadException(String message, Throwable cause) {
    super(message, cause, EXIT_CODE);
  }
}
