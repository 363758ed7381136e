package com.scholary.whisper.batch.engine;

/**
 * Exception thrown when the engine fails on a file.
 *
 * <p>This could be malformed or unsupported audio, a crashed engine process, or an error response
 * from the service. Only the current job fails.
 */
public class TranscriptionException extends RuntimeException {

  public TranscriptionException(String message) {
    super(message);
  }

  public TranscriptionException(String message, Throwable cause) {
    super(message, cause);
  }
}
