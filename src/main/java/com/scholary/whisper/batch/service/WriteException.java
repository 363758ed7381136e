package com.scholary.whisper.batch.service;

/** Exception thrown when a transcript cannot be written to the output directory. */
public class WriteException extends RuntimeException {

  public WriteException(String message) {
    super(message);
  }

  public WriteException(String message, Throwable cause) {
    super(message, cause);
  }
}
