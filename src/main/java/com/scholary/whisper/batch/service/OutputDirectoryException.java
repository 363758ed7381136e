package com.scholary.whisper.batch.service;

/** Thrown when the output directory cannot be created or is not a directory. */
public class OutputDirectoryException extends BatchAbortedException {

  public static final int EXIT_CODE = 3;

  public OutputDirectoryException(String message) {
    super(message, EXIT_CODE);
  }

  public OutputDirectoryException(String message, Throwable cause) {
    super(message, cause, EXIT_CODE);
  }
}
