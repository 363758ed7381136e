package com.scholary.whisper.batch.service;

import org.springframework.boot.ExitCodeGenerator;

/**
 * Base class for failures that stop the whole batch before any file is processed.
 *
 * <p>Spring Boot picks up the exit code from the exception chain when the runner fails, so the
 * process terminates with a non-zero status that identifies the failed precondition.
 */
public abstract class BatchAbortedException extends RuntimeException implements ExitCodeGenerator {

  private final int exitCode;

  protected BatchAbortedException(String message, int exitCode) {
    super(message);
    this.exitCode = exitCode;
  }

  protected BatchAbortedException(String message, Throwable cause, int exitCode) {
    super(message, cause);
    this.exitCode = exitCode;
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }
}
