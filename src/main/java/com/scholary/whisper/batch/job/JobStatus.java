package com.scholary.whisper.batch.job;

/** Lifecycle of a single file's job. */
public enum JobStatus {
  PENDING(false),
  STAGING(false),
  TRANSCRIBING(false),
  WRITING(false),
  SUCCEEDED(true),
  FAILED(true),
  SKIPPED_EMPTY(true),
  SKIPPED_MISSING(true);

  private final boolean terminal;

  JobStatus(boolean terminal) {
    this.terminal = terminal;
  }

  public boolean isTerminal() {
    return terminal;
  }

  public boolean isSkipped() {
    return this == SKIPPED_EMPTY || this == SKIPPED_MISSING;
  }
}
