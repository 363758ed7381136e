package com.scholary.whisper.batch.job;

/** Why a job ended in {@link JobStatus#FAILED}. */
public enum FailureReason {
  STAGING_ERROR,
  TRANSCRIPTION_ERROR,
  WRITE_ERROR
}
