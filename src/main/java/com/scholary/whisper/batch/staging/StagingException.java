package com.scholary.whisper.batch.staging;

/**
 * Exception thrown when an audio file cannot be copied into its staging directory.
 *
 * <p>Typical causes are a full disk, missing permissions or the source vanishing mid-copy. It only
 * fails the job that tried to stage the file.
 */
public class StagingException extends RuntimeException {

  public StagingException(String message) {
    super(message);
  }

  public StagingException(String message, Throwable cause) {
    super(message, cause);
  }
}
