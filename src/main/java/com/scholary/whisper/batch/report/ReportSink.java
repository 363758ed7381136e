package com.scholary.whisper.batch.report;

import com.scholary.whisper.batch.job.JobStatus;

/**
 * Receives progress and log events from the batch.
 *
 * <p>The pipeline only defines what is reported and when. Where events end up (console, log file,
 * a progress display, a test capture) is up to the implementation.
 */
public interface ReportSink {

  void info(String message);

  void error(String message);

  /** A job is about to be processed. {@code index} is 1-based. */
  void jobStart(int index, int total, String filename);

  /** A job reached its terminal status. */
  void jobEnd(int index, int total, String filename, JobStatus status, double elapsedSeconds);

  /** All jobs are done. */
  void batchComplete(int succeeded, int failed, int skipped);
}
