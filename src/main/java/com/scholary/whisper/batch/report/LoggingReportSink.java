package com.scholary.whisper.batch.report;

import com.scholary.whisper.batch.job.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

/**
 * {@link ReportSink} that writes events to SLF4J with MDC fields.
 *
 * <p>The logging configuration sends these to both the console and the per-run log file. While a
 * job is in flight its index and file name stay in the MDC so every log line emitted by the
 * pipeline can be attributed to it.
 */
@Component
public class LoggingReportSink implements ReportSink {

  private static final Logger LOGGER = LoggerFactory.getLogger("whisper_batch");

  static final String JOB_INDEX = "job_index";
  static final String FILE = "file";
  static final String EVENT_TYPE = "event_type";

  @Override
  public void info(String message) {
    LOGGER.info(message);
  }

  @Override
  public void error(String message) {
    LOGGER.error(message);
  }

  @Override
  public void jobStart(int index, int total, String filename) {
    MDC.put(JOB_INDEX, String.valueOf(index));
    MDC.put(FILE, filename);
    try {
      MDC.put(EVENT_TYPE, "job_started");
      LOGGER.info("[{}/{}] {}", index, total, filename);
    } finally {
      MDC.remove(EVENT_TYPE);
    }
  }

  @Override
  public void jobEnd(
      int index, int total, String filename, JobStatus status, double elapsedSeconds) {
    try {
      MDC.put(EVENT_TYPE, "job_finished");
      MDC.put("status", status.name());
      LOGGER.info(
          "[{}/{}] {} finished: status={}, elapsed={}s",
          index,
          total,
          filename,
          status,
          String.format("%.1f", elapsedSeconds));
      LOGGER.info("Progress: {}/{} ({}%)", index, total, total == 0 ? 100 : index * 100 / total);
    } finally {
      MDC.remove(EVENT_TYPE);
      MDC.remove("status");
      MDC.remove(JOB_INDEX);
      MDC.remove(FILE);
    }
  }

  @Override
  public void batchComplete(int succeeded, int failed, int skipped) {
    try {
      MDC.put(EVENT_TYPE, "batch_complete");
      LOGGER.info(
          "All files processed: succeeded={}, failed={}, skipped={}", succeeded, failed, skipped);
    } finally {
      MDC.remove(EVENT_TYPE);
    }
  }
}
