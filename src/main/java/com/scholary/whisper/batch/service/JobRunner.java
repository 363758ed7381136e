package com.scholary.whisper.batch.service;

import com.scholary.whisper.batch.catalog.AudioFile;
import com.scholary.whisper.batch.engine.TranscriptionEngine;
import com.scholary.whisper.batch.engine.TranscriptionResult;
import com.scholary.whisper.batch.job.BatchReport;
import com.scholary.whisper.batch.job.FailureReason;
import com.scholary.whisper.batch.job.Job;
import com.scholary.whisper.batch.job.JobStatus;
import com.scholary.whisper.batch.report.ReportSink;
import com.scholary.whisper.batch.staging.IsolationStager;
import com.scholary.whisper.batch.staging.StagedFile;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs one job per audio file, strictly one after another.
 *
 * <p>For each file: check it still exists and is not empty, stage an ASCII-named copy, hand the copy
 * to the engine, and write the transcript next to the others. Whatever goes wrong with a file is
 * recorded on its job and reported; the loop always moves on to the next file.
 *
 * <p>The engine is never entered concurrently. Nothing here spawns threads.
 */
@Service
public class JobRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobRunner.class);

  private final IsolationStager stager;
  private final TranscriptWriter transcriptWriter;
  private final ReportSink reportSink;

  public JobRunner(
      IsolationStager stager, TranscriptWriter transcriptWriter, ReportSink reportSink) {
    this.stager = stager;
    this.transcriptWriter = transcriptWriter;
    this.reportSink = reportSink;
  }

  /**
   * Process every file in order.
   *
   * @param catalog the files to process
   * @param engine the loaded engine
   * @param outputDir existing directory for transcripts
   * @param languageHint language passed to the engine
   * @return one job per file, each in a terminal status
   */
  public BatchReport run(
      List<AudioFile> catalog, TranscriptionEngine engine, Path outputDir, String languageHint) {
    int total = catalog.size();
    List<Job> jobs = new ArrayList<>(total);

    reportSink.info(String.format("Processing %d files...", total));

    for (int i = 0; i < total; i++) {
      Job job = new Job(i + 1, catalog.get(i));
      jobs.add(job);
      reportSink.jobStart(job.getIndex(), total, job.getAudioFile().name());

      long startNanos = System.nanoTime();
      job.start(Instant.now());
      process(job, engine, outputDir, languageHint, startNanos);

      reportSink.jobEnd(
          job.getIndex(),
          total,
          job.getAudioFile().name(),
          job.getStatus(),
          job.getElapsed().toMillis() / 1000.0);
    }

    BatchReport report = new BatchReport(jobs);
    reportSink.batchComplete(report.succeeded(), report.failed(), report.skipped());
    return report;
  }

  private void process(
      Job job, TranscriptionEngine engine, Path outputDir, String languageHint, long startNanos) {
    AudioFile audioFile = job.getAudioFile();
    Path source = audioFile.sourcePath();
    reportSink.info("Processing file: " + source);

    // It may have been removed since discovery
    if (!Files.exists(source)) {
      skip(job, JobStatus.SKIPPED_MISSING, "File does not exist: " + audioFile.name(), startNanos);
      return;
    }

    long size;
    try {
      size = Files.size(source);
    } catch (NoSuchFileException e) {
      skip(job, JobStatus.SKIPPED_MISSING, "File does not exist: " + audioFile.name(), startNanos);
      return;
    } catch (IOException e) {
      fail(job, FailureReason.STAGING_ERROR, "Cannot read file size", e, startNanos);
      return;
    }
    reportSink.info(String.format("File size: %,d bytes", size));

    if (size == 0) {
      skip(job, JobStatus.SKIPPED_EMPTY, "File is empty (0 bytes): " + audioFile.name(), startNanos);
      return;
    }

    job.advance(JobStatus.STAGING);
    StagedFile staged;
    try {
      staged = stager.stage(audioFile);
    } catch (Exception e) {
      fail(job, FailureReason.STAGING_ERROR, "Staging failed", e, startNanos);
      return;
    }

    TranscriptionResult result;
    try (staged) {
      job.advance(JobStatus.TRANSCRIBING);
      reportSink.info("Transcribing...");
      result = engine.transcribe(staged.stagedPath(), languageHint);
    } catch (Exception e) {
      fail(job, FailureReason.TRANSCRIPTION_ERROR, "Transcription failed", e, startNanos);
      return;
    }

    job.advance(JobStatus.WRITING);
    Path outputPath;
    try {
      outputPath = transcriptWriter.write(outputDir, audioFile, result.text());
    } catch (Exception e) {
      fail(job, FailureReason.WRITE_ERROR, "Writing transcript failed", e, startNanos);
      return;
    }

    Duration elapsed = elapsedSince(startNanos);
    job.succeed(outputPath, elapsed);
    double seconds = elapsed.toMillis() / 1000.0;
    reportSink.info(
        String.format("Done (%.1fs, %.1f min): %s", seconds, seconds / 60.0, outputPath));
  }

  private void skip(Job job, JobStatus status, String message, long startNanos) {
    job.skip(status, message, elapsedSince(startNanos));
    reportSink.error(message);
  }

  private void fail(Job job, FailureReason reason, String what, Exception e, long startNanos) {
    String message =
        String.format("%s for %s: %s", what, job.getAudioFile().name(), describe(e));
    job.fail(reason, message, elapsedSince(startNanos));
    reportSink.error(message);
    LOGGER.debug("Job {} failed with {}", job.getIndex(), reason, e);
  }

  private static String describe(Exception e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }

  private static Duration elapsedSince(long startNanos) {
    return Duration.ofNanos(System.nanoTime() - startNanos);
  }
}
