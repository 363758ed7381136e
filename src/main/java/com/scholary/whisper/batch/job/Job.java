package com.scholary.whisper.batch.job;

import com.scholary.whisper.batch.catalog.AudioFile;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One audio file's journey through the pipeline.
 *
 * <p>Status only moves forward and a terminal status is assigned exactly once. Jobs are confined
 * to the batch thread and share no state with each other.
 */
public class Job {

  private final int index;
  private final AudioFile audioFile;

  private JobStatus status;
  private FailureReason failureReason;
  private String message;
  private Instant startTime;
  private Duration elapsed = Duration.ZERO;
  private Path outputPath;

  public Job(int index, AudioFile audioFile) {
    this.index = index;
    this.audioFile = Objects.requireNonNull(audioFile, "audioFile");
    this.status = JobStatus.PENDING;
  }

  /** 1-based position in the batch. */
  public int getIndex() {
    return index;
  }

  public AudioFile getAudioFile() {
    return audioFile;
  }

  public JobStatus getStatus() {
    return status;
  }

  public FailureReason getFailureReason() {
    return failureReason;
  }

  public String getMessage() {
    return message;
  }

  public Instant getStartTime() {
    return startTime;
  }

  public Duration getElapsed() {
    return elapsed;
  }

  public Path getOutputPath() {
    return outputPath;
  }

  public void start(Instant now) {
    this.startTime = now;
  }

  /** Move to a non-terminal processing stage. */
  public void advance(JobStatus next) {
    if (next.isTerminal()) {
      throw new IllegalArgumentException("Use a finishing method for terminal status " + next);
    }
    requireTransition(next);
    this.status = next;
  }

  public void succeed(Path outputPath, Duration elapsed) {
    requireTransition(JobStatus.SUCCEEDED);
    this.status = JobStatus.SUCCEEDED;
    this.outputPath = outputPath;
    this.elapsed = elapsed;
  }

  public void fail(FailureReason reason, String message, Duration elapsed) {
    requireTransition(JobStatus.FAILED);
    this.status = JobStatus.FAILED;
    this.failureReason = Objects.requireNonNull(reason, "reason");
    this.message = message;
    this.elapsed = elapsed;
  }

  public void skip(JobStatus skipStatus, String message, Duration elapsed) {
    if (!skipStatus.isSkipped()) {
      throw new IllegalArgumentException("Not a skip status: " + skipStatus);
    }
    requireTransition(skipStatus);
    this.status = skipStatus;
    this.message = message;
    this.elapsed = elapsed;
  }

  private void requireTransition(JobStatus next) {
    if (status.isTerminal()) {
      throw new IllegalStateException(
          String.format("Job %d already finished as %s, cannot move to %s", index, status, next));
    }
    if (next.ordinal() < status.ordinal()) {
      throw new IllegalStateException(
          String.format("Job %d cannot move back from %s to %s", index, status, next));
    }
  }

  @Override
  public String toString() {
    return "Job{" + index + ", " + audioFile.name() + ", " + status + "}";
  }
}
