package com.scholary.whisper.batch.job;

import java.util.List;

/**
 * Outcome of a batch run: every job in processing order.
 *
 * <p>Each job holds exactly one terminal status, so {@code succeeded + failed + skipped} always
 * equals {@code total}.
 */
public record BatchReport(List<Job> jobs) {

  public BatchReport {
    jobs = List.copyOf(jobs);
  }

  public static BatchReport empty() {
    return new BatchReport(List.of());
  }

  public int total() {
    return jobs.size();
  }

  public int succeeded() {
    return count(JobStatus.SUCCEEDED);
  }

  public int failed() {
    return count(JobStatus.FAILED);
  }

  public int skipped() {
    return (int) jobs.stream().filter(j -> j.getStatus().isSkipped()).count();
  }

  public int count(JobStatus status) {
    return (int) jobs.stream().filter(j -> j.getStatus() == status).count();
  }
}
