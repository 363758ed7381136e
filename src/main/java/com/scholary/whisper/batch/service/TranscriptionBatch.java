package com.scholary.whisper.batch.service;

import com.scholary.whisper.batch.catalog.AudioFile;
import com.scholary.whisper.batch.catalog.FileCatalog;
import com.scholary.whisper.batch.engine.EngineLoader;
import com.scholary.whisper.batch.engine.TranscriptionEngine;
import com.scholary.whisper.batch.job.BatchReport;
import com.scholary.whisper.batch.report.ReportSink;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.springframework.stereotype.Service;

/**
 * Drives a whole run: checks the preconditions, then hands the files to the {@link JobRunner}.
 *
 * <p>Only three things abort a run: an unreadable input directory, an output directory that cannot
 * be created, and an engine that fails to load. All of them happen before the first file is
 * touched. Discovery comes first so an empty input directory never pays for loading a model.
 */
@Service
public class TranscriptionBatch {

  private final FileCatalog fileCatalog;
  private final EngineLoader engineLoader;
  private final JobRunner jobRunner;
  private final ReportSink reportSink;

  public TranscriptionBatch(
      FileCatalog fileCatalog,
      EngineLoader engineLoader,
      JobRunner jobRunner,
      ReportSink reportSink) {
    this.fileCatalog = fileCatalog;
    this.engineLoader = engineLoader;
    this.jobRunner = jobRunner;
    this.reportSink = reportSink;
  }

  /**
   * Run the batch.
   *
   * @param options directories, model and language for this run
   * @return the per-file outcome; empty if no audio files were found
   * @throws com.scholary.whisper.batch.catalog.DiscoveryException if the input directory is bad
   * @throws OutputDirectoryException if the output directory cannot be created
   * @throws com.scholary.whisper.batch.engine.EngineLoadException if the engine cannot be loaded
   */
  public BatchReport execute(BatchOptions options) {
    List<AudioFile> files = fileCatalog.discover(options.inputDir());
    if (files.isEmpty()) {
      reportSink.error("No audio files found in " + options.inputDir());
      return BatchReport.empty();
    }

    reportSink.info("Found files:");
    for (AudioFile file : files) {
      reportSink.info("  - " + file.name());
    }

    Path outputDir = prepareOutputDir(options.outputDir());

    reportSink.info(String.format("Loading Whisper model '%s'...", options.model().modelName()));
    TranscriptionEngine engine = engineLoader.load(options.model());

    return jobRunner.run(files, engine, outputDir, options.language());
  }

  private static Path prepareOutputDir(Path outputDir) {
    try {
      Files.createDirectories(outputDir);
    } catch (IOException e) {
      throw new OutputDirectoryException("Failed to create output directory: " + outputDir, e);
    }
    if (!Files.isWritable(outputDir)) {
      throw new OutputDirectoryException("Output directory is not writable: " + outputDir);
    }
    return outputDir;
  }
}
