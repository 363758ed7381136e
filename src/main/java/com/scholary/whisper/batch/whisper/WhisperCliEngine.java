package com.scholary.whisper.batch.whisper;

import com.scholary.whisper.batch.engine.ModelSize;
import com.scholary.whisper.batch.engine.TranscriptionEngine;
import com.scholary.whisper.batch.engine.TranscriptionException;
import com.scholary.whisper.batch.engine.TranscriptionResult;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Engine that runs a local whisper.cpp binary once per file.
 *
 * <p>CLI contract:
 *
 * <pre>
 * ${binary} -m ${model} -f ${audio} -l ${language} -t ${threads} -nt -np
 * </pre>
 *
 * <p>stdout carries the transcript without timestamps; stderr is captured for error messages. The
 * process runs in the staging directory so anything it writes next to the input is cleaned up with
 * the staged copy. There is no timeout.
 */
public class WhisperCliEngine implements TranscriptionEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(WhisperCliEngine.class);

  static final int STDERR_SNIPPET_CHARS = 2000;

  private final Path binaryPath;
  private final Path modelPath;
  private final int threads;
  private final ModelSize modelSize;
  private final ProcessFactory processFactory;

  WhisperCliEngine(
      Path binaryPath,
      Path modelPath,
      int threads,
      ModelSize modelSize,
      ProcessFactory processFactory) {
    this.binaryPath = Objects.requireNonNull(binaryPath, "binaryPath");
    this.modelPath = Objects.requireNonNull(modelPath, "modelPath");
    this.threads = threads;
    this.modelSize = Objects.requireNonNull(modelSize, "modelSize");
    this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
  }

  @Override
  public TranscriptionResult transcribe(Path audioFile, String languageHint) {
    List<String> command = buildCommand(audioFile, languageHint);
    LOGGER.info(
        "Running whisper.cpp: file={}, model={}, language={}",
        audioFile.getFileName(),
        modelSize.modelName(),
        languageHint);

    StringBuilder stdout = new StringBuilder();
    StringBuilder stderr = new StringBuilder();
    Process process = null;
    try {
      process = processFactory.start(command, audioFile.toAbsolutePath().getParent());

      // Start gobblers before waiting to avoid a full pipe blocking the process
      Thread outGobbler = startGobbler(process.getInputStream(), stdout, "whisper-out");
      Thread errGobbler = startGobbler(process.getErrorStream(), stderr, "whisper-err");

      int exitCode = process.waitFor();
      outGobbler.join();
      errGobbler.join();

      if (exitCode != 0) {
        throw new TranscriptionException(
            String.format(
                "whisper.cpp exited with %d: %s",
                exitCode, snippet(stderr, STDERR_SNIPPET_CHARS)));
      }
    } catch (IOException e) {
      throw new TranscriptionException("Failed to run whisper.cpp: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      if (process != null) {
        process.destroyForcibly();
      }
      throw new TranscriptionException("Transcription interrupted", e);
    }

    String text = stdout.toString().strip();
    LOGGER.info("Transcription successful: {} chars", text.length());
    return TranscriptionResult.ofText(text);
  }

  List<String> buildCommand(Path audioFile, String languageHint) {
    List<String> cmd = new ArrayList<>();
    cmd.add(binaryPath.toString());
    cmd.add("-m");
    cmd.add(modelPath.toString());
    cmd.add("-f");
    cmd.add(audioFile.toAbsolutePath().toString());
    cmd.add("-l");
    cmd.add(languageHint);
    cmd.add("-t");
    cmd.add(String.valueOf(threads));
    cmd.add("-nt");
    cmd.add("-np");
    return cmd;
  }

  private static Thread startGobbler(InputStream inputStream, StringBuilder sink, String name) {
    Thread thread = new Thread(() -> gobble(inputStream, sink, name), name);
    thread.setDaemon(true);
    thread.start();
    return thread;
  }

  private static void gobble(InputStream inputStream, StringBuilder sink, String name) {
    try (BufferedReader br =
        new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
      String line;
      while ((line = br.readLine()) != null) {
        synchronized (sink) {
          if (sink.length() > 0) {
            sink.append('\n');
          }
          sink.append(line);
        }
      }
    } catch (IOException e) {
      LOGGER.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
    }
  }

  private static String snippet(StringBuilder sb, int maxChars) {
    synchronized (sb) {
      return sb.substring(0, Math.min(maxChars, sb.length()));
    }
  }
}
