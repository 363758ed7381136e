package com.scholary.whisper.batch.whisper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/** {@link ProcessFactory} backed by {@link ProcessBuilder}. */
final class DefaultProcessFactory implements ProcessFactory {

  @Override
  public Process start(List<String> command, Path workingDir) throws IOException {
    ProcessBuilder pb = new ProcessBuilder(command);
    if (workingDir != null) {
      pb.directory(workingDir.toFile());
    }
    // stdout carries the transcript, stderr the diagnostics
    pb.redirectErrorStream(false);
    return pb.start();
  }
}
