package com.scholary.whisper.batch.whisper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Abstraction over {@link ProcessBuilder} so the CLI engine can be tested without a real binary.
 *
 * <p>Production code uses {@link DefaultProcessFactory}.
 */
interface ProcessFactory {

  /**
   * Starts a new process.
   *
   * @param command full command line, executable first
   * @param workingDir working directory for the process (may be null)
   * @return the started process
   * @throws IOException if the process cannot be started
   */
  Process start(List<String> command, Path workingDir) throws IOException;
}
