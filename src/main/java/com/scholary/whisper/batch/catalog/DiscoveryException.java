package com.scholary.whisper.batch.catalog;

import com.scholary.whisper.batch.service.BatchAbortedException;

/**
 * Exception thrown when the input directory cannot be enumerated.
 *
 * <p>This is fatal for the run: without a readable input directory there is nothing to process.
 */
public class DiscoveryException extends BatchAbortedException {

  public static final int EXIT_CODE = 2;

  public DiscoveryException(String message) {
    super(message, EXIT_CODE);
  }

  public DiscoveryException(String message, Throwable cause) {
    super(message, cause, EXIT_CODE);
  }
}
