package com.scholary.whisper.batch.cli;

import com.scholary.whisper.batch.config.BatchProperties;
import com.scholary.whisper.batch.engine.ModelSize;
import com.scholary.whisper.batch.service.BatchAbortedException;
import com.scholary.whisper.batch.service.BatchOptions;
import com.scholary.whisper.batch.service.TranscriptionBatch;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs the batch when the application starts.
 *
 * <p>Usage:
 *
 * <pre>
 * whisper-batch [inputDir] [outputDir] [--model=tiny|base|small|medium|large] [--language=ja]
 * </pre>
 *
 * <p>Anything not given falls back to the "batch.*" properties. Set {@code
 * batch.run-on-startup=false} to start the context without running.
 */
@Component
@ConditionalOnProperty(
    prefix = "batch",
    name = "run-on-startup",
    havingValue = "true",
    matchIfMissing = true)
public class BatchCommandLineRunner implements ApplicationRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(BatchCommandLineRunner.class);

  static final String MODEL_OPTION = "model";
  static final String LANGUAGE_OPTION = "language";

  private final TranscriptionBatch transcriptionBatch;
  private final BatchProperties defaults;

  public BatchCommandLineRunner(TranscriptionBatch transcriptionBatch, BatchProperties defaults) {
    this.transcriptionBatch = transcriptionBatch;
    this.defaults = defaults;
  }

  @Override
  public void run(ApplicationArguments args) {
    BatchOptions options = parse(args, defaults);
    LOGGER.info(
        "Starting batch: input={}, output={}, model={}, language={}",
        options.inputDir().toAbsolutePath(),
        options.outputDir().toAbsolutePath(),
        options.model().modelName(),
        options.language());
    try {
      transcriptionBatch.execute(options);
    } catch (BatchAbortedException e) {
      LOGGER.error("Batch aborted: {}", e.getMessage());
      throw e;
    }
  }

  /**
   * Map command-line arguments onto batch options.
   *
   * @throws IllegalArgumentException on extra positional arguments or an unknown model
   */
  static BatchOptions parse(ApplicationArguments args, BatchProperties defaults) {
    List<String> positional = args.getNonOptionArgs();
    if (positional.size() > 2) {
      throw new IllegalArgumentException(
          "Expected at most 2 positional arguments (inputDir outputDir), got " + positional);
    }

    String inputDir = positional.size() > 0 ? positional.get(0) : defaults.inputDir();
    String outputDir = positional.size() > 1 ? positional.get(1) : defaults.outputDir();

    ModelSize model =
        args.containsOption(MODEL_OPTION)
            ? ModelSize.parse(lastValue(args, MODEL_OPTION))
            : defaults.model();
    String language =
        args.containsOption(LANGUAGE_OPTION)
            ? lastValue(args, LANGUAGE_OPTION)
            : defaults.language();

    return new BatchOptions(Path.of(inputDir), Path.of(outputDir), model, language);
  }

  private static String lastValue(ApplicationArguments args, String name) {
    List<String> values = args.getOptionValues(name);
    if (values == null || values.isEmpty()) {
      throw new IllegalArgumentException("Option --" + name + " requires a value");
    }
    return values.get(values.size() - 1);
  }
}
