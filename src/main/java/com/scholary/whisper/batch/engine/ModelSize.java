package com.scholary.whisper.batch.engine;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/** Whisper model sizes, smallest first. */
public enum ModelSize {
  TINY,
  BASE,
  SMALL,
  MEDIUM,
  LARGE;

  /** The name the engines expect, e.g. {@code medium}. */
  public String modelName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parse a model size, ignoring case and surrounding whitespace.
   *
   * @throws IllegalArgumentException if the value is not a known size
   */
  public static ModelSize parse(String value) {
    if (value != null) {
      String normalized = value.trim().toUpperCase(Locale.ROOT);
      for (ModelSize size : values()) {
        if (size.name().equals(normalized)) {
          return size;
        }
      }
    }
    throw new IllegalArgumentException(
        String.format(
            "Unknown model '%s' (expected one of %s)",
            value,
            Arrays.stream(values()).map(ModelSize::modelName).collect(Collectors.joining("/"))));
  }
}
