package com.scholary.whisper.batch.engine;

import java.util.List;

/**
 * Result of transcribing one file.
 *
 * <p>{@code text} is what gets written to the output file. Language and segments are engine
 * metadata; either may be empty.
 */
public record TranscriptionResult(String text, String language, List<TranscriptSegment> segments) {

  public TranscriptionResult {
    text = text == null ? "" : text;
    segments = segments == null ? List.of() : List.copyOf(segments);
  }

  public static TranscriptionResult ofText(String text) {
    return new TranscriptionResult(text, null, List.of());
  }
}
