package com.scholary.whisper.batch.whisper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.scholary.whisper.batch.engine.TranscriptSegment;
import com.scholary.whisper.batch.engine.TranscriptionResult;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Response from the Whisper transcription API.
 *
 * <p>Some servers only return segments; the full text is then rebuilt from them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WhisperResponse(String text, String language, List<TranscriptSegment> segments) {

  public TranscriptionResult toResult() {
    List<TranscriptSegment> safeSegments = segments == null ? List.of() : segments;
    String fullText = text;
    if (fullText == null) {
      fullText =
          safeSegments.stream()
              .map(TranscriptSegment::text)
              .filter(t -> t != null && !t.isBlank())
              .map(String::strip)
              .collect(Collectors.joining(" "));
    }
    return new TranscriptionResult(fullText, language, safeSegments);
  }
}
