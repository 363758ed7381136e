package com.scholary.whisper.batch.engine;

/**
 * A timed piece of transcribed audio as reported by the engine.
 *
 * <p>The batch pipeline only persists the full text; segments are kept for logging.
 */
public record TranscriptSegment(double start, double end, String text) {}
