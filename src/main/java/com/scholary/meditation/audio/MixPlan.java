package com.scholary.meditation.audio;

/**
 * How the background is fitted to the narration's length.
 *
 * @param strategy TRIM when the background is at least as long as the narration, LOOP otherwise
 * @param offsetSeconds where in the (possibly looped) background the mix starts
 * @param repetitions whole plays of the background needed; 1 for TRIM
 */
public record MixPlan(
    Strategy strategy,
    double narrationSeconds,
    double backgroundSeconds,
    double offsetSeconds,
    int repetitions) {

  public enum Strategy {
    TRIM,
    LOOP
  }

  /** Value for ffmpeg's {@code -stream_loop}: extra plays after the first. */
  public int streamLoopCount() {
    return repetitions - 1;
  }
}
