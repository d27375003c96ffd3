package com.scholary.meditation.audio;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/** Reads stream durations with ffprobe. */
public class AudioProbe {

  private final FfmpegCommandRunner runner;

  public AudioProbe(FfmpegCommandRunner runner) {
    this.runner = runner;
  }

  /**
   * Duration of an audio file in seconds.
   *
   * @throws IOException if ffprobe fails or does not report a positive duration
   */
  public double durationSeconds(Path file) throws IOException {
    String output =
        runner
            .run(
                List.of(
                    runner.ffprobe(),
                    "-v",
                    "error",
                    "-show_entries",
                    "format=duration",
                    "-of",
                    "default=noprint_wrappers=1:nokey=1",
                    file.toString()),
                "ffprobe")
            .trim();

    double duration;
    try {
      duration = Double.parseDouble(output);
    } catch (NumberFormatException e) {
      throw new IOException("Invalid duration from ffprobe for " + file + ": " + output, e);
    }
    if (!(duration > 0)) {
      throw new IOException("ffprobe reported no duration for " + file + ": " + output);
    }
    return duration;
  }
}
