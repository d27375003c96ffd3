package com.scholary.meditation.audio;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs ffmpeg and ffprobe as blocking subprocesses.
 *
 * <p>Output (stdout and stderr combined) is captured to a temporary file rather than read from the
 * pipe, so a hung process cannot block past the timeout. Non-zero exit, timeout and interruption
 * are all reported as {@link IOException} carrying the tool output.
 */
public class FfmpegCommandRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegCommandRunner.class);

  private final FfmpegProperties properties;

  public FfmpegCommandRunner(FfmpegProperties properties) {
    this.properties = properties;
  }

  public String ffmpeg() {
    return properties.ffmpegPath();
  }

  public String ffprobe() {
    return properties.ffprobePath();
  }

  /**
   * Run a command and wait for it to finish.
   *
   * @param command the executable and its arguments
   * @param stage short label used in log and error messages
   * @return the combined output of the process
   * @throws IOException if the process cannot be started, exits non-zero or times out
   */
  public String run(List<String> command, String stage) throws IOException {
    LOGGER.debug("Executing [{}]: {}", stage, String.join(" ", command));

    Path outputFile = Files.createTempFile("ffmpeg-" + stage + "-", ".log");
    try {
      Process process =
          new ProcessBuilder(command)
              .redirectErrorStream(true)
              .redirectOutput(outputFile.toFile())
              .start();

      boolean finished;
      try {
        finished = process.waitFor(properties.timeoutSeconds(), TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        process.destroyForcibly();
        Thread.currentThread().interrupt();
        throw new IOException(stage + " interrupted", e);
      }

      if (!finished) {
        process.destroyForcibly();
        throw new IOException(
            stage + " timed out after " + properties.timeoutSeconds() + "s");
      }

      String output = Files.readString(outputFile, StandardCharsets.UTF_8);
      if (process.exitValue() != 0) {
        throw new IOException(
            stage + " failed with exit code " + process.exitValue() + ". Output: " + output.trim());
      }
      return output;
    } finally {
      Files.deleteIfExists(outputFile);
    }
  }
}
