package com.scholary.meditation.audio;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Joins audio files end to end with the ffmpeg concat demuxer.
 *
 * <p>Streams are copied, never re-encoded, so all parts must share codec parameters (which they do
 * when they come from the same synthesis voice and format).
 */
public class AudioConcatenator {

  private static final Logger LOGGER = LoggerFactory.getLogger(AudioConcatenator.class);

  private final FfmpegCommandRunner runner;

  public AudioConcatenator(FfmpegCommandRunner runner) {
    this.runner = runner;
  }

  /**
   * Concatenate {@code parts} in order into {@code output}. The list file is always removed; the
   * parts are left to the caller.
   */
  public void concat(List<Path> parts, Path output) throws IOException {
    if (parts.isEmpty()) {
      throw new IllegalArgumentException("Nothing to concatenate");
    }

    Path listFile = output.resolveSibling(output.getFileName() + ".concat.txt");
    try {
      Files.writeString(listFile, listFileContent(parts), StandardCharsets.UTF_8);
      runner.run(buildConcatCommand(listFile, output), "concat");
      LOGGER.info("Concatenated {} parts into {}", parts.size(), output);
    } finally {
      Files.deleteIfExists(listFile);
    }
  }

  List<String> buildConcatCommand(Path listFile, Path output) {
    List<String> command = new ArrayList<>();
    command.add(runner.ffmpeg());
    command.add("-y");
    command.add("-f");
    command.add("concat");
    command.add("-safe");
    command.add("0");
    command.add("-i");
    command.add(listFile.toString());
    command.add("-c");
    command.add("copy");
    command.add(output.toString());
    return command;
  }

  /** One {@code file '<path>'} line per part, with single quotes escaped for the demuxer. */
  static String listFileContent(List<Path> parts) {
    StringBuilder content = new StringBuilder();
    for (Path part : parts) {
      String path = part.toAbsolutePath().toString().replace("'", "'\\''");
      content.append("file '").append(path).append("'\n");
    }
    return content.toString();
  }
}
