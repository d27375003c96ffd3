package com.scholary.meditation.audio;

import com.scholary.meditation.logging.StructuredLogger;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lays a narration track over a background soundscape.
 *
 * <p>The result is always exactly as long as the narration:
 *
 * <ol>
 *   <li>A background at least as long as the narration is trimmed from a random offset.
 *   <li>A shorter background is looped enough whole times to cover the narration, then trimmed.
 *   <li>The background is volume-scaled (and optionally faded); the narration is never attenuated.
 * </ol>
 *
 * <p>Optionally a short preview sample is cut from the mix with a stream copy. Any failure removes
 * the files written so far and is reported as {@link MixingException}.
 */
public class AudioMixer {

  private static final Logger LOGGER = LoggerFactory.getLogger(AudioMixer.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  /** Samples of long mixes skip the opening seconds, where the fade-in sits. */
  static final double SAMPLE_LEAD_IN_SECONDS = 10.0;

  private final FfmpegCommandRunner runner;
  private final AudioProbe probe;
  private final FfmpegProperties ffmpegProperties;
  private final MixingProperties mixingProperties;
  private final Random random;

  public AudioMixer(
      FfmpegCommandRunner runner,
      AudioProbe probe,
      FfmpegProperties ffmpegProperties,
      MixingProperties mixingProperties,
      Random random) {
    this.runner = runner;
    this.probe = probe;
    this.ffmpegProperties = ffmpegProperties;
    this.mixingProperties = mixingProperties;
    this.random = random;
  }

  /** Mix into the narration's directory. */
  public MixResult mix(
      Path narration,
      Path background,
      double backgroundVolume,
      boolean makeSample,
      double sampleDurationSeconds) {
    Path outputDir = narration.toAbsolutePath().getParent();
    return mix(
        narration, background, backgroundVolume, makeSample, sampleDurationSeconds, outputDir);
  }

  /**
   * Mix a narration with a background.
   *
   * @param backgroundVolume scale applied to the background, between 0 and 1
   * @param makeSample whether to also cut a preview sample from the mix
   * @param sampleDurationSeconds requested sample length; the sample is never longer than the mix
   * @param outputDir directory for the mix and the sample
   * @throws IllegalArgumentException if the volume is outside [0, 1] or the sample length is not
   *     positive
   * @throws MixingException if an input is missing or unreadable, or ffmpeg fails
   */
  public MixResult mix(
      Path narration,
      Path background,
      double backgroundVolume,
      boolean makeSample,
      double sampleDurationSeconds,
      Path outputDir) {
    if (!(backgroundVolume >= 0.0 && backgroundVolume <= 1.0)) {
      throw new IllegalArgumentException(
          "Background volume must be between 0 and 1, got " + backgroundVolume);
    }
    if (makeSample && !(sampleDurationSeconds > 0)) {
      throw new IllegalArgumentException(
          "Sample duration must be positive, got " + sampleDurationSeconds);
    }
    requireFile(narration, "Narration");
    requireFile(background, "Background");

    double narrationSeconds = probeDuration(narration, "narration");
    double backgroundSeconds = probeDuration(background, "background");
    MixPlan plan = planMix(narrationSeconds, backgroundSeconds);
    structuredLogger.logMixPlanned(
        plan.strategy().name(),
        plan.narrationSeconds(),
        plan.backgroundSeconds(),
        plan.offsetSeconds(),
        plan.repetitions());

    Path mixedFile = outputDir.resolve(mixedFileName(narration, background));
    Path sampleFile = makeSample ? outputDir.resolve("sample_" + mixedFile.getFileName()) : null;

    try {
      Files.createDirectories(outputDir);
      runner.run(buildMixCommand(plan, narration, background, backgroundVolume, mixedFile), "mix");
      LOGGER.info("Mixed {} over {} into {}", narration, background, mixedFile);

      if (makeSample) {
        double totalSeconds = probe.durationSeconds(mixedFile);
        double length = Math.min(sampleDurationSeconds, totalSeconds);
        double start = sampleStart(totalSeconds, sampleDurationSeconds);
        runner.run(buildSampleCommand(mixedFile, sampleFile, start, length), "sample");
        LOGGER.info(
            "Created {}s sample at {}s: {}",
            formatSeconds(length),
            formatSeconds(start),
            sampleFile);
      }
      return new MixResult(mixedFile, sampleFile);
    } catch (IOException e) {
      deleteQuietly(mixedFile);
      deleteQuietly(sampleFile);
      throw new MixingException(
          "Failed to mix " + narration.getFileName() + ": " + e.getMessage(), e);
    }
  }

  /**
   * Decide how to fit the background to the narration.
   *
   * <p>A background at least as long as the narration is trimmed from a random offset in {@code [0,
   * B - N]}. A shorter one is played {@code floor(N / B) + 1} times from the start, which always
   * covers the narration.
   */
  public MixPlan planMix(double narrationSeconds, double backgroundSeconds) {
    if (!(narrationSeconds > 0) || !(backgroundSeconds > 0)) {
      throw new IllegalArgumentException(
          "Durations must be positive: narration="
              + narrationSeconds
              + ", background="
              + backgroundSeconds);
    }
    if (backgroundSeconds >= narrationSeconds) {
      double offset = random.nextDouble() * (backgroundSeconds - narrationSeconds);
      return new MixPlan(
          MixPlan.Strategy.TRIM, narrationSeconds, backgroundSeconds, offset, 1);
    }
    int repetitions = (int) Math.floor(narrationSeconds / backgroundSeconds) + 1;
    return new MixPlan(
        MixPlan.Strategy.LOOP, narrationSeconds, backgroundSeconds, 0.0, repetitions);
  }

  /** Start of the preview sample: random past the lead-in when the mix is long enough, else 0. */
  double sampleStart(double totalSeconds, double sampleDurationSeconds) {
    if (totalSeconds > sampleDurationSeconds + SAMPLE_LEAD_IN_SECONDS) {
      double latest = totalSeconds - sampleDurationSeconds;
      return SAMPLE_LEAD_IN_SECONDS + random.nextDouble() * (latest - SAMPLE_LEAD_IN_SECONDS);
    }
    return 0.0;
  }

  List<String> buildMixCommand(
      MixPlan plan, Path narration, Path background, double backgroundVolume, Path output) {
    List<String> command = new ArrayList<>();
    command.add(runner.ffmpeg());
    command.add("-y");
    command.add("-i");
    command.add(narration.toString());
    if (plan.strategy() == MixPlan.Strategy.LOOP && plan.streamLoopCount() > 0) {
      command.add("-stream_loop");
      command.add(String.valueOf(plan.streamLoopCount()));
    }
    command.add("-i");
    command.add(background.toString());
    command.add("-filter_complex");
    command.add(buildFilterGraph(plan, backgroundVolume));
    command.add("-map");
    command.add("[out]");
    if (output.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".mp3")) {
      command.add("-c:a");
      command.add("libmp3lame");
      command.add("-q:a");
      command.add(String.valueOf(ffmpegProperties.audioQuality()));
    }
    command.add(output.toString());
    return command;
  }

  String buildFilterGraph(MixPlan plan, double backgroundVolume) {
    double duration = plan.narrationSeconds();
    StringBuilder graph = new StringBuilder();
    graph
        .append("[1:a]atrim=start=")
        .append(formatSeconds(plan.offsetSeconds()))
        .append(":duration=")
        .append(formatSeconds(duration))
        .append(",asetpts=PTS-STARTPTS,volume=")
        .append(formatSeconds(backgroundVolume));

    double fadeIn = mixingProperties.fadeInSeconds();
    double fadeOut = mixingProperties.fadeOutSeconds();
    if (duration > fadeIn + fadeOut) {
      if (fadeIn > 0) {
        graph.append(",afade=t=in:st=0:d=").append(formatSeconds(fadeIn));
      }
      if (fadeOut > 0) {
        graph
            .append(",afade=t=out:st=")
            .append(formatSeconds(duration - fadeOut))
            .append(":d=")
            .append(formatSeconds(fadeOut));
      }
    }

    graph
        .append("[bg];[0:a][bg]")
        .append("amix=inputs=2:duration=first:dropout_transition=0:normalize=0[out]");
    return graph.toString();
  }

  List<String> buildSampleCommand(Path mixedFile, Path sampleFile, double start, double length) {
    return List.of(
        runner.ffmpeg(),
        "-y",
        "-ss",
        formatSeconds(start),
        "-i",
        mixedFile.toString(),
        "-t",
        formatSeconds(length),
        "-c",
        "copy",
        sampleFile.toString());
  }

  static String mixedFileName(Path narration, Path background) {
    String narrationName = narration.getFileName().toString();
    int dot = narrationName.lastIndexOf('.');
    String extension = dot > 0 ? narrationName.substring(dot) : ".mp3";
    return baseName(narration) + "_with_" + baseName(background) + extension;
  }

  private static String baseName(Path file) {
    String name = file.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(0, dot) : name;
  }

  private double probeDuration(Path file, String role) {
    try {
      return probe.durationSeconds(file);
    } catch (IOException e) {
      throw new MixingException(
          "Cannot read " + role + " audio " + file + ": " + e.getMessage(), e);
    }
  }

  private static void requireFile(Path file, String role) {
    if (file == null || !Files.isRegularFile(file)) {
      throw new MixingException(role + " file not found: " + file);
    }
  }

  private static void deleteQuietly(Path file) {
    if (file == null) {
      return;
    }
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete partial output {}", file, e);
    }
  }

  private static String formatSeconds(double seconds) {
    return String.format(Locale.ROOT, "%.3f", seconds);
  }
}
