package com.scholary.meditation.cli;

import com.scholary.meditation.pipeline.PipelineEngine;
import com.scholary.meditation.state.AudioOutput;
import com.scholary.meditation.state.MeditationRequest;
import com.scholary.meditation.state.PipelineState;
import com.scholary.meditation.state.PipelineStep;
import java.io.PrintStream;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Command-line entry point for running all or part of the pipeline.
 *
 * <p>Run with: {@code java -jar target/meditation-pipeline.jar --spring.profiles.active=cli
 * --start-step=speech-synthesis --end-step=audio-mixing}
 *
 * <p>Without {@code --resume-from}, a run that does not start at the first step picks up the latest
 * snapshot of the step before it. A failed run prints its error to stderr and exits with status 1.
 */
@Component
@Profile("cli")
public class PipelineCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

  private static final Logger LOGGER = LoggerFactory.getLogger(PipelineCommandLineRunner.class);

  static final MeditationRequest DEFAULT_REQUEST =
      new MeditationRequest(
          "anxious", "Mindfulness", "StressRelief", 10, "Female", "en-US", "Nature");

  private final PipelineEngine engine;
  private final PrintStream out;
  private final PrintStream err;
  private int exitCode;

  @Autowired
  public PipelineCommandLineRunner(PipelineEngine engine) {
    this(engine, System.out, System.err);
  }

  PipelineCommandLineRunner(PipelineEngine engine, PrintStream out, PrintStream err) {
    this.engine = engine;
    this.out = out;
    this.err = err;
  }

  @Override
  public void run(ApplicationArguments args) {
    PipelineStep start;
    PipelineStep end;
    MeditationRequest request;
    try {
      start = stepOption(args, "start-step", PipelineStep.first());
      end = stepOption(args, "end-step", PipelineStep.last());
      request = requestFrom(args);
    } catch (IllegalArgumentException e) {
      err.println(e.getMessage());
      exitCode = 1;
      return;
    }

    String resumeFrom = option(args, "resume-from");
    LOGGER.info(
        "Running steps {}..{}{}",
        start,
        end,
        resumeFrom == null ? "" : " from snapshot " + resumeFrom);

    PipelineState result;
    try {
      result =
          resumeFrom == null
              ? engine.runRange(start, end, request, null)
              : engine.resumeFrom(resumeFrom, start, end);
    } catch (IllegalArgumentException e) {
      err.println(e.getMessage());
      exitCode = 1;
      return;
    }

    if (result.hasError()) {
      err.println(result.getError());
      exitCode = 1;
      return;
    }
    printSummary(result);
    exitCode = 0;
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }

  private void printSummary(PipelineState state) {
    out.println("Completed steps through " + state.getCurrentStep());
    AudioOutput audio = state.getAudioOutput();
    if (audio != null) {
      printIfPresent("Narration", audio.getNarrationFile());
      printIfPresent("Background", audio.getBackgroundFile());
      printIfPresent("Mixed audio", audio.getMixedFile());
      printIfPresent("Sample", audio.getSampleFile());
      printIfPresent("Summary", audio.getSummaryFile());
    }
    for (String warning : state.getWarnings()) {
      out.println("Warning: " + warning);
    }
  }

  private void printIfPresent(String label, String value) {
    if (value != null) {
      out.println(label + ": " + value);
    }
  }

  static MeditationRequest requestFrom(ApplicationArguments args) {
    String duration = option(args, "duration");
    int minutes = DEFAULT_REQUEST.durationMinutes();
    if (duration != null) {
      try {
        minutes = Integer.parseInt(duration);
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Invalid duration: " + duration);
      }
      if (minutes <= 0) {
        throw new IllegalArgumentException("Duration must be positive: " + duration);
      }
    }
    return new MeditationRequest(
        optionOr(args, "emotional-state", DEFAULT_REQUEST.emotionalState()),
        optionOr(args, "meditation-style", DEFAULT_REQUEST.meditationStyle()),
        optionOr(args, "meditation-theme", DEFAULT_REQUEST.meditationTheme()),
        minutes,
        optionOr(args, "voice-type", DEFAULT_REQUEST.voiceType()),
        optionOr(args, "language", DEFAULT_REQUEST.languageCode()),
        optionOr(args, "soundscape", DEFAULT_REQUEST.soundscape()));
  }

  private static PipelineStep stepOption(
      ApplicationArguments args, String name, PipelineStep defaultStep) {
    String value = option(args, name);
    return value == null ? defaultStep : PipelineStep.fromId(value);
  }

  private static String optionOr(ApplicationArguments args, String name, String defaultValue) {
    String value = option(args, name);
    return value == null ? defaultValue : value;
  }

  private static String option(ApplicationArguments args, String name) {
    List<String> values = args.getOptionValues(name);
    if (values == null || values.isEmpty()) {
      return null;
    }
    return values.get(values.size() - 1);
  }
}
