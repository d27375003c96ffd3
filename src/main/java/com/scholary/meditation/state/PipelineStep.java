package com.scholary.meditation.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The stages of the meditation pipeline, in execution order.
 *
 * <p>The order is fixed and linear: every stage depends on the output of the one before it. The
 * {@link #id()} is the stable name used in snapshot file names, logs and the CLI.
 */
public enum PipelineStep {
  SCRIPT_GENERATION("script-generation"),
  PROSODY_ANALYSIS("prosody-analysis"),
  PROSODY_PROFILE("prosody-profile"),
  MARKUP_GENERATION("markup-generation"),
  MARKUP_REVIEW("markup-review"),
  SPEECH_SYNTHESIS("speech-synthesis"),
  AUDIO_MIXING("audio-mixing");

  private final String id;

  PipelineStep(String id) {
    this.id = id;
  }

  @JsonValue
  public String id() {
    return id;
  }

  public static PipelineStep first() {
    return values()[0];
  }

  public static PipelineStep last() {
    return values()[values().length - 1];
  }

  /** The step that runs immediately before this one, if any. */
  public Optional<PipelineStep> previous() {
    return ordinal() == 0 ? Optional.empty() : Optional.of(values()[ordinal() - 1]);
  }

  public boolean isAfter(PipelineStep other) {
    return ordinal() > other.ordinal();
  }

  @JsonCreator
  public static PipelineStep fromId(String id) {
    return Arrays.stream(values())
        .filter(step -> step.id.equals(id) || step.name().equalsIgnoreCase(id))
        .findFirst()
        .orElseThrow(
            () ->
                new IllegalArgumentException(
                    "Unknown pipeline step: "
                        + id
                        + ". Must be one of "
                        + Arrays.stream(values())
                            .map(PipelineStep::id)
                            .collect(Collectors.joining(", ", "[", "]"))));
  }

  @Override
  public String toString() {
    return id;
  }
}
