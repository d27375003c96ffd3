package com.scholary.meditation.state;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The record threaded through every pipeline stage and persisted after each one.
 *
 * <p>Fields fill in progressively as stages run. The request is fixed at construction. Once an
 * error has been recorded the record is frozen: every mutator except {@link #setCurrentStep} and
 * {@link #addWarning} throws {@link IllegalStateException}.
 *
 * <p>Not thread-safe. A record belongs to a single run.
 */
@JsonAutoDetect(
    fieldVisibility = Visibility.ANY,
    getterVisibility = Visibility.NONE,
    isGetterVisibility = Visibility.NONE,
    setterVisibility = Visibility.NONE,
    creatorVisibility = Visibility.ANY)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PipelineState {

  private final MeditationRequest request;

  private MeditationScript script;
  private ProsodyAnalysis prosodyAnalysis;
  private ProsodyProfile prosodyProfile;
  private String markupOutput;
  private AudioOutput audioOutput;
  private String error;
  private PipelineStep currentStep;
  private List<String> warnings = new ArrayList<>();

  @JsonCreator
  PipelineState(@JsonProperty("request") MeditationRequest request) {
    this.request = request;
  }

  /** Fresh record for a new run. */
  public static PipelineState start(MeditationRequest request) {
    return new PipelineState(Objects.requireNonNull(request, "request is required"));
  }

  /**
   * Record that already carries an error. Used when a run cannot even begin, e.g. because the
   * snapshot it should resume from is unreadable.
   */
  public static PipelineState failed(MeditationRequest request, String error) {
    PipelineState state = new PipelineState(request);
    state.markFailed(error);
    return state;
  }

  public MeditationRequest getRequest() {
    return request;
  }

  public MeditationScript getScript() {
    return script;
  }

  public void setScript(MeditationScript script) {
    ensureWritable();
    this.script = script;
  }

  public ProsodyAnalysis getProsodyAnalysis() {
    return prosodyAnalysis;
  }

  public void setProsodyAnalysis(ProsodyAnalysis prosodyAnalysis) {
    ensureWritable();
    this.prosodyAnalysis = prosodyAnalysis;
  }

  public ProsodyProfile getProsodyProfile() {
    return prosodyProfile;
  }

  public void setProsodyProfile(ProsodyProfile prosodyProfile) {
    ensureWritable();
    this.prosodyProfile = prosodyProfile;
  }

  public String getMarkupOutput() {
    return markupOutput;
  }

  public void setMarkupOutput(String markupOutput) {
    ensureWritable();
    this.markupOutput = markupOutput;
  }

  public AudioOutput getAudioOutput() {
    return audioOutput;
  }

  /** Record a new narration file, creating the audio output on first use. */
  public void recordNarration(String narrationFile) {
    ensureWritable();
    if (audioOutput == null) {
      audioOutput = new AudioOutput();
    }
    audioOutput.recordNarration(narrationFile);
  }

  /** Record the mix results. Requires a narration to have been recorded. */
  public void recordMix(String backgroundFile, String mixedFile, String sampleFile) {
    ensureWritable();
    if (audioOutput == null || !audioOutput.hasNarration()) {
      throw new IllegalStateException("No narration recorded to mix");
    }
    audioOutput.recordMix(backgroundFile, mixedFile, sampleFile);
  }

  public void recordSummaryFile(String summaryFile) {
    ensureWritable();
    if (audioOutput == null) {
      audioOutput = new AudioOutput();
    }
    audioOutput.setSummaryFile(summaryFile);
  }

  public String getError() {
    return error;
  }

  @JsonIgnore
  public boolean hasError() {
    return error != null && !error.isEmpty();
  }

  /**
   * Mark the run as failed. The first error wins; later calls are ignored so the original cause
   * is what gets persisted.
   */
  public void markFailed(String error) {
    if (hasError()) {
      return;
    }
    this.error = (error == null || error.isEmpty()) ? "Unknown error" : error;
  }

  public PipelineStep getCurrentStep() {
    return currentStep;
  }

  public void setCurrentStep(PipelineStep currentStep) {
    this.currentStep = currentStep;
  }

  public List<String> getWarnings() {
    return warnings == null ? List.of() : Collections.unmodifiableList(warnings);
  }

  public void addWarning(String warning) {
    if (warnings == null) {
      warnings = new ArrayList<>();
    }
    warnings.add(warning);
  }

  private void ensureWritable() {
    if (hasError()) {
      throw new IllegalStateException("State is frozen after failure: " + error);
    }
  }
}
