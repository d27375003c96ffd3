package com.scholary.meditation.state;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Audio results accumulated by the synthesis and mixing stages.
 *
 * <p>Stages write known keys only. Recording a new narration resets the keys derived from the
 * previous one, so re-running synthesis never leaves a stale mix pointing at an old voice track.
 */
@JsonAutoDetect(
    fieldVisibility = Visibility.ANY,
    getterVisibility = Visibility.NONE,
    isGetterVisibility = Visibility.NONE,
    setterVisibility = Visibility.NONE)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AudioOutput {

  private String narrationFile;
  private String backgroundFile;
  private String mixedFile;
  private String sampleFile;
  private String summaryFile;
  private AudioStatus status;

  public String getNarrationFile() {
    return narrationFile;
  }

  public String getBackgroundFile() {
    return backgroundFile;
  }

  public String getMixedFile() {
    return mixedFile;
  }

  public String getSampleFile() {
    return sampleFile;
  }

  public String getSummaryFile() {
    return summaryFile;
  }

  public AudioStatus getStatus() {
    return status;
  }

  /** Record a freshly synthesized narration. */
  public void recordNarration(String narrationFile) {
    this.narrationFile = narrationFile;
    this.backgroundFile = null;
    this.mixedFile = null;
    this.sampleFile = null;
    this.summaryFile = null;
    this.status = AudioStatus.GENERATED;
  }

  /** Record the result of mixing the current narration over a background. */
  public void recordMix(String backgroundFile, String mixedFile, String sampleFile) {
    this.backgroundFile = backgroundFile;
    this.mixedFile = mixedFile;
    this.sampleFile = sampleFile;
    this.status = AudioStatus.COMPLETED;
  }

  public void setSummaryFile(String summaryFile) {
    this.summaryFile = summaryFile;
  }

  @JsonIgnore
  public boolean hasNarration() {
    return narrationFile != null && !narrationFile.isBlank();
  }
}
