package com.scholary.meditation.api;

import com.scholary.meditation.state.PipelineStep;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/** Request to continue a run from a named snapshot. {@code endStep} defaults to the last step. */
public record ResumeRunRequest(
    @NotBlank @Schema(example = "state_markup-review_20240301_101530_123.json") String snapshotId,
    @NotNull @Schema(example = "speech-synthesis") PipelineStep startStep,
    @Schema(example = "audio-mixing") PipelineStep endStep) {

  public PipelineStep effectiveEndStep() {
    return endStep == null ? PipelineStep.last() : endStep;
  }
}
