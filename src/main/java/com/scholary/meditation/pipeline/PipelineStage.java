package com.scholary.meditation.pipeline;

import com.scholary.meditation.state.PipelineState;
import com.scholary.meditation.state.PipelineStep;

/**
 * One step of the meditation pipeline.
 *
 * <p>A stage reads what earlier stages wrote to the state and fills in its own part. Expected
 * failures are reported with {@link PipelineState#markFailed}; anything thrown is converted into an
 * error by the {@link PipelineEngine}. Stages are never retried by the engine.
 */
public interface PipelineStage {

  /** The step this stage implements. */
  PipelineStep step();

  /** Run the stage against the state, returning the (usually same) updated record. */
  PipelineState apply(PipelineState state);
}
