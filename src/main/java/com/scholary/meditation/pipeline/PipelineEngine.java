package com.scholary.meditation.pipeline;

import com.scholary.meditation.logging.StructuredLogger;
import com.scholary.meditation.state.MeditationRequest;
import com.scholary.meditation.state.PipelineState;
import com.scholary.meditation.state.PipelineStep;
import com.scholary.meditation.store.StateStore;
import com.scholary.meditation.store.StateStoreException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs the pipeline stages in their fixed order against a state record.
 *
 * <p>Supports the full chain, a contiguous sub-range or a single step. When no seed record is
 * given, the run resumes from the latest snapshot of the step before the first one requested.
 * After every stage, failed or not, the record is saved to the {@link StateStore}.
 *
 * <p>Stage faults never escape: an exception thrown by a stage, or a failure to persist its
 * snapshot, becomes {@code "Error in <step>: <message>"} on the record and the run halts. There is
 * no retry at this level.
 */
public class PipelineEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(PipelineEngine.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final Map<PipelineStep, PipelineStage> stages;
  private final StateStore stateStore;

  public PipelineEngine(List<PipelineStage> stages, StateStore stateStore) {
    this.stages = new EnumMap<>(PipelineStep.class);
    for (PipelineStage stage : stages) {
      PipelineStage previous = this.stages.put(stage.step(), stage);
      if (previous != null) {
        throw new IllegalArgumentException("Duplicate stage for step " + stage.step());
      }
    }
    for (PipelineStep step : PipelineStep.values()) {
      if (!this.stages.containsKey(step)) {
        throw new IllegalArgumentException("No stage registered for step " + step);
      }
    }
    this.stateStore = stateStore;
  }

  /** Run the whole chain from a fresh record. */
  public PipelineState runAll(MeditationRequest request) {
    return runRange(
        PipelineStep.first(), PipelineStep.last(), request, PipelineState.start(request));
  }

  /** Run a single step against the given record. */
  public PipelineState runStep(PipelineStep step, PipelineState state) {
    return runRange(step, step, state.getRequest(), state);
  }

  /**
   * Run every step from {@code start} to {@code end} inclusive.
   *
   * @param request request for a fresh record; ignored when a seed or predecessor snapshot is used
   * @param seed record to run against, or {@code null} to resume from the predecessor snapshot
   * @return the final record; carries an error if a step failed
   * @throws IllegalArgumentException if {@code end} is before {@code start}, or there is neither a
   *     seed, a predecessor snapshot nor a request to start from
   */
  public PipelineState runRange(
      PipelineStep start, PipelineStep end, MeditationRequest request, PipelineState seed) {
    if (start.isAfter(end)) {
      throw new IllegalArgumentException(
          "End step " + end + " comes before start step " + start);
    }

    String previousRunId = MDC.get(StructuredLogger.RUN_ID);
    StructuredLogger.setRunContext(UUID.randomUUID().toString());
    try {
      PipelineState state = seed != null ? seed : resolveSeed(start, request);
      if (state.hasError()) {
        LOGGER.warn("Not running {}..{}: record already failed: {}", start, end, state.getError());
        return state;
      }
      LOGGER.info("Running pipeline {}..{}", start, end);
      return execute(start, end, state);
    } finally {
      if (previousRunId != null) {
        StructuredLogger.setRunContext(previousRunId);
      } else {
        StructuredLogger.clearRunContext();
      }
    }
  }

  /**
   * Resume from an explicit snapshot. A snapshot that is missing or unreadable yields a failed
   * record, persisted under {@code start}.
   */
  public PipelineState resumeFrom(String snapshotId, PipelineStep start, PipelineStep end) {
    PipelineState seed;
    try {
      seed = stateStore.load(snapshotId);
    } catch (StateStoreException e) {
      seed =
          failAndPersist(
              null, start, "Failed to resume from " + snapshotId + ": " + e.getMessage());
    }
    return runRange(start, end, seed.getRequest(), seed);
  }

  private PipelineState resolveSeed(PipelineStep start, MeditationRequest request) {
    Optional<PipelineStep> predecessor = start.previous();
    Optional<String> snapshotId = predecessor.flatMap(stateStore::latest);

    if (snapshotId.isPresent()) {
      try {
        PipelineState loaded = stateStore.load(snapshotId.get());
        LOGGER.info("Resuming {} from snapshot {}", start, snapshotId.get());
        return loaded;
      } catch (StateStoreException e) {
        return failAndPersist(
            request,
            start,
            "Error in " + start + ": failed to load snapshot " + snapshotId.get() + ": "
                + e.getMessage());
      }
    }

    if (request == null) {
      throw new IllegalArgumentException(
          "No snapshot found for step "
              + predecessor.map(PipelineStep::id).orElse("(none)")
              + " and no request given to start "
              + start
              + " from");
    }
    return PipelineState.start(request);
  }

  private PipelineState failAndPersist(
      MeditationRequest request, PipelineStep step, String error) {
    PipelineState failed = PipelineState.failed(request, error);
    failed.setCurrentStep(step);
    try {
      stateStore.save(failed, step);
    } catch (StateStoreException e) {
      LOGGER.error("Could not persist failed record for {}", step, e);
    }
    structuredLogger.logStepFailed(step.id(), 0, error);
    return failed;
  }

  private PipelineState execute(PipelineStep start, PipelineStep end, PipelineState state) {
    int total = end.ordinal() - start.ordinal() + 1;

    for (PipelineStep step : PipelineStep.values()) {
      if (step.ordinal() < start.ordinal() || step.isAfter(end)) {
        continue;
      }
      int position = step.ordinal() - start.ordinal() + 1;
      state.setCurrentStep(step);
      structuredLogger.logStepStarted(step.id(), position, total);
      long startTime = System.currentTimeMillis();

      state = runStage(step, state);

      String snapshotId = null;
      try {
        snapshotId = stateStore.save(state, step);
      } catch (StateStoreException e) {
        LOGGER.error("Failed to persist snapshot for {}", step, e);
        state.markFailed(errorMessage(step, e));
      }

      long durationMs = System.currentTimeMillis() - startTime;
      if (state.hasError()) {
        structuredLogger.logStepFailed(step.id(), durationMs, state.getError());
        return state;
      }
      structuredLogger.logStepFinished(step.id(), durationMs, snapshotId);
    }

    LOGGER.info("Pipeline {}..{} completed", start, end);
    return state;
  }

  private PipelineState runStage(PipelineStep step, PipelineState state) {
    try {
      PipelineState result = stages.get(step).apply(state);
      if (result == null) {
        state.markFailed("Error in " + step + ": stage returned no state");
        return state;
      }
      result.setCurrentStep(step);
      return result;
    } catch (RuntimeException e) {
      LOGGER.error("Stage {} threw", step, e);
      state.markFailed(errorMessage(step, e));
      return state;
    }
  }

  private static String errorMessage(PipelineStep step, Exception e) {
    String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    return "Error in " + step + ": " + message;
  }
}
