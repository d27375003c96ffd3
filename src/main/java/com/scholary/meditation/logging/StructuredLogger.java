package com.scholary.meditation.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Provides methods to log pipeline events with structured fields that can be queried in Kibana.
 * Event fields are removed again after each call; the run context stays for the whole run.
 */
public class StructuredLogger {

  public static final String RUN_ID = "runId";
  public static final String JOB_ID = "jobId";

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log step started event. */
  public void logStepStarted(String step, int stepIndex, int totalSteps) {
    try {
      MDC.put("event_type", "step_started");
      MDC.put("step", step);
      MDC.put("step_index", String.valueOf(stepIndex));
      MDC.put("total_steps", String.valueOf(totalSteps));

      logger.info("Step started: step={}, position={}/{}", step, stepIndex, totalSteps);
    } finally {
      clearEventFields();
    }
  }

  /** Log step finished event. */
  public void logStepFinished(String step, long durationMs, String snapshotId) {
    try {
      MDC.put("event_type", "step_finished");
      MDC.put("step", step);
      MDC.put("durationMs", String.valueOf(durationMs));
      MDC.put("snapshot", snapshotId);

      logger.info(
          "Step finished: step={}, duration={}ms, snapshot={}", step, durationMs, snapshotId);
    } finally {
      clearEventFields();
    }
  }

  /** Log step failure event. The run halts after this. */
  public void logStepFailed(String step, long durationMs, String error) {
    try {
      MDC.put("event_type", "step_failed");
      MDC.put("step", step);
      MDC.put("durationMs", String.valueOf(durationMs));

      logger.error("Step failed: step={}, duration={}ms, error={}", step, durationMs, error);
    } finally {
      clearEventFields();
    }
  }

  /** Log fragment synthesized event. */
  public void logFragmentSynthesized(
      int fragmentIndex, int totalFragments, int characters, long synthesizeMs) {
    try {
      MDC.put("event_type", "fragment_synthesized");
      MDC.put("fragment_index", String.valueOf(fragmentIndex));
      MDC.put("total_fragments", String.valueOf(totalFragments));
      MDC.put("characters", String.valueOf(characters));
      MDC.put("synthesizeMs", String.valueOf(synthesizeMs));

      logger.debug(
          "Fragment synthesized: index={}/{}, chars={}, synthesize={}ms",
          fragmentIndex,
          totalFragments,
          characters,
          synthesizeMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log mix planned event. */
  public void logMixPlanned(
      String strategy,
      double narrationSeconds,
      double backgroundSeconds,
      double offsetSeconds,
      int repetitions) {
    try {
      MDC.put("event_type", "mix_planned");
      MDC.put("strategy", strategy);
      MDC.put("narrationSeconds", String.valueOf(narrationSeconds));
      MDC.put("backgroundSeconds", String.valueOf(backgroundSeconds));
      MDC.put("offsetSeconds", String.valueOf(offsetSeconds));
      MDC.put("repetitions", String.valueOf(repetitions));

      logger.info(
          "Mix planned: strategy={}, narration={}s, background={}s, offset={}s, repetitions={}",
          strategy,
          narrationSeconds,
          backgroundSeconds,
          offsetSeconds,
          repetitions);
    } finally {
      clearEventFields();
    }
  }

  /** Log that a collaborator response could not be decoded and a fallback was used. */
  public void logFallbackUsed(String step, String target, int reformatAttempts) {
    try {
      MDC.put("event_type", "fallback_used");
      MDC.put("step", step);
      MDC.put("target", target);
      MDC.put("attempt", String.valueOf(reformatAttempts));

      logger.warn(
          "Fallback used: step={}, target={}, reformatAttempts={}",
          step,
          target,
          reformatAttempts);
    } finally {
      clearEventFields();
    }
  }

  /** Set run context in MDC. */
  public static void setRunContext(String runId) {
    MDC.put(RUN_ID, runId);
  }

  /** Clear run context from MDC. */
  public static void clearRunContext() {
    MDC.remove(RUN_ID);
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId) {
    MDC.put(JOB_ID, jobId);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove(JOB_ID);
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("step");
    MDC.remove("step_index");
    MDC.remove("total_steps");
    MDC.remove("durationMs");
    MDC.remove("snapshot");
    MDC.remove("fragment_index");
    MDC.remove("total_fragments");
    MDC.remove("characters");
    MDC.remove("synthesizeMs");
    MDC.remove("strategy");
    MDC.remove("narrationSeconds");
    MDC.remove("backgroundSeconds");
    MDC.remove("offsetSeconds");
    MDC.remove("repetitions");
    MDC.remove("target");
    MDC.remove("attempt");
  }
}
