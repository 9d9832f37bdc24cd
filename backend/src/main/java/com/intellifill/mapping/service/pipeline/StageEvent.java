package com.intellifill.mapping.service.pipeline;

/** Outcome of running a stage, fed to {@link StageTransitions#next}. */
public enum StageEvent {
  CLASSIFIED,
  MAPPED,
  SOURCES_REQUESTED,
  QA_PASSED,
  QA_FAILED_RETRYABLE,
  QA_FAILED_EXHAUSTED,
  RECOVERY_SCHEDULED,
  RECOVERY_ABANDONED,
  STAGE_TIMED_OUT_RETRYABLE,
  STAGE_TIMED_OUT_EXHAUSTED,
  FATAL_ERROR
}
