package com.intellifill.mapping.service.pipeline;

/**
 * The pipeline's transition function. Stages only move forward, apart from the RECOVER to MAP
 * edge which the orchestrator pairs with an attempt increment. MAP loops on itself while it waits
 * for re-extracted sources; those rounds are bounded by their own counter. CLASSIFY is never
 * re-entered.
 */
public final class StageTransitions {

  private StageTransitions() {}

  public static Stage next(Stage stage, StageEvent event) {
    if (stage == null || event == null) {
      throw new IllegalArgumentException("Stage and event are required");
    }
    if (event == StageEvent.FATAL_ERROR && !stage.isTerminal()) {
      return Stage.FAILED;
    }
    switch (stage) {
      case CLASSIFY:
        if (event == StageEvent.CLASSIFIED) {
          return Stage.MAP;
        }
        break;
      case MAP:
        if (event == StageEvent.MAPPED) {
          return Stage.QA;
        }
        if (event == StageEvent.SOURCES_REQUESTED) {
          return Stage.MAP;
        }
        return afterTimeout(stage, event);
      case QA:
        switch (event) {
          case QA_PASSED:
          case QA_FAILED_EXHAUSTED:
            return Stage.FINALIZE;
          case QA_FAILED_RETRYABLE:
            return Stage.RECOVER;
          default:
            return afterTimeout(stage, event);
        }
      case RECOVER:
        if (event == StageEvent.RECOVERY_SCHEDULED) {
          return Stage.MAP;
        }
        if (event == StageEvent.RECOVERY_ABANDONED) {
          return Stage.FINALIZE;
        }
        break;
      default:
        break;
    }
    throw illegal(stage, event);
  }

  private static Stage afterTimeout(Stage stage, StageEvent event) {
    if (event == StageEvent.STAGE_TIMED_OUT_RETRYABLE) {
      return Stage.RECOVER;
    }
    if (event == StageEvent.STAGE_TIMED_OUT_EXHAUSTED) {
      return Stage.FINALIZE;
    }
    throw illegal(stage, event);
  }

  private static IllegalStateException illegal(Stage stage, StageEvent event) {
    return new IllegalStateException("No transition from " + stage + " on " + event);
  }
}
