package com.intellifill.mapping.service.recovery;

import java.util.List;

import org.springframework.stereotype.Component;

import com.intellifill.mapping.dto.validation.FailureKind;
import com.intellifill.mapping.dto.validation.ValidationFailure;
import com.intellifill.mapping.service.mapping.MappingConfig;
import com.intellifill.mapping.service.mapping.StrategyWeights;

import lombok.extern.slf4j.Slf4j;

/**
 * Chooses the next step after QA rejects a mapping. Decisions are pure: the input config is never
 * modified, adjustments come back as a new {@link MappingConfig}.
 */
@Slf4j
@Component
public class ErrorRecoveryPolicy {

  static final double MAX_THRESHOLD = 0.95;
  static final double MIN_WEIGHT = 0.05;

  public RecoveryDecision decide(
      List<ValidationFailure> failures,
      MappingConfig config,
      int attempt,
      int usableSourceCount,
      int reextractionAttempts) {
    if (attempt >= config.getMaxAttempts()) {
      return decision(
          RecoveryAction.ACCEPT_DEGRADED,
          config,
          "Attempt " + attempt + " of " + config.getMaxAttempts() + " used, accepting best result");
    }
    if (usableSourceCount == 0 && reextractionAttempts < config.getMaxReextractionAttempts()) {
      return decision(
          RecoveryAction.REQUEST_REEXTRACTION, config, "No usable source fields to map from");
    }

    boolean precisionProblem =
        has(failures, FailureKind.TYPE_MISMATCH)
            || has(failures, FailureKind.BELOW_MINIMUM_CONFIDENCE)
            || has(failures, FailureKind.INVALID_OPTION);
    if (precisionProblem) {
      return decision(
          RecoveryAction.RETRY_NARROWED,
          narrow(config),
          "Rejected mappings, raising threshold and type weight");
    }
    if (has(failures, FailureKind.MISSING_REQUIRED_FIELD)) {
      return decision(
          RecoveryAction.RETRY_WIDENED,
          widen(config),
          "Required fields unmapped, lowering threshold");
    }
    return decision(RecoveryAction.RETRY_UNCHANGED, config, "Retrying with the same parameters");
  }

  /**
   * Whether a candidate attempt beats the current best: fewer failures first, then higher mean
   * confidence. Ties keep the earlier attempt.
   */
  public boolean isBetter(
      int candidateFailures,
      double candidateMeanConfidence,
      int bestFailures,
      double bestMeanConfidence) {
    if (candidateFailures != bestFailures) {
      return candidateFailures < bestFailures;
    }
    return candidateMeanConfidence > bestMeanConfidence;
  }

  MappingConfig narrow(MappingConfig config) {
    double step = config.getThresholdStep();
    double typeStep = config.getTypeWeightStep();
    StrategyWeights weights = config.getWeights();
    StrategyWeights shifted =
        weights.toBuilder()
            .typeCompatibility(weights.getTypeCompatibility() + typeStep)
            .lexical(Math.max(MIN_WEIGHT, weights.getLexical() - typeStep / 2))
            .tokenOverlap(Math.max(MIN_WEIGHT, weights.getTokenOverlap() - typeStep / 2))
            .build();
    return config.toBuilder()
        .assignmentThreshold(Math.min(MAX_THRESHOLD, config.getAssignmentThreshold() + step))
        .weights(shifted)
        .build();
  }

  MappingConfig widen(MappingConfig config) {
    double step = config.getThresholdStep();
    double typeStep = config.getTypeWeightStep();
    StrategyWeights weights = config.getWeights();
    StrategyWeights shifted =
        weights.toBuilder()
            .tokenOverlap(weights.getTokenOverlap() + typeStep / 2)
            .lexical(Math.max(MIN_WEIGHT, weights.getLexical() - typeStep / 2))
            .build();
    return config.toBuilder()
        .assignmentThreshold(
            Math.max(config.getMinimumConfidence(), config.getAssignmentThreshold() - step))
        .weights(shifted)
        .build();
  }

  private static boolean has(List<ValidationFailure> failures, FailureKind kind) {
    return failures != null && failures.stream().anyMatch(f -> f.getKind() == kind);
  }

  private static RecoveryDecision decision(
      RecoveryAction action, MappingConfig config, String reason) {
    log.debug("Recovery decision {}: {}", action, reason);
    return RecoveryDecision.builder().action(action).adjustedConfig(config).reason(reason).build();
  }
}
