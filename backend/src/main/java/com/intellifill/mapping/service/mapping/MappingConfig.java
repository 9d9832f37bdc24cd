package com.intellifill.mapping.service.mapping;

import java.util.List;
import java.util.Map;

import com.intellifill.mapping.service.scoring.AliasTable;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Tunable parameters for one mapping run. Instances are treated as values: recovery derives a new
 * config with {@code toBuilder()} instead of editing the active one, and the active config is
 * persisted with each checkpoint.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MappingConfig {

  @Builder.Default private StrategyWeights weights = StrategyWeights.defaults();

  /** Pairs scoring below this are not candidates at all. */
  @Builder.Default private double candidateFloor = 0.3;

  /** Pairs scoring below this are never accepted, even without competition. */
  @Builder.Default private double assignmentThreshold = 0.6;

  /** Accepted pairs within this margin above the threshold are flagged for review. */
  @Builder.Default private double flagMargin = 0.1;

  @Builder.Default private double aliasFloor = 0.9;

  @Builder.Default private double exactMatchFloor = 0.95;

  /** QA hard floor, kept below the assignment threshold. */
  @Builder.Default private double minimumConfidence = 0.4;

  @Builder.Default private int maxAttempts = 3;

  @Builder.Default private int maxReextractionAttempts = 2;

  @Builder.Default private double thresholdStep = 0.1;

  @Builder.Default private double typeWeightStep = 0.1;

  /** When set, uniqueness is enforced per (target, source document) instead of per target. */
  private boolean multiSourceMerge;

  @Builder.Default private Map<String, List<String>> aliasGroups = AliasTable.DEFAULT_GROUPS;

  public static MappingConfig defaults() {
    return MappingConfig.builder().build();
  }
}
