package com.intellifill.mapping.service.pipeline;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.intellifill.mapping.dto.field.TargetField;
import com.intellifill.mapping.dto.job.JobOptions;
import com.intellifill.mapping.exception.InvalidJobSchemaException;

/**
 * Structural checks on a job's target schema and options. These are the only problems that fail a
 * job; anything wrong with the extracted data is handled by QA and recovery instead.
 */
@Component
public class JobSchemaValidator {

  static final int MAX_ATTEMPTS_LIMIT = 10;

  public void validate(List<TargetField> targets, JobOptions options) {
    List<String> problems = problems(targets, options);
    if (!problems.isEmpty()) {
      throw new InvalidJobSchemaException(problems);
    }
  }

  public List<String> problems(List<TargetField> targets, JobOptions options) {
    List<String> problems = new ArrayList<>();
    if (targets == null || targets.isEmpty()) {
      problems.add("At least one target field is required");
    } else {
      Set<String> seen = new HashSet<>();
      for (int i = 0; i < targets.size(); i++) {
        TargetField target = targets.get(i);
        if (target == null || target.getName() == null || target.getName().isBlank()) {
          problems.add("Target field " + i + " has no name");
          continue;
        }
        if (!seen.add(target.getName().trim().toLowerCase(Locale.ROOT))) {
          problems.add("Duplicate target field '" + target.getName() + "'");
        }
      }
    }

    if (options != null) {
      Double threshold = options.getAssignmentThreshold();
      if (threshold != null && (threshold.isNaN() || threshold < 0.0 || threshold > 1.0)) {
        problems.add("assignmentThreshold must be between 0 and 1");
      }
      Integer maxAttempts = options.getMaxAttempts();
      if (maxAttempts != null && (maxAttempts < 1 || maxAttempts > MAX_ATTEMPTS_LIMIT)) {
        problems.add("maxAttempts must be between 1 and " + MAX_ATTEMPTS_LIMIT);
      }
      if (options.getWeights() != null && !options.getWeights().isUsable()) {
        problems.add("weights must be non-negative and not all zero");
      }
    }
    return problems;
  }
}
