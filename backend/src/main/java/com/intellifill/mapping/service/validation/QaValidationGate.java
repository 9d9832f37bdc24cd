package com.intellifill.mapping.service.validation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import org.springframework.stereotype.Service;

import com.intellifill.mapping.dto.field.FieldMapping;
import com.intellifill.mapping.dto.field.TargetField;
import com.intellifill.mapping.dto.validation.FailureKind;
import com.intellifill.mapping.dto.validation.ValidationFailure;
import com.intellifill.mapping.dto.validation.ValidationResult;
import com.intellifill.mapping.service.mapping.MappingConfig;
import com.intellifill.mapping.service.scoring.FieldNameNormalizer;
import com.intellifill.mapping.service.scoring.ValueTypeInspector;

import lombok.extern.slf4j.Slf4j;

/**
 * Checks a set of mappings against the target schema. Problems are reported, never thrown.
 * Failures come out grouped per target in schema order: duplicate assignments, then a missing
 * required field, then per-mapping checks (confidence floor, type coercibility, allowed options).
 */
@Slf4j
@Service
public class QaValidationGate {

  public ValidationResult validate(List<FieldMapping> mappings, List<TargetField> targets) {
    return validate(mappings, targets, MappingConfig.defaults());
  }

  public ValidationResult validate(
      List<FieldMapping> mappings, List<TargetField> targets, MappingConfig config) {
    MappingConfig effective = config != null ? config : MappingConfig.defaults();
    List<FieldMapping> safeMappings = mappings != null ? mappings : List.of();
    List<TargetField> safeTargets = targets != null ? targets : List.of();

    Map<String, List<FieldMapping>> byTarget = new LinkedHashMap<>();
    for (FieldMapping mapping : safeMappings) {
      if (mapping != null && mapping.getTargetName() != null) {
        byTarget.computeIfAbsent(mapping.getTargetName(), k -> new ArrayList<>()).add(mapping);
      }
    }

    List<ValidationFailure> failures = new ArrayList<>();
    for (TargetField target : safeTargets) {
      if (target == null || target.getName() == null) {
        continue;
      }
      List<FieldMapping> assigned = byTarget.getOrDefault(target.getName(), List.of());
      checkDuplicates(target, assigned, effective, failures);

      if (target.isRequired() && !hasValue(assigned)) {
        failures.add(
            failure(
                FailureKind.MISSING_REQUIRED_FIELD,
                target.getName(),
                null,
                "Required field '" + target.getName() + "' has no mapped value"));
      }

      for (FieldMapping mapping : assigned) {
        checkMapping(target, mapping, effective, failures);
      }
    }

    if (!failures.isEmpty()) {
      log.debug(
          "QA found {} failure(s) across {} target fields", failures.size(), safeTargets.size());
    }
    return ValidationResult.of(failures);
  }

  private void checkDuplicates(
      TargetField target,
      List<FieldMapping> assigned,
      MappingConfig config,
      List<ValidationFailure> failures) {
    Map<String, Integer> perKey = new LinkedHashMap<>();
    for (FieldMapping mapping : assigned) {
      String key =
          config.isMultiSourceMerge() ? Objects.toString(mapping.getSourceDocumentId(), "") : "";
      perKey.merge(key, 1, Integer::sum);
    }
    perKey.forEach(
        (key, count) -> {
          if (count > 1) {
            String scope = key.isEmpty() ? "" : " from document '" + key + "'";
            failures.add(
                failure(
                    FailureKind.DUPLICATE_ASSIGNMENT,
                    target.getName(),
                    null,
                    "Field '" + target.getName() + "' is assigned " + count + " times" + scope));
          }
        });
  }

  private void checkMapping(
      TargetField target,
      FieldMapping mapping,
      MappingConfig config,
      List<ValidationFailure> failures) {
    if (mapping.getConfidence() < config.getMinimumConfidence()) {
      failures.add(
          failure(
              FailureKind.BELOW_MINIMUM_CONFIDENCE,
              target.getName(),
              mapping.getSourceName(),
              String.format(
                  Locale.ROOT,
                  "Confidence %.4f is below the minimum %.2f",
                  mapping.getConfidence(), config.getMinimumConfidence())));
    }

    if (!ValueTypeInspector.isCoercible(mapping.getValue(), target.getType())) {
      failures.add(
          failure(
              FailureKind.TYPE_MISMATCH,
              target.getName(),
              mapping.getSourceName(),
              "Value of '"
                  + mapping.getSourceName()
                  + "' is not a valid "
                  + target.getType().getWireName()));
    }

    if (target.getOptions() != null
        && !target.getOptions().isEmpty()
        && hasText(mapping.getValue())
        && !matchesOption(mapping.getValue(), target.getOptions())) {
      failures.add(
          failure(
              FailureKind.INVALID_OPTION,
              target.getName(),
              mapping.getSourceName(),
              "Value of '" + mapping.getSourceName() + "' is not one of the allowed options"));
    }
  }

  private static boolean matchesOption(String value, List<String> options) {
    String normalized = FieldNameNormalizer.normalize(value);
    for (String option : options) {
      if (normalized.equals(FieldNameNormalizer.normalize(option))) {
        return true;
      }
    }
    return false;
  }

  private static boolean hasValue(List<FieldMapping> assigned) {
    return assigned.stream().anyMatch(m -> hasText(m.getValue()));
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }

  private static ValidationFailure failure(
      FailureKind kind, String targetName, String sourceName, String message) {
    return ValidationFailure.builder()
        .kind(kind)
        .targetName(targetName)
        .sourceName(sourceName)
        .message(message)
        .build();
  }
}
