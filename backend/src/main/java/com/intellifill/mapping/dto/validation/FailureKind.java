package com.intellifill.mapping.dto.validation;

/**
 * Distinct reasons a completed assignment can fail the QA gate. {@link #NO_USABLE_SOURCES} comes
 * from the pipeline, not the gate, when a job finishes without anything to map from.
 */
public enum FailureKind {
  MISSING_REQUIRED_FIELD,
  BELOW_MINIMUM_CONFIDENCE,
  TYPE_MISMATCH,
  DUPLICATE_ASSIGNMENT,
  INVALID_OPTION,
  NO_USABLE_SOURCES
}
