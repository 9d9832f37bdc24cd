package com.intellifill.mapping.dto.job;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum JobStatus {
  PENDING,
  RUNNING,
  COMPLETED,
  COMPLETED_WITH_WARNINGS,
  FAILED,
  CANCELLED;

  public boolean isTerminal() {
    return this == COMPLETED
        || this == COMPLETED_WITH_WARNINGS
        || this == FAILED
        || this == CANCELLED;
  }

  @JsonValue
  public String getWireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static JobStatus fromValue(String value) {
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
