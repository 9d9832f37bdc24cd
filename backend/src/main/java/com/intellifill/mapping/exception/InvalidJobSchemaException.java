package com.intellifill.mapping.exception;

import java.util.List;

/** The target schema or job options cannot be processed at all. */
public class InvalidJobSchemaException extends RuntimeException {

  private final List<String> problems;

  public InvalidJobSchemaException(List<String> problems) {
    super("Invalid job: " + String.join("; ", problems));
    this.problems = List.copyOf(problems);
  }

  public List<String> getProblems() {
    return problems;
  }
}
