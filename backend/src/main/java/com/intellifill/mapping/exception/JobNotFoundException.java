package com.intellifill.mapping.exception;

public class JobNotFoundException extends RuntimeException {

  public JobNotFoundException(String jobId) {
    super("Mapping job not found: " + jobId);
  }
}
