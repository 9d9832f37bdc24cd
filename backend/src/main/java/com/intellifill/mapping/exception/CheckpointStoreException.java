package com.intellifill.mapping.exception;

/** A checkpoint could not be read or written. Transient; the worker retries the job. */
public class CheckpointStoreException extends RuntimeException {

  public CheckpointStoreException(String message, Throwable cause) {
    super(message, cause);
  }

  public CheckpointStoreException(String message) {
    super(message);
  }
}
