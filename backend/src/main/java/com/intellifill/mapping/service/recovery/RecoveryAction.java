package com.intellifill.mapping.service.recovery;

/** What the pipeline should do after a failed QA pass. */
public enum RecoveryAction {
  /** Lower the assignment threshold and favour token overlap, to fill missing fields. */
  RETRY_WIDENED,
  /** Raise the threshold and favour type compatibility, to drop doubtful mappings. */
  RETRY_NARROWED,
  RETRY_UNCHANGED,
  /** No usable source fields; ask the extraction collaborator for another pass. */
  REQUEST_REEXTRACTION,
  ACCEPT_DEGRADED;

  public boolean isRetry() {
    return this != ACCEPT_DEGRADED;
  }
}
