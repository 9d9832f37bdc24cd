package com.intellifill.mapping.service.lease;

import java.time.Duration;

/** Guarantees that at most one worker processes a job at any time. */
public interface IJobLeaseManager {

  /**
   * Takes the lease on a job if nobody holds it or the previous lease has expired. Not reentrant:
   * a second acquire by the same owner fails while the first lease is live.
   *
   * @param jobId the job identifier
   * @param owner unique token of the acquiring worker run
   * @param duration how long the lease stays valid without renewal
   * @return true if the lease was acquired
   */
  boolean tryAcquire(String jobId, String owner, Duration duration);

  /**
   * Extends a lease held by {@code owner}.
   *
   * @return false if the owner no longer holds the lease
   */
  boolean renew(String jobId, String owner, Duration duration);

  /** Gives the lease up. Releasing a lease held by someone else has no effect. */
  void release(String jobId, String owner);

  boolean isHeld(String jobId);
}
