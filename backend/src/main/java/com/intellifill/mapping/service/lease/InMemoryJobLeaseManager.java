package com.intellifill.mapping.service.lease;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Component;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Process-local lease table with wall-clock expiry. */
@Slf4j
@Component
@RequiredArgsConstructor
public class InMemoryJobLeaseManager implements IJobLeaseManager {

  private final Clock clock;
  private final Map<String, Lease> leases = new ConcurrentHashMap<>();

  @Override
  public boolean tryAcquire(String jobId, String owner, Duration duration) {
    Instant now = clock.instant();
    Lease fresh = new Lease(owner, now.plus(duration));
    Lease result =
        leases.compute(
            jobId,
            (id, current) -> current == null || current.isExpired(now) ? fresh : current);
    boolean acquired = result == fresh;
    if (!acquired) {
      log.debug("Lease on job {} is held by {}", jobId, result.getOwner());
    }
    return acquired;
  }

  @Override
  public boolean renew(String jobId, String owner, Duration duration) {
    Instant now = clock.instant();
    Lease result =
        leases.computeIfPresent(
            jobId,
            (id, current) ->
                current.getOwner().equals(owner) && !current.isExpired(now)
                    ? new Lease(owner, now.plus(duration))
                    : current);
    return result != null && result.getOwner().equals(owner) && !result.isExpired(now);
  }

  @Override
  public void release(String jobId, String owner) {
    leases.computeIfPresent(
        jobId, (id, current) -> current.getOwner().equals(owner) ? null : current);
  }

  @Override
  public boolean isHeld(String jobId) {
    Lease lease = leases.get(jobId);
    return lease != null && !lease.isExpired(clock.instant());
  }

  @Getter
  @AllArgsConstructor
  private static final class Lease {
    private final String owner;
    private final Instant expiresAt;

    boolean isExpired(Instant now) {
      return !now.isBefore(expiresAt);
    }
  }
}
