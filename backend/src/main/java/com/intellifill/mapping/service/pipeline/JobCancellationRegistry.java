package com.intellifill.mapping.service.pipeline;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Component;

/**
 * Cancellation requests for jobs currently running in this process. The running worker owns the
 * checkpoint and would overwrite a flag written there, so requests are handed over here instead.
 */
@Component
public class JobCancellationRegistry {

  private final Set<String> requested = ConcurrentHashMap.newKeySet();

  public void request(String jobId) {
    requested.add(jobId);
  }

  public boolean isRequested(String jobId) {
    return requested.contains(jobId);
  }

  public void clear(String jobId) {
    requested.remove(jobId);
  }
}
