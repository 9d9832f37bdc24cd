package com.intellifill.mapping.config;

import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component("checkpointRetryListener")
public class CheckpointRetryListener implements RetryListener {

  @Override
  public <T, E extends Throwable> void onError(
      RetryContext context, RetryCallback<T, E> callback, Throwable throwable) {
    log.warn(
        "Checkpoint store failure on attempt {}: {}. Retrying job run...",
        context.getRetryCount(),
        throwable.getMessage());
  }
}
