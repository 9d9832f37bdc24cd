package com.intellifill.mapping.service.storage;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intellifill.mapping.service.pipeline.ProcessingState;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Default checkpoint store. Keeps copies, so callers never share state objects with the store. */
@Slf4j
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(
    prefix = "mapping.checkpoint",
    name = "store",
    havingValue = "memory",
    matchIfMissing = true)
public class InMemoryJobCheckpointRepository implements IJobCheckpointRepository {

  private final ObjectMapper objectMapper;
  private final Map<String, ProcessingState> checkpoints = new ConcurrentHashMap<>();
  private final Set<String> cancellations = ConcurrentHashMap.newKeySet();

  @Override
  public void save(ProcessingState state) {
    checkpoints.put(state.getJobId(), copy(state));
    log.debug("Checkpointed job {} at stage {}", state.getJobId(), state.getStage());
  }

  @Override
  public Optional<ProcessingState> findById(String jobId) {
    if (jobId == null) {
      return Optional.empty();
    }
    ProcessingState stored = checkpoints.get(jobId);
    return stored == null ? Optional.empty() : Optional.of(copy(stored));
  }

  @Override
  public List<ProcessingState> findAll() {
    List<ProcessingState> all = new ArrayList<>();
    for (ProcessingState state : checkpoints.values()) {
      all.add(copy(state));
    }
    all.sort(Comparator.comparing(ProcessingState::getJobId));
    return all;
  }

  @Override
  public boolean deleteById(String jobId) {
    if (jobId == null) {
      return false;
    }
    cancellations.remove(jobId);
    return checkpoints.remove(jobId) != null;
  }

  @Override
  public void requestCancellation(String jobId) {
    cancellations.add(jobId);
  }

  @Override
  public boolean isCancellationRequested(String jobId) {
    return jobId != null && cancellations.contains(jobId);
  }

  @Override
  public void clearCancellation(String jobId) {
    if (jobId != null) {
      cancellations.remove(jobId);
    }
  }

  private ProcessingState copy(ProcessingState state) {
    return objectMapper.convertValue(state, ProcessingState.class);
  }
}
