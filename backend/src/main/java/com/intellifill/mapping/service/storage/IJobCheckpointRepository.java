package com.intellifill.mapping.service.storage;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import com.intellifill.mapping.service.pipeline.ProcessingState;

/**
 * Durable store of job checkpoints, one record per job id. Implementations throw {@link
 * com.intellifill.mapping.exception.CheckpointStoreException} when the backing store fails.
 */
public interface IJobCheckpointRepository {

  /**
   * Writes the full state, replacing any earlier checkpoint of the same job.
   *
   * @param state the job state to persist
   */
  void save(ProcessingState state);

  /**
   * Loads the last checkpoint of a job. The returned object is a copy; changing it does not change
   * the stored checkpoint.
   *
   * @param jobId the job identifier
   * @return the checkpoint if the job exists
   */
  Optional<ProcessingState> findById(String jobId);

  /**
   * Lists all checkpoints.
   *
   * @return every stored job state
   */
  List<ProcessingState> findAll();

  /**
   * Checkpoints of jobs that have not reached a terminal status, used to resume work on startup.
   *
   * @return unfinished job states
   */
  default List<ProcessingState> findUnfinished() {
    return findAll().stream().filter(s -> !s.getStatus().isTerminal()).collect(Collectors.toList());
  }

  /**
   * Removes a checkpoint.
   *
   * @param jobId the job identifier
   * @return true if a checkpoint was removed
   */
  boolean deleteById(String jobId);

  /**
   * Records a cancellation request next to the checkpoint without rewriting it, so the worker that
   * owns the checkpoint cannot overwrite the request with its next save.
   *
   * @param jobId the job identifier
   */
  void requestCancellation(String jobId);

  boolean isCancellationRequested(String jobId);

  /** Drops the cancellation marker of a job, if any. */
  void clearCancellation(String jobId);
}
