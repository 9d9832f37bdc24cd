package com.intellifill.mapping.service.pipeline;

import java.util.List;
import java.util.concurrent.Executor;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import com.intellifill.mapping.exception.CheckpointStoreException;
import com.intellifill.mapping.service.storage.IJobCheckpointRepository;

import lombok.extern.slf4j.Slf4j;

/** Runs jobs on the bounded mapping executor and resumes unfinished jobs after a restart. */
@Slf4j
@Component
public class MappingJobWorker {

  private final PipelineOrchestrator orchestrator;
  private final IJobCheckpointRepository checkpointRepository;
  private final Executor executor;
  private final RetryTemplate retryTemplate;

  public MappingJobWorker(
      PipelineOrchestrator orchestrator,
      IJobCheckpointRepository checkpointRepository,
      @Qualifier("mappingJobExecutor") Executor executor,
      @Qualifier("checkpointRetryTemplate") RetryTemplate retryTemplate) {
    this.orchestrator = orchestrator;
    this.checkpointRepository = checkpointRepository;
    this.executor = executor;
    this.retryTemplate = retryTemplate;
  }

  public void dispatch(String jobId) {
    executor.execute(() -> run(jobId));
  }

  void run(String jobId) {
    try {
      retryTemplate.execute(context -> orchestrator.process(jobId));
    } catch (CheckpointStoreException e) {
      log.error(
          "Giving up on job {} after repeated checkpoint failures; it resumes on next start",
          jobId,
          e);
    } catch (RuntimeException e) {
      log.error("Worker failed on job {}", jobId, e);
    }
  }

  @EventListener(ApplicationReadyEvent.class)
  public void resumeUnfinishedJobs() {
    List<ProcessingState> unfinished;
    try {
      unfinished = checkpointRepository.findUnfinished();
    } catch (CheckpointStoreException e) {
      log.error("Could not list unfinished jobs for resumption", e);
      return;
    }
    if (unfinished.isEmpty()) {
      return;
    }
    log.info("Resuming {} unfinished mapping job(s)", unfinished.size());
    for (ProcessingState state : unfinished) {
      dispatch(state.getJobId());
    }
  }
}
