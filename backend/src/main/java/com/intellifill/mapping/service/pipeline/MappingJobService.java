package com.intellifill.mapping.service.pipeline;

import java.time.Clock;
import java.time.Instant;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.stereotype.Service;

import com.intellifill.mapping.config.MappingProperties;
import com.intellifill.mapping.dto.field.SourceField;
import com.intellifill.mapping.dto.field.TargetField;
import com.intellifill.mapping.dto.job.JobOptions;
import com.intellifill.mapping.dto.job.JobStatus;
import com.intellifill.mapping.dto.job.JobStatusResponse;
import com.intellifill.mapping.dto.job.MappingResult;
import com.intellifill.mapping.exception.JobNotFoundException;
import com.intellifill.mapping.service.lease.IJobLeaseManager;
import com.intellifill.mapping.service.storage.IJobCheckpointRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Job API: submission, status, results and cancellation of mapping jobs. */
@Slf4j
@Service
@RequiredArgsConstructor
public class MappingJobService {

  private final JobSchemaValidator schemaValidator;
  private final IJobCheckpointRepository checkpointRepository;
  private final IJobLeaseManager leaseManager;
  private final JobCancellationRegistry cancellationRegistry;
  private final MappingJobWorker worker;
  private final MappingProperties mappingProperties;
  private final Clock clock;

  /**
   * Validates and persists a new job, then hands it to a worker.
   *
   * @throws com.intellifill.mapping.exception.InvalidJobSchemaException if the schema or options
   *     are malformed
   */
  public String submit(
      List<SourceField> sourceFields, List<TargetField> targetFields, JobOptions options) {
    schemaValidator.validate(targetFields, options);

    Instant now = clock.instant();
    String jobId = UUID.randomUUID().toString();
    ProcessingState state =
        ProcessingState.builder()
            .jobId(jobId)
            .stage(Stage.CLASSIFY)
            .status(JobStatus.PENDING)
            .attempt(1)
            .sourceFields(PipelineOrchestrator.withoutNulls(sourceFields))
            .targetFields(new ArrayList<>(targetFields))
            .options(options)
            .documentTypeHint(options != null ? options.getDocumentTypeHint() : null)
            .stageStartedAt(now)
            .createdAt(now)
            .updatedAt(now)
            .build();
    checkpointRepository.save(state);
    log.info(
        "Accepted job {} with {} source and {} target fields",
        jobId,
        state.getSourceFields().size(),
        state.getTargetFields().size());

    worker.dispatch(jobId);
    return jobId;
  }

  public JobStatusResponse getStatus(String jobId) {
    return toStatus(load(jobId));
  }

  /** The final result, or empty while the job is still running. */
  public Optional<MappingResult> getResult(String jobId) {
    ProcessingState state = load(jobId);
    if (!state.getStatus().isTerminal()) {
      return Optional.empty();
    }
    return Optional.ofNullable(state.getResult());
  }

  /**
   * Requests cancellation. A running job stops before its next stage; finished jobs are left as
   * they are. The checkpoint is only rewritten while holding the job's lease. When a worker holds
   * it, the request goes through the store's cancellation marker and the in-process registry.
   */
  public JobStatusResponse cancel(String jobId) {
    ProcessingState state = load(jobId);
    if (state.getStatus().isTerminal()) {
      log.info(
          "Job {} already finished with status {}, nothing to cancel", jobId, state.getStatus());
      return toStatus(state);
    }
    cancellationRegistry.request(jobId);
    checkpointRepository.requestCancellation(jobId);

    String owner = "cancel:" + UUID.randomUUID();
    Duration leaseDuration = mappingProperties.getPipeline().getLeaseDuration();
    if (leaseManager.tryAcquire(jobId, owner, leaseDuration)) {
      try {
        state = load(jobId);
        if (!state.getStatus().isTerminal() && !state.isCancelRequested()) {
          state.setCancelRequested(true);
          state.setUpdatedAt(clock.instant());
          checkpointRepository.save(state);
        }
      } finally {
        leaseManager.release(jobId, owner);
      }
    }
    log.info("Cancellation requested for job {}", jobId);
    return toStatus(state);
  }

  private ProcessingState load(String jobId) {
    return checkpointRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
  }

  private static JobStatusResponse toStatus(ProcessingState state) {
    return JobStatusResponse.builder()
        .jobId(state.getJobId())
        .stage(state.getStage())
        .attempt(state.getAttempt())
        .status(state.getStatus())
        .build();
  }
}
