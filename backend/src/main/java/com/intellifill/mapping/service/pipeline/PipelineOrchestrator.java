package com.intellifill.mapping.service.pipeline;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import com.intellifill.mapping.config.MappingProperties;
import com.intellifill.mapping.dto.field.FieldMapping;
import com.intellifill.mapping.dto.field.SourceField;
import com.intellifill.mapping.dto.field.TargetField;
import com.intellifill.mapping.dto.job.JobStatus;
import com.intellifill.mapping.dto.job.MappingResult;
import com.intellifill.mapping.dto.validation.FailureKind;
import com.intellifill.mapping.dto.validation.ValidationFailure;
import com.intellifill.mapping.dto.validation.ValidationResult;
import com.intellifill.mapping.exception.CheckpointStoreException;
import com.intellifill.mapping.service.extraction.SourceFieldProvider;
import com.intellifill.mapping.service.lease.IJobLeaseManager;
import com.intellifill.mapping.service.mapping.FieldMappingEngine;
import com.intellifill.mapping.service.mapping.MappingConfig;
import com.intellifill.mapping.service.recovery.ErrorRecoveryPolicy;
import com.intellifill.mapping.service.recovery.RecoveryAction;
import com.intellifill.mapping.service.recovery.RecoveryDecision;
import com.intellifill.mapping.service.scoring.SignalScores;
import com.intellifill.mapping.service.scoring.SimilarityCache;
import com.intellifill.mapping.service.storage.IJobCheckpointRepository;
import com.intellifill.mapping.service.validation.QaValidationGate;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Drives one job through CLASSIFY, MAP, QA, the RECOVER loop and FINALIZE. Each call runs the job
 * from its last checkpoint to a terminal status under a lease, writing a checkpoint after every
 * stage. Checkpoint store failures propagate to the caller, which retries the whole run; the next
 * run resumes from the last checkpoint that was written.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineOrchestrator {

  static final String MDC_JOB_ID = "jobId";
  static final String MDC_STAGE = "stage";
  static final String MDC_ATTEMPT = "attempt";

  private final IJobCheckpointRepository checkpointRepository;
  private final IJobLeaseManager leaseManager;
  private final FieldMappingEngine mappingEngine;
  private final QaValidationGate validationGate;
  private final ErrorRecoveryPolicy recoveryPolicy;
  private final MappingProfileResolver profileResolver;
  private final JobSchemaValidator schemaValidator;
  private final SourceFieldProvider sourceFieldProvider;
  private final JobCancellationRegistry cancellationRegistry;
  private final MappingProperties mappingProperties;
  private final Clock clock;

  /**
   * Runs a job to completion.
   *
   * @param jobId the job to run
   * @return the final state, or empty if the job does not exist or another worker holds it
   */
  public Optional<ProcessingState> process(String jobId) {
    String owner = mappingProperties.getPipeline().getWorkerId() + ":" + UUID.randomUUID();
    Duration leaseDuration = mappingProperties.getPipeline().getLeaseDuration();
    if (!leaseManager.tryAcquire(jobId, owner, leaseDuration)) {
      log.info("Job {} is being processed by another worker, skipping", jobId);
      return Optional.empty();
    }

    MDC.put(MDC_JOB_ID, jobId);
    ProcessingState state = null;
    try {
      state = checkpointRepository.findById(jobId).orElse(null);
      if (state == null) {
        log.warn("No checkpoint found for job {}", jobId);
        return Optional.empty();
      }
      if (state.getStatus().isTerminal()) {
        return Optional.of(state);
      }

      SimilarityCache cache = newCache();
      if (state.getStatus() == JobStatus.PENDING) {
        state.setStatus(JobStatus.RUNNING);
      }
      if (state.getStageStartedAt() == null) {
        state.setStageStartedAt(clock.instant());
      }
      log.info(
          "Processing job {} from stage {} attempt {}",
          jobId,
          state.getStage(),
          state.getAttempt());

      while (!state.getStatus().isTerminal()) {
        MDC.put(MDC_STAGE, state.getStage().name());
        MDC.put(MDC_ATTEMPT, String.valueOf(state.getAttempt()));

        if (isCancelled(state)) {
          cancel(state);
        } else {
          runStage(state, cache);
        }

        checkpointRepository.save(state);
        if (!state.getStatus().isTerminal()
            && !leaseManager.renew(jobId, owner, leaseDuration)) {
          log.warn("Lost lease on job {} at stage {}, stopping", jobId, state.getStage());
          break;
        }
      }

      if (state.getStatus().isTerminal()) {
        cancellationRegistry.clear(jobId);
        checkpointRepository.clearCancellation(jobId);
        log.info(
            "Job {} finished with status {} after {} attempt(s)",
            jobId,
            state.getStatus(),
            state.getAttempt());
      }
      return Optional.of(state);
    } catch (CheckpointStoreException e) {
      throw e;
    } catch (RuntimeException e) {
      log.error("Job {} failed unexpectedly", jobId, e);
      if (state == null) {
        throw e;
      }
      markFailed(state, "Unexpected error: " + e.getMessage());
      checkpointRepository.save(state);
      return Optional.of(state);
    } finally {
      leaseManager.release(jobId, owner);
      MDC.remove(MDC_STAGE);
      MDC.remove(MDC_ATTEMPT);
      MDC.remove(MDC_JOB_ID);
    }
  }

  private void runStage(ProcessingState state, SimilarityCache cache) {
    StageEvent event;
    switch (state.getStage()) {
      case CLASSIFY:
        event = classify(state);
        break;
      case MAP:
        if (isTimedOut(state)) {
          event = timeoutEvent(state);
        } else if (needsSources(state)) {
          reextract(state);
          event = StageEvent.SOURCES_REQUESTED;
        } else {
          event = map(state, cache);
        }
        break;
      case QA:
        event = isTimedOut(state) ? timeoutEvent(state) : qa(state);
        break;
      case RECOVER:
        event = recover(state);
        break;
      case FINALIZE:
        finalizeJob(state);
        return;
      case FAILED:
      default:
        markFailed(state, state.getFailureReason());
        return;
    }
    advance(state, event);
  }

  private StageEvent classify(ProcessingState state) {
    state.setSourceFields(withoutNulls(state.getSourceFields()));
    List<String> problems = schemaValidator.problems(state.getTargetFields(), state.getOptions());
    if (!problems.isEmpty()) {
      state.setFailureReason("Invalid target schema: " + String.join("; ", problems));
      return StageEvent.FATAL_ERROR;
    }
    ResolvedProfile profile =
        profileResolver.resolve(state.getDocumentTypeHint(), state.getOptions());
    state.setProfileName(profile.getName());
    state.setActiveConfig(profile.getConfig());
    log.info(
        "Classified job {} as profile {} with {} source and {} target fields",
        state.getJobId(),
        profile.getName(),
        state.getSourceFields().size(),
        state.getTargetFields().size());
    return StageEvent.CLASSIFIED;
  }

  private StageEvent map(ProcessingState state, SimilarityCache cache) {
    List<FieldMapping> mappings =
        mappingEngine.map(
            state.getSourceFields(), state.getTargetFields(), state.getActiveConfig(), cache);
    state.setCurrentMappings(mappings);
    state.setValidationFailures(new ArrayList<>());
    state.setQaPassed(false);
    log.info(
        "Attempt {} mapped {} of {} target fields",
        state.getAttempt(),
        mappings.size(),
        state.getTargetFields().size());
    return StageEvent.MAPPED;
  }

  private StageEvent qa(ProcessingState state) {
    ValidationResult result =
        validationGate.validate(
            state.getCurrentMappings(), state.getTargetFields(), state.getActiveConfig());
    state.setValidationFailures(result.getFailures());
    state.setQaPassed(result.isValid());
    rememberAttempt(state, result.getFailures());

    if (result.isValid()) {
      log.info("Attempt {} passed QA", state.getAttempt());
      return StageEvent.QA_PASSED;
    }
    log.info(
        "Attempt {} failed QA with {} failure(s)",
        state.getAttempt(),
        result.getFailures().size());
    return hasAttemptsLeft(state)
        ? StageEvent.QA_FAILED_RETRYABLE
        : StageEvent.QA_FAILED_EXHAUSTED;
  }

  private StageEvent recover(ProcessingState state) {
    MappingConfig config = state.getActiveConfig();
    RecoveryDecision decision =
        recoveryPolicy.decide(
            state.getValidationFailures(),
            config,
            state.getAttempt(),
            usableSourceCount(state.getSourceFields()),
            state.getReextractionAttempts());
    log.info(
        "Recovery for attempt {}: {} ({})",
        state.getAttempt(),
        decision.getAction(),
        decision.getReason());

    if (decision.getAction() == RecoveryAction.ACCEPT_DEGRADED) {
      return StageEvent.RECOVERY_ABANDONED;
    }
    // A re-extraction decision keeps the config; MAP issues the request before mapping again.
    state.setActiveConfig(decision.getAdjustedConfig());
    state.setAttempt(state.getAttempt() + 1);
    return StageEvent.RECOVERY_SCHEDULED;
  }

  private boolean needsSources(ProcessingState state) {
    return usableSourceCount(state.getSourceFields()) == 0
        && state.getReextractionAttempts() < state.getActiveConfig().getMaxReextractionAttempts();
  }

  private void reextract(ProcessingState state) {
    int requestNumber = state.getReextractionAttempts() + 1;
    state.setReextractionAttempts(requestNumber);
    Optional<List<SourceField>> fresh =
        sourceFieldProvider.reextract(state.getJobId(), state.getDocumentTypeHint(), requestNumber);
    List<SourceField> supplied = fresh.map(PipelineOrchestrator::withoutNulls).orElse(List.of());
    if (!supplied.isEmpty()) {
      state.setSourceFields(supplied);
      log.info("Re-extraction {} supplied {} source fields", requestNumber, supplied.size());
    } else {
      log.info("Re-extraction {} supplied no new source fields", requestNumber);
    }
  }

  private void finalizeJob(ProcessingState state) {
    List<FieldMapping> mappings;
    List<ValidationFailure> warnings;
    if (state.isQaPassed()) {
      mappings = state.getCurrentMappings();
      warnings = new ArrayList<>();
    } else {
      AttemptSnapshot best = state.getBestAttempt();
      if (best == null) {
        MappingConfig config =
            state.getActiveConfig() != null ? state.getActiveConfig() : MappingConfig.defaults();
        ValidationResult result =
            validationGate.validate(state.getCurrentMappings(), state.getTargetFields(), config);
        best = snapshot(state.getAttempt(), state.getCurrentMappings(), result.getFailures());
      }
      mappings = best.getMappings();
      warnings = new ArrayList<>(best.getFailures());
    }
    if (usableSourceCount(state.getSourceFields()) == 0) {
      warnings.add(
          ValidationFailure.builder()
              .kind(FailureKind.NO_USABLE_SOURCES)
              .message(
                  "No usable source fields after "
                      + state.getReextractionAttempts()
                      + " re-extraction request(s)")
              .build());
    }

    JobStatus status =
        warnings.isEmpty() ? JobStatus.COMPLETED : JobStatus.COMPLETED_WITH_WARNINGS;
    state.setStatus(status);
    state.setResult(
        MappingResult.builder()
            .jobId(state.getJobId())
            .status(status)
            .mappings(new ArrayList<>(mappings))
            .warnings(new ArrayList<>(warnings))
            .unmappedTargetFields(unmappedTargets(state.getTargetFields(), mappings))
            .unmappedSourceFields(unmappedSources(state.getSourceFields(), mappings))
            .overallConfidence(meanConfidence(mappings))
            .attempts(state.getAttempt())
            .profileName(state.getProfileName())
            .build());
    touch(state);
  }

  private void advance(ProcessingState state, StageEvent event) {
    Stage from = state.getStage();
    Stage to = StageTransitions.next(from, event);
    Instant now = clock.instant();
    state.getHistory()
        .add(
            StageTransitionRecord.builder()
                .from(from)
                .to(to)
                .event(event)
                .attempt(state.getAttempt())
                .at(now)
                .build());
    state.setStage(to);
    state.setStageStartedAt(now);
    state.setUpdatedAt(now);
    if (to == Stage.FAILED) {
      markFailed(state, state.getFailureReason());
    }
    log.debug("Job {} moved {} -> {} on {}", state.getJobId(), from, to, event);
  }

  private boolean isTimedOut(ProcessingState state) {
    Duration timeout = mappingProperties.getPipeline().getStageTimeout();
    Instant startedAt = state.getStageStartedAt();
    if (timeout == null || startedAt == null) {
      return false;
    }
    boolean timedOut = clock.instant().isAfter(startedAt.plus(timeout));
    if (timedOut) {
      log.warn(
          "Stage {} of job {} exceeded its {} timeout",
          state.getStage(),
          state.getJobId(),
          timeout);
    }
    return timedOut;
  }

  private StageEvent timeoutEvent(ProcessingState state) {
    return hasAttemptsLeft(state)
        ? StageEvent.STAGE_TIMED_OUT_RETRYABLE
        : StageEvent.STAGE_TIMED_OUT_EXHAUSTED;
  }

  private boolean hasAttemptsLeft(ProcessingState state) {
    return state.getAttempt() < state.getActiveConfig().getMaxAttempts();
  }

  private boolean isCancelled(ProcessingState state) {
    return state.isCancelRequested()
        || cancellationRegistry.isRequested(state.getJobId())
        || checkpointRepository.isCancellationRequested(state.getJobId());
  }

  private void cancel(ProcessingState state) {
    log.info("Job {} cancelled at stage {}", state.getJobId(), state.getStage());
    state.setCancelRequested(true);
    state.setStatus(JobStatus.CANCELLED);
    state.setResult(
        MappingResult.builder()
            .jobId(state.getJobId())
            .status(JobStatus.CANCELLED)
            .attempts(state.getAttempt())
            .profileName(state.getProfileName())
            .build());
    touch(state);
  }

  private void markFailed(ProcessingState state, String reason) {
    state.setStatus(JobStatus.FAILED);
    state.setFailureReason(reason);
    state.setResult(
        MappingResult.builder()
            .jobId(state.getJobId())
            .status(JobStatus.FAILED)
            .attempts(state.getAttempt())
            .profileName(state.getProfileName())
            .failureReason(reason)
            .build());
    touch(state);
  }

  private void rememberAttempt(ProcessingState state, List<ValidationFailure> failures) {
    AttemptSnapshot candidate = snapshot(state.getAttempt(), state.getCurrentMappings(), failures);
    AttemptSnapshot best = state.getBestAttempt();
    if (best == null
        || recoveryPolicy.isBetter(
            candidate.getFailures().size(),
            candidate.getMeanConfidence(),
            best.getFailures().size(),
            best.getMeanConfidence())) {
      state.setBestAttempt(candidate);
    }
  }

  private SimilarityCache newCache() {
    MappingProperties.Cache cacheProperties = mappingProperties.getCache();
    return cacheProperties.isEnabled()
        ? SimilarityCache.withMaximumSize(cacheProperties.getMaxSize())
        : SimilarityCache.disabled();
  }

  private void touch(ProcessingState state) {
    state.setUpdatedAt(clock.instant());
  }

  private static AttemptSnapshot snapshot(
      int attempt, List<FieldMapping> mappings, List<ValidationFailure> failures) {
    return AttemptSnapshot.builder()
        .attempt(attempt)
        .mappings(new ArrayList<>(mappings))
        .failures(new ArrayList<>(failures))
        .meanConfidence(meanConfidence(mappings))
        .build();
  }

  /** Copy of {@code sources} without null entries; null input gives an empty list. */
  static List<SourceField> withoutNulls(List<SourceField> sources) {
    List<SourceField> present = new ArrayList<>();
    if (sources != null) {
      for (SourceField source : sources) {
        if (source != null) {
          present.add(source);
        }
      }
    }
    return present;
  }

  static int usableSourceCount(List<SourceField> sources) {
    if (sources == null) {
      return 0;
    }
    int usable = 0;
    for (SourceField source : sources) {
      if (source != null
          && source.getName() != null
          && !source.getName().isBlank()
          && !source.getValue().isBlank()) {
        usable++;
      }
    }
    return usable;
  }

  private static double meanConfidence(List<FieldMapping> mappings) {
    if (mappings.isEmpty()) {
      return 0.0;
    }
    double total = 0.0;
    for (FieldMapping mapping : mappings) {
      total += mapping.getConfidence();
    }
    return SignalScores.round(total / mappings.size());
  }

  private static List<String> unmappedTargets(
      List<TargetField> targets, List<FieldMapping> mappings) {
    Set<String> mapped = new HashSet<>();
    for (FieldMapping mapping : mappings) {
      mapped.add(mapping.getTargetName());
    }
    List<String> unmapped = new ArrayList<>();
    for (TargetField target : targets) {
      if (!mapped.contains(target.getName())) {
        unmapped.add(target.getName());
      }
    }
    return unmapped;
  }

  private static List<String> unmappedSources(
      List<SourceField> sources, List<FieldMapping> mappings) {
    Set<String> used = new HashSet<>();
    for (FieldMapping mapping : mappings) {
      used.add(sourceKey(mapping.getSourceName(), mapping.getSourceDocumentId()));
    }
    List<String> unmapped = new ArrayList<>();
    for (SourceField source : sources) {
      if (source == null) {
        continue;
      }
      if (!used.contains(sourceKey(source.getName(), source.getSourceDocumentId()))) {
        unmapped.add(source.getName());
      }
    }
    return unmapped;
  }

  private static String sourceKey(String name, String documentId) {
    return name + "|" + Objects.toString(documentId, "");
  }
}
