package com.intellifill.mapping.UnitTests.service.pipeline;

import static com.intellifill.mapping.fixtures.TestFixtures.source;
import static com.intellifill.mapping.fixtures.TestFixtures.target;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import com.intellifill.mapping.config.MappingProperties;
import com.intellifill.mapping.dto.field.FieldMapping;
import com.intellifill.mapping.dto.field.FieldTypeGuess;
import com.intellifill.mapping.dto.field.SourceField;
import com.intellifill.mapping.dto.field.TargetField;
import com.intellifill.mapping.dto.job.JobOptions;
import com.intellifill.mapping.dto.job.JobStatus;
import com.intellifill.mapping.dto.job.MappingResult;
import com.intellifill.mapping.dto.validation.FailureKind;
import com.intellifill.mapping.dto.validation.ValidationFailure;
import com.intellifill.mapping.exception.CheckpointStoreException;
import com.intellifill.mapping.fixtures.TestFixtures;
import com.intellifill.mapping.service.extraction.SourceFieldProvider;
import com.intellifill.mapping.service.lease.InMemoryJobLeaseManager;
import com.intellifill.mapping.service.mapping.FieldMappingEngine;
import com.intellifill.mapping.service.mapping.MappingConfig;
import com.intellifill.mapping.service.pipeline.JobCancellationRegistry;
import com.intellifill.mapping.service.pipeline.JobSchemaValidator;
import com.intellifill.mapping.service.pipeline.MappingProfileResolver;
import com.intellifill.mapping.service.pipeline.PipelineOrchestrator;
import com.intellifill.mapping.service.pipeline.ProcessingState;
import com.intellifill.mapping.service.pipeline.Stage;
import com.intellifill.mapping.service.pipeline.StageEvent;
import com.intellifill.mapping.service.pipeline.StageTransitionRecord;
import com.intellifill.mapping.service.recovery.ErrorRecoveryPolicy;
import com.intellifill.mapping.service.scoring.SimilarityScorer;
import com.intellifill.mapping.service.storage.InMemoryJobCheckpointRepository;
import com.intellifill.mapping.service.validation.QaValidationGate;

@ExtendWith(MockitoExtension.class)
@DisplayName("PipelineOrchestrator Tests")
class PipelineOrchestratorTest {

  private static final String JOB_ID = "job-1";

  @Mock private SourceFieldProvider sourceFieldProvider;

  private InMemoryJobCheckpointRepository repository;
  private InMemoryJobLeaseManager leaseManager;
  private JobCancellationRegistry cancellationRegistry;
  private MappingProperties mappingProperties;
  private PipelineOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    repository = spy(new InMemoryJobCheckpointRepository(TestFixtures.objectMapper()));
    leaseManager = new InMemoryJobLeaseManager(TestFixtures.fixedClock());
    cancellationRegistry = new JobCancellationRegistry();
    mappingProperties = new MappingProperties();
    orchestrator =
        new PipelineOrchestrator(
            repository,
            leaseManager,
            new FieldMappingEngine(new SimilarityScorer()),
            new QaValidationGate(),
            new ErrorRecoveryPolicy(),
            new MappingProfileResolver(mappingProperties),
            new JobSchemaValidator(),
            sourceFieldProvider,
            cancellationRegistry,
            mappingProperties,
            TestFixtures.fixedClock());
  }

  private void store(ProcessingState state) {
    repository.save(state);
    clearInvocations(repository);
  }

  private ProcessingState run() {
    Optional<ProcessingState> result = orchestrator.process(JOB_ID);
    assertThat(result).isPresent();
    return result.get();
  }

  private static List<SourceField> unrelatedSources() {
    return List.of(source("first_name", "John", FieldTypeGuess.NAME));
  }

  private static List<TargetField> passportForm() {
    return List.of(target("passport_number", FieldTypeGuess.NUMERIC, true));
  }

  private static List<Stage> path(ProcessingState state) {
    List<Stage> stages = new ArrayList<>();
    for (StageTransitionRecord record : state.getHistory()) {
      if (stages.isEmpty()) {
        stages.add(record.getFrom());
      }
      stages.add(record.getTo());
    }
    return stages;
  }

  @Nested
  @DisplayName("Happy path")
  class HappyPathTests {

    @Test
    @DisplayName("Should complete a clean job on the first attempt")
    void shouldCompleteCleanJob() {
      store(
          TestFixtures.pendingState(
              JOB_ID, TestFixtures.applicantSources(), TestFixtures.applicantForm()));

      ProcessingState state = run();

      assertThat(state.getStatus()).isEqualTo(JobStatus.COMPLETED);
      assertThat(state.getStage()).isEqualTo(Stage.FINALIZE);
      assertThat(state.getAttempt()).isEqualTo(1);
      assertThat(path(state)).containsExactly(Stage.CLASSIFY, Stage.MAP, Stage.QA, Stage.FINALIZE);
      assertThat(state.getProfileName()).isEqualTo(MappingProperties.DEFAULT_PROFILE);

      MappingResult result = state.getResult();
      assertThat(result.getStatus()).isEqualTo(JobStatus.COMPLETED);
      assertThat(result.getMappings()).hasSize(5);
      assertThat(result.getWarnings()).isEmpty();
      assertThat(result.getUnmappedTargetFields()).isEmpty();
      assertThat(result.getUnmappedSourceFields()).isEmpty();
      assertThat(result.getOverallConfidence()).isBetween(0.9, 1.0);
      assertThat(result.getAttempts()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should checkpoint after every stage")
    void shouldCheckpointAfterEveryStage() {
      store(
          TestFixtures.pendingState(
              JOB_ID, TestFixtures.applicantSources(), TestFixtures.applicantForm()));

      run();

      verify(repository, times(4)).save(any(ProcessingState.class));
      ProcessingState stored = repository.findById(JOB_ID).orElseThrow();
      assertThat(stored.getStatus()).isEqualTo(JobStatus.COMPLETED);
      assertThat(stored.getResult().getMappings()).hasSize(5);
    }

    @Test
    @DisplayName("Should release the lease and clear the logging context when done")
    void shouldReleaseLeaseAndMdc() {
      store(
          TestFixtures.pendingState(
              JOB_ID, TestFixtures.applicantSources(), TestFixtures.applicantForm()));

      run();

      assertThat(leaseManager.isHeld(JOB_ID)).isFalse();
      assertThat(MDC.get("jobId")).isNull();
      assertThat(MDC.get("stage")).isNull();
      assertThat(MDC.get("attempt")).isNull();
    }

    @Test
    @DisplayName("Should return a finished job without running it again")
    void shouldNotRerunFinishedJob() {
      store(
          TestFixtures.pendingState(
              JOB_ID, TestFixtures.applicantSources(), TestFixtures.applicantForm()));
      run();
      clearInvocations(repository);

      ProcessingState again = run();

      assertThat(again.getStatus()).isEqualTo(JobStatus.COMPLETED);
      verify(repository, times(0)).save(any(ProcessingState.class));
    }

    @Test
    @DisplayName("Should apply the profile matching the document type hint")
    void shouldApplyDocumentProfile() {
      MappingProperties.Profile passport = new MappingProperties.Profile();
      passport.setAssignmentThreshold(0.65);
      mappingProperties.getProfiles().put("PASSPORT", passport);
      ProcessingState pending =
          TestFixtures.pendingState(
              JOB_ID, TestFixtures.applicantSources(), TestFixtures.applicantForm());
      pending.setDocumentTypeHint("passport");
      store(pending);

      ProcessingState state = run();

      assertThat(state.getProfileName()).isEqualTo("PASSPORT");
      assertThat(state.getActiveConfig().getAssignmentThreshold()).isEqualTo(0.65);
      assertThat(state.getResult().getProfileName()).isEqualTo("PASSPORT");
    }
  }

  @Nested
  @DisplayName("Recovery loop")
  class RecoveryTests {

    @Test
    @DisplayName("Should use every attempt and finish with warnings when nothing fits")
    void shouldFinishDegradedAfterAllAttempts() {
      store(TestFixtures.pendingState(JOB_ID, unrelatedSources(), passportForm()));

      ProcessingState state = run();

      assertThat(state.getStatus()).isEqualTo(JobStatus.COMPLETED_WITH_WARNINGS);
      assertThat(state.getAttempt()).isEqualTo(3);
      assertThat(state.getHistory()).hasSize(9);
      assertThat(state.getHistory().get(8).getEvent()).isEqualTo(StageEvent.QA_FAILED_EXHAUSTED);
      MappingResult result = state.getResult();
      assertThat(result.getMappings()).isEmpty();
      assertThat(result.getWarnings())
          .extracting(ValidationFailure::getKind)
          .containsExactly(FailureKind.MISSING_REQUIRED_FIELD);
      assertThat(result.getUnmappedTargetFields()).containsExactly("passport_number");
      assertThat(result.getUnmappedSourceFields()).containsExactly("first_name");
      assertThat(result.getOverallConfidence()).isEqualTo(0.0);
      assertThat(result.getAttempts()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should widen the config between attempts")
    void shouldWidenBetweenAttempts() {
      store(TestFixtures.pendingState(JOB_ID, unrelatedSources(), passportForm()));

      ProcessingState state = run();

      assertThat(state.getActiveConfig().getAssignmentThreshold()).isEqualTo(0.4);
    }

    @Test
    @DisplayName("Should honour a single-attempt budget from the job options")
    void shouldHonourMaxAttemptsOption() {
      ProcessingState pending =
          TestFixtures.pendingState(JOB_ID, unrelatedSources(), passportForm());
      pending.setOptions(JobOptions.builder().maxAttempts(1).build());
      store(pending);

      ProcessingState state = run();

      assertThat(state.getStatus()).isEqualTo(JobStatus.COMPLETED_WITH_WARNINGS);
      assertThat(state.getAttempt()).isEqualTo(1);
      assertThat(path(state)).containsExactly(Stage.CLASSIFY, Stage.MAP, Stage.QA, Stage.FINALIZE);
    }

    @Test
    @DisplayName("Should re-extract when no source field is usable")
    void shouldReextractEmptySources() {
      when(sourceFieldProvider.reextract(eq(JOB_ID), any(), eq(1)))
          .thenReturn(Optional.of(TestFixtures.applicantSources()));
      store(TestFixtures.pendingState(JOB_ID, List.of(), TestFixtures.applicantForm()));

      ProcessingState state = run();

      assertThat(state.getStatus()).isEqualTo(JobStatus.COMPLETED);
      assertThat(state.getAttempt()).isEqualTo(1);
      assertThat(state.getReextractionAttempts()).isEqualTo(1);
      assertThat(path(state))
          .containsExactly(Stage.CLASSIFY, Stage.MAP, Stage.MAP, Stage.QA, Stage.FINALIZE);
      assertThat(state.getHistory().get(1).getEvent()).isEqualTo(StageEvent.SOURCES_REQUESTED);
      assertThat(state.getResult().getMappings()).hasSize(5);
      assertThat(state.getResult().getWarnings()).isEmpty();
    }

    @Test
    @DisplayName("Should stop asking for re-extraction once the budget is spent")
    void shouldBoundReextraction() {
      store(TestFixtures.pendingState(JOB_ID, List.of(), TestFixtures.applicantForm()));

      ProcessingState state = run();

      verify(sourceFieldProvider, times(2)).reextract(eq(JOB_ID), any(), anyInt());
      assertThat(state.getReextractionAttempts()).isEqualTo(2);
      assertThat(state.getStatus()).isEqualTo(JobStatus.COMPLETED_WITH_WARNINGS);
      assertThat(state.getResult().getWarnings())
          .extracting(ValidationFailure::getKind, ValidationFailure::getTargetName)
          .containsExactly(
              tuple(FailureKind.MISSING_REQUIRED_FIELD, "first_name"),
              tuple(FailureKind.MISSING_REQUIRED_FIELD, "last_name"),
              tuple(FailureKind.MISSING_REQUIRED_FIELD, "email"),
              tuple(FailureKind.NO_USABLE_SOURCES, null));
    }

    @Test
    @DisplayName("Should keep the full attempt budget for retries after re-extraction")
    void shouldNotSpendAttemptsOnReextraction() {
      when(sourceFieldProvider.reextract(eq(JOB_ID), any(), eq(1))).thenReturn(Optional.empty());
      when(sourceFieldProvider.reextract(eq(JOB_ID), any(), eq(2)))
          .thenReturn(Optional.of(unrelatedSources()));
      store(TestFixtures.pendingState(JOB_ID, List.of(), passportForm()));

      ProcessingState state = run();

      assertThat(state.getReextractionAttempts()).isEqualTo(2);
      assertThat(state.getAttempt()).isEqualTo(3);
      assertThat(state.getHistory())
          .extracting(StageTransitionRecord::getEvent)
          .containsExactly(
              StageEvent.CLASSIFIED,
              StageEvent.SOURCES_REQUESTED,
              StageEvent.SOURCES_REQUESTED,
              StageEvent.MAPPED,
              StageEvent.QA_FAILED_RETRYABLE,
              StageEvent.RECOVERY_SCHEDULED,
              StageEvent.MAPPED,
              StageEvent.QA_FAILED_RETRYABLE,
              StageEvent.RECOVERY_SCHEDULED,
              StageEvent.MAPPED,
              StageEvent.QA_FAILED_EXHAUSTED);
      assertThat(state.getActiveConfig().getAssignmentThreshold()).isEqualTo(0.4);
    }

    @Test
    @DisplayName("Should ask for re-extraction even when QA has nothing required to check")
    void shouldReextractBeforeMappingOptionalForm() {
      store(
          TestFixtures.pendingState(
              JOB_ID, List.of(), List.of(target("nickname", FieldTypeGuess.TEXT, false))));

      ProcessingState state = run();

      verify(sourceFieldProvider, times(2)).reextract(eq(JOB_ID), any(), anyInt());
      assertThat(state.getAttempt()).isEqualTo(1);
      assertThat(state.getStatus()).isEqualTo(JobStatus.COMPLETED_WITH_WARNINGS);
      assertThat(state.getResult().getWarnings())
          .extracting(ValidationFailure::getKind)
          .containsExactly(FailureKind.NO_USABLE_SOURCES);
      assertThat(state.getResult().getUnmappedTargetFields()).containsExactly("nickname");
    }

    @Test
    @DisplayName("Should drop null source fields instead of failing the job")
    void shouldIgnoreNullSourceFields() {
      List<SourceField> sources = new ArrayList<>();
      sources.add(source("first_name", "John", FieldTypeGuess.NAME));
      sources.add(null);
      store(
          TestFixtures.pendingState(
              JOB_ID, sources, List.of(target("first_name", FieldTypeGuess.NAME, true))));

      ProcessingState state = run();

      assertThat(state.getStatus()).isEqualTo(JobStatus.COMPLETED);
      assertThat(state.getSourceFields()).hasSize(1);
      assertThat(state.getResult().getMappings())
          .extracting(FieldMapping::getTargetName)
          .containsExactly("first_name");
      assertThat(state.getResult().getUnmappedSourceFields()).isEmpty();
      verifyNoInteractions(sourceFieldProvider);
    }

    @Test
    @DisplayName("Should not ask for re-extraction while sources are usable")
    void shouldNotReextractUsableSources() {
      store(TestFixtures.pendingState(JOB_ID, unrelatedSources(), passportForm()));

      run();

      verifyNoInteractions(sourceFieldProvider);
    }
  }

  @Nested
  @DisplayName("Resumption and timeouts")
  class ResumeTests {

    private ProcessingState atMap(int attempt, Duration startedAgo) {
      ProcessingState state =
          TestFixtures.pendingState(
              JOB_ID, TestFixtures.applicantSources(), TestFixtures.applicantForm());
      state.setStage(Stage.MAP);
      state.setStatus(JobStatus.RUNNING);
      state.setAttempt(attempt);
      state.setActiveConfig(MappingConfig.defaults());
      state.setStageStartedAt(TestFixtures.NOW.minus(startedAgo));
      return state;
    }

    @Test
    @DisplayName("Should resume from the checkpointed stage without classifying again")
    void shouldResumeFromCheckpoint() {
      store(atMap(1, Duration.ofSeconds(5)));

      ProcessingState state = run();

      assertThat(state.getStatus()).isEqualTo(JobStatus.COMPLETED);
      assertThat(state.getProfileName()).isNull();
      assertThat(path(state)).containsExactly(Stage.MAP, Stage.QA, Stage.FINALIZE);
    }

    @Test
    @DisplayName("Should finish a resumed checkpoint that still holds null source fields")
    void shouldResumeWithNullSourceFields() {
      ProcessingState resumed = atMap(1, Duration.ofSeconds(5));
      resumed.getSourceFields().add(null);
      store(resumed);

      ProcessingState state = run();

      assertThat(state.getStatus()).isEqualTo(JobStatus.COMPLETED);
      assertThat(state.getResult().getMappings()).hasSize(5);
      assertThat(state.getResult().getUnmappedSourceFields()).isEmpty();
    }

    @Test
    @DisplayName("Should retry a stage that ran past its timeout")
    void shouldRetryTimedOutStage() {
      store(atMap(1, Duration.ofMinutes(1)));

      ProcessingState state = run();

      assertThat(state.getHistory().get(0).getEvent())
          .isEqualTo(StageEvent.STAGE_TIMED_OUT_RETRYABLE);
      assertThat(path(state))
          .containsExactly(Stage.MAP, Stage.RECOVER, Stage.MAP, Stage.QA, Stage.FINALIZE);
      assertThat(state.getAttempt()).isEqualTo(2);
      assertThat(state.getStatus()).isEqualTo(JobStatus.COMPLETED);
    }

    @Test
    @DisplayName("Should finalize a timed out stage on the last attempt")
    void shouldFinalizeTimedOutLastAttempt() {
      store(atMap(3, Duration.ofMinutes(1)));

      ProcessingState state = run();

      assertThat(state.getHistory()).hasSize(1);
      assertThat(state.getHistory().get(0).getEvent())
          .isEqualTo(StageEvent.STAGE_TIMED_OUT_EXHAUSTED);
      assertThat(state.getStatus()).isEqualTo(JobStatus.COMPLETED_WITH_WARNINGS);
      assertThat(state.getResult().getWarnings())
          .extracting(ValidationFailure::getKind)
          .containsOnly(FailureKind.MISSING_REQUIRED_FIELD);
    }
  }

  @Nested
  @DisplayName("Cancellation and failure")
  class TerminationTests {

    @Test
    @DisplayName("Should stop before the next stage when cancellation is requested")
    void shouldCancelThroughRegistry() {
      store(
          TestFixtures.pendingState(
              JOB_ID, TestFixtures.applicantSources(), TestFixtures.applicantForm()));
      cancellationRegistry.request(JOB_ID);

      ProcessingState state = run();

      assertThat(state.getStatus()).isEqualTo(JobStatus.CANCELLED);
      assertThat(state.getStage()).isEqualTo(Stage.CLASSIFY);
      assertThat(state.getHistory()).isEmpty();
      assertThat(state.getResult().getStatus()).isEqualTo(JobStatus.CANCELLED);
      assertThat(cancellationRegistry.isRequested(JOB_ID)).isFalse();
    }

    @Test
    @DisplayName("Should honour a cancellation flag stored in the checkpoint")
    void shouldCancelThroughCheckpointFlag() {
      ProcessingState pending =
          TestFixtures.pendingState(
              JOB_ID, TestFixtures.applicantSources(), TestFixtures.applicantForm());
      pending.setCancelRequested(true);
      store(pending);

      ProcessingState state = run();

      assertThat(state.getStatus()).isEqualTo(JobStatus.CANCELLED);
      assertThat(repository.findById(JOB_ID).orElseThrow().getStatus())
          .isEqualTo(JobStatus.CANCELLED);
    }

    @Test
    @DisplayName("Should honour a cancellation marker kept by the checkpoint store")
    void shouldCancelThroughStoreMarker() {
      store(
          TestFixtures.pendingState(
              JOB_ID, TestFixtures.applicantSources(), TestFixtures.applicantForm()));
      repository.requestCancellation(JOB_ID);

      ProcessingState state = run();

      assertThat(state.getStatus()).isEqualTo(JobStatus.CANCELLED);
      assertThat(state.getHistory()).isEmpty();
      assertThat(repository.isCancellationRequested(JOB_ID)).isFalse();
    }

    @Test
    @DisplayName("Should fail a job whose target schema is invalid")
    void shouldFailInvalidSchema() {
      store(TestFixtures.pendingState(JOB_ID, TestFixtures.applicantSources(), List.of()));

      ProcessingState state = run();

      assertThat(state.getStatus()).isEqualTo(JobStatus.FAILED);
      assertThat(state.getStage()).isEqualTo(Stage.FAILED);
      assertThat(state.getFailureReason()).startsWith("Invalid target schema");
      assertThat(state.getHistory()).hasSize(1);
      assertThat(state.getHistory().get(0).getEvent()).isEqualTo(StageEvent.FATAL_ERROR);
      assertThat(state.getResult().getFailureReason()).isEqualTo(state.getFailureReason());
    }

    @Test
    @DisplayName("Should fail the job when a collaborator throws")
    void shouldFailOnUnexpectedError() {
      when(sourceFieldProvider.reextract(eq(JOB_ID), any(), anyInt()))
          .thenThrow(new IllegalStateException("extractor down"));
      store(TestFixtures.pendingState(JOB_ID, List.of(), TestFixtures.applicantForm()));

      ProcessingState state = run();

      assertThat(state.getStatus()).isEqualTo(JobStatus.FAILED);
      assertThat(state.getFailureReason()).contains("extractor down");
      assertThat(repository.findById(JOB_ID).orElseThrow().getStatus())
          .isEqualTo(JobStatus.FAILED);
    }

    @Test
    @DisplayName("Should propagate checkpoint failures and release the lease")
    void shouldPropagateCheckpointFailures() {
      store(
          TestFixtures.pendingState(
              JOB_ID, TestFixtures.applicantSources(), TestFixtures.applicantForm()));
      doThrow(new CheckpointStoreException("store down"))
          .when(repository)
          .save(any(ProcessingState.class));

      assertThatThrownBy(() -> orchestrator.process(JOB_ID))
          .isInstanceOf(CheckpointStoreException.class)
          .hasMessage("store down");
      assertThat(leaseManager.isHeld(JOB_ID)).isFalse();
      assertThat(repository.findById(JOB_ID).orElseThrow().getStatus())
          .isEqualTo(JobStatus.PENDING);
    }
  }

  @Nested
  @DisplayName("Leases")
  class LeaseTests {

    @Test
    @DisplayName("Should skip a job leased by another worker")
    void shouldSkipLeasedJob() {
      store(
          TestFixtures.pendingState(
              JOB_ID, TestFixtures.applicantSources(), TestFixtures.applicantForm()));
      leaseManager.tryAcquire(JOB_ID, "other-worker", Duration.ofMinutes(5));

      assertThat(orchestrator.process(JOB_ID)).isEmpty();
      verify(repository, times(0)).save(any(ProcessingState.class));
      assertThat(leaseManager.isHeld(JOB_ID)).isTrue();
    }

    @Test
    @DisplayName("Should return empty for an unknown job and release the lease")
    void shouldHandleUnknownJob() {
      assertThat(orchestrator.process("missing")).isEmpty();
      assertThat(leaseManager.isHeld("missing")).isFalse();
    }
  }
}
