package com.intellifill.mapping.service.pipeline;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import com.intellifill.mapping.dto.field.FieldMapping;
import com.intellifill.mapping.dto.field.SourceField;
import com.intellifill.mapping.dto.field.TargetField;
import com.intellifill.mapping.dto.job.JobOptions;
import com.intellifill.mapping.dto.job.JobStatus;
import com.intellifill.mapping.dto.job.MappingResult;
import com.intellifill.mapping.dto.validation.ValidationFailure;
import com.intellifill.mapping.service.mapping.MappingConfig;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Persistent record of one job, written as a whole after every stage transition. Only the worker
 * holding the job's lease modifies it, apart from {@link #cancelRequested} which the job API may
 * set at any time.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessingState {

  private String jobId;

  @Builder.Default private Stage stage = Stage.CLASSIFY;

  @Builder.Default private JobStatus status = JobStatus.PENDING;

  @Builder.Default private int attempt = 1;

  @Builder.Default private List<SourceField> sourceFields = new ArrayList<>();

  @Builder.Default private List<TargetField> targetFields = new ArrayList<>();

  private JobOptions options;

  private String documentTypeHint;

  private String profileName;

  /** Config of the current attempt, set at CLASSIFY and replaced on each recovery. */
  private MappingConfig activeConfig;

  @Builder.Default private List<FieldMapping> currentMappings = new ArrayList<>();

  @Builder.Default private List<ValidationFailure> validationFailures = new ArrayList<>();

  /** Whether QA has run on {@link #currentMappings} and passed. */
  private boolean qaPassed;

  private AttemptSnapshot bestAttempt;

  private int reextractionAttempts;

  private boolean cancelRequested;

  private String failureReason;

  private MappingResult result;

  @Builder.Default private List<StageTransitionRecord> history = new ArrayList<>();

  private Instant stageStartedAt;

  private Instant createdAt;

  private Instant updatedAt;
}
