package com.intellifill.mapping.controller;

import java.util.Optional;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.intellifill.mapping.dto.job.JobStatus;
import com.intellifill.mapping.dto.job.JobStatusResponse;
import com.intellifill.mapping.dto.job.JobSubmissionRequest;
import com.intellifill.mapping.dto.job.JobSubmissionResponse;
import com.intellifill.mapping.dto.job.MappingResult;
import com.intellifill.mapping.exception.GlobalExceptionHandler.ErrorResponse;
import com.intellifill.mapping.service.pipeline.MappingJobService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/jobs")
@RequiredArgsConstructor
@Tag(name = "Mapping Jobs", description = "Map extracted document fields onto form schemas")
public class MappingJobController {

  private final MappingJobService mappingJobService;

  @PostMapping(
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Submit a mapping job",
      description = "Validates the target schema and queues the job for asynchronous processing")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "202",
            description = "Job accepted",
            content = @Content(schema = @Schema(implementation = JobSubmissionResponse.class))),
        @ApiResponse(
            responseCode = "400",
            description = "Malformed schema or options",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
      })
  public ResponseEntity<JobSubmissionResponse> submit(
      @Valid @RequestBody JobSubmissionRequest request) {
    log.info(
        "Received mapping job with {} source and {} target fields",
        request.getSourceFields() != null ? request.getSourceFields().size() : 0,
        request.getTargetFields().size());
    String jobId =
        mappingJobService.submit(
            request.getSourceFields(), request.getTargetFields(), request.getOptions());
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(JobSubmissionResponse.builder().jobId(jobId).status(JobStatus.PENDING).build());
  }

  @GetMapping(value = "/{jobId}", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Get job status", description = "Current stage, attempt and status of a job")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Job found"),
        @ApiResponse(responseCode = "404", description = "Unknown job", content = @Content)
      })
  public ResponseEntity<JobStatusResponse> getStatus(@PathVariable String jobId) {
    return ResponseEntity.ok(mappingJobService.getStatus(jobId));
  }

  @GetMapping(value = "/{jobId}/result", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Get job result",
      description = "Final mappings and warnings; 202 with the job status while still running")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Job finished",
            content = @Content(schema = @Schema(implementation = MappingResult.class))),
        @ApiResponse(
            responseCode = "202",
            description = "Job still running",
            content = @Content(schema = @Schema(implementation = JobStatusResponse.class))),
        @ApiResponse(responseCode = "404", description = "Unknown job", content = @Content)
      })
  public ResponseEntity<?> getResult(@PathVariable String jobId) {
    Optional<MappingResult> result = mappingJobService.getResult(jobId);
    if (result.isPresent()) {
      return ResponseEntity.ok(result.get());
    }
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(mappingJobService.getStatus(jobId));
  }

  @DeleteMapping(value = "/{jobId}", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Cancel a job",
      description = "The job stops before its next stage; finished jobs are not changed")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "202", description = "Cancellation requested"),
        @ApiResponse(responseCode = "404", description = "Unknown job", content = @Content)
      })
  public ResponseEntity<JobStatusResponse> cancel(@PathVariable String jobId) {
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(mappingJobService.cancel(jobId));
  }
}
