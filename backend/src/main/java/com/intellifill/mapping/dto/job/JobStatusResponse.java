package com.intellifill.mapping.dto.job;

import com.intellifill.mapping.service.pipeline.Stage;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Progress of a mapping job")
public class JobStatusResponse {

  private String jobId;

  @Schema(description = "Pipeline stage the job is in or ended at", example = "QA")
  private Stage stage;

  @Schema(description = "Current mapping attempt, starting at 1", example = "1")
  private int attempt;

  @Schema(example = "running")
  private JobStatus status;
}
