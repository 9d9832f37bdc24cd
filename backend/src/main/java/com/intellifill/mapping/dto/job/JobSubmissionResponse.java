package com.intellifill.mapping.dto.job;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Accepted mapping job")
public class JobSubmissionResponse {

  @Schema(description = "Job identifier", example = "2f9a7c1e-7f3c-4c52-9b1e-3f1d2a0e8b44")
  private String jobId;

  @Schema(description = "Status right after submission", example = "pending")
  private JobStatus status;
}
