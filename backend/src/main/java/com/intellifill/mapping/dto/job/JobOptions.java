package com.intellifill.mapping.dto.job;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.intellifill.mapping.service.mapping.StrategyWeights;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Per-job overrides. Unset fields fall back to the document profile, then to the defaults. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Per-job overrides of the mapping configuration")
public class JobOptions {

  @Schema(
      description = "Document category used to pick a configuration profile",
      example = "PASSPORT")
  private String documentTypeHint;

  @Schema(description = "Minimum composite confidence for an assignment", example = "0.6")
  private Double assignmentThreshold;

  @Schema(description = "Signal weights replacing the profile's weights")
  private StrategyWeights weights;

  @Schema(description = "Maximum number of mapping attempts", example = "3")
  private Integer maxAttempts;

  @Schema(description = "Allow one mapping per target and source document")
  private Boolean multiSourceMerge;
}
