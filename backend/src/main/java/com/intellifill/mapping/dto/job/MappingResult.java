package com.intellifill.mapping.dto.job;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.intellifill.mapping.dto.field.FieldMapping;
import com.intellifill.mapping.dto.validation.ValidationFailure;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Final outcome of a mapping job")
public class MappingResult {

  private String jobId;

  @Schema(example = "completed")
  private JobStatus status;

  @Builder.Default private List<FieldMapping> mappings = new ArrayList<>();

  @Schema(description = "Outstanding QA failures of a degraded result")
  @Builder.Default
  private List<ValidationFailure> warnings = new ArrayList<>();

  @Builder.Default private List<String> unmappedTargetFields = new ArrayList<>();

  @Builder.Default private List<String> unmappedSourceFields = new ArrayList<>();

  @Schema(description = "Mean confidence of the mappings, 0 when nothing was mapped")
  private double overallConfidence;

  @Schema(description = "Mapping attempts used", example = "1")
  private int attempts;

  @Schema(description = "Configuration profile that was applied", example = "PASSPORT")
  private String profileName;

  @Schema(description = "Why the job failed, for failed jobs only")
  private String failureReason;
}
