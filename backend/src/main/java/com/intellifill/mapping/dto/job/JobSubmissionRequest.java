package com.intellifill.mapping.dto.job;

import java.util.ArrayList;
import java.util.List;

import com.intellifill.mapping.dto.field.SourceField;
import com.intellifill.mapping.dto.field.TargetField;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request to map extracted fields onto a form schema")
public class JobSubmissionRequest {

  @Schema(description = "Fields extracted from the user's documents, in extraction order")
  @Builder.Default
  private List<SourceField> sourceFields = new ArrayList<>();

  @Schema(description = "Form schema to fill", requiredMode = Schema.RequiredMode.REQUIRED)
  @NotNull(message = "Target fields are required")
  private List<TargetField> targetFields;

  @Valid private JobOptions options;
}
