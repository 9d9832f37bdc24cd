package com.intellifill.mapping.dto.validation;

import com.fasterxml.jackson.annotation.JsonInclude;

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
@Schema(description = "One QA finding against a mapped form")
public class ValidationFailure {

  @Schema(description = "Failure category", example = "MISSING_REQUIRED_FIELD")
  private FailureKind kind;

  @Schema(description = "Form field the finding is about", example = "date_of_birth")
  private String targetName;

  @Schema(description = "Source field involved, if any", example = "dob")
  private String sourceName;

  @Schema(description = "Human readable explanation")
  private String message;
}
