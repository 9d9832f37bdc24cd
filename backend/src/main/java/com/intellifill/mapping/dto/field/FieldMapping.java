package com.intellifill.mapping.dto.field;

import java.util.Map;

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
@Schema(description = "Assignment of one extracted value to one form field")
public class FieldMapping {

  @Schema(description = "Name of the extracted source field", example = "firstName")
  private String sourceName;

  @Schema(description = "Name of the form field receiving the value", example = "first_name")
  private String targetName;

  @Schema(description = "Value carried over from the source field", example = "John")
  private String value;

  @Schema(description = "Originating document in multi-source merge mode")
  private String sourceDocumentId;

  @Schema(description = "Composite confidence in [0,1]", example = "0.9375")
  private double confidence;

  @Schema(description = "Per-strategy scores that produced the composite confidence")
  private Map<String, Double> strategyBreakdown;

  @Schema(description = "Weak accept that should be reviewed by a human", example = "false")
  private boolean flagged;
}
