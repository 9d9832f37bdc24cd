package com.intellifill.mapping.dto.field;

import java.util.List;

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
@Schema(description = "A field of the destination form schema")
public class TargetField {

  @Schema(description = "Form field name", example = "first_name")
  private String name;

  @Schema(description = "Declared field type", example = "name")
  @Builder.Default
  private FieldTypeGuess type = FieldTypeGuess.TEXT;

  @Schema(description = "Whether the form cannot be submitted without this field", example = "true")
  private boolean required;

  @Schema(description = "Allowed values for choice fields")
  private List<String> options;

  public FieldTypeGuess getType() {
    return FieldTypeGuess.orDefault(type);
  }
}
