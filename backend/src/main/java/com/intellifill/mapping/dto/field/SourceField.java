package com.intellifill.mapping.dto.field;

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
@Schema(description = "A field extracted from a user document")
public class SourceField {

  @Schema(description = "Field label as found by the extractor", example = "firstName")
  private String name;

  @Schema(description = "Extracted value, empty when the label had no value", example = "John")
  @Builder.Default
  private String value = "";

  @Schema(description = "Extractor's type guess", example = "name")
  @Builder.Default
  private FieldTypeGuess type = FieldTypeGuess.TEXT;

  @Schema(description = "Surrounding text the field was extracted from")
  private String context;

  @Schema(description = "Originating document, used when merging several documents into one form")
  private String sourceDocumentId;

  public String getValue() {
    return value != null ? value : "";
  }

  public FieldTypeGuess getType() {
    return FieldTypeGuess.orDefault(type);
  }
}
