package com.intellifill.mapping.service.mapping;

import com.fasterxml.jackson.annotation.JsonIgnore;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Relative weight of each similarity signal in the composite confidence")
public class StrategyWeights {

  @Schema(example = "0.3")
  @Builder.Default
  private double lexical = 0.3;

  @Schema(example = "0.25")
  @Builder.Default
  private double tokenOverlap = 0.25;

  @Schema(example = "0.25")
  @Builder.Default
  private double typeCompatibility = 0.25;

  @Schema(example = "0.2")
  @Builder.Default
  private double alias = 0.2;

  public static StrategyWeights defaults() {
    return StrategyWeights.builder().build();
  }

  public double total() {
    return lexical + tokenOverlap + typeCompatibility + alias;
  }

  @JsonIgnore
  public boolean isUsable() {
    return lexical >= 0
        && tokenOverlap >= 0
        && typeCompatibility >= 0
        && alias >= 0
        && lexical + tokenOverlap + typeCompatibility > 0;
  }
}
