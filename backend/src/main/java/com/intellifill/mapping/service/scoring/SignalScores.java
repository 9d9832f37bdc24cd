package com.intellifill.mapping.service.scoring;

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

/** The four independent similarity signals for one (source, target) pair. */
@Data
@Builder
@AllArgsConstructor
public class SignalScores {

  public static final String LEXICAL = "lexical";
  public static final String TOKEN_OVERLAP = "tokenOverlap";
  public static final String TYPE_COMPATIBILITY = "typeCompatibility";
  public static final String ALIAS = "alias";
  public static final String COMPOSITE = "composite";

  private final double lexical;
  private final double tokenOverlap;
  private final double typeCompatibility;
  private final double alias;

  /** Whether both names normalize to the same non-empty string. */
  private final boolean exactNameMatch;

  public static SignalScores zero() {
    return new SignalScores(0.0, 0.0, 0.0, 0.0, false);
  }

  public Map<String, Double> toBreakdown(double composite) {
    Map<String, Double> breakdown = new LinkedHashMap<>();
    breakdown.put(LEXICAL, round(lexical));
    breakdown.put(TOKEN_OVERLAP, round(tokenOverlap));
    breakdown.put(TYPE_COMPATIBILITY, round(typeCompatibility));
    breakdown.put(ALIAS, round(alias));
    breakdown.put(COMPOSITE, composite);
    return breakdown;
  }

  public static double round(double value) {
    return Math.round(value * 10_000d) / 10_000d;
  }
}
