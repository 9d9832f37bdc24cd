package com.intellifill.mapping.service.mapping;

import com.intellifill.mapping.dto.field.SourceField;
import com.intellifill.mapping.dto.field.TargetField;
import com.intellifill.mapping.service.scoring.SignalScores;

import lombok.AllArgsConstructor;
import lombok.Getter;

/** One cell of the candidate matrix. */
@Getter
@AllArgsConstructor
public class ScoredPair {

  private final int sourceIndex;
  private final int targetIndex;
  private final SourceField source;
  private final TargetField target;
  private final SignalScores signals;
  private final double composite;

  public boolean isExactTypeMatch() {
    return source.getType() == target.getType();
  }
}
