package com.intellifill.mapping.service.pipeline;

import java.time.Instant;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StageTransitionRecord {
  private Stage from;
  private Stage to;
  private StageEvent event;
  private int attempt;
  private Instant at;
}
