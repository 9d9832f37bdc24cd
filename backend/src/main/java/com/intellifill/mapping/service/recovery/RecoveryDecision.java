package com.intellifill.mapping.service.recovery;

import com.intellifill.mapping.service.mapping.MappingConfig;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecoveryDecision {

  private RecoveryAction action;

  /** Config for the next attempt; the unchanged input config when nothing was adjusted. */
  private MappingConfig adjustedConfig;

  private String reason;
}
