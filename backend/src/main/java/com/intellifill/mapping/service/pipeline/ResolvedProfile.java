package com.intellifill.mapping.service.pipeline;

import com.intellifill.mapping.service.mapping.MappingConfig;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class ResolvedProfile {
  private final String name;
  private final MappingConfig config;
}
