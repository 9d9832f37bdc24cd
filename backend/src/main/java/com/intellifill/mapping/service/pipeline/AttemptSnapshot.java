package com.intellifill.mapping.service.pipeline;

import java.util.ArrayList;
import java.util.List;

import com.intellifill.mapping.dto.field.FieldMapping;
import com.intellifill.mapping.dto.validation.ValidationFailure;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Mappings and QA outcome of one attempt, kept so degraded finalization can pick the best. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AttemptSnapshot {

  private int attempt;

  @Builder.Default private List<FieldMapping> mappings = new ArrayList<>();

  @Builder.Default private List<ValidationFailure> failures = new ArrayList<>();

  private double meanConfidence;
}
