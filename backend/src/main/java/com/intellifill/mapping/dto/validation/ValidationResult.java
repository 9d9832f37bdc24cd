package com.intellifill.mapping.dto.validation;

import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationResult {

  private boolean valid;

  @Builder.Default private List<ValidationFailure> failures = new ArrayList<>();

  public static ValidationResult of(List<ValidationFailure> failures) {
    return ValidationResult.builder()
        .valid(failures.isEmpty())
        .failures(new ArrayList<>(failures))
        .build();
  }

  public boolean hasFailure(FailureKind kind) {
    return failures.stream().anyMatch(f -> f.getKind() == kind);
  }
}
