package com.intellifill.mapping.service.extraction;

import java.util.List;
import java.util.Optional;

import com.intellifill.mapping.dto.field.SourceField;

/** Upstream extraction collaborator, asked for another pass when a job has nothing to map. */
public interface SourceFieldProvider {

  /**
   * Re-runs extraction for a job.
   *
   * @param jobId the job identifier
   * @param documentTypeHint the document category, may be null
   * @param attempt 1-based re-extraction attempt
   * @return new source fields, or empty if the provider has nothing new to offer
   */
  Optional<List<SourceField>> reextract(String jobId, String documentTypeHint, int attempt);
}
