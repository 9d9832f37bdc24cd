package com.intellifill.mapping.service.extraction;

import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.intellifill.mapping.dto.field.SourceField;

import lombok.extern.slf4j.Slf4j;

/** Default provider when no extraction service is wired in; never supplies new fields. */
@Slf4j
@Component
public class NoOpSourceFieldProvider implements SourceFieldProvider {

  @Override
  public Optional<List<SourceField>> reextract(String jobId, String documentTypeHint, int attempt) {
    log.info("No extraction service configured, job {} keeps its source fields", jobId);
    return Optional.empty();
  }
}
