package com.intellifill.mapping.service.pipeline;

import java.util.Locale;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.intellifill.mapping.config.MappingProperties;
import com.intellifill.mapping.dto.job.JobOptions;
import com.intellifill.mapping.service.mapping.MappingConfig;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds the config for a job. Layers, lowest first: the {@code mapping.*} properties, the profile
 * matching the document type hint, then the job's own options. Hints are matched ignoring case
 * and separators, so {@code id-card}, {@code ID_CARD} and {@code IdCard} select the same profile.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MappingProfileResolver {

  private final MappingProperties mappingProperties;

  public ResolvedProfile resolve(String documentTypeHint, JobOptions options) {
    MappingConfig config = mappingProperties.toMappingConfig();
    String profileName = MappingProperties.DEFAULT_PROFILE;

    Map.Entry<String, MappingProperties.Profile> profile = findProfile(documentTypeHint);
    if (profile != null) {
      profileName = MappingProperties.profileKey(profile.getKey());
      config = applyProfile(config, profile.getValue());
    } else if (documentTypeHint != null && !documentTypeHint.isBlank()) {
      log.info("No profile for document type '{}', using defaults", documentTypeHint);
    }

    return new ResolvedProfile(profileName, applyOptions(config, options));
  }

  private Map.Entry<String, MappingProperties.Profile> findProfile(String documentTypeHint) {
    if (documentTypeHint == null || documentTypeHint.isBlank()) {
      return null;
    }
    String wanted = compact(documentTypeHint);
    for (Map.Entry<String, MappingProperties.Profile> entry :
        mappingProperties.getProfiles().entrySet()) {
      if (compact(entry.getKey()).equals(wanted)) {
        return entry;
      }
    }
    return null;
  }

  private static MappingConfig applyProfile(
      MappingConfig config, MappingProperties.Profile profile) {
    MappingConfig.MappingConfigBuilder builder = config.toBuilder();
    if (profile.getWeights() != null) {
      builder.weights(profile.getWeights().toBuilder().build());
    }
    if (profile.getAssignmentThreshold() != null) {
      builder.assignmentThreshold(profile.getAssignmentThreshold());
    }
    return builder.build();
  }

  private static MappingConfig applyOptions(MappingConfig config, JobOptions options) {
    if (options == null) {
      return config;
    }
    MappingConfig.MappingConfigBuilder builder = config.toBuilder();
    if (options.getWeights() != null) {
      builder.weights(options.getWeights().toBuilder().build());
    }
    if (options.getAssignmentThreshold() != null) {
      builder.assignmentThreshold(options.getAssignmentThreshold());
    }
    if (options.getMaxAttempts() != null) {
      builder.maxAttempts(options.getMaxAttempts());
    }
    if (options.getMultiSourceMerge() != null) {
      builder.multiSourceMerge(options.getMultiSourceMerge());
    }
    return builder.build();
  }

  private static String compact(String key) {
    return key.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]", "");
  }
}
