package com.intellifill.mapping.config;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import com.intellifill.mapping.service.mapping.MappingConfig;
import com.intellifill.mapping.service.mapping.StrategyWeights;
import com.intellifill.mapping.service.scoring.AliasTable;

import lombok.Data;

@Data
@Component
@ConfigurationProperties(prefix = "mapping")
public class MappingProperties {

  public static final String DEFAULT_PROFILE = "DEFAULT";

  private StrategyWeights weights = StrategyWeights.defaults();
  private double candidateFloor = 0.3;
  private double assignmentThreshold = 0.6;
  private double flagMargin = 0.1;
  private double aliasFloor = 0.9;
  private double exactMatchFloor = 0.95;
  private double minimumConfidence = 0.4;
  private int maxAttempts = 3;
  private int maxReextractionAttempts = 2;
  private double thresholdStep = 0.1;
  private double typeWeightStep = 0.1;
  private boolean multiSourceMerge;

  /** Alias groups by group name. Empty means the built-in groups. */
  private Map<String, List<String>> aliases = new LinkedHashMap<>();

  /** Presets keyed by document type, e.g. {@code PASSPORT} or {@code BANK_STATEMENT}. */
  private Map<String, Profile> profiles = new LinkedHashMap<>();

  private Cache cache = new Cache();
  private Pipeline pipeline = new Pipeline();
  private Checkpoint checkpoint = new Checkpoint();
  private Retry retry = new Retry();

  /** Base config built from the top-level properties, before any profile or job override. */
  public MappingConfig toMappingConfig() {
    return MappingConfig.builder()
        .weights(weights != null ? weights.toBuilder().build() : StrategyWeights.defaults())
        .candidateFloor(candidateFloor)
        .assignmentThreshold(assignmentThreshold)
        .flagMargin(flagMargin)
        .aliasFloor(aliasFloor)
        .exactMatchFloor(exactMatchFloor)
        .minimumConfidence(minimumConfidence)
        .maxAttempts(maxAttempts)
        .maxReextractionAttempts(maxReextractionAttempts)
        .thresholdStep(thresholdStep)
        .typeWeightStep(typeWeightStep)
        .multiSourceMerge(multiSourceMerge)
        .aliasGroups(
            aliases == null || aliases.isEmpty()
                ? AliasTable.DEFAULT_GROUPS
                : new LinkedHashMap<>(aliases))
        .build();
  }

  public static String profileKey(String documentType) {
    if (documentType == null || documentType.isBlank()) {
      return DEFAULT_PROFILE;
    }
    return documentType.trim().toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]+", "_");
  }

  @Data
  public static class Profile {
    private StrategyWeights weights;
    private Double assignmentThreshold;
  }

  @Data
  public static class Cache {
    private boolean enabled = true;
    private long maxSize = 10_000;
  }

  @Data
  public static class Pipeline {
    private Duration stageTimeout = Duration.ofSeconds(30);
    private Duration leaseDuration = Duration.ofMinutes(5);
    private String workerId = "worker";
    private int corePoolSize = 4;
    private int maxPoolSize = 8;
    private int queueCapacity = 500;
  }

  @Data
  public static class Checkpoint {
    /** One of {@code memory}, {@code file} or {@code s3}. */
    private String store = "memory";

    private String directory = "./data/checkpoints";
    private String bucket;
    private String prefix = "checkpoints/";
    private String region = "us-east-1";
  }

  @Data
  public static class Retry {
    private int maxAttempts = 5;
    private long initialIntervalMs = 200;
    private double multiplier = 2.0;
    private long maxIntervalMs = 5_000;
  }
}
