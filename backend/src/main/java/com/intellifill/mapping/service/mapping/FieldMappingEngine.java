package com.intellifill.mapping.service.mapping;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.intellifill.mapping.dto.field.FieldMapping;
import com.intellifill.mapping.dto.field.SourceField;
import com.intellifill.mapping.dto.field.TargetField;
import com.intellifill.mapping.service.scoring.AliasTable;
import com.intellifill.mapping.service.scoring.SignalScores;
import com.intellifill.mapping.service.scoring.SimilarityCache;
import com.intellifill.mapping.service.scoring.SimilarityScorer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Resolves extracted source fields onto a target schema. Every (source, target) pair gets a
 * composite confidence; candidates above the floor are allocated greedily from the highest score
 * down, so each target receives at most one source (one per source document in merge mode) and
 * each source is used at most once.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FieldMappingEngine {

  private static final double BELOW_EXACT_CAP = 0.9999;

  static final Comparator<ScoredPair> ALLOCATION_ORDER =
      Comparator.comparingDouble(ScoredPair::getComposite)
          .reversed()
          .thenComparing(ScoredPair::isExactTypeMatch, Comparator.reverseOrder())
          .thenComparingInt(p -> p.getTarget().getName().length())
          .thenComparing(p -> p.getSource().getName())
          .thenComparing(p -> p.getTarget().getName())
          .thenComparingInt(ScoredPair::getSourceIndex)
          .thenComparingInt(ScoredPair::getTargetIndex);

  private final SimilarityScorer scorer;

  public List<FieldMapping> map(
      List<SourceField> sources, List<TargetField> targets, MappingConfig config) {
    return map(sources, targets, config, SimilarityCache.disabled());
  }

  public List<FieldMapping> map(
      List<SourceField> sources,
      List<TargetField> targets,
      MappingConfig config,
      SimilarityCache cache) {
    if (sources == null || targets == null || sources.isEmpty() || targets.isEmpty()) {
      return new ArrayList<>();
    }
    MappingConfig effective = config != null ? config : MappingConfig.defaults();

    List<ScoredPair> candidates = candidatesFor(sources, targets, effective, cache);
    List<ScoredPair> accepted = new ArrayList<>();
    Set<String> takenTargets = new HashSet<>();
    Set<Integer> takenSources = new HashSet<>();

    for (ScoredPair pair : candidates) {
      if (pair.getComposite() < effective.getAssignmentThreshold()) {
        break;
      }
      String targetKey = targetKey(pair, effective);
      if (takenSources.contains(pair.getSourceIndex()) || takenTargets.contains(targetKey)) {
        continue;
      }
      takenSources.add(pair.getSourceIndex());
      takenTargets.add(targetKey);
      accepted.add(pair);
    }

    accepted.sort(
        Comparator.comparingInt(ScoredPair::getTargetIndex)
            .thenComparingInt(ScoredPair::getSourceIndex));
    List<FieldMapping> mappings = new ArrayList<>(accepted.size());
    for (ScoredPair pair : accepted) {
      mappings.add(toMapping(pair, effective));
    }

    log.debug(
        "Mapped {} of {} target fields from {} source fields",
        mappings.size(),
        targets.size(),
        sources.size());
    return mappings;
  }

  /** Pairs at or above the candidate floor, in allocation order. */
  public List<ScoredPair> candidatesFor(
      List<SourceField> sources,
      List<TargetField> targets,
      MappingConfig config,
      SimilarityCache cache) {
    List<ScoredPair> candidates = new ArrayList<>();
    for (ScoredPair pair : compositeMatrix(sources, targets, config, cache)) {
      if (pair.getComposite() >= config.getCandidateFloor()) {
        candidates.add(pair);
      }
    }
    candidates.sort(ALLOCATION_ORDER);
    return candidates;
  }

  /** Every (source, target) pair with its composite score, row-major by source. */
  public List<ScoredPair> compositeMatrix(
      List<SourceField> sources,
      List<TargetField> targets,
      MappingConfig config,
      SimilarityCache cache) {
    AliasTable aliases = AliasTable.fromGroups(config.getAliasGroups());
    List<ScoredPair> matrix = new ArrayList<>(sources.size() * targets.size());
    for (int i = 0; i < sources.size(); i++) {
      SourceField source = sources.get(i);
      for (int j = 0; j < targets.size(); j++) {
        TargetField target = targets.get(j);
        SignalScores signals = scorer.score(source, target, aliases, cache);
        matrix.add(new ScoredPair(i, j, source, target, signals, composite(signals, config)));
      }
    }
    return matrix;
  }

  /**
   * Weighted mean of lexical, token and type signals. The alias signal only joins the mean when it
   * fires, and then floors the result; exact normalized names override everything else.
   */
  public double composite(SignalScores signals, MappingConfig config) {
    StrategyWeights weights = config.getWeights();
    double numerator =
        weights.getLexical() * signals.getLexical()
            + weights.getTokenOverlap() * signals.getTokenOverlap()
            + weights.getTypeCompatibility() * signals.getTypeCompatibility();
    double denominator =
        weights.getLexical() + weights.getTokenOverlap() + weights.getTypeCompatibility();

    boolean aliased = signals.getAlias() >= 1.0;
    if (aliased) {
      numerator += weights.getAlias() * signals.getAlias();
      denominator += weights.getAlias();
    }
    double value = denominator > 0 ? numerator / denominator : 0.0;
    if (aliased) {
      value = Math.max(value, config.getAliasFloor());
    }

    if (signals.isExactNameMatch()) {
      value =
          signals.getTypeCompatibility() >= 1.0
              ? 1.0
              : Math.max(value, config.getExactMatchFloor());
    } else {
      value = Math.min(value, BELOW_EXACT_CAP);
    }
    return SignalScores.round(Math.max(0.0, Math.min(1.0, value)));
  }

  private static String targetKey(ScoredPair pair, MappingConfig config) {
    if (!config.isMultiSourceMerge()) {
      return String.valueOf(pair.getTargetIndex());
    }
    String documentId = Objects.toString(pair.getSource().getSourceDocumentId(), "");
    return pair.getTargetIndex() + "|" + documentId;
  }

  private static FieldMapping toMapping(ScoredPair pair, MappingConfig config) {
    double confidence = pair.getComposite();
    return FieldMapping.builder()
        .sourceName(pair.getSource().getName())
        .targetName(pair.getTarget().getName())
        .value(pair.getSource().getValue())
        .sourceDocumentId(pair.getSource().getSourceDocumentId())
        .confidence(confidence)
        .strategyBreakdown(pair.getSignals().toBreakdown(confidence))
        .flagged(confidence < config.getAssignmentThreshold() + config.getFlagMargin())
        .build();
  }
}
