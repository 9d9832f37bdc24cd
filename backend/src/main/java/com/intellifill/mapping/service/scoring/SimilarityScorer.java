package com.intellifill.mapping.service.scoring;

import java.util.HashSet;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.intellifill.mapping.dto.field.FieldTypeGuess;
import com.intellifill.mapping.dto.field.SourceField;
import com.intellifill.mapping.dto.field.TargetField;

/**
 * Computes the independent similarity signals between a source field and a target field. Every
 * signal is in [0,1], and blank names score 0 everywhere. The scorer holds no state; memoization
 * goes through the {@link SimilarityCache} passed in by the caller.
 */
@Component
public class SimilarityScorer {

  /** Share of full type credit a value earns by looking like the target type. */
  static final double APPARENT_TYPE_WEIGHT = 0.8;

  public SignalScores score(
      SourceField source, TargetField target, AliasTable aliases, SimilarityCache cache) {
    if (source == null
        || target == null
        || isBlank(source.getName())
        || isBlank(target.getName())) {
      return SignalScores.zero();
    }
    SimilarityCache effectiveCache = cache != null ? cache : SimilarityCache.disabled();
    SimilarityCache.NameScores names =
        effectiveCache.get(
            source.getName(),
            target.getName(),
            () -> nameScores(source.getName(), target.getName()));

    return SignalScores.builder()
        .lexical(names.getLexical())
        .tokenOverlap(names.getTokenOverlap())
        .typeCompatibility(typeCompatibilityScore(source, target))
        .alias(aliasScore(source.getName(), target.getName(), aliases))
        .exactNameMatch(names.isExactNameMatch())
        .build();
  }

  /** Normalized Levenshtein similarity of the normalized names. */
  public double lexicalScore(String sourceName, String targetName) {
    String a = FieldNameNormalizer.normalize(sourceName);
    String b = FieldNameNormalizer.normalize(targetName);
    if (a.isEmpty() || b.isEmpty()) {
      return 0.0;
    }
    if (a.equals(b)) {
      return 1.0;
    }
    int distance = levenshtein(a, b);
    return 1.0 - (double) distance / Math.max(a.length(), b.length());
  }

  /** Mean of Jaccard and overlap coefficient over significant name tokens. */
  public double tokenOverlapScore(String sourceName, String targetName) {
    Set<String> a = FieldNameNormalizer.significantTokens(sourceName);
    Set<String> b = FieldNameNormalizer.significantTokens(targetName);
    if (a.isEmpty() || b.isEmpty()) {
      return 0.0;
    }
    Set<String> intersection = new HashSet<>(a);
    intersection.retainAll(b);
    Set<String> union = new HashSet<>(a);
    union.addAll(b);

    double jaccard = (double) intersection.size() / union.size();
    double overlap = (double) intersection.size() / Math.min(a.size(), b.size());
    return (jaccard + overlap) / 2.0;
  }

  /**
   * Declared-type compatibility, or partial credit when the value itself looks like the target
   * type, whichever is higher.
   */
  public double typeCompatibilityScore(SourceField source, TargetField target) {
    FieldTypeGuess sourceType = source.getType();
    FieldTypeGuess targetType = target.getType();
    if (sourceType == targetType && sourceType != FieldTypeGuess.UNKNOWN) {
      return 1.0;
    }
    double declared = sourceType.compatibilityWith(targetType);
    FieldTypeGuess apparent = ValueTypeInspector.detect(source.getValue());
    double fromValue =
        apparent == FieldTypeGuess.UNKNOWN
            ? 0.0
            : apparent.compatibilityWith(targetType) * APPARENT_TYPE_WEIGHT;
    return Math.max(declared, fromValue);
  }

  public double aliasScore(String sourceName, String targetName, AliasTable aliases) {
    if (aliases == null || isBlank(sourceName) || isBlank(targetName)) {
      return 0.0;
    }
    return aliases.areAliases(sourceName, targetName) ? 1.0 : 0.0;
  }

  private SimilarityCache.NameScores nameScores(String sourceName, String targetName) {
    String a = FieldNameNormalizer.normalize(sourceName);
    boolean exact = !a.isEmpty() && a.equals(FieldNameNormalizer.normalize(targetName));
    return new SimilarityCache.NameScores(
        lexicalScore(sourceName, targetName), tokenOverlapScore(sourceName, targetName), exact);
  }

  private static int levenshtein(String a, String b) {
    int[] previous = new int[b.length() + 1];
    int[] current = new int[b.length() + 1];
    for (int j = 0; j <= b.length(); j++) {
      previous[j] = j;
    }
    for (int i = 1; i <= a.length(); i++) {
      current[0] = i;
      for (int j = 1; j <= b.length(); j++) {
        int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
        current[j] =
            Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
      }
      int[] swap = previous;
      previous = current;
      current = swap;
    }
    return previous[b.length()];
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
