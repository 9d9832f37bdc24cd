package com.intellifill.mapping.service.scoring;

import java.util.function.Supplier;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Memoizes the name-only signals (lexical and token overlap) of a pair of field labels. A cache is
 * created per job run and handed to the scorer explicitly; nothing in the scoring code keeps one of
 * its own.
 */
public final class SimilarityCache {

  private final Cache<String, NameScores> cache;

  private SimilarityCache(Cache<String, NameScores> cache) {
    this.cache = cache;
  }

  public static SimilarityCache withMaximumSize(long maximumSize) {
    return new SimilarityCache(CacheBuilder.newBuilder().maximumSize(maximumSize).build());
  }

  public static SimilarityCache disabled() {
    return new SimilarityCache(null);
  }

  public NameScores get(String sourceName, String targetName, Supplier<NameScores> loader) {
    if (cache == null) {
      return loader.get();
    }
    String key = sourceName + '\u0000' + targetName;
    NameScores cached = cache.getIfPresent(key);
    if (cached == null) {
      cached = loader.get();
      cache.put(key, cached);
    }
    return cached;
  }

  public long size() {
    return cache == null ? 0 : cache.size();
  }

  @Data
  @AllArgsConstructor
  public static class NameScores {
    private final double lexical;
    private final double tokenOverlap;
    private final boolean exactNameMatch;
  }
}
