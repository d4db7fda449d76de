package com.scholary.inference.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.inference.cache.ResponseCache.CacheStats;

/** Response cache counters. */
public record CacheStatsResponse(
    int size,
    @JsonProperty("max_size") int maxSize,
    long hits,
    long misses,
    long evictions,
    @JsonProperty("hit_rate") double hitRate) {

  public static CacheStatsResponse from(CacheStats stats) {
    return new CacheStatsResponse(
        stats.size(),
        stats.maxSize(),
        stats.hits(),
        stats.misses(),
        stats.evictions(),
        stats.hitRate());
  }
}
