package com.ospicorp.forecastcache.forecast.cache;

public record CacheStats(
    int capacity,
    int size,
    long hits,
    long misses,
    long evictions
) {}
