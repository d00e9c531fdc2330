package com.ospicorp.forecastcache.forecast.service;

import com.ospicorp.forecastcache.forecast.cache.CacheStats;
import com.ospicorp.forecastcache.forecast.cache.LfuCache;
import com.ospicorp.forecastcache.forecast.client.RemoteFetcher;
import com.ospicorp.forecastcache.forecast.model.Coordinate;
import com.ospicorp.forecastcache.forecast.model.Sample;
import java.util.List;

/**
 * Serves queries from an LFU cache of raw series keyed by coordinate, fetching on a miss.
 *
 * <p>The cache is owned exclusively by this service. Every access to it goes through
 * {@code lock}, since {@link LfuCache} itself is not safe for concurrent use.
 *
 * <p>A miss fetches while holding the lock, so each miss makes at most one remote call. The
 * cost is that a slow fetch stalls every other cached query, hits on other coordinates
 * included, for up to the remote read timeout.
 */
public class CachedQueryService implements ForecastQueryService {
  private final RemoteFetcher fetcher;
  private final LfuCache<Coordinate, List<Sample>> cache;
  private final Object lock = new Object();

  public CachedQueryService(RemoteFetcher fetcher, int capacity) {
    this.fetcher = fetcher;
    this.cache = new LfuCache<>(capacity);
  }

  @Override
  public List<Double> query(Coordinate coordinate, long start, long end) {
    List<Sample> samples;
    synchronized (lock) {
      samples = cache.getOrFetch(coordinate, () -> List.copyOf(fetcher.fetch(coordinate)));
    }
    return Resampler.resample(SeriesStore.build(samples), start, end);
  }

  public void clear() {
    synchronized (lock) {
      cache.clear();
    }
  }

  public CacheStats stats() {
    synchronized (lock) {
      return cache.stats();
    }
  }
}
