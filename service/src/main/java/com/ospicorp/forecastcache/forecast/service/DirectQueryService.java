package com.ospicorp.forecastcache.forecast.service;

import com.ospicorp.forecastcache.forecast.client.RemoteFetcher;
import com.ospicorp.forecastcache.forecast.model.Coordinate;
import java.util.List;

// One remote fetch per query
public class DirectQueryService implements ForecastQueryService {
  private final RemoteFetcher fetcher;

  public DirectQueryService(RemoteFetcher fetcher) {
    this.fetcher = fetcher;
  }

  @Override
  public List<Double> query(Coordinate coordinate, long start, long end) {
    return Resampler.resample(SeriesStore.build(fetcher.fetch(coordinate)), start, end);
  }
}
