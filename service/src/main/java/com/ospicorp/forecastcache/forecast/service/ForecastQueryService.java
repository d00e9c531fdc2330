package com.ospicorp.forecastcache.forecast.service;

import com.ospicorp.forecastcache.forecast.model.Coordinate;
import java.util.List;

public interface ForecastQueryService {

  /**
   * Forecast values for {@code coordinate} resampled over {@code [start, end)} (epoch seconds).
   * Returns an empty list when {@code start >= end}.
   *
   * @throws com.ospicorp.forecastcache.forecast.client.FetchException when the series cannot be
   *     fetched
   */
  List<Double> query(Coordinate coordinate, long start, long end);
}
