package com.ospicorp.forecastcache.forecast.model;

/**
 * Geographic location used as the cache key. Equality is exact on both components, so
 * {@code 0.0} and {@code -0.0} are distinct keys.
 */
public record Coordinate(double lat, double lon) {

  @Override
  public String toString() {
    return "(" + lat + ", " + lon + ")";
  }
}
