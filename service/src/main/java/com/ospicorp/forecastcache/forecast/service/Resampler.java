package com.ospicorp.forecastcache.forecast.service;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

public final class Resampler {
  private Resampler() {
  }

  /**
   * Walks {@code [start, end)} in {@link Granularity#forRange} steps and emits the nearest
   * sample value for each grid point. Grid points without a value are skipped, so the result may
   * be shorter than the grid.
   */
  public static List<Double> resample(SeriesStore store, long start, long end) {
    List<Double> out = new ArrayList<>();
    if (start >= end || store.isEmpty()) {
      return out;
    }
    long width = end - start;
    if (width < 0) {
      // wrapped: wider than any long range
      width = Long.MAX_VALUE;
    }
    long step = Granularity.forRange(width).seconds();
    for (long i = start; i < end; i += step) {
      OptionalDouble value = store.nearest(i);
      if (value.isEmpty()) {
        // past the last sample, and so is every later grid point
        break;
      }
      out.add(value.getAsDouble());
      if (i > Long.MAX_VALUE - step) {
        break;
      }
    }
    return out;
  }
}
