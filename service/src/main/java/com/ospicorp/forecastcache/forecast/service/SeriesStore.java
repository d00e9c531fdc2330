package com.ospicorp.forecastcache.forecast.service;

import com.ospicorp.forecastcache.forecast.model.Sample;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Timestamp-ordered view over one forecast series answering nearest-sample lookups in
 * logarithmic time.
 */
public final class SeriesStore {
  private final NavigableMap<Long, Double> samples;

  private SeriesStore(NavigableMap<Long, Double> samples) {
    this.samples = samples;
  }

  /**
   * Builds a store from raw samples. A later sample replaces an earlier one with the same
   * timestamp.
   */
  public static SeriesStore build(List<Sample> in) {
    NavigableMap<Long, Double> map = new TreeMap<>();
    for (Sample s : in) {
      map.put(s.timestamp(), s.value());
    }
    return new SeriesStore(map);
  }

  /**
   * Value of the sample closest to {@code t}. Equal distances resolve to the later sample.
   * Timestamps before the first sample resolve to the first sample; timestamps past the last
   * sample have no value.
   */
  public OptionalDouble nearest(long t) {
    Map.Entry<Long, Double> low = samples.ceilingEntry(t);
    if (low == null) {
      return OptionalDouble.empty();
    }
    if (low.getKey().equals(samples.firstKey())) {
      return OptionalDouble.of(low.getValue());
    }
    // low is not the first key, so a predecessor exists
    Map.Entry<Long, Double> before = samples.lowerEntry(t);
    if (t - before.getKey() < low.getKey() - t) {
      return OptionalDouble.of(before.getValue());
    }
    return OptionalDouble.of(low.getValue());
  }

  public int size() {
    return samples.size();
  }

  public boolean isEmpty() {
    return samples.isEmpty();
  }
}
