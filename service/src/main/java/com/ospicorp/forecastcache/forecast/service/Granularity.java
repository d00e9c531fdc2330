package com.ospicorp.forecastcache.forecast.service;

/** Output step of a resampled query, chosen from the width of the requested range. */
public enum Granularity {
  MINUTE(60),
  FIVE_MINUTES(5 * 60),
  HOUR(60 * 60);

  static final long TWO_HOURS = 2 * 60 * 60;
  static final long ONE_DAY = 24 * 60 * 60;

  private final long seconds;

  Granularity(long seconds) {
    this.seconds = seconds;
  }

  public long seconds() {
    return seconds;
  }

  public static Granularity forRange(long rangeSeconds) {
    if (rangeSeconds < TWO_HOURS) {
      return MINUTE;
    }
    if (rangeSeconds < ONE_DAY) {
      return FIVE_MINUTES;
    }
    return HOUR;
  }
}
