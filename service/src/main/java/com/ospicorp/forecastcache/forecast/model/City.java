package com.ospicorp.forecastcache.forecast.model;

import java.util.Locale;
import java.util.Optional;

public enum City {
  SEATTLE(47.36, -122.19),
  VANCOUVER(45.62, -122.67);

  private final Coordinate coordinate;

  City(double lat, double lon) {
    this.coordinate = new Coordinate(lat, lon);
  }

  public Coordinate coordinate() {
    return coordinate;
  }

  public static Optional<City> fromName(String name) {
    if (name == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(City.valueOf(name.trim().toUpperCase(Locale.ROOT)));
    } catch (IllegalArgumentException ex) {
      return Optional.empty();
    }
  }
}
