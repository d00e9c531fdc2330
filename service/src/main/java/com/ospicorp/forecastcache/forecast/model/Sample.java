package com.ospicorp.forecastcache.forecast.model;

// One forecast observation: epoch seconds and value (temperature in Kelvin)
public record Sample(long timestamp, double value) {}
