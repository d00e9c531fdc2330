package com.ospicorp.forecastcache.forecast.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ForecastResponse(
    double lat,
    double lon,
    String city,
    long start,
    long end,
    @JsonProperty("granularity_seconds") long granularitySeconds,
    String mode,
    @JsonProperty("point_count") int pointCount,
    List<Double> values
) {}
