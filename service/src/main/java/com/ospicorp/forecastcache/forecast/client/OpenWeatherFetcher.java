package com.ospicorp.forecastcache.forecast.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.ospicorp.forecastcache.forecast.model.Coordinate;
import com.ospicorp.forecastcache.forecast.model.Sample;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Reads the OpenWeatherMap 5 day / 3 hour forecast and keeps {@code dt} and {@code main.temp}
 * from each entry of {@code list}.
 */
public class OpenWeatherFetcher implements RemoteFetcher {
  private static final Logger log = LoggerFactory.getLogger(OpenWeatherFetcher.class);
  static final String FORECAST_PATH = "/data/2.5/forecast";

  private final RestTemplate restTemplate;
  private final String baseUrl;
  private final String apiKey;

  public OpenWeatherFetcher(RestTemplate restTemplate, String baseUrl, String apiKey) {
    this.restTemplate = restTemplate;
    this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    this.apiKey = apiKey;
  }

  @Override
  public List<Sample> fetch(Coordinate coordinate) {
    URI uri = forecastUri(coordinate);
    log.debug("Fetching forecast for {} from {}", coordinate, baseUrl);
    JsonNode body;
    try {
      body = restTemplate.getForObject(uri, JsonNode.class);
    } catch (RestClientException ex) {
      log.warn("Forecast request for {} failed: {}", coordinate, ex.getMessage());
      throw new FetchException("Forecast request failed for " + coordinate, ex);
    }
    return parseSamples(body, coordinate);
  }

  URI forecastUri(Coordinate coordinate) {
    UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(baseUrl)
        .path(FORECAST_PATH)
        .queryParam("lat", coordinate.lat())
        .queryParam("lon", coordinate.lon());
    if (StringUtils.hasText(apiKey)) {
      builder.queryParam("appid", apiKey);
    }
    return builder.build().toUri();
  }

  private List<Sample> parseSamples(JsonNode body, Coordinate coordinate) {
    if (body == null) {
      throw new FetchException("Empty forecast response for " + coordinate);
    }
    JsonNode list = body.path("list");
    if (!list.isArray()) {
      throw new FetchException("Forecast response for " + coordinate + " has no list array");
    }
    List<Sample> samples = new ArrayList<>(list.size());
    for (JsonNode element : list) {
      JsonNode dt = element.path("dt");
      JsonNode temp = element.path("main").path("temp");
      if (!dt.isIntegralNumber() || !temp.isNumber()) {
        throw new FetchException("Malformed forecast entry for " + coordinate + ": " + element);
      }
      samples.add(new Sample(dt.asLong(), temp.asDouble()));
    }
    log.debug("Received {} samples for {}", samples.size(), coordinate);
    return samples;
  }
}
