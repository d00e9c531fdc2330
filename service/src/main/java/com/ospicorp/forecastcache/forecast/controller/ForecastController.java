package com.ospicorp.forecastcache.forecast.controller;

import com.ospicorp.forecastcache.forecast.model.City;
import com.ospicorp.forecastcache.forecast.model.Coordinate;
import com.ospicorp.forecastcache.forecast.model.ForecastResponse;
import com.ospicorp.forecastcache.forecast.service.CachedQueryService;
import com.ospicorp.forecastcache.forecast.service.DirectQueryService;
import com.ospicorp.forecastcache.forecast.service.ForecastQueryService;
import com.ospicorp.forecastcache.forecast.service.Granularity;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import org.springframework.http.ProblemDetail;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/forecast")
@Validated
@Tag(name = "Forecast")
public class ForecastController {
  private static final String ERROR_DOCS_BASE = "https://docs.forecast-cache.dev/errors/";
  static final long MAX_GRID_POINTS = 100_000;

  private final DirectQueryService direct;
  private final CachedQueryService cached;

  public ForecastController(DirectQueryService direct, CachedQueryService cached) {
    this.direct = direct;
    this.cached = cached;
  }

  @GetMapping
  @Operation(summary = "Forecast for a coordinate",
      description = "Temperatures (K) over [start, end) at a step chosen from the range width.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Resampled forecast",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = ForecastResponse.class))),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "502", description = "Forecast source unavailable",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ForecastResponse forecast(
      @RequestParam @DecimalMin("-90.0") @DecimalMax("90.0")
          @Parameter(description = "Latitude", example = "47.36") double lat,
      @RequestParam @DecimalMin("-180.0") @DecimalMax("180.0")
          @Parameter(description = "Longitude", example = "-122.19") double lon,
      @RequestParam @Parameter(description = "Range start, epoch seconds (inclusive)") long start,
      @RequestParam(required = false) @Parameter(description = "Range end, epoch seconds (exclusive)") Long end,
      @RequestParam(required = false) @Parameter(description = "ISO-8601 duration used instead of end", example = "P2D") String duration,
      @RequestParam(defaultValue = "cached") @Parameter(description = "cached or direct") String mode) {
    return respond(new Coordinate(lat, lon), null, start, resolveEnd(start, end, duration), mode);
  }

  @GetMapping("/cities/{city}")
  @Operation(summary = "Forecast for a named city", description = "Supported cities: seattle, vancouver.")
  public ForecastResponse cityForecast(
      @PathVariable @Parameter(description = "City name", example = "seattle") String city,
      @RequestParam long start,
      @RequestParam(required = false) Long end,
      @RequestParam(required = false) String duration,
      @RequestParam(defaultValue = "cached") String mode) {
    City resolved = City.fromName(city)
        .orElseThrow(() -> invalidParameter("Unknown city. Supported values: seattle,vancouver.", 2004));
    return respond(resolved.coordinate(), resolved.name().toLowerCase(Locale.ROOT), start,
        resolveEnd(start, end, duration), mode);
  }

  private ForecastResponse respond(Coordinate coordinate, String city, long start, long end,
      String mode) {
    QueryMode queryMode = parseMode(mode);
    checkGridSize(start, end);
    ForecastQueryService service = queryMode == QueryMode.DIRECT ? direct : cached;
    List<Double> values = service.query(coordinate, start, end);
    long step = start < end ? Granularity.forRange(end - start).seconds() : 0L;
    return new ForecastResponse(coordinate.lat(), coordinate.lon(), city, start, end, step,
        queryMode.name().toLowerCase(Locale.ROOT), values.size(), values);
  }

  private static long resolveEnd(long start, Long end, String duration) {
    boolean hasDuration = StringUtils.hasText(duration);
    if (end != null && hasDuration) {
      throw invalidParameter("Provide either end or duration, not both.", 2001);
    }
    if (end != null) {
      return end;
    }
    if (!hasDuration) {
      throw invalidParameter("One of end or duration is required.", 2001);
    }
    long seconds;
    try {
      seconds = Duration.parse(duration).getSeconds();
    } catch (DateTimeParseException ex) {
      throw invalidParameter("Invalid duration. Expected ISO-8601, e.g. PT3H or P2D.", 2002);
    }
    try {
      return Math.addExact(start, seconds);
    } catch (ArithmeticException ex) {
      throw invalidParameter("Duration is out of range for the given start.", 2002);
    }
  }

  private static void checkGridSize(long start, long end) {
    if (start >= end) {
      return;
    }
    long width;
    try {
      width = Math.subtractExact(end, start);
    } catch (ArithmeticException ex) {
      throw invalidParameter("Range too wide. At most " + MAX_GRID_POINTS + " points per query.", 2005);
    }
    long step = Granularity.forRange(width).seconds();
    if ((width - 1) / step + 1 > MAX_GRID_POINTS) {
      throw invalidParameter("Range too wide. At most " + MAX_GRID_POINTS + " points per query.", 2005);
    }
  }

  private static QueryMode parseMode(String value) {
    try {
      return QueryMode.valueOf(value.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw invalidParameter("Invalid mode. Supported values: cached,direct.", 2003);
    }
  }

  private static InvalidParameterException invalidParameter(String message, int errorCode) {
    return new InvalidParameterException(message, errorCode, ERROR_DOCS_BASE + errorCode);
  }

  enum QueryMode {
    CACHED,
    DIRECT
  }
}
