package com.ospicorp.forecastcache.forecast.service;

import static com.ospicorp.forecastcache.forecast.ForecastFixtures.ONE_HOUR;
import static com.ospicorp.forecastcache.forecast.ForecastFixtures.SAMPLE_DATA_START;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.ospicorp.forecastcache.forecast.ForecastFixtures;
import com.ospicorp.forecastcache.forecast.client.FetchException;
import com.ospicorp.forecastcache.forecast.client.RemoteFetcher;
import com.ospicorp.forecastcache.forecast.model.Coordinate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CachedQueryServiceTest {

  private static final Coordinate SEATTLE = new Coordinate(47.36, -122.19);
  private static final Coordinate VANCOUVER = new Coordinate(45.62, -122.67);

  private RemoteFetcher fetcher;

  @BeforeEach
  void setUp() {
    fetcher = mock(RemoteFetcher.class);
    when(fetcher.fetch(any())).thenReturn(ForecastFixtures.threeHourlyForecast());
  }

  @Test
  void repeatedQueryFetchesOnce() {
    CachedQueryService service = new CachedQueryService(fetcher, 4);
    long end = SAMPLE_DATA_START + 3 * ONE_HOUR;

    for (int i = 0; i < 5; i++) {
      assertThat(service.query(SEATTLE, SAMPLE_DATA_START, end)).hasSize(36);
    }

    verify(fetcher, times(1)).fetch(SEATTLE);
  }

  @Test
  void overlappingRangesShareOneFetch() {
    CachedQueryService service = new CachedQueryService(fetcher, 4);

    assertThat(service.query(SEATTLE, SAMPLE_DATA_START, SAMPLE_DATA_START + 25 * ONE_HOUR))
        .hasSize(25);
    assertThat(service.query(SEATTLE, SAMPLE_DATA_START, SAMPLE_DATA_START + 3 * ONE_HOUR))
        .hasSize(36);
    assertThat(service.query(SEATTLE, SAMPLE_DATA_START, SAMPLE_DATA_START + ONE_HOUR))
        .hasSize(60);

    verify(fetcher, times(1)).fetch(SEATTLE);
  }

  @Test
  void matchesDirectQueryOutput() {
    CachedQueryService cached = new CachedQueryService(fetcher, 4);
    DirectQueryService direct = new DirectQueryService(fetcher);
    long[][] ranges = {
        {SAMPLE_DATA_START, SAMPLE_DATA_START + 25 * ONE_HOUR},
        {SAMPLE_DATA_START + 600, SAMPLE_DATA_START + 5 * ONE_HOUR},
        {SAMPLE_DATA_START - ONE_HOUR, SAMPLE_DATA_START + 90 * 60},
        {SAMPLE_DATA_START + 100 * ONE_HOUR, SAMPLE_DATA_START + 130 * ONE_HOUR}
    };

    for (long[] range : ranges) {
      assertThat(cached.query(SEATTLE, range[0], range[1]))
          .isEqualTo(direct.query(SEATTLE, range[0], range[1]));
    }

    // one fetch for the cached path plus one per direct query
    verify(fetcher, times(1 + ranges.length)).fetch(SEATTLE);
  }

  @Test
  void evictedCoordinateIsFetchedAgain() {
    CachedQueryService service = new CachedQueryService(fetcher, 1);
    long end = SAMPLE_DATA_START + ONE_HOUR;

    service.query(SEATTLE, SAMPLE_DATA_START, end);
    service.query(VANCOUVER, SAMPLE_DATA_START, end);
    service.query(SEATTLE, SAMPLE_DATA_START, end);

    verify(fetcher, times(2)).fetch(SEATTLE);
    verify(fetcher, times(1)).fetch(VANCOUVER);
    assertThat(service.stats().evictions()).isEqualTo(2);
  }

  @Test
  void fetchFailurePropagatesAndIsNotCached() {
    when(fetcher.fetch(VANCOUVER))
        .thenThrow(new FetchException("connection refused"))
        .thenReturn(ForecastFixtures.threeHourlyForecast());
    CachedQueryService service = new CachedQueryService(fetcher, 1);
    service.query(SEATTLE, SAMPLE_DATA_START, SAMPLE_DATA_START + ONE_HOUR);

    assertThatThrownBy(() -> service.query(VANCOUVER, SAMPLE_DATA_START, SAMPLE_DATA_START + ONE_HOUR))
        .isInstanceOf(FetchException.class)
        .hasMessage("connection refused");
    // the full cache kept its entry
    assertThat(service.stats().size()).isEqualTo(1);
    service.query(SEATTLE, SAMPLE_DATA_START, SAMPLE_DATA_START + ONE_HOUR);
    verify(fetcher, times(1)).fetch(SEATTLE);

    assertThat(service.query(VANCOUVER, SAMPLE_DATA_START, SAMPLE_DATA_START + ONE_HOUR)).hasSize(60);
    verify(fetcher, times(2)).fetch(VANCOUVER);
  }

  @Test
  void clearForcesRefetch() {
    CachedQueryService service = new CachedQueryService(fetcher, 4);
    service.query(SEATTLE, SAMPLE_DATA_START, SAMPLE_DATA_START + ONE_HOUR);
    service.clear();
    service.query(SEATTLE, SAMPLE_DATA_START, SAMPLE_DATA_START + ONE_HOUR);

    verify(fetcher, times(2)).fetch(SEATTLE);
    assertThat(service.stats().size()).isEqualTo(1);
  }

  @Test
  void zeroCapacityFetchesEveryTime() {
    CachedQueryService service = new CachedQueryService(fetcher, 0);
    service.query(SEATTLE, SAMPLE_DATA_START, SAMPLE_DATA_START + ONE_HOUR);
    service.query(SEATTLE, SAMPLE_DATA_START, SAMPLE_DATA_START + ONE_HOUR);

    verify(fetcher, times(2)).fetch(SEATTLE);
    assertThat(service.stats().size()).isZero();
  }

  @Test
  void emptySeriesIsCachedAndYieldsNoValues() {
    when(fetcher.fetch(VANCOUVER)).thenReturn(List.of());
    CachedQueryService service = new CachedQueryService(fetcher, 2);

    assertThat(service.query(VANCOUVER, SAMPLE_DATA_START, SAMPLE_DATA_START + ONE_HOUR)).isEmpty();
    assertThat(service.query(VANCOUVER, SAMPLE_DATA_START, SAMPLE_DATA_START + ONE_HOUR)).isEmpty();
    verify(fetcher, times(1)).fetch(VANCOUVER);
  }
}
