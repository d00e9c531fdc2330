package com.ospicorp.forecastcache.config;

import com.ospicorp.forecastcache.forecast.client.OpenWeatherFetcher;
import com.ospicorp.forecastcache.forecast.client.RemoteFetcher;
import com.ospicorp.forecastcache.forecast.service.CachedQueryService;
import com.ospicorp.forecastcache.forecast.service.DirectQueryService;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class ForecastConfig {
  private static final Logger log = LoggerFactory.getLogger(ForecastConfig.class);

  @Bean
  RestTemplate restTemplate(RestTemplateBuilder builder,
      @Value("${forecast.remote.connect-timeout:5s}") Duration connectTimeout,
      @Value("${forecast.remote.read-timeout:10s}") Duration readTimeout) {
    return builder
        .setConnectTimeout(connectTimeout)
        .setReadTimeout(readTimeout)
        .build();
  }

  @Bean
  RemoteFetcher remoteFetcher(RestTemplate restTemplate,
      @Value("${forecast.remote.base-url:http://localhost:50000}") String baseUrl,
      @Value("${forecast.remote.api-key:}") String apiKey) {
    log.info("Forecast source: {}", baseUrl);
    return new OpenWeatherFetcher(restTemplate, baseUrl, apiKey);
  }

  @Bean
  DirectQueryService directQueryService(RemoteFetcher remoteFetcher) {
    return new DirectQueryService(remoteFetcher);
  }

  @Bean
  CachedQueryService cachedQueryService(RemoteFetcher remoteFetcher,
      @Value("${forecast.cache.capacity:64}") int capacity) {
    if (capacity == 0) {
      log.warn("forecast.cache.capacity=0; cached queries will fetch every time");
    }
    return new CachedQueryService(remoteFetcher, capacity);
  }
}
