package com.ospicorp.forecastcache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ForecastCacheApplication {

  public static void main(String[] args) {
    SpringApplication.run(ForecastCacheApplication.class, args);
  }
}
