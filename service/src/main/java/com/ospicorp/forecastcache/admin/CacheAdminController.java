package com.ospicorp.forecastcache.admin;

import com.ospicorp.forecastcache.forecast.cache.CacheStats;
import com.ospicorp.forecastcache.forecast.service.CachedQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/cache")
@Tag(name = "Admin")
public class CacheAdminController {
  private static final Logger log = LoggerFactory.getLogger(CacheAdminController.class);

  private final CachedQueryService cachedQueryService;

  public CacheAdminController(CachedQueryService cachedQueryService) {
    this.cachedQueryService = cachedQueryService;
  }

  @GetMapping
  @Operation(summary = "Cache statistics")
  public CacheStats stats() {
    return cachedQueryService.stats();
  }

  @DeleteMapping
  @Operation(summary = "Drop every cached series")
  public ResponseEntity<Void> clear() {
    cachedQueryService.clear();
    log.info("Forecast cache cleared");
    return ResponseEntity.noContent().build();
  }
}
