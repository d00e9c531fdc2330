package com.ospicorp.forecastcache.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

@Component
public class RequestLoggingFilter extends OncePerRequestFilter {
  private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);

  @Override
  protected void doFilterInternal(@NonNull HttpServletRequest request,
      @NonNull HttpServletResponse response, @NonNull FilterChain filterChain)
      throws ServletException, IOException {
    long startNanos = System.nanoTime();
    try {
      filterChain.doFilter(request, response);
    } catch (ServletException | IOException | RuntimeException ex) {
      log.error("Request {} {} failed: {}", request.getMethod(),
          HttpRequests.uriWithQuery(request), ex.getMessage(), ex);
      throw ex;
    } finally {
      long millis = (System.nanoTime() - startNanos) / 1_000_000;
      log.info("HTTP {} {} from {} -> {} ({} ms)",
          request.getMethod(),
          HttpRequests.uriWithQuery(request),
          HttpRequests.clientIp(request),
          response.getStatus(),
          millis);
    }
  }
}
