package com.ospicorp.dataapi.config;

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

/**
 * Logs one line per request. Asynchronous data requests are logged when their response is
 * dispatched, so the duration covers waiting on the cache.
 */
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);
  private static final String START_ATTRIBUTE = RequestLoggingFilter.class.getName() + ".start";

  @Override
  protected boolean shouldNotFilterAsyncDispatch() {
    return false;
  }

  @Override
  protected void doFilterInternal(@NonNull HttpServletRequest request, @NonNull HttpServletResponse response,
      @NonNull FilterChain filterChain) throws ServletException, IOException {
    if (request.getAttribute(START_ATTRIBUTE) == null) {
      request.setAttribute(START_ATTRIBUTE, System.currentTimeMillis());
    }
    try {
      filterChain.doFilter(request, response);
    } catch (ServletException | IOException | RuntimeException ex) {
      log.error("Request {} {} from {} failed: {}",
          request.getMethod(),
          getRequestUriWithQuery(request),
          getClientIp(request),
          ex.getMessage(),
          ex);
      throw ex;
    } finally {
      if (!request.isAsyncStarted()) {
        long duration = System.currentTimeMillis() - (Long) request.getAttribute(START_ATTRIBUTE);
        log.info("HTTP {} {} from {} -> {} ({} ms)",
            request.getMethod(),
            getRequestUriWithQuery(request),
            getClientIp(request),
            response.getStatus(),
            duration);
      }
    }
  }

  private String getRequestUriWithQuery(HttpServletRequest request) {
    String queryString = request.getQueryString();
    if (queryString == null || queryString.isBlank()) {
      return request.getRequestURI();
    }
    return request.getRequestURI() + "?" + queryString;
  }

  private String getClientIp(HttpServletRequest request) {
    String forwardedHeader = request.getHeader("X-Forwarded-For");
    if (forwardedHeader != null && !forwardedHeader.isBlank()) {
      return forwardedHeader.split(",")[0].trim();
    }
    return request.getRemoteAddr();
  }
}
