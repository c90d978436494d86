package com.ospicorp.dataapi.web;

import com.ospicorp.dataapi.cache.store.BlobCacheStore;
import com.ospicorp.dataapi.trace.DependencyTracer;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

/**
 * Reports whether the database and the cache store answer. Either failing makes the check
 * return 503 with the failure in its entry.
 */
@RestController
public class HealthcheckController {

  private static final Logger log = LoggerFactory.getLogger(HealthcheckController.class);

  static final String HEALTHCHECK_KEY = "info/seen";

  private final JdbcTemplate jdbc;
  private final BlobCacheStore store;
  private final DependencyTracer tracer;

  public HealthcheckController(JdbcTemplate jdbc, BlobCacheStore store, DependencyTracer tracer) {
    this.jdbc = jdbc;
    this.store = store;
    this.tracer = tracer;
  }

  @RequestMapping(path = "/api/v2/healthcheck", method = RequestMethod.GET)
  public ResponseEntity<Map<String, String>> healthcheck() {
    Map<String, String> checks = new LinkedHashMap<>();
    boolean healthy = check(checks, "db", () -> String.valueOf(
        tracer.trace(DependencyTracer.POSTGRES, "healthcheck",
            () -> jdbc.queryForObject("SELECT NOW()", Object.class))));
    healthy &= check(checks, "storage", () -> store.exists(HEALTHCHECK_KEY) ? "reachable" : "empty");
    return ResponseEntity.status(healthy ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
        .body(checks);
  }

  @RequestMapping(path = "/api/v2/healthcheck", method = RequestMethod.HEAD)
  public ResponseEntity<Void> healthcheckHead() {
    return ResponseEntity.noContent().build();
  }

  private static boolean check(Map<String, String> checks, String name, Supplier<String> status) {
    try {
      checks.put(name, "healthy - " + status.get());
      return true;
    } catch (RuntimeException e) {
      log.error("Healthcheck of {} failed", name, e);
      checks.put(name, "unhealthy - " + e.getMessage());
      return false;
    }
  }
}
