package com.ospicorp.dataapi.trace;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Times outbound calls to the database and the object store.
 *
 * <p>Each call is recorded under {@code dataapi.dependency.calls}, tagged with the dependency,
 * the operation and whether the call returned normally.
 */
@Component
public class DependencyTracer {

  public static final String METRIC = "dataapi.dependency.calls";
  public static final String POSTGRES = "postgres";
  public static final String BLOB_STORE = "blob-store";

  private static final Logger log = LoggerFactory.getLogger(DependencyTracer.class);

  private final MeterRegistry registry;

  public DependencyTracer(MeterRegistry registry) {
    this.registry = registry;
  }

  public <T> T trace(String dependency, String operation, Supplier<T> call) {
    long start = System.nanoTime();
    boolean success = false;
    try {
      T result = call.get();
      success = true;
      return result;
    } finally {
      long elapsed = System.nanoTime() - start;
      Timer.builder(METRIC)
          .tag("dependency", dependency)
          .tag("operation", operation)
          .tag("success", Boolean.toString(success))
          .register(registry)
          .record(elapsed, TimeUnit.NANOSECONDS);
      if (log.isDebugEnabled()) {
        log.debug("{} {} took {} ms (success={})", dependency, operation,
            TimeUnit.NANOSECONDS.toMillis(elapsed), success);
      }
    }
  }
}
