package com.ospicorp.dataapi.data;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Request validation and query options.
 *
 * @param maxMetrics metrics allowed in one request
 * @param releasedMetricsOnly only serve metrics flagged as released; off in development
 * @param permalinkBase scheme and host used for {@code Content-Location}
 * @param errorDocsBase documentation base linked from parameter errors
 */
@ConfigurationProperties(prefix = "dataapi.request")
public record RequestProperties(
    Integer maxMetrics,
    Boolean releasedMetricsOnly,
    String permalinkBase,
    String errorDocsBase) {

  public RequestProperties {
    if (maxMetrics == null) {
      maxMetrics = 5;
    }
    if (releasedMetricsOnly == null) {
      releasedMetricsOnly = true;
    }
    if (permalinkBase == null) {
      permalinkBase = "http://localhost:8080";
    }
    if (errorDocsBase == null) {
      errorDocsBase = "https://coronavirus.data.gov.uk/details/developers-guide#errors-";
    }
  }

  public static RequestProperties defaults() {
    return new RequestProperties(null, null, null, null);
  }
}
