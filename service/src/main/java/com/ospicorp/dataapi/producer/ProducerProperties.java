package com.ospicorp.dataapi.producer;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param batchSize areas queried together when a whole area type is requested
 * @param pageSize rows fetched per keyset page when a single area is requested
 * @param threads workers running producers and uncached fallbacks
 */
@ConfigurationProperties(prefix = "dataapi.producer")
public record ProducerProperties(Integer batchSize, Integer pageSize, Integer threads) {

  public ProducerProperties {
    if (batchSize == null) {
      batchSize = 15;
    }
    if (pageSize == null) {
      pageSize = 10_000;
    }
    if (threads == null) {
      threads = 8;
    }
  }

  public static ProducerProperties defaults() {
    return new ProducerProperties(null, null, null);
  }
}
