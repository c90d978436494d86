package com.ospicorp.dataapi.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection settings for the S3 cache store.
 *
 * @param region AWS region; the SDK default chain decides when unset
 * @param endpoint endpoint override for S3 compatible stores, e.g. MinIO
 * @param pathStyleAccess address buckets by path rather than by host name
 * @param leasePrefix key prefix of the lease objects
 */
@ConfigurationProperties(prefix = "dataapi.cache.s3")
public record S3StoreProperties(
    String region,
    String endpoint,
    boolean pathStyleAccess,
    String leasePrefix) {

  public S3StoreProperties {
    if (leasePrefix == null || leasePrefix.isBlank()) {
      leasePrefix = "_leases/";
    }
  }
}
