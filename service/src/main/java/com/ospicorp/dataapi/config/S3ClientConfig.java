package com.ospicorp.dataapi.config;

import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

@Configuration
@ConditionalOnProperty(prefix = "dataapi.cache", name = "store", havingValue = "s3", matchIfMissing = true)
public class S3ClientConfig {

  private static final Logger log = LoggerFactory.getLogger(S3ClientConfig.class);

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  S3Client s3Client(S3StoreProperties properties) {
    S3ClientBuilder builder = S3Client.builder()
        .forcePathStyle(properties.pathStyleAccess());
    if (properties.region() != null && !properties.region().isBlank()) {
      builder.region(Region.of(properties.region()));
    }
    if (properties.endpoint() != null && !properties.endpoint().isBlank()) {
      builder.endpointOverride(URI.create(properties.endpoint()));
    }
    log.info("S3 client region={}, endpointOverride={}",
        properties.region() == null ? "<default>" : properties.region(),
        properties.endpoint() == null ? "<none>" : properties.endpoint());
    return builder.build();
  }
}
