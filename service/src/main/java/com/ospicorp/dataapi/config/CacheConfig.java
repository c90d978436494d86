package com.ospicorp.dataapi.config;

import com.ospicorp.dataapi.cache.CacheProperties;
import com.ospicorp.dataapi.cache.store.BlobCacheStore;
import com.ospicorp.dataapi.cache.store.InMemoryBlobCacheStore;
import com.ospicorp.dataapi.cache.store.S3BlobCacheStore;
import com.ospicorp.dataapi.producer.ProducerProperties;
import com.ospicorp.dataapi.trace.DependencyTracer;
import java.net.URI;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import software.amazon.awssdk.services.s3.S3Client;

@Configuration
public class CacheConfig {

  private static final Logger log = LoggerFactory.getLogger(CacheConfig.class);

  @Bean
  @ConditionalOnMissingBean
  Clock clock() {
    return Clock.systemUTC();
  }

  /** Re-polls entries that another instance is producing. */
  @Bean
  ThreadPoolTaskScheduler cachePollScheduler(CacheProperties properties) {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(properties.getPollThreads());
    scheduler.setThreadNamePrefix("cache-poll-");
    scheduler.setDaemon(true);
    scheduler.setRemoveOnCancelPolicy(true);
    return scheduler;
  }

  /** Runs producers and cache writes. */
  @Bean
  ThreadPoolTaskExecutor producerExecutor(ProducerProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.threads());
    executor.setMaxPoolSize(properties.threads() * 4);
    executor.setQueueCapacity(500);
    executor.setThreadNamePrefix("producer-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    return executor;
  }

  @Bean
  @ConditionalOnProperty(prefix = "dataapi.cache", name = "store", havingValue = "local")
  BlobCacheStore inMemoryBlobCacheStore(CacheProperties properties, Clock clock) {
    log.info("Using in-memory cache store; entries are not shared between instances");
    return new InMemoryBlobCacheStore(clock, key -> URI.create(properties.publicLocation(key)));
  }

  @Bean
  @ConditionalOnProperty(prefix = "dataapi.cache", name = "store", havingValue = "s3", matchIfMissing = true)
  BlobCacheStore s3BlobCacheStore(S3Client s3, CacheProperties properties,
      S3StoreProperties s3Properties, Clock clock, DependencyTracer tracer) {
    log.info("Using S3 cache store in bucket {}", properties.getContainer());
    return new S3BlobCacheStore(s3, properties.getContainer(), s3Properties.leasePrefix(), clock,
        tracer, key -> URI.create(properties.publicLocation(key)));
  }
}
