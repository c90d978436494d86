package com.ospicorp.dataapi.config;

import java.time.Duration;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.lang.NonNull;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.servlet.config.annotation.AsyncSupportConfigurer;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Response bodies are written on their own pool, apart from the producers feeding them. The async
 * timeout must outlast the longest wait on another producer plus the time to stream a full
 * response.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

  private final AsyncTaskExecutor responseBodyExecutor;
  private final Duration asyncTimeout;

  public WebConfig(@Qualifier("responseBodyExecutor") AsyncTaskExecutor responseBodyExecutor,
      @Value("${dataapi.web.async-timeout:10m}") Duration asyncTimeout) {
    this.responseBodyExecutor = responseBodyExecutor;
    this.asyncTimeout = asyncTimeout;
  }

  /** Writes streamed bodies; a cancelled body only stops its own copy loop. */
  @Bean
  static ThreadPoolTaskExecutor responseBodyExecutor(
      @Value("${dataapi.web.body-threads:32}") int threads) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(500);
    executor.setThreadNamePrefix("response-body-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    return executor;
  }

  @Override
  public void configureAsyncSupport(@NonNull AsyncSupportConfigurer configurer) {
    configurer.setTaskExecutor(responseBodyExecutor);
    configurer.setDefaultTimeout(asyncTimeout.toMillis());
  }
}
