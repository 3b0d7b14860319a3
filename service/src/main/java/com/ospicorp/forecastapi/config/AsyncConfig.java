package com.ospicorp.forecastapi.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Model fitting is CPU bound and blocking, so analyses run on their own bounded pool instead of
 * the servlet threads.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

  @Bean(name = "forecastExecutor")
  ThreadPoolTaskExecutor forecastExecutor(
      @Value("${forecast.executor.pool-size:2}") int poolSize,
      @Value("${forecast.executor.queue-capacity:50}") int queueCapacity) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(poolSize);
    executor.setMaxPoolSize(poolSize);
    executor.setQueueCapacity(queueCapacity);
    executor.setThreadNamePrefix("forecast-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.initialize();
    return executor;
  }
}
