package com.finalsentence.infrastructure;

import java.time.Clock;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Threads used by the orchestrator: one scheduler for round and grace deadlines, one executor
 * for per-room message delivery and one for write-behind persistence.
 */
@Configuration
public class SchedulingConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public ThreadPoolTaskScheduler gameTaskScheduler(
      @Value("${finalsentence.scheduler-threads:2}") int threads) {
    ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
    s.setPoolSize(threads);
    s.setThreadNamePrefix("round-timer-");
    s.setRemoveOnCancelPolicy(true);
    s.initialize();
    return s;
  }

  @Bean
  public ThreadPoolTaskExecutor messagingExecutor(
      @Value("${finalsentence.messaging-threads:4}") int threads) {
    ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
    e.setCorePoolSize(threads);
    e.setMaxPoolSize(threads);
    e.setThreadNamePrefix("room-fanout-");
    e.initialize();
    return e;
  }

  @Bean
  public ThreadPoolTaskExecutor persistenceExecutor() {
    ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
    e.setCorePoolSize(1);
    e.setMaxPoolSize(1);
    e.setQueueCapacity(10_000);
    e.setThreadNamePrefix("store-writer-");
    e.initialize();
    return e;
  }
}
