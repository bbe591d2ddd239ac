package com.flamingo.ai.mano.config;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Executors for concurrent context fetches, background mining and SSE streaming. */
@Configuration
@EnableAsync
public class AsyncConfig {

  /** Runs the concurrent branches of context building. Overflow runs on the caller thread. */
  @Bean(name = "contextExecutor")
  public ThreadPoolTaskExecutor contextExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(8);
    executor.setMaxPoolSize(16);
    executor.setQueueCapacity(200);
    executor.setThreadNamePrefix("ctx-");
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.initialize();
    return executor;
  }

  /** Bounded pool for fire-and-forget mining jobs. Rejections are reported by the dispatcher. */
  @Bean(name = "backgroundExecutor")
  public ThreadPoolTaskExecutor backgroundExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(4);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("mining-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "sseExecutor")
  public Executor sseExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(5);
    executor.setMaxPoolSize(20);
    executor.setQueueCapacity(50);
    executor.setThreadNamePrefix("sse-");
    executor.initialize();
    return executor;
  }
}
