package com.flamingo.ai.mano.config;

import com.flamingo.ai.mano.cache.ContextCache;
import com.github.benmanes.caffeine.cache.Ticker;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Creates the process-wide context cache shared by every aggregator. */
@Configuration
public class CacheConfig {

  @Bean
  public Ticker cacheTicker() {
    return Ticker.systemTicker();
  }

  @Bean
  public ContextCache contextCache(
      EngineConfig engineConfig, Ticker cacheTicker, MeterRegistry meterRegistry) {
    return new ContextCache(engineConfig.getCache().getMaximumSize(), cacheTicker, meterRegistry);
  }
}
