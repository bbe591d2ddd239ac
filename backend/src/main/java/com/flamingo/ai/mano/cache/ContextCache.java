package com.flamingo.ai.mano.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Per-key TTL cache for context sub-results.
 *
 * <p>Every entry carries its own time-to-live: a read at or after {@code insertion + ttl} is a
 * miss. Writes overwrite. Concurrent misses on the same key may compute the value more than once;
 * the last write wins. Size is bounded so long-lived processes do not grow without limit.
 */
@Slf4j
public class ContextCache {

  private final Cache<String, Entry> entries;
  private final MeterRegistry meterRegistry;

  public ContextCache(long maximumSize, Ticker ticker, MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.entries =
        Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .ticker(ticker)
            .expireAfter(new PerEntryExpiry())
            .build();
  }

  /** Returns the cached value for {@code key}, or empty when absent or expired. */
  @SuppressWarnings("unchecked")
  public <T> Optional<T> get(String key) {
    Entry entry = entries.getIfPresent(key);
    if (entry == null) {
      meterRegistry.counter("context_cache.misses").increment();
      return Optional.empty();
    }
    meterRegistry.counter("context_cache.hits").increment();
    return Optional.of((T) entry.payload());
  }

  /** Stores {@code value} under {@code key} for {@code ttl}. Null values are not cached. */
  public void put(String key, Object value, Duration ttl) {
    if (value == null || ttl.isZero() || ttl.isNegative()) {
      return;
    }
    entries.put(key, new Entry(value, ttl));
  }

  /**
   * Returns the cached value or computes, stores and returns a fresh one. Exceptions thrown by
   * {@code loader} propagate and nothing is cached.
   */
  public <T> T getOrCompute(String key, Duration ttl, Supplier<T> loader) {
    Optional<T> cached = get(key);
    if (cached.isPresent()) {
      log.debug("Context cache hit for {}", key);
      return cached.get();
    }
    T value = loader.get();
    put(key, value, ttl);
    return value;
  }

  public void invalidate(String key) {
    entries.invalidate(key);
  }

  /** Drops every entry that belongs to {@code userId}, e.g. after the roster changed. */
  public void invalidateUser(String userId) {
    String prefix = CacheKeys.userPrefix(userId);
    entries.asMap().keySet().removeIf(key -> key.startsWith(prefix));
  }

  public long estimatedSize() {
    entries.cleanUp();
    return entries.estimatedSize();
  }

  private record Entry(Object payload, Duration ttl) {}

  private static final class PerEntryExpiry implements Expiry<String, Entry> {

    @Override
    public long expireAfterCreate(String key, Entry value, long currentTime) {
      return value.ttl().toNanos();
    }

    @Override
    public long expireAfterUpdate(
        String key, Entry value, long currentTime, long currentDuration) {
      return value.ttl().toNanos();
    }

    @Override
    public long expireAfterRead(String key, Entry value, long currentTime, long currentDuration) {
      return currentDuration;
    }
  }
}
