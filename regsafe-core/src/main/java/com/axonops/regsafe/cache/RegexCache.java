/*
 * Copyright 2025 AxonOps
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.axonops.regsafe.cache;

import com.axonops.regsafe.api.Regex;
import com.axonops.regsafe.metrics.MetricNames;
import com.axonops.regsafe.metrics.RegsafeMetricsRegistry;
import com.axonops.regsafe.util.PatternHasher;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-safe cache of registered {@link Regex} instances with dual eviction.
 *
 * <p>Registering a pattern compiles it and derives its schema. The cache makes that happen at most
 * once per distinct (pattern text, declared group names) pair while the entry stays cached: {@code
 * computeIfAbsent} runs the compiler for one key on one thread while other keys proceed
 * concurrently.
 *
 * <p>Eviction strategies: 1. LRU (soft limit): When cache exceeds max size, async evict least
 * recently used 2. Idle time: Background thread evicts entries idle beyond timeout
 *
 * <p>Evicted instances stay fully usable by callers that hold them; they are immutable and own no
 * resources.
 *
 * @since 1.0.0
 */
public final class RegexCache {
  private static final Logger logger = LoggerFactory.getLogger(RegexCache.class);

  private volatile RegsafeConfig config;

  // ConcurrentHashMap for lock-free reads/writes
  private volatile ConcurrentHashMap<CacheKey, CachedRegex> cache;
  private IdleEvictionTask evictionTask;

  // Single-thread executor for async LRU eviction (doesn't block cache access)
  private ExecutorService lruEvictionExecutor;

  private final AtomicLong hits = new AtomicLong(0);
  private final AtomicLong misses = new AtomicLong(0);
  private final AtomicLong evictionsLRU = new AtomicLong(0);
  private final AtomicLong evictionsIdle = new AtomicLong(0);

  /**
   * Creates a new cache with the given configuration.
   *
   * @param config the cache configuration
   */
  public RegexCache(RegsafeConfig config) {
    this.config = config;
    initialize(config);
  }

  public RegsafeConfig getConfig() {
    return config;
  }

  private void initialize(RegsafeConfig newConfig) {
    if (newConfig.cacheEnabled()) {
      this.cache = new ConcurrentHashMap<>(Math.min(newConfig.maxCacheSize(), 1024));
      this.lruEvictionExecutor =
          Executors.newSingleThreadExecutor(
              r -> {
                Thread t = new Thread(r, "Regsafe-LRU-Eviction");
                t.setDaemon(true);
                t.setPriority(Thread.MIN_PRIORITY);
                return t;
              });

      this.evictionTask = new IdleEvictionTask(this, newConfig);
      this.evictionTask.start();

      logger.info(
          "Regsafe: Regex cache initialized - maxSize: {}, idleTimeout: {}s, scanInterval: {}s",
          newConfig.maxCacheSize(),
          newConfig.idleTimeoutSeconds(),
          newConfig.evictionScanIntervalSeconds());

      newConfig
          .metricsRegistry()
          .registerGauge(MetricNames.CACHE_PATTERNS_COUNT, this::currentSize);
    } else {
      this.cache = null;
      this.evictionTask = null;
      this.lruEvictionExecutor = null;
      logger.info("Regsafe: Regex caching disabled");
    }
  }

  /**
   * Gets a cached registration or creates one.
   *
   * <p>Lock-free for cache hits. On a miss the compiler runs inside {@code computeIfAbsent}, so
   * concurrent callers registering the same key wait for one compilation instead of repeating it.
   * If the compiler throws, nothing is cached and the exception reaches every waiting caller's
   * own attempt.
   *
   * @param regex pattern text
   * @param groupNames caller-declared group names
   * @param compiler function that compiles and analyzes on a miss
   * @return cached or newly created instance
   */
  public Regex getOrCompile(String regex, List<String> groupNames, Supplier<Regex> compiler) {
    RegsafeMetricsRegistry metrics = config.metricsRegistry();
    ConcurrentHashMap<CacheKey, CachedRegex> map = this.cache;

    if (!config.cacheEnabled() || map == null) {
      misses.incrementAndGet();
      metrics.incrementCounter(MetricNames.PATTERNS_CACHE_MISSES);
      return compiler.get();
    }

    CacheKey key = new CacheKey(regex, List.copyOf(groupNames));

    CachedRegex cached = map.get(key);
    if (cached != null) {
      cached.touch();
      hits.incrementAndGet();
      metrics.incrementCounter(MetricNames.PATTERNS_CACHE_HITS);
      logger.trace("Regsafe: Cache hit - hash: {}", PatternHasher.hashWithNames(regex, groupNames));
      return cached.regex();
    }

    misses.incrementAndGet();
    metrics.incrementCounter(MetricNames.PATTERNS_CACHE_MISSES);
    logger.trace(
        "Regsafe: Cache miss - hash: {}, compiling", PatternHasher.hashWithNames(regex, groupNames));

    CachedRegex created = map.computeIfAbsent(key, k -> new CachedRegex(compiler.get()));

    // Soft limit: trigger eviction if over, but don't block
    int currentSize = map.size();
    if (currentSize > config.maxCacheSize()) {
      triggerAsyncLRUEviction(currentSize - config.maxCacheSize());
    }

    return created.regex();
  }

  private void triggerAsyncLRUEviction(int toEvict) {
    ExecutorService executor = lruEvictionExecutor;
    if (toEvict <= 0 || executor == null || executor.isShutdown()) {
      return;
    }

    executor.submit(
        () -> {
          try {
            evictLRUBatch(toEvict);
          } catch (RuntimeException e) {
            logger.warn("Regsafe: Error during async LRU eviction", e);
          }
        });
  }

  /**
   * Evicts least-recently-used entries.
   *
   * <p>Uses sample-based LRU: samples a subset of the cache and evicts the oldest. Entries accessed
   * within {@link RegsafeConfig#evictionProtectionMs()} are never candidates.
   */
  void evictLRUBatch(int toEvict) {
    ConcurrentHashMap<CacheKey, CachedRegex> map = this.cache;
    if (map == null) {
      return;
    }
    int actualToEvict = Math.min(toEvict, map.size() - config.maxCacheSize());
    if (actualToEvict <= 0) {
      return;
    }

    int sampleSize = Math.min(500, map.size());
    long minAgeNanos = config.evictionProtectionMs() * 1_000_000L;
    long cutoffTime = System.nanoTime() - minAgeNanos;

    List<Map.Entry<CacheKey, CachedRegex>> candidates =
        map.entrySet().stream()
            .filter(e -> e.getValue().lastAccessTimeNanos() <= cutoffTime)
            .limit(sampleSize)
            .sorted(Comparator.comparingLong(e -> e.getValue().lastAccessTimeNanos()))
            .limit(actualToEvict)
            .collect(Collectors.toList());

    int evicted = 0;
    for (Map.Entry<CacheKey, CachedRegex> entry : candidates) {
      if (map.remove(entry.getKey(), entry.getValue())) {
        evictionsLRU.incrementAndGet();
        config.metricsRegistry().incrementCounter(MetricNames.CACHE_EVICTIONS_LRU);
        logger.trace("Regsafe: LRU evicting regex: {}", entry.getKey());
        evicted++;
      }
    }

    if (evicted > 0) {
      logger.debug(
          "Regsafe: LRU eviction completed - evicted: {}, cacheSize: {}/{}",
          evicted,
          map.size(),
          config.maxCacheSize());
    }
  }

  /**
   * Evicts idle entries (called by background thread).
   *
   * @return number of entries evicted
   */
  int evictIdleEntries() {
    ConcurrentHashMap<CacheKey, CachedRegex> map = this.cache;
    if (!config.cacheEnabled() || map == null) {
      return 0;
    }

    long cutoffNanos = System.nanoTime() - (config.idleTimeoutSeconds() * 1_000_000_000L);
    AtomicLong evictedCount = new AtomicLong(0);

    map.entrySet()
        .removeIf(
            entry -> {
              if (entry.getValue().lastAccessTimeNanos() < cutoffNanos) {
                logger.trace("Regsafe: Idle evicting regex: {}", entry.getKey());
                evictionsIdle.incrementAndGet();
                config.metricsRegistry().incrementCounter(MetricNames.CACHE_EVICTIONS_IDLE);
                evictedCount.incrementAndGet();
                return true;
              }
              return false;
            });

    int evicted = (int) evictedCount.get();
    if (evicted > 0) {
      logger.debug(
          "Regsafe: Idle eviction completed - evicted: {}, cacheSize: {}", evicted, map.size());
    }
    return evicted;
  }

  private int currentSize() {
    ConcurrentHashMap<CacheKey, CachedRegex> map = this.cache;
    return map != null ? map.size() : 0;
  }

  /** Gets cache statistics snapshot. */
  public CacheStatistics getStatistics() {
    return new CacheStatistics(
        hits.get(),
        misses.get(),
        evictionsLRU.get(),
        evictionsIdle.get(),
        currentSize(),
        config.maxCacheSize());
  }

  /** Removes all cached entries. Instances held by callers stay valid. */
  public void clear() {
    ConcurrentHashMap<CacheKey, CachedRegex> map = this.cache;
    if (map == null) {
      return;
    }
    logger.debug("Regsafe: Clearing cache - {} cached entries", map.size());
    map.clear();
  }

  /** Resets cache statistics (for testing only). */
  public void resetStatistics() {
    hits.set(0);
    misses.set(0);
    evictionsLRU.set(0);
    evictionsIdle.set(0);
    logger.trace("Regsafe: Cache statistics reset");
  }

  /** Full reset for testing (clears cache and resets statistics). */
  public void reset() {
    clear();
    resetStatistics();
  }

  /**
   * Reconfigures the cache with new settings.
   *
   * <p>This clears the existing cache, resets statistics and reinitializes with the new config.
   *
   * @param newConfig the new configuration
   */
  public synchronized void reconfigure(RegsafeConfig newConfig) {
    logger.info("Regsafe: Reconfiguring cache with new settings");

    stopBackgroundTasks();
    clear();
    resetStatistics();
    config.metricsRegistry().removeGauge(MetricNames.CACHE_PATTERNS_COUNT);

    this.config = newConfig;
    initialize(newConfig);
  }

  /** Shuts down the cache (stops eviction thread, clears cache). */
  public void shutdown() {
    logger.info("Regsafe: Shutting down cache");
    stopBackgroundTasks();
    clear();
    config.metricsRegistry().removeGauge(MetricNames.CACHE_PATTERNS_COUNT);
  }

  private void stopBackgroundTasks() {
    if (evictionTask != null) {
      evictionTask.stop();
    }
    if (lruEvictionExecutor != null) {
      lruEvictionExecutor.shutdown();
    }
  }

  /** Checks whether the idle eviction thread is alive (for testing). */
  boolean isEvictionThreadRunning() {
    return evictionTask != null && evictionTask.isRunning();
  }

  /** Cache key combining pattern text and caller-declared group names. */
  private record CacheKey(String regex, List<String> groupNames) {
    @Override
    public String toString() {
      return PatternHasher.hashWithNames(regex, groupNames);
    }
  }

  /**
   * Cached registration with atomic access time tracking.
   *
   * <p>Uses nanoTime for efficient timestamp comparison without object allocation.
   */
  private static class CachedRegex {
    private final Regex regex;
    private final AtomicLong lastAccessTimeNanos;

    CachedRegex(Regex regex) {
      this.regex = regex;
      this.lastAccessTimeNanos = new AtomicLong(System.nanoTime());
    }

    Regex regex() {
      return regex;
    }

    long lastAccessTimeNanos() {
      return lastAccessTimeNanos.get();
    }

    void touch() {
      lastAccessTimeNanos.set(System.nanoTime());
    }
  }
}
