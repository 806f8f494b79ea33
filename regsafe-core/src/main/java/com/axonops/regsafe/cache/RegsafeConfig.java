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

import com.axonops.regsafe.metrics.NoOpMetricsRegistry;
import com.axonops.regsafe.metrics.RegsafeMetricsRegistry;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for libregsafe-java: registration caching and metrics.
 *
 * <p>Immutable configuration using Java 17 records. Controls how registered {@link
 * com.axonops.regsafe.api.Regex} instances are cached and where metrics are reported.
 *
 * <h2>Registration Cache</h2>
 *
 * <p>Registering a pattern compiles it with {@code java.util.regex} and derives its schema. The cache
 * keeps the result per distinct (pattern, declared group names) pair so that repeated registration
 * of the same pattern is a map lookup. The cache uses a <b>dual eviction strategy</b>:
 *
 * <ol>
 *   <li><b>LRU Eviction</b> - When cache exceeds {@code maxCacheSize}, least-recently-used entries
 *       are evicted asynchronously
 *   <li><b>Idle Eviction</b> - Background thread evicts entries unused for {@code
 *       idleTimeoutSeconds}
 * </ol>
 *
 * <p>Evicting an entry never invalidates a {@code Regex} a caller still holds; it only means the
 * next registration of that pattern compiles again.
 *
 * <h2>Configuration Examples</h2>
 *
 * <pre>{@code
 * // Defaults: 10K entries, 5 min idle timeout, metrics disabled
 * Regex.configureCache(RegsafeConfig.DEFAULT);
 *
 * // Metrics enabled, smaller cache
 * RegsafeConfig config = RegsafeConfig.builder()
 *     .maxCacheSize(1_000)
 *     .idleTimeoutSeconds(60)
 *     .evictionScanIntervalSeconds(15)
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "myapp.regsafe"))
 *     .build();
 *
 * // No caching: every registration compiles
 * Regex.configureCache(RegsafeConfig.NO_CACHE);
 * }</pre>
 *
 * @param cacheEnabled Enable registration caching
 * @param maxCacheSize Maximum cached entries before LRU eviction (must be > 0 if cache enabled)
 * @param idleTimeoutSeconds Evict entries unused for this duration (must be > 0 if cache enabled)
 * @param evictionScanIntervalSeconds How often the idle eviction task runs (must be > 0)
 * @param evictionProtectionMs Protect recently used entries from LRU eviction for this duration
 * @param metricsRegistry Metrics implementation (use {@link NoOpMetricsRegistry} for zero overhead)
 * @since 1.0.0
 * @see RegexCache
 * @see com.axonops.regsafe.metrics.MetricNames
 */
public record RegsafeConfig(
    boolean cacheEnabled,
    int maxCacheSize,
    long idleTimeoutSeconds,
    long evictionScanIntervalSeconds,
    long evictionProtectionMs,
    RegsafeMetricsRegistry metricsRegistry) {

  private static final Logger logger = LoggerFactory.getLogger(RegsafeConfig.class);

  /**
   * Default configuration.
   *
   * <p>10K cached entries, 5 minute idle timeout, 1 minute scan interval, 1 second eviction
   * protection, metrics disabled.
   */
  public static final RegsafeConfig DEFAULT =
      new RegsafeConfig(
          true, // Cache enabled
          10000, // Max 10K cached entries
          300, // 5 minute idle timeout
          60, // Scan every 60 seconds
          1000, // 1 second eviction protection
          NoOpMetricsRegistry.INSTANCE // Metrics disabled (zero overhead)
          );

  /** Configuration with caching disabled. Every registration compiles and analyzes. */
  public static final RegsafeConfig NO_CACHE =
      new RegsafeConfig(
          false, // Cache disabled
          0, // Ignored when cache disabled
          0, // Ignored when cache disabled
          0, // Ignored when cache disabled
          0, // Ignored when cache disabled
          NoOpMetricsRegistry.INSTANCE // Metrics disabled
          );

  /** Compact constructor with validation. */
  public RegsafeConfig {
    Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");

    if (cacheEnabled) {
      if (maxCacheSize <= 0) {
        throw new IllegalArgumentException("maxCacheSize must be positive when cache enabled");
      }
      if (idleTimeoutSeconds <= 0) {
        throw new IllegalArgumentException(
            "idleTimeoutSeconds must be positive when cache enabled");
      }
      if (evictionScanIntervalSeconds <= 0) {
        throw new IllegalArgumentException(
            "evictionScanIntervalSeconds must be positive when cache enabled");
      }
      if (evictionProtectionMs < 0) {
        throw new IllegalArgumentException(
            "evictionProtectionMs must be non-negative when cache enabled");
      }

      // Still valid, just means idle entries linger past their timeout
      if (evictionScanIntervalSeconds > idleTimeoutSeconds) {
        logger.warn(
            "Regsafe: evictionScanIntervalSeconds ({}s) exceeds idleTimeoutSeconds ({}s) - idle entries may not be evicted promptly",
            evictionScanIntervalSeconds,
            idleTimeoutSeconds);
      }
    }
  }

  /**
   * Creates a builder for custom configuration.
   *
   * <p>Builder starts with defaults and allows selective overrides:
   *
   * <pre>{@code
   * RegsafeConfig config = RegsafeConfig.builder()
   *     .maxCacheSize(1_000)
   *     .build();
   * }</pre>
   *
   * @return new builder with default values
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for custom configuration.
   *
   * <p>All fields start with the values of {@link #DEFAULT}.
   */
  public static class Builder {
    private boolean cacheEnabled = true;
    private int maxCacheSize = 10000;
    private long idleTimeoutSeconds = 300;
    private long evictionScanIntervalSeconds = 60;
    private long evictionProtectionMs = 1000;
    private RegsafeMetricsRegistry metricsRegistry = NoOpMetricsRegistry.INSTANCE;

    /**
     * Enable or disable registration caching.
     *
     * @param enabled true to enable caching (default), false to disable
     * @return this builder
     */
    public Builder cacheEnabled(boolean enabled) {
      this.cacheEnabled = enabled;
      return this;
    }

    /**
     * Set maximum number of cached entries before LRU eviction.
     *
     * <p><b>Default: 10,000</b>
     *
     * <p>Monitor {@code cache.patterns.current.count} and the hit rate to tune.
     *
     * @param size maximum cached entries (must be > 0)
     * @return this builder
     */
    public Builder maxCacheSize(int size) {
      this.maxCacheSize = size;
      return this;
    }

    /**
     * Set idle timeout for eviction.
     *
     * <p><b>Default: 300 seconds (5 minutes)</b>
     *
     * @param seconds idle timeout in seconds (must be > 0)
     * @return this builder
     */
    public Builder idleTimeoutSeconds(long seconds) {
      this.idleTimeoutSeconds = seconds;
      return this;
    }

    /**
     * Set how often the idle eviction task runs.
     *
     * <p><b>Default: 60 seconds</b>. Should be ≤ {@code idleTimeoutSeconds}.
     *
     * @param seconds scan interval in seconds (must be > 0)
     * @return this builder
     */
    public Builder evictionScanIntervalSeconds(long seconds) {
      this.evictionScanIntervalSeconds = seconds;
      return this;
    }

    /**
     * Set eviction protection period for recently used entries.
     *
     * <p><b>Default: 1000ms (1 second)</b>
     *
     * <p>LRU eviction skips entries accessed within this window, so an entry is not evicted between
     * being stored and being returned to its caller.
     *
     * @param ms protection period in milliseconds (must be ≥ 0)
     * @return this builder
     */
    public Builder evictionProtectionMs(long ms) {
      this.evictionProtectionMs = ms;
      return this;
    }

    /**
     * Set the metrics registry.
     *
     * <p><b>Default: {@link NoOpMetricsRegistry#INSTANCE}</b>
     *
     * @param metricsRegistry metrics implementation (must not be null)
     * @return this builder
     */
    public Builder metricsRegistry(RegsafeMetricsRegistry metricsRegistry) {
      this.metricsRegistry = metricsRegistry;
      return this;
    }

    /**
     * Build the configuration.
     *
     * @return new immutable configuration
     * @throws IllegalArgumentException if validation fails
     * @throws NullPointerException if metricsRegistry is null
     */
    public RegsafeConfig build() {
      return new RegsafeConfig(
          cacheEnabled,
          maxCacheSize,
          idleTimeoutSeconds,
          evictionScanIntervalSeconds,
          evictionProtectionMs,
          metricsRegistry);
    }
  }
}
