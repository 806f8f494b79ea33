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

package com.axonops.regsafe.metrics;

/**
 * Metric name constants for libregsafe-java instrumentation.
 *
 * <p>Names are relative; {@link DropwizardMetricsAdapter} prepends its prefix. Counters end in
 * {@code .total.count}, gauges in {@code .current.count}, and timers in {@code .latency}.
 *
 * <h2>Registration</h2>
 *
 * <p>{@link com.axonops.regsafe.api.Regex#compile(String, String...)} first asks the
 * {@link com.axonops.regsafe.cache.RegexCache}. A cache hit returns the shared instance. A miss
 * compiles the pattern with {@code java.util.regex}, derives its schema, and stores the result.
 * Compilation and schema analysis are timed separately.
 *
 * <h2>Extraction</h2>
 *
 * <p>Every shape-checked extraction is counted and timed. A schema violation is counted in
 * {@link #ERRORS_SCHEMA_VIOLATION} before the exception is thrown; any non-zero value of that
 * counter is a defect worth investigating.
 *
 * @since 1.0.0
 */
public final class MetricNames {
  private MetricNames() {}

  // ========================================
  // Pattern Registration Metrics
  // ========================================

  /** Patterns compiled and analyzed (cache misses plus uncached compilations). */
  public static final String PATTERNS_COMPILED = "patterns.compiled.total.count";

  /** Registrations served from the cache. */
  public static final String PATTERNS_CACHE_HITS = "patterns.cache.hits.total.count";

  /** Registrations that had to compile. */
  public static final String PATTERNS_CACHE_MISSES = "patterns.cache.misses.total.count";

  /** Time spent in {@code java.util.regex.Pattern.compile}. */
  public static final String PATTERNS_COMPILATION_LATENCY = "patterns.compilation.latency";

  /** Time spent deriving a schema from pattern text. */
  public static final String SCHEMA_ANALYSIS_LATENCY = "schema.analysis.latency";

  // ========================================
  // Cache Metrics
  // ========================================

  /** Gauge: patterns currently cached. */
  public static final String CACHE_PATTERNS_COUNT = "cache.patterns.current.count";

  public static final String CACHE_EVICTIONS_LRU = "cache.evictions.lru.total.count";

  public static final String CACHE_EVICTIONS_IDLE = "cache.evictions.idle.total.count";

  // ========================================
  // Matching Metrics
  // ========================================

  /** Match attempts of any mode, successful or not. */
  public static final String MATCHING_OPERATIONS = "matching.operations.total.count";

  public static final String MATCHING_LATENCY = "matching.latency";

  public static final String MATCHING_FULL_MATCH_LATENCY = "matching.full_match.latency";

  public static final String MATCHING_PREFIX_MATCH_LATENCY = "matching.prefix_match.latency";

  public static final String MATCHING_FIND_LATENCY = "matching.find.latency";

  /** Shape-checked extractions that produced a result. */
  public static final String EXTRACTION_OPERATIONS = "extraction.operations.total.count";

  public static final String EXTRACTION_LATENCY = "extraction.latency";

  /** Replacement operations (any replace* variant). */
  public static final String REPLACE_OPERATIONS = "replace.operations.total.count";

  // ========================================
  // Error Metrics
  // ========================================

  /** Patterns rejected by the engine. */
  public static final String ERRORS_COMPILATION_FAILED = "errors.compilation.failed.total.count";

  /** Schema and engine disagreed: at registration or during extraction. */
  public static final String ERRORS_SCHEMA_VIOLATION = "errors.schema.violation.total.count";
}
