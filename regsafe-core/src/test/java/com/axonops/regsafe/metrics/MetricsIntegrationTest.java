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

import com.axonops.regsafe.api.MatchMode;
import com.axonops.regsafe.api.PatternCompilationException;
import com.axonops.regsafe.api.Regex;
import com.axonops.regsafe.api.RequiredGroupAbsentException;
import com.axonops.regsafe.api.ShapeMismatchException;
import com.axonops.regsafe.cache.RegexCache;
import com.axonops.regsafe.test.TestUtils;
import com.codahale.metrics.Counter;
import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests verifying metrics are actually collected during operations.
 *
 * Swaps in a global cache reporting to a Dropwizard registry, then performs real
 * operations and verifies the metrics are updated.
 */
class MetricsIntegrationTest {

    private static final String PREFIX = "test.regsafe";

    private MetricRegistry registry;
    private RegexCache originalCache;

    @BeforeEach
    void setup() {
        registry = new MetricRegistry();
        originalCache = TestUtils.replaceGlobalCacheWithMetrics(registry, PREFIX);
    }

    @AfterEach
    void cleanup() {
        TestUtils.restoreGlobalCache(originalCache);
    }

    private Counter counter(String name) {
        return registry.counter(PREFIX + "." + name);
    }

    private Timer timer(String name) {
        return registry.timer(PREFIX + "." + name);
    }

    @Test
    void testRegistrationMetrics() {
        Regex.compile("(a)(b)?");

        Counter compiled = counter(MetricNames.PATTERNS_COMPILED);
        assertThat(compiled.getCount()).isEqualTo(1);
        assertThat(timer(MetricNames.PATTERNS_COMPILATION_LATENCY).getCount()).isEqualTo(1);
        assertThat(timer(MetricNames.SCHEMA_ANALYSIS_LATENCY).getCount()).isEqualTo(1);

        Regex.compile("(c)");
        assertThat(compiled.getCount()).isEqualTo(2);
    }

    @Test
    void testCacheHitMissMetrics() {
        Regex.compile("test.*");

        Counter misses = counter(MetricNames.PATTERNS_CACHE_MISSES);
        Counter hits = counter(MetricNames.PATTERNS_CACHE_HITS);
        assertThat(misses.getCount()).isEqualTo(1);
        assertThat(hits.getCount()).isEqualTo(0);

        Regex.compile("test.*");
        assertThat(misses.getCount()).isEqualTo(1);
        assertThat(hits.getCount()).isEqualTo(1);
        assertThat(counter(MetricNames.PATTERNS_COMPILED).getCount()).isEqualTo(1);

        Regex.compile("other.*");
        assertThat(misses.getCount()).isEqualTo(2);
        assertThat(hits.getCount()).isEqualTo(1);
    }

    @Test
    void testMatchingMetrics() {
        Regex regex = Regex.compile("test.*");
        Counter operations = counter(MetricNames.MATCHING_OPERATIONS);

        regex.matches("test123");
        assertThat(timer(MetricNames.MATCHING_FULL_MATCH_LATENCY).getCount()).isEqualTo(1);
        assertThat(operations.getCount()).isEqualTo(1);

        regex.match("test456 and more", MatchMode.PREFIX);
        assertThat(timer(MetricNames.MATCHING_PREFIX_MATCH_LATENCY).getCount()).isEqualTo(1);

        regex.findFirstIn("a test");
        assertThat(timer(MetricNames.MATCHING_FIND_LATENCY).getCount()).isEqualTo(1);

        assertThat(operations.getCount()).isEqualTo(3);
        assertThat(timer(MetricNames.MATCHING_LATENCY).getCount()).isEqualTo(3);
    }

    @Test
    void testExtractionMetrics() {
        Regex regex = Regex.compile("(\\d+)(?:\\.(\\d+))?");

        regex.extract("3.14");
        regex.extract("3");
        regex.extract("x");

        // No match is not an extraction
        assertThat(counter(MetricNames.EXTRACTION_OPERATIONS).getCount()).isEqualTo(2);
        assertThat(timer(MetricNames.EXTRACTION_LATENCY).getCount()).isEqualTo(2);
        assertThat(counter(MetricNames.MATCHING_OPERATIONS).getCount()).isEqualTo(3);
    }

    @Test
    void testReplaceMetrics() {
        Regex regex = Regex.compile("\\d");

        regex.replaceAllIn("a1b2", "#");
        regex.replaceFirstIn("a1b2", "#");
        regex.replaceSomeIn("a1b2", m -> Optional.empty());

        assertThat(counter(MetricNames.REPLACE_OPERATIONS).getCount()).isEqualTo(3);
    }

    @Test
    @SuppressWarnings("unchecked")
    void testCacheGauge() {
        Gauge<Number> cacheSize = (Gauge<Number>) registry.getGauges().get(PREFIX + "." + MetricNames.CACHE_PATTERNS_COUNT);
        assertThat(cacheSize).isNotNull();
        assertThat(cacheSize.getValue().intValue()).isEqualTo(0);

        Regex.compile("pattern1");
        assertThat(cacheSize.getValue().intValue()).isEqualTo(1);

        Regex.compile("pattern2");
        Regex.compile("pattern2");
        assertThat(cacheSize.getValue().intValue()).isEqualTo(2);
    }

    @Test
    void testGaugeRemovedOnShutdown() {
        String gaugeName = PREFIX + "." + MetricNames.CACHE_PATTERNS_COUNT;
        assertThat(registry.getGauges()).containsKey(gaugeName);

        Regex.getGlobalCache().shutdown();

        assertThat(registry.getGauges()).doesNotContainKey(gaugeName);
    }

    @Test
    void testErrorMetrics_CompilationFailed() {
        Counter errorCounter = counter(MetricNames.ERRORS_COMPILATION_FAILED);
        assertThat(errorCounter.getCount()).isEqualTo(0);

        assertThatThrownBy(() -> Regex.compile("(unclosed"))
            .isInstanceOf(PatternCompilationException.class);

        assertThat(errorCounter.getCount()).isEqualTo(1);
        assertThat(counter(MetricNames.PATTERNS_COMPILED).getCount()).isEqualTo(0);
    }

    @Test
    void testErrorMetrics_SchemaViolation() {
        Counter violations = counter(MetricNames.ERRORS_SCHEMA_VIOLATION);

        assertThatThrownBy(() -> Regex.compile("(?x)(a)#(b)"))
            .isInstanceOf(ShapeMismatchException.class);
        assertThat(violations.getCount()).isEqualTo(1);

        Regex lookahead = Regex.compile("(?!(a))b");
        assertThatThrownBy(() -> lookahead.extract("b"))
            .isInstanceOf(RequiredGroupAbsentException.class);
        assertThat(violations.getCount()).isEqualTo(2);
    }

    @Test
    void testEvictionMetrics() throws InterruptedException {
        TestUtils.restoreGlobalCache(originalCache);
        originalCache = TestUtils.replaceGlobalCache(TestUtils.testConfigWithMetrics(registry, "eviction.test")
            .maxCacheSize(5)
            .evictionProtectionMs(0)
            .build());

        Counter lruEvictions = registry.counter("eviction.test." + MetricNames.CACHE_EVICTIONS_LRU);

        for (int i = 0; i < 15; i++) {
            Regex.compile("eviction_test_" + i);
        }

        // Wait for async LRU eviction to complete
        long deadline = System.currentTimeMillis() + 5000;
        while (lruEvictions.getCount() < 10 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }

        assertThat(Regex.getCacheStatistics().currentSize()).isLessThanOrEqualTo(5);
        assertThat(lruEvictions.getCount()).isEqualTo(10);
    }

    @Test
    void testAllCoreMetricsExist() {
        Regex regex = Regex.compile("(t)est.*");
        Regex.compile("(t)est.*");
        regex.matches("test");
        regex.findPrefixOf("test");
        regex.findFirstIn("a test");
        regex.extract("test");
        regex.replaceAllIn("test", "x");
        try {
            Regex.compile("(invalid");
        } catch (PatternCompilationException e) {
            // Expected
        }

        assertThat(registry.getCounters().keySet()).contains(
            PREFIX + ".patterns.compiled.total.count",
            PREFIX + ".patterns.cache.hits.total.count",
            PREFIX + ".patterns.cache.misses.total.count",
            PREFIX + ".matching.operations.total.count",
            PREFIX + ".extraction.operations.total.count",
            PREFIX + ".replace.operations.total.count",
            PREFIX + ".errors.compilation.failed.total.count"
        );

        assertThat(registry.getTimers().keySet()).contains(
            PREFIX + ".patterns.compilation.latency",
            PREFIX + ".schema.analysis.latency",
            PREFIX + ".matching.latency",
            PREFIX + ".matching.full_match.latency",
            PREFIX + ".matching.prefix_match.latency",
            PREFIX + ".matching.find.latency",
            PREFIX + ".extraction.latency"
        );

        assertThat(registry.getGauges().keySet()).contains(PREFIX + ".cache.patterns.current.count");
    }

    @Test
    void testNoOpMetrics() {
        TestUtils.restoreGlobalCache(originalCache);
        originalCache = TestUtils.replaceGlobalCache(TestUtils.testConfigBuilder().build());

        Regex regex = Regex.compile("test.*");
        assertThat(regex.matches("test123")).isTrue();

        assertThat(registry.getCounters()).isEmpty();
    }
}
