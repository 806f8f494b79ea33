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

import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Dropwizard Metrics adapter for libregsafe-java.
 *
 * <p>Wraps a Dropwizard {@link MetricRegistry} and delegates all metric
 * operations to it, so the library reports into whatever registry the host
 * application already exposes.
 *
 * <p><strong>Thread Safety:</strong> MetricRegistry and all Dropwizard metric
 * types are thread-safe. This adapter is fully thread-safe.
 *
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * RegsafeMetricsRegistry metrics = new DropwizardMetricsAdapter(registry, "com.myapp.regsafe");
 *
 * RegsafeConfig config = RegsafeConfig.builder()
 *     .metricsRegistry(metrics)
 *     .build();
 * Regex.configureCache(config);
 * }</pre>
 *
 * @since 1.0.0
 */
public final class DropwizardMetricsAdapter implements RegsafeMetricsRegistry {

    /** Prefix used when none is given. */
    public static final String DEFAULT_PREFIX = "com.axonops.regsafe";

    private final MetricRegistry registry;
    private final String prefix;

    /**
     * Creates adapter with default metric prefix: {@code com.axonops.regsafe}
     *
     * @param registry the Dropwizard MetricRegistry to register metrics with
     * @throws NullPointerException if registry is null
     */
    public DropwizardMetricsAdapter(MetricRegistry registry) {
        this(registry, DEFAULT_PREFIX);
    }

    /**
     * Creates adapter with custom metric prefix.
     *
     * <p>With prefix {@code "com.myapp.regsafe"}, metrics appear as
     * {@code com.myapp.regsafe.patterns.compiled.total.count} and so on.
     *
     * @param registry the Dropwizard MetricRegistry to register metrics with
     * @param prefix the metric name prefix
     * @throws NullPointerException if registry or prefix is null
     */
    public DropwizardMetricsAdapter(MetricRegistry registry, String prefix) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.prefix = Objects.requireNonNull(prefix, "prefix cannot be null");
    }

    @Override
    public void incrementCounter(String name) {
        registry.counter(metricName(name)).inc();
    }

    @Override
    public void incrementCounter(String name, long delta) {
        registry.counter(metricName(name)).inc(delta);
    }

    @Override
    public void recordTimer(String name, long durationNanos) {
        registry.timer(metricName(name)).update(durationNanos, TimeUnit.NANOSECONDS);
    }

    @Override
    public void registerGauge(String name, Supplier<Number> valueSupplier) {
        String fullName = metricName(name);

        // Idempotent registration: replace any gauge left by a previous cache instance
        registry.remove(fullName);
        registry.register(fullName, (Gauge<Number>) valueSupplier::get);
    }

    @Override
    public void removeGauge(String name) {
        registry.remove(metricName(name));
    }

    public String getPrefix() {
        return prefix;
    }

    private String metricName(String name) {
        return MetricRegistry.name(prefix, name);
    }
}
