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

package com.axonops.regsafe.dropwizard;

import com.axonops.regsafe.cache.RegsafeConfig;
import com.axonops.regsafe.metrics.DropwizardMetricsAdapter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Convenience factory for {@link RegsafeConfig} with Dropwizard Metrics integration.
 *
 * <p>Builds a configuration whose metrics go to an application's {@link MetricRegistry} and,
 * optionally, starts a {@link JmxReporter} so they are visible over JMX.
 *
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * Regex.configureCache(RegsafeMetricsConfig.withMetrics(registry, "com.mycompany.myapp.regsafe"));
 * }</pre>
 *
 * @since 1.0.0
 */
public final class RegsafeMetricsConfig {
    private static final Logger logger = LoggerFactory.getLogger(RegsafeMetricsConfig.class);
    private static volatile JmxReporter jmxReporter;

    private RegsafeMetricsConfig() {
        // Utility class
    }

    /**
     * Creates a config with Dropwizard Metrics integration and automatic JMX.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @return configured RegsafeConfig with metrics enabled
     */
    public static RegsafeConfig withMetrics(MetricRegistry registry, String metricPrefix) {
        return withMetrics(registry, metricPrefix, true);
    }

    /**
     * Creates a config with Dropwizard Metrics integration.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @param enableJmx whether to set up JMX exposure
     * @return configured RegsafeConfig with metrics enabled
     */
    public static RegsafeConfig withMetrics(MetricRegistry registry, String metricPrefix, boolean enableJmx) {
        return withMetrics(RegsafeConfig.builder(), registry, metricPrefix, enableJmx);
    }

    /**
     * Creates a config from a partially filled builder, adding Dropwizard Metrics integration.
     *
     * <p>Use this to combine metrics with non-default cache settings:
     * <pre>{@code
     * RegsafeConfig config = RegsafeMetricsConfig.withMetrics(
     *     RegsafeConfig.builder().maxCacheSize(1_000), registry, "myapp.regsafe", false);
     * }</pre>
     *
     * @param builder builder carrying the other settings
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @param enableJmx whether to set up JMX exposure
     * @return configured RegsafeConfig with metrics enabled
     */
    public static RegsafeConfig withMetrics(RegsafeConfig.Builder builder, MetricRegistry registry,
                                            String metricPrefix, boolean enableJmx) {
        Objects.requireNonNull(builder, "builder cannot be null");
        Objects.requireNonNull(registry, "registry cannot be null");
        Objects.requireNonNull(metricPrefix, "metricPrefix cannot be null");

        if (enableJmx) {
            ensureJmxReporter(registry);
        }

        return builder
            .metricsRegistry(new DropwizardMetricsAdapter(registry, metricPrefix))
            .build();
    }

    /**
     * Creates a config with Dropwizard Metrics using the default prefix
     * {@value DropwizardMetricsAdapter#DEFAULT_PREFIX}.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @return configured RegsafeConfig with metrics enabled
     */
    public static RegsafeConfig withMetrics(MetricRegistry registry) {
        return withMetrics(registry, DropwizardMetricsAdapter.DEFAULT_PREFIX, true);
    }

    /**
     * Ensures a JmxReporter is running. Only the first registry passed here is exposed; later
     * calls are no-ops until {@link #shutdown()}.
     */
    private static synchronized void ensureJmxReporter(MetricRegistry registry) {
        if (jmxReporter == null) {
            try {
                logger.info("Regsafe: Registering JmxReporter for metrics");
                jmxReporter = JmxReporter.forRegistry(registry).build();
                jmxReporter.start();
                logger.info("Regsafe: JmxReporter started - metrics available via JMX");
            } catch (RuntimeException e) {
                // Not fatal: the host may already expose the registry over JMX
                logger.warn("Regsafe: Failed to start JmxReporter (may already be configured)", e);
            }
        }
    }

    /**
     * Checks whether a JmxReporter started by this class is running.
     */
    public static synchronized boolean isJmxReporterRunning() {
        return jmxReporter != null;
    }

    /**
     * Stops the JmxReporter started by this class, if any.
     */
    public static synchronized void shutdown() {
        if (jmxReporter != null) {
            logger.info("Regsafe: Stopping JmxReporter");
            jmxReporter.stop();
            jmxReporter = null;
        }
    }
}
