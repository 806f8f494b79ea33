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

import com.codahale.metrics.MetricRegistry;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class DropwizardMetricsAdapterTest {

    @Test
    void testDefaultPrefix() {
        MetricRegistry registry = new MetricRegistry();
        DropwizardMetricsAdapter adapter = new DropwizardMetricsAdapter(registry);

        adapter.incrementCounter(MetricNames.PATTERNS_COMPILED);

        assertThat(adapter.getPrefix()).isEqualTo("com.axonops.regsafe");
        assertThat(registry.counter("com.axonops.regsafe.patterns.compiled.total.count").getCount()).isEqualTo(1);
    }

    @Test
    void testCountersAndTimers() {
        MetricRegistry registry = new MetricRegistry();
        DropwizardMetricsAdapter adapter = new DropwizardMetricsAdapter(registry, "app.regex");

        adapter.incrementCounter(MetricNames.MATCHING_OPERATIONS);
        adapter.incrementCounter(MetricNames.MATCHING_OPERATIONS, 4);
        adapter.recordTimer(MetricNames.MATCHING_LATENCY, TimeUnit.MILLISECONDS.toNanos(3));

        assertThat(registry.counter("app.regex.matching.operations.total.count").getCount()).isEqualTo(5);
        assertThat(registry.timer("app.regex.matching.latency").getCount()).isEqualTo(1);
        assertThat(registry.timer("app.regex.matching.latency").getSnapshot().getMax())
            .isEqualTo(TimeUnit.MILLISECONDS.toNanos(3));
    }

    @Test
    void testGaugeRegistrationIsIdempotent() {
        MetricRegistry registry = new MetricRegistry();
        DropwizardMetricsAdapter adapter = new DropwizardMetricsAdapter(registry, "app.regex");
        AtomicInteger first = new AtomicInteger(1);
        AtomicInteger second = new AtomicInteger(2);

        adapter.registerGauge(MetricNames.CACHE_PATTERNS_COUNT, first::get);
        adapter.registerGauge(MetricNames.CACHE_PATTERNS_COUNT, second::get);

        assertThat(registry.getGauges().get("app.regex.cache.patterns.current.count").getValue()).isEqualTo(2);

        adapter.removeGauge(MetricNames.CACHE_PATTERNS_COUNT);
        assertThat(registry.getGauges()).isEmpty();
    }

    @Test
    void testNullArgumentsRejected() {
        assertThatNullPointerException().isThrownBy(() -> new DropwizardMetricsAdapter(null));
        assertThatNullPointerException().isThrownBy(() -> new DropwizardMetricsAdapter(new MetricRegistry(), null));
    }
}
