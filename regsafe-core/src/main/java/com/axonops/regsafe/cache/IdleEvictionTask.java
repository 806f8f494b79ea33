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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background thread that periodically evicts idle entries from the registration cache.
 *
 * Runs as a low-priority daemon thread.
 *
 * @since 1.0.0
 */
final class IdleEvictionTask {
    private static final Logger logger = LoggerFactory.getLogger(IdleEvictionTask.class);

    private final RegexCache cache;
    private final RegsafeConfig config;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Thread thread;

    IdleEvictionTask(RegexCache cache, RegsafeConfig config) {
        this.cache = cache;
        this.config = config;
    }

    /**
     * Starts the eviction thread.
     */
    void start() {
        if (running.compareAndSet(false, true)) {
            thread = new Thread(this::run, "Regsafe-IdleEviction");
            thread.setDaemon(true);
            thread.setPriority(Thread.MIN_PRIORITY);
            thread.start();

            logger.info("Regsafe: Idle eviction thread started - interval: {}s",
                config.evictionScanIntervalSeconds());
        }
    }

    /**
     * Stops the eviction thread gracefully.
     */
    void stop() {
        if (running.compareAndSet(true, false)) {
            logger.info("Regsafe: Stopping idle eviction thread");

            Thread t = thread;
            if (t != null) {
                t.interrupt();
                try {
                    t.join(5000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }

            logger.info("Regsafe: Idle eviction thread stopped");
        }
    }

    private void run() {
        logger.debug("Regsafe: Idle eviction thread running");

        long scanIntervalMs = config.evictionScanIntervalSeconds() * 1000;

        while (running.get()) {
            try {
                Thread.sleep(scanIntervalMs);

                int evicted = cache.evictIdleEntries();
                logger.debug("Regsafe: Idle eviction scan complete - evicted: {}", evicted);

            } catch (InterruptedException e) {
                logger.debug("Regsafe: Idle eviction thread interrupted");
                break;
            } catch (RuntimeException e) {
                // Keep the thread alive; the next scan retries
                logger.error("Regsafe: Error in idle eviction thread", e);
            }
        }

        logger.debug("Regsafe: Idle eviction thread exiting");
    }

    /**
     * Checks if eviction thread is running.
     */
    boolean isRunning() {
        return running.get() && thread != null && thread.isAlive();
    }
}
