// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring.metrics;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Collects unscoped metrics between two harvests.
 *
 * <p>Recording and draining exclude each other, so every recorded value lands in exactly one drained window.
 */
public class MetricAggregator {
    private final Clock clock;
    private final Object lock = new Object();
    private Map<String, MetricStats> metrics = new LinkedHashMap<>();
    private Map<String, ApdexStats> apdexMetrics = new LinkedHashMap<>();
    private long beginMillis;

    public MetricAggregator(Clock clock) {
        this.clock = clock;
        this.beginMillis = clock.millis();
    }

    // Callers must hold the lock while they update the returned stats.
    MetricStats getOrCreateMetric(String name) {
        synchronized (lock) {
            return metrics.computeIfAbsent(name, key -> new MetricStats());
        }
    }

    ApdexStats getOrCreateApdexMetric(String name, Duration apdexT) {
        synchronized (lock) {
            return apdexMetrics.computeIfAbsent(name, key -> new ApdexStats(apdexT));
        }
    }

    /** Returns the metric of the current window, or null if nothing was recorded under that name. */
    public MetricStats getMetric(String name) {
        synchronized (lock) {
            return metrics.get(name);
        }
    }

    /** Returns the Apdex metric of the current window, or null if nothing was recorded under that name. */
    public ApdexStats getApdexMetric(String name) {
        synchronized (lock) {
            return apdexMetrics.get(name);
        }
    }

    /** Records one call with timing. */
    public void recordValue(String name, Duration duration) {
        synchronized (lock) {
            getOrCreateMetric(name).recordValue(duration.toNanos() / 1e9);
        }
    }

    /** Counts one call without timing. */
    public void incrementCallCount(String name) {
        synchronized (lock) {
            getOrCreateMetric(name).incrementCallCount(1);
        }
    }

    /** Classifies one response into the Apdex buckets of {@code name}. */
    public void recordApdex(String name, Duration apdexT, Duration duration, boolean failed) {
        synchronized (lock) {
            getOrCreateApdexMetric(name, apdexT).recordValue(duration, failed);
        }
    }

    public boolean isEmpty() {
        synchronized (lock) {
            return metrics.isEmpty() && apdexMetrics.isEmpty();
        }
    }

    /** Returns the metrics of the current window and starts a new one. */
    public MetricData drain() {
        synchronized (lock) {
            var now = clock.millis();
            var data = new MetricData(
                    beginMillis,
                    now,
                    Collections.unmodifiableMap(metrics),
                    Collections.unmodifiableMap(apdexMetrics));
            metrics = new LinkedHashMap<>();
            apdexMetrics = new LinkedHashMap<>();
            beginMillis = now;
            return data;
        }
    }

    /** Folds previously drained metrics back into the current window, e.g. after a failed harvest. */
    public void merge(MetricData data) {
        synchronized (lock) {
            data.metrics().forEach((name, stats) -> metrics.computeIfAbsent(name, key -> new MetricStats())
                    .merge(stats));
            data.apdexMetrics().forEach((name, stats) -> apdexMetrics
                    .computeIfAbsent(name, key -> new ApdexStats(Duration.ofNanos((long) (stats.getApdexT() * 1e9))))
                    .merge(stats));
            beginMillis = Math.min(beginMillis, data.beginMillis());
        }
    }
}
