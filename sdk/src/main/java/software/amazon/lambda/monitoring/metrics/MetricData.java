// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring.metrics;

import java.util.Map;

/**
 * Metrics drained from a {@link MetricAggregator} for one harvest window.
 *
 * @param beginMillis start of the window, epoch milliseconds
 * @param endMillis end of the window, epoch milliseconds
 * @param metrics unscoped timing metrics by name
 * @param apdexMetrics unscoped Apdex metrics by name
 */
public record MetricData(
        long beginMillis, long endMillis, Map<String, MetricStats> metrics, Map<String, ApdexStats> apdexMetrics) {

    public boolean isEmpty() {
        return metrics.isEmpty() && apdexMetrics.isEmpty();
    }
}
