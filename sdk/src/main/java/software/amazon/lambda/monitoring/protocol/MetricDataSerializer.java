// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring.protocol;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import software.amazon.lambda.monitoring.metrics.MetricData;

/**
 * Serializes unscoped metrics into the {@code metric_data} payload:
 * {@code [runId, beginSeconds, endSeconds, [[{"name": name}, [values...]], ...]]}. Timing metrics come first, then
 * Apdex metrics, each in recording order.
 */
public final class MetricDataSerializer {

    private MetricDataSerializer() {}

    public static String serialize(Object runId, MetricData data) {
        var rows = new ArrayList<Object>();
        data.metrics().forEach((name, stats) -> rows.add(List.of(Map.of("name", name), stats.toArray())));
        data.apdexMetrics().forEach((name, stats) -> rows.add(List.of(Map.of("name", name), stats.toArray())));

        var payload = new ArrayList<Object>(4);
        payload.add(runId);
        payload.add(data.beginMillis() / 1000.0);
        payload.add(data.endMillis() / 1000.0);
        payload.add(rows);
        return ProtocolMapper.write(payload);
    }
}
