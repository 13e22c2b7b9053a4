// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring.protocol;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import software.amazon.lambda.monitoring.events.TransactionEvent;

/**
 * Serializes transaction events into the {@code analytic_event_data} payload:
 * {@code [runId, {"reservoir_size": n, "events_seen": m}, [[intrinsics, userAttributes, agentAttributes], ...]]}.
 */
public final class TransactionEventSerializer {

    private TransactionEventSerializer() {}

    public static String serialize(Object runId, int reservoirSize, long eventsSeen, List<TransactionEvent> events) {
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("reservoir_size", reservoirSize);
        metadata.put("events_seen", eventsSeen);

        var rows = new ArrayList<Object>(events.size());
        for (TransactionEvent event : events) {
            rows.add(List.of(event.intrinsics(), event.userAttributes(), event.agentAttributes()));
        }

        var payload = new ArrayList<Object>(3);
        payload.add(runId);
        payload.add(metadata);
        payload.add(rows);
        return ProtocolMapper.write(payload);
    }
}
