// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring.events;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import software.amazon.lambda.monitoring.attributes.AttributeDestination;
import software.amazon.lambda.monitoring.transaction.Transaction;

/**
 * Analytic event describing one finished transaction.
 *
 * @param intrinsics type, timestamp, name, duration and error flag
 * @param userAttributes custom attributes visible to transaction events
 * @param agentAttributes agent attributes visible to transaction events
 */
public record TransactionEvent(
        Map<String, Object> intrinsics, Map<String, Object> userAttributes, Map<String, Object> agentAttributes) {

    static final String EVENT_TYPE = "Transaction";

    /** Builds the event of an ended transaction. */
    public static TransactionEvent from(Transaction transaction) {
        var seconds = transaction.getDuration().toNanos() / 1e9;
        var intrinsics = new LinkedHashMap<String, Object>();
        intrinsics.put("type", EVENT_TYPE);
        intrinsics.put("timestamp", transaction.getStartTimeMillis());
        intrinsics.put("name", transaction.getFullName());
        intrinsics.put("duration", seconds);
        intrinsics.put("totalTime", seconds);
        intrinsics.put("error", transaction.getNoticedError() != null);
        return new TransactionEvent(
                Collections.unmodifiableMap(intrinsics),
                transaction.getCustomAttributes().get(AttributeDestination.TRANS_EVENT),
                transaction.getAgentAttributes().get(AttributeDestination.TRANS_EVENT));
    }
}
