// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring.protocol;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import software.amazon.lambda.monitoring.errors.NoticedError;

/**
 * Serializes noticed errors into the {@code error_data} payload:
 *
 * <pre>{@code
 * [runId, [[timestamp, transactionName, message, className, {
 *     "userAttributes": {...}, "agentAttributes": {...},
 *     "intrinsics": {"error.expected": false, ...},
 *     "stack_trace": ["line", ...]
 * }], ...]]
 * }</pre>
 *
 * <p>{@code stack_trace} is omitted for errors without a stack. Errors are written in the given order.
 */
public final class ErrorTraceSerializer {

    private ErrorTraceSerializer() {}

    public static String serialize(Object runId, List<NoticedError> errors) {
        return ProtocolMapper.write(toPayload(runId, errors));
    }

    /** Builds the payload tree without writing it. */
    public static List<Object> toPayload(Object runId, List<NoticedError> errors) {
        var traces = new ArrayList<Object>(errors.size());
        for (NoticedError error : errors) {
            traces.add(toTrace(error));
        }
        var payload = new ArrayList<Object>(2);
        payload.add(runId);
        payload.add(traces);
        return payload;
    }

    private static List<Object> toTrace(NoticedError error) {
        var params = new LinkedHashMap<String, Object>();
        params.put("userAttributes", error.userAttributes());
        params.put("agentAttributes", error.agentAttributes());
        params.put("intrinsics", error.intrinsics());
        if (error.stackTrace() != null) {
            params.put("stack_trace", error.stackTrace());
        }
        var trace = new ArrayList<Object>(5);
        trace.add(error.timestamp());
        trace.add(error.transactionName());
        trace.add(error.message());
        trace.add(error.className());
        trace.add(params);
        return trace;
    }
}
