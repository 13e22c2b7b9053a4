// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring.errors;

import java.util.List;
import java.util.Map;

/**
 * A captured application failure waiting for the next harvest.
 *
 * @param timestamp start of the owning transaction in epoch milliseconds, 0 outside a transaction
 * @param transactionName full name of the owning transaction, or {@value #UNKNOWN_TRANSACTION}
 * @param message the error message
 * @param className the error class name
 * @param userAttributes custom attributes visible to error events
 * @param agentAttributes agent attributes visible to error events
 * @param intrinsics intrinsic attributes, starting with {@code error.expected}
 * @param stackTrace one entry per stack line, or null when no stack is available
 */
public record NoticedError(
        long timestamp,
        String transactionName,
        String message,
        String className,
        Map<String, Object> userAttributes,
        Map<String, Object> agentAttributes,
        Map<String, Object> intrinsics,
        List<String> stackTrace) {

    public static final String UNKNOWN_TRANSACTION = "Unknown";
    public static final String EXPECTED_INTRINSIC = "error.expected";

    public boolean isExpected() {
        return Boolean.TRUE.equals(intrinsics.get(EXPECTED_INTRINSIC));
    }
}
