// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring.exception;

import software.amazon.lambda.monitoring.harvest.CollectorMethod;

/**
 * Exception thrown by a {@link software.amazon.lambda.monitoring.harvest.CollectorClient} when a payload could not be
 * delivered. The harvester keeps the drained data for the next attempt when it sees this exception.
 */
public class CollectorException extends MonitoringException {
    private final CollectorMethod method;

    public CollectorException(CollectorMethod method, String message, Throwable cause) {
        super(message, cause);
        this.method = method;
    }

    public CollectorException(CollectorMethod method, String message) {
        super(message);
        this.method = method;
    }

    public CollectorMethod getMethod() {
        return method;
    }
}
