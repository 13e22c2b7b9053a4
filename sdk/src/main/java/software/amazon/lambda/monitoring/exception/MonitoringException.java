// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring.exception;

/** Base class of the exceptions raised by the monitoring SDK. */
public class MonitoringException extends RuntimeException {
    public MonitoringException(String message, Throwable cause) {
        super(message, cause);
    }

    public MonitoringException(String message) {
        super(message);
    }
}
