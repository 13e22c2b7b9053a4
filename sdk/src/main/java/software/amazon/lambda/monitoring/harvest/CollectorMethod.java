// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring.harvest;

/** Collector endpoints a harvest sends payloads to. */
public enum CollectorMethod {
    METRIC_DATA("metric_data"),
    ERROR_DATA("error_data"),
    ANALYTIC_EVENT_DATA("analytic_event_data");

    private final String methodName;

    CollectorMethod(String methodName) {
        this.methodName = methodName;
    }

    /** Returns the wire name of the endpoint, e.g. {@code error_data}. */
    public String getMethodName() {
        return methodName;
    }
}
