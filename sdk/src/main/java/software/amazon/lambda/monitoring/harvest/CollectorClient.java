// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring.harvest;

import software.amazon.lambda.monitoring.exception.CollectorException;

/** Transport that delivers serialized payloads to the collector. */
public interface CollectorClient {
    /**
     * Sends one payload.
     *
     * @param method the endpoint
     * @param payload the JSON payload
     * @throws CollectorException if the payload was not delivered
     */
    void send(CollectorMethod method, String payload);
}
