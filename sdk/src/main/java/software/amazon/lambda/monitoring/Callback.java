// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring;

/**
 * Trailing completion callback handed to a {@link LambdaHandler}.
 *
 * @param <O> the result type
 */
@FunctionalInterface
public interface Callback<O> {
    /**
     * Reports completion.
     *
     * @param error the error the invocation failed with, or null on success
     * @param result the result, or null
     */
    void call(Object error, O result);
}
