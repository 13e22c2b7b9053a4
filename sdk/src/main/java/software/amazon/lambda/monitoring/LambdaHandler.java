// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring;

/**
 * Handler whose completion is signalled rather than returned: through the {@code callback}, or through
 * {@link InvocationContext#done}, {@link InvocationContext#succeed} or {@link InvocationContext#fail}. The handler may
 * signal from any thread, after {@code handle} has returned.
 *
 * @param <I> the event type
 * @param <O> the result type
 */
@FunctionalInterface
public interface LambdaHandler<I, O> {
    void handle(I event, InvocationContext<O> context, Callback<O> callback) throws Exception;
}
