// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring;

import com.amazonaws.services.lambda.runtime.Context;

/**
 * Lambda {@link Context} that also carries the context-object completion methods. Each of them, like the trailing
 * {@link Callback}, reports that the invocation is done.
 *
 * @param <O> the result type
 */
public interface InvocationContext<O> extends Context {

    /** Completes the invocation with an error, or with a result when {@code error} is null. */
    void done(Object error, O result);

    /** Completes the invocation successfully. */
    void succeed(O result);

    /** Completes the invocation with an error. */
    void fail(Object error);
}
