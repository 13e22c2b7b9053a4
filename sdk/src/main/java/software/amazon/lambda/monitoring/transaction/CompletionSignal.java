// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring.transaction;

/** The conventions by which a handler reports that it is done. */
public enum CompletionSignal {
    /** The trailing callback passed to the handler. */
    CALLBACK,
    /** {@code context.done(error, result)}. */
    DONE,
    /** {@code context.succeed(result)}. */
    SUCCEED,
    /** {@code context.fail(error)}. */
    FAIL,
    /** The handler returned or threw without signalling. */
    RETURN
}
