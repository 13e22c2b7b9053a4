// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide state of the agent: the cold start flag and the invoked function ARN.
 *
 * <p>Each field changes at most once between two calls to {@link #reset()}; the first writer wins. A state is created
 * with its agent and reset only when the agent is re-initialized.
 */
public class AgentState {
    private final AtomicBoolean coldStart = new AtomicBoolean(true);
    private final AtomicReference<String> lambdaArn = new AtomicReference<>();

    /**
     * Returns true for the first caller since creation or the last reset, false for every later caller.
     *
     * @return whether the caller is serving the cold start invocation
     */
    public boolean consumeColdStart() {
        return coldStart.getAndSet(false);
    }

    /** Returns whether no invocation has started yet. */
    public boolean isColdStart() {
        return coldStart.get();
    }

    /**
     * Stores the invoked function ARN unless one is already known.
     *
     * @param arn the ARN read from the invocation context
     * @return the ARN now held, which is the first one ever offered
     */
    public String captureLambdaArn(String arn) {
        if (arn != null) {
            lambdaArn.compareAndSet(null, arn);
        }
        return lambdaArn.get();
    }

    /** Returns the cached ARN, or null before the first invocation. */
    public String getLambdaArn() {
        return lambdaArn.get();
    }

    /** Restores the initial state. Only for agent re-initialization. */
    public void reset() {
        coldStart.set(true);
        lambdaArn.set(null);
    }
}
