// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;

/**
 * Base class for {@link RequestHandler} implementations whose invocations are traced. Every invocation runs in a
 * transaction that ends when {@link #handleTracedRequest} returns or throws.
 *
 * <p>The agent is created once per handler instance from {@link #createConfiguration()}, which subclasses override to
 * customize it.
 *
 * @param <I> the event type
 * @param <O> the result type
 */
public abstract class TracingRequestHandler<I, O> implements RequestHandler<I, O> {
    private final MonitoringAgent agent;

    protected TracingRequestHandler() {
        this.agent = new MonitoringAgent(createConfiguration());
    }

    protected TracingRequestHandler(MonitoringAgent agent) {
        this.agent = agent;
    }

    /** Returns the configuration of the handler's agent. Defaults to {@link AgentConfig#defaultConfig()}. */
    protected AgentConfig createConfiguration() {
        return AgentConfig.defaultConfig();
    }

    @Override
    public final O handleRequest(I input, Context context) {
        return agent.getInvocationWrapper().invokeSync(input, context, this::handleTracedRequest);
    }

    /**
     * Handles one invocation.
     *
     * @param input the event
     * @param context the Lambda context
     * @return the result
     */
    protected abstract O handleTracedRequest(I input, Context context);

    public MonitoringAgent getAgent() {
        return agent;
    }
}
