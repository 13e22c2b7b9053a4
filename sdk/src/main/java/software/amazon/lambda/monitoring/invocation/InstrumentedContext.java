// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring.invocation;

import com.amazonaws.services.lambda.runtime.ClientContext;
import com.amazonaws.services.lambda.runtime.CognitoIdentity;
import com.amazonaws.services.lambda.runtime.LambdaLogger;
import software.amazon.lambda.monitoring.InvocationContext;
import software.amazon.lambda.monitoring.transaction.CompletionSignal;

/**
 * Context handed to an instrumented handler. The completion methods complete the latch before forwarding to the host
 * context with the original arguments; everything else is delegated unchanged.
 */
final class InstrumentedContext<O> implements InvocationContext<O> {
    private final InvocationContext<O> delegate;
    private final CompletionLatch latch;

    InstrumentedContext(InvocationContext<O> delegate, CompletionLatch latch) {
        this.delegate = delegate;
        this.latch = latch;
    }

    @Override
    public void done(Object error, O result) {
        latch.complete(CompletionSignal.DONE, error, result);
        delegate.done(error, result);
    }

    @Override
    public void succeed(O result) {
        latch.complete(CompletionSignal.SUCCEED, null, result);
        delegate.succeed(result);
    }

    @Override
    public void fail(Object error) {
        latch.complete(CompletionSignal.FAIL, error, null);
        delegate.fail(error);
    }

    @Override
    public String getAwsRequestId() {
        return delegate.getAwsRequestId();
    }

    @Override
    public String getLogGroupName() {
        return delegate.getLogGroupName();
    }

    @Override
    public String getLogStreamName() {
        return delegate.getLogStreamName();
    }

    @Override
    public String getFunctionName() {
        return delegate.getFunctionName();
    }

    @Override
    public String getFunctionVersion() {
        return delegate.getFunctionVersion();
    }

    @Override
    public String getInvokedFunctionArn() {
        return delegate.getInvokedFunctionArn();
    }

    @Override
    public CognitoIdentity getIdentity() {
        return delegate.getIdentity();
    }

    @Override
    public ClientContext getClientContext() {
        return delegate.getClientContext();
    }

    @Override
    public int getRemainingTimeInMillis() {
        return delegate.getRemainingTimeInMillis();
    }

    @Override
    public int getMemoryLimitInMB() {
        return delegate.getMemoryLimitInMB();
    }

    @Override
    public LambdaLogger getLogger() {
        return delegate.getLogger();
    }
}
