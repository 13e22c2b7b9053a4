// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring.invocation;

import java.util.concurrent.atomic.AtomicBoolean;
import software.amazon.lambda.monitoring.transaction.CompletionSignal;

/**
 * One-shot completion of an invocation. Every completion signal calls {@link #complete}; the first call runs the
 * completion action, later calls do nothing.
 */
final class CompletionLatch {
    private final AtomicBoolean completed = new AtomicBoolean(false);
    private final CompletionAction action;

    CompletionLatch(CompletionAction action) {
        this.action = action;
    }

    /**
     * @return true if this call completed the invocation
     */
    boolean complete(CompletionSignal signal, Object error, Object result) {
        if (!completed.compareAndSet(false, true)) {
            return false;
        }
        action.onComplete(signal, error, result);
        return true;
    }

    boolean isCompleted() {
        return completed.get();
    }

    @FunctionalInterface
    interface CompletionAction {
        void onComplete(CompletionSignal signal, Object error, Object result);
    }
}
