// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/** Logger wrapper that adds the request id and transaction name of an invocation to log entries via MDC. */
public class InvocationLogger {
    static final String MDC_REQUEST_ID = "awsRequestId";
    static final String MDC_TRANSACTION_NAME = "transactionName";

    private final Logger delegate;
    private final String requestId;
    private final String transactionName;

    public InvocationLogger(Logger delegate, String requestId, String transactionName) {
        this.delegate = delegate;
        this.requestId = requestId;
        this.transactionName = transactionName;
    }

    public void trace(String format, Object... args) {
        log(() -> delegate.trace(format, args));
    }

    public void debug(String format, Object... args) {
        log(() -> delegate.debug(format, args));
    }

    public void info(String format, Object... args) {
        log(() -> delegate.info(format, args));
    }

    public void warn(String format, Object... args) {
        log(() -> delegate.warn(format, args));
    }

    public void error(String format, Object... args) {
        log(() -> delegate.error(format, args));
    }

    public void error(String message, Throwable t) {
        log(() -> delegate.error(message, t));
    }

    public boolean isDebugEnabled() {
        return delegate.isDebugEnabled();
    }

    private void log(Runnable logAction) {
        var previousRequestId = MDC.get(MDC_REQUEST_ID);
        var previousTransactionName = MDC.get(MDC_TRANSACTION_NAME);
        try {
            if (requestId != null) {
                MDC.put(MDC_REQUEST_ID, requestId);
            }
            if (transactionName != null) {
                MDC.put(MDC_TRANSACTION_NAME, transactionName);
            }
            logAction.run();
        } finally {
            restore(MDC_REQUEST_ID, previousRequestId);
            restore(MDC_TRANSACTION_NAME, previousTransactionName);
        }
    }

    private static void restore(String key, String previous) {
        if (previous == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, previous);
        }
    }
}
