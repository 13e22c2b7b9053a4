// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring.transaction;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.lambda.monitoring.AgentState;
import software.amazon.lambda.monitoring.attributes.AttributeFilter;

/**
 * Creates and ends transactions and tracks the transaction of the current unit of work.
 *
 * <p>The current transaction is bound per thread for the duration of a {@link Scope}. Work handed to another thread
 * keeps its transaction when it is wrapped with one of the {@code bind} methods, or submitted to an executor returned
 * by {@link #wrap(ExecutorService)}: the transaction current at scheduling time is captured and re-established while
 * the task runs. Concurrent invocations therefore never observe each other's transaction, however many hops their work
 * takes.
 */
public class Tracer {
    private static final Logger logger = LoggerFactory.getLogger(Tracer.class);

    private final Clock clock;
    private final AgentState agentState;
    private final Supplier<AttributeFilter> attributeFilter;
    private final TransactionFinalizer finalizer;
    private final ThreadLocal<Transaction> current = new ThreadLocal<>();

    public Tracer(
            Clock clock,
            AgentState agentState,
            Supplier<AttributeFilter> attributeFilter,
            TransactionFinalizer finalizer) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.agentState = Objects.requireNonNull(agentState, "agentState cannot be null");
        this.attributeFilter = Objects.requireNonNull(attributeFilter, "attributeFilter cannot be null");
        this.finalizer = Objects.requireNonNull(finalizer, "finalizer cannot be null");
    }

    // ===== Lifecycle =====

    /**
     * Starts a transaction. The transaction is ACTIVE on return but not bound to any thread; use
     * {@link #activate(Transaction)} to make it current.
     *
     * @param kind web or background
     * @param partialName {@code <group>/<name>}
     * @return the new transaction
     */
    public Transaction begin(TransactionKind kind, String partialName) {
        var transaction =
                new Transaction(kind, partialName, clock.instant(), agentState.consumeColdStart(), attributeFilter);
        transaction.activate();
        logger.debug("Started {}", transaction);
        return transaction;
    }

    /**
     * Ends a transaction and finalizes it. Only the first call for a transaction has an effect.
     *
     * @param transaction the transaction to end
     * @param error the error the invocation completed with, or null
     * @param signal the completion signal that fired
     * @return true if this call ended the transaction
     */
    public boolean end(Transaction transaction, Object error, CompletionSignal signal) {
        if (!transaction.end(clock.instant(), signal)) {
            logger.debug("{} already ended, ignoring {}", transaction, signal);
            return false;
        }
        transaction.freezeAttributes();
        finalizer.finalizeTransaction(transaction, error);
        logger.debug("Ended {} via {} after {}", transaction, signal, transaction.getDuration());
        return true;
    }

    // ===== Current transaction =====

    /** Returns the transaction bound to the current unit of work if it is still active, otherwise null. */
    public Transaction getTransaction() {
        var transaction = current.get();
        return transaction != null && transaction.isActive() ? transaction : null;
    }

    /**
     * Binds a transaction to the current thread until the returned scope is closed. Scopes nest; closing one restores
     * the binding that was in place when it was opened.
     */
    public Scope activate(Transaction transaction) {
        var previous = current.get();
        current.set(transaction);
        return new Scope(previous);
    }

    /** Returns a runnable that runs with the transaction that is current now. */
    public Runnable bind(Runnable task) {
        var captured = current.get();
        return () -> {
            try (var ignored = activate(captured)) {
                task.run();
            }
        };
    }

    /** Returns a callable that runs with the transaction that is current now. */
    public <T> Callable<T> bind(Callable<T> task) {
        var captured = current.get();
        return () -> {
            try (var ignored = activate(captured)) {
                return task.call();
            }
        };
    }

    /** Returns a supplier that runs with the transaction that is current now. */
    public <T> Supplier<T> bindSupplier(Supplier<T> task) {
        var captured = current.get();
        return () -> {
            try (var ignored = activate(captured)) {
                return task.get();
            }
        };
    }

    /** Returns an executor that propagates the scheduling thread's transaction to each task. */
    public Executor wrap(Executor executor) {
        return task -> executor.execute(bind(task));
    }

    /** Returns an executor service that propagates the scheduling thread's transaction to each task. */
    public ExecutorService wrap(ExecutorService executorService) {
        return new ContextPropagatingExecutorService(executorService, this);
    }

    /** Restores the previous binding when closed. */
    public final class Scope implements AutoCloseable {
        private final Transaction previous;

        private Scope(Transaction previous) {
            this.previous = previous;
        }

        @Override
        public void close() {
            if (previous == null) {
                current.remove();
            } else {
                current.set(previous);
            }
        }
    }
}
