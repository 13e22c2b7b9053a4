// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring.transaction;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import software.amazon.lambda.monitoring.attributes.AttributeFilter;
import software.amazon.lambda.monitoring.attributes.AttributeSet;
import software.amazon.lambda.monitoring.errors.NoticedError;

/**
 * The traced record of one invocation.
 *
 * <p>A transaction moves from {@link TransactionState#PENDING} to {@link TransactionState#ACTIVE} when it begins and
 * to {@link TransactionState#ENDED} exactly once. Attribute writes after the end are ignored.
 *
 * <p>Transactions are created by {@link Tracer#begin(TransactionKind, String)}.
 */
public class Transaction {
    /** Maximum number of agent attributes per transaction. */
    static final int MAX_AGENT_ATTRIBUTES = 255;

    /** Maximum number of custom attributes per transaction. */
    static final int MAX_CUSTOM_ATTRIBUTES = 64;

    private final String id;
    private final TransactionKind kind;
    private final String partialName;
    private final Instant startTime;
    private final boolean coldStart;
    private final AttributeSet agentAttributes;
    private final AttributeSet customAttributes;
    private final AtomicReference<TransactionState> state = new AtomicReference<>(TransactionState.PENDING);

    private volatile Duration duration;
    private volatile CompletionSignal completionSignal;
    private volatile Object pendingError;
    private volatile NoticedError noticedError;
    private volatile Integer statusCode;

    Transaction(
            TransactionKind kind,
            String partialName,
            Instant startTime,
            boolean coldStart,
            Supplier<AttributeFilter> attributeFilter) {
        this.id = UUID.randomUUID().toString();
        this.kind = kind;
        this.partialName = partialName;
        this.startTime = startTime;
        this.coldStart = coldStart;
        this.agentAttributes = new AttributeSet(attributeFilter, MAX_AGENT_ATTRIBUTES);
        this.customAttributes = new AttributeSet(attributeFilter, MAX_CUSTOM_ATTRIBUTES);
    }

    // ============= lifecycle ===============

    /** PENDING to ACTIVE. Returns false if the transaction was not pending. */
    boolean activate() {
        return state.compareAndSet(TransactionState.PENDING, TransactionState.ACTIVE);
    }

    /**
     * Moves the transaction to ENDED. Only the first call succeeds.
     *
     * @param endTime the time the invocation completed
     * @param signal the completion signal that ended the invocation
     * @return true if this call ended the transaction
     */
    boolean end(Instant endTime, CompletionSignal signal) {
        var previous = state.getAndSet(TransactionState.ENDED);
        if (previous == TransactionState.ENDED) {
            return false;
        }
        var elapsed = Duration.between(startTime, endTime);
        this.duration = elapsed.isNegative() ? Duration.ZERO : elapsed;
        this.completionSignal = signal;
        return true;
    }

    public boolean isActive() {
        return state.get() == TransactionState.ACTIVE;
    }

    public TransactionState getState() {
        return state.get();
    }

    // ============= naming ===============

    public String getId() {
        return id;
    }

    public TransactionKind getKind() {
        return kind;
    }

    /** Returns {@code <group>/<name>}. */
    public String getPartialName() {
        return partialName;
    }

    /** Returns {@code WebTransaction/<group>/<name>} or {@code OtherTransaction/<group>/<name>}. */
    public String getFullName() {
        return kind.getNamePrefix() + "/" + partialName;
    }

    // ============= timing ===============

    public Instant getStartTime() {
        return startTime;
    }

    public long getStartTimeMillis() {
        return startTime.toEpochMilli();
    }

    /** Returns the duration, or null while the transaction has not ended. */
    public Duration getDuration() {
        return duration;
    }

    /** Returns the signal that ended the transaction, or null while it has not ended. */
    public CompletionSignal getCompletionSignal() {
        return completionSignal;
    }

    public boolean isColdStart() {
        return coldStart;
    }

    // ============= attributes ===============

    /** Adds an agent attribute. Ignored once the transaction has ended. */
    public boolean addAgentAttribute(String key, Object value) {
        if (state.get() == TransactionState.ENDED) {
            return false;
        }
        return agentAttributes.add(key, value);
    }

    /** Adds a custom (user) attribute. Ignored once the transaction has ended. */
    public boolean addCustomAttribute(String key, Object value) {
        if (state.get() == TransactionState.ENDED) {
            return false;
        }
        return customAttributes.add(key, value);
    }

    public AttributeSet getAgentAttributes() {
        return agentAttributes;
    }

    public AttributeSet getCustomAttributes() {
        return customAttributes;
    }

    void freezeAttributes() {
        agentAttributes.freeze();
        customAttributes.freeze();
    }

    // ============= response and errors ===============

    /** Returns the HTTP status code of a web response, or null. */
    public Integer getStatusCode() {
        return statusCode;
    }

    public void setStatusCode(Integer statusCode) {
        if (state.get() != TransactionState.ENDED) {
            this.statusCode = statusCode;
        }
    }

    /**
     * Records an error noticed while the transaction is running. It is captured when the transaction ends unless the
     * handler completes with an error of its own.
     */
    public void noticeError(Object error) {
        if (error != null && state.get() != TransactionState.ENDED) {
            this.pendingError = error;
        }
    }

    public Object getPendingError() {
        return pendingError;
    }

    /** Returns the error captured for this transaction, or null. */
    public NoticedError getNoticedError() {
        return noticedError;
    }

    public void setNoticedError(NoticedError noticedError) {
        this.noticedError = noticedError;
    }

    @Override
    public String toString() {
        return "Transaction{id=" + id + ", name=" + getFullName() + ", state=" + state.get() + "}";
    }
}
