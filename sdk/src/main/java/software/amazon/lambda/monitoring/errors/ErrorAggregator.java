// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring.errors;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.lambda.monitoring.attributes.AttributeDestination;
import software.amazon.lambda.monitoring.metrics.MetricAggregator;
import software.amazon.lambda.monitoring.metrics.MetricNames;
import software.amazon.lambda.monitoring.transaction.Transaction;
import software.amazon.lambda.monitoring.transaction.TransactionKind;

/**
 * Collects noticed errors between two harvests.
 *
 * <p>Errors are kept in capture order up to {@link ErrorCollectorConfig#maxErrors()}. Once the limit is reached further
 * errors are rejected and counted in {@link #getDroppedCount()}. The same {@link Throwable} instance is captured at
 * most once per harvest cycle.
 *
 * <p>{@code add} and {@code drain} are mutually exclusive, so a harvest may run while invocations complete on other
 * threads.
 */
public class ErrorAggregator {
    private static final Logger logger = LoggerFactory.getLogger(ErrorAggregator.class);

    private final MetricAggregator metrics;
    private final Object lock = new Object();
    private final List<NoticedError> errors = new ArrayList<>();
    private final Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    private volatile ErrorCollectorConfig config;
    private volatile Object runId;
    private long droppedCount;

    public ErrorAggregator(ErrorCollectorConfig config, MetricAggregator metrics) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
    }

    /** Applies a new policy to errors captured from now on. */
    public void reconfigure(ErrorCollectorConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    public ErrorCollectorConfig getConfig() {
        return config;
    }

    /** Returns the run id issued by the collector session, or null before the agent connected. */
    public Object getRunId() {
        return runId;
    }

    /** Sets the run id issued by the collector session: a string or a number, serialized as given. */
    public void setRunId(Object runId) {
        this.runId = runId;
    }

    /**
     * Captures an error.
     *
     * @param transaction the transaction the error belongs to, or null
     * @param error a {@link Throwable}, a {@link CapturedError} or any other value
     * @return the captured error, empty if capture is disabled, the error is ignored or a duplicate, or the retention
     *     limit is reached
     */
    public Optional<NoticedError> add(Transaction transaction, Object error) {
        if (error == null) {
            return Optional.empty();
        }
        var current = config;
        if (!current.enabled()) {
            return Optional.empty();
        }
        var details = ErrorDetails.of(error);
        if (ErrorDetails.matchesClass(error, details.className(), current.ignoreClasses())) {
            logger.debug("Ignoring error of class {}", details.className());
            return Optional.empty();
        }
        var expected = ErrorDetails.matchesClass(error, details.className(), current.expectedClasses());
        return capture(transaction, error, details, expected);
    }

    /**
     * Captures the error implied by an HTTP status code of a web response.
     *
     * @return the captured error, empty for codes below 500, ignored codes, or when nothing can be captured
     */
    public Optional<NoticedError> addStatusCode(Transaction transaction, int statusCode) {
        var current = config;
        if (!current.enabled() || statusCode < 500 || current.ignoreStatusCodes().contains(statusCode)) {
            return Optional.empty();
        }
        var expected = current.expectedStatusCodes().contains(statusCode);
        return capture(transaction, null, ErrorDetails.ofStatusCode(statusCode), expected);
    }

    private Optional<NoticedError> capture(
            Transaction transaction, Object source, ErrorDetails details, boolean expected) {
        var noticed = createNoticedError(transaction, details, expected);
        synchronized (lock) {
            if (source instanceof Throwable throwable && !seen.add(throwable)) {
                logger.debug("Error {} already captured", details.className());
                return Optional.empty();
            }
            if (errors.size() >= config.maxErrors()) {
                droppedCount++;
                logger.debug("Error limit of {} reached, dropping {}", config.maxErrors(), details.className());
                return Optional.empty();
            }
            errors.add(noticed);
        }
        if (!expected) {
            recordErrorMetrics(transaction);
        }
        return Optional.of(noticed);
    }

    private static NoticedError createNoticedError(Transaction transaction, ErrorDetails details, boolean expected) {
        var intrinsics = new LinkedHashMap<String, Object>();
        intrinsics.put(NoticedError.EXPECTED_INTRINSIC, expected);

        Map<String, Object> userAttributes = Map.of();
        Map<String, Object> agentAttributes = Map.of();
        long timestamp = 0;
        var transactionName = NoticedError.UNKNOWN_TRANSACTION;
        if (transaction != null) {
            timestamp = transaction.getStartTimeMillis();
            transactionName = transaction.getFullName();
            userAttributes = transaction.getCustomAttributes().get(AttributeDestination.ERROR_EVENT);
            agentAttributes = transaction.getAgentAttributes().get(AttributeDestination.ERROR_EVENT);
        }
        return new NoticedError(
                timestamp,
                transactionName,
                details.message(),
                details.className(),
                userAttributes,
                agentAttributes,
                Collections.unmodifiableMap(intrinsics),
                details.stackTrace());
    }

    private void recordErrorMetrics(Transaction transaction) {
        metrics.incrementCallCount(MetricNames.ERRORS_ALL);
        if (transaction != null) {
            metrics.incrementCallCount(
                    transaction.getKind() == TransactionKind.WEB
                            ? MetricNames.ERRORS_ALL_WEB
                            : MetricNames.ERRORS_ALL_OTHER);
            metrics.incrementCallCount(MetricNames.ERRORS_PREFIX + transaction.getFullName());
        }
    }

    /** Returns a snapshot of the errors captured since the last drain, in capture order. */
    public List<NoticedError> getErrors() {
        synchronized (lock) {
            return List.copyOf(errors);
        }
    }

    /** Returns how many errors were rejected because the retention limit was reached. */
    public long getDroppedCount() {
        synchronized (lock) {
            return droppedCount;
        }
    }

    /** Removes and returns the captured errors, in capture order, and starts a new harvest cycle. */
    public List<NoticedError> drain() {
        synchronized (lock) {
            var drained = List.copyOf(errors);
            errors.clear();
            seen.clear();
            droppedCount = 0;
            return drained;
        }
    }

    /**
     * Puts drained errors back ahead of the errors captured since, e.g. after a failed harvest. Errors that no longer
     * fit within the retention limit are dropped.
     */
    public void merge(List<NoticedError> drained) {
        synchronized (lock) {
            var combined = new ArrayList<NoticedError>(drained);
            combined.addAll(errors);
            errors.clear();
            var limit = config.maxErrors();
            errors.addAll(combined.subList(0, Math.min(limit, combined.size())));
            droppedCount += Math.max(0, combined.size() - limit);
        }
    }
}
