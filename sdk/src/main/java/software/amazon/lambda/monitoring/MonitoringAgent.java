// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.lambda.monitoring.attributes.AttributeConfig;
import software.amazon.lambda.monitoring.attributes.AttributeFilter;
import software.amazon.lambda.monitoring.errors.ErrorAggregator;
import software.amazon.lambda.monitoring.errors.NoticedError;
import software.amazon.lambda.monitoring.events.TransactionEvent;
import software.amazon.lambda.monitoring.events.TransactionEventAggregator;
import software.amazon.lambda.monitoring.harvest.CollectorMethod;
import software.amazon.lambda.monitoring.harvest.Harvester;
import software.amazon.lambda.monitoring.invocation.InvocationWrapper;
import software.amazon.lambda.monitoring.metrics.MetricAggregator;
import software.amazon.lambda.monitoring.metrics.MetricNames;
import software.amazon.lambda.monitoring.transaction.Tracer;
import software.amazon.lambda.monitoring.transaction.Transaction;
import software.amazon.lambda.monitoring.transaction.TransactionFinalizer;
import software.amazon.lambda.monitoring.transaction.TransactionKind;
import software.amazon.lambda.monitoring.transaction.TransactionListener;

/**
 * Entry point of the monitoring core. An agent owns the process state, the tracer, the aggregators and the harvester,
 * and finalizes every transaction its tracer ends.
 *
 * <p>Create one agent per process and wrap handlers with it:
 *
 * <pre>{@code
 * MonitoringAgent agent = new MonitoringAgent(AgentConfig.defaultConfig());
 * LambdaHandler<Map<String, Object>, String> handler = agent.wrap((event, context, callback) -> {
 *     callback.call(null, "done");
 * });
 * }</pre>
 *
 * <p>When a transaction ends its metrics are recorded first, then its error is captured and its transaction event
 * added, and only then are listeners notified. Listeners therefore always observe a settled transaction.
 */
public class MonitoringAgent implements TransactionFinalizer {
    private static final Logger logger = LoggerFactory.getLogger(MonitoringAgent.class);

    private final AgentConfig config;
    private final AgentState agentState = new AgentState();
    private final MetricAggregator metrics;
    private final ErrorAggregator errors;
    private final TransactionEventAggregator transactionEvents;
    private final Tracer tracer;
    private final InvocationWrapper invocationWrapper;
    private final Harvester harvester;
    private final List<TransactionListener> listeners = new CopyOnWriteArrayList<>();
    private volatile AttributeFilter attributeFilter;

    public MonitoringAgent(AgentConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.attributeFilter = new AttributeFilter(config.getAttributeConfig());
        this.metrics = new MetricAggregator(config.getClock());
        this.errors = new ErrorAggregator(config.getErrorCollectorConfig(), metrics);
        this.transactionEvents = new TransactionEventAggregator(config.getEventCapacity());
        this.tracer = new Tracer(config.getClock(), agentState, this::getAttributeFilter, this);
        this.invocationWrapper = new InvocationWrapper(config, agentState, tracer, metrics);
        this.harvester = new Harvester(config.getCollectorClient(), metrics, errors, transactionEvents);
        logger.debug("Monitoring agent created for transaction group {}", config.getTransactionGroup());
    }

    // ===== Handler API =====

    /**
     * Instruments a handler. Records {@value MetricNames#SUPPORTABILITY_RECORD_LAMBDA}.
     *
     * @param handler the handler
     * @return the instrumented handler
     */
    public <I, O> LambdaHandler<I, O> wrap(LambdaHandler<I, O> handler) {
        return invocationWrapper.wrap(handler);
    }

    /** Instruments a value if it is a {@link LambdaHandler}, otherwise returns it unchanged and records nothing. */
    public Object wrap(Object handler) {
        return invocationWrapper.wrap(handler);
    }

    /**
     * Notices an error. Inside a transaction the error is held by the transaction and captured when it ends, unless the
     * handler completes with an error of its own; outside any transaction it is captured at once.
     */
    public void noticeError(Object error) {
        var transaction = tracer.getTransaction();
        if (transaction != null) {
            transaction.noticeError(error);
        } else {
            errors.add(null, error);
        }
    }

    /**
     * Adds a custom attribute to the current transaction.
     *
     * @return true if the attribute was stored
     */
    public boolean addCustomAttribute(String key, Object value) {
        var transaction = tracer.getTransaction();
        if (transaction == null) {
            logger.debug("No active transaction, dropping custom attribute '{}'", key);
            return false;
        }
        return transaction.addCustomAttribute(key, value);
    }

    // ===== Configuration =====

    /** Replaces the attribute policy. Transactions that already ended keep their attributes. */
    public void reconfigure(AttributeConfig attributeConfig) {
        this.attributeFilter = new AttributeFilter(attributeConfig);
        logger.debug("Attribute policy replaced");
    }

    /** Sets the run id of the collector session; harvests are skipped until one is set. */
    public void setRunId(Object runId) {
        errors.setRunId(runId);
    }

    public AgentConfig getConfig() {
        return config;
    }

    public AttributeFilter getAttributeFilter() {
        return attributeFilter;
    }

    // ===== Listeners and harvest =====

    public void addListener(TransactionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener cannot be null"));
    }

    public void removeListener(TransactionListener listener) {
        listeners.remove(listener);
    }

    /**
     * Sends everything aggregated so far.
     *
     * @return the endpoints that received a payload
     */
    public Set<CollectorMethod> harvest() {
        return harvester.harvest();
    }

    // ===== Finalization =====

    @Override
    public void finalizeTransaction(Transaction transaction, Object error) {
        try {
            recordMetrics(transaction, error);
        } catch (Exception e) {
            logger.warn("Failed to record metrics of {}", transaction, e);
        }
        try {
            noticeTransactionError(transaction, error);
        } catch (Exception e) {
            logger.warn("Failed to capture error of {}", transaction, e);
        }
        try {
            transactionEvents.add(TransactionEvent.from(transaction));
        } catch (Exception e) {
            logger.warn("Failed to record transaction event of {}", transaction, e);
        }
        for (var listener : listeners) {
            try {
                listener.onTransactionFinished(transaction);
            } catch (Exception e) {
                logger.warn("Transaction listener {} failed", listener.getClass().getName(), e);
            }
        }
        if (config.isHarvestOnTransactionEnd() && config.getCollectorClient() != null) {
            try {
                harvester.onTransactionFinished(transaction);
            } catch (Exception e) {
                logger.warn("Harvest after {} failed", transaction, e);
            }
        }
    }

    private void recordMetrics(Transaction transaction, Object error) {
        var duration = transaction.getDuration();
        var partialName = transaction.getPartialName();
        if (transaction.getKind() == TransactionKind.WEB) {
            metrics.recordValue(MetricNames.HTTP_DISPATCHER, duration);
            metrics.recordValue(MetricNames.WEB_TRANSACTION, duration);
            metrics.recordValue(transaction.getFullName(), duration);
            metrics.recordValue(MetricNames.WEB_TRANSACTION_TOTAL_TIME, duration);
            metrics.recordValue(MetricNames.WEB_TRANSACTION_TOTAL_TIME + "/" + partialName, duration);
            var statusCode = transaction.getStatusCode();
            var failed = error != null || (statusCode != null && statusCode >= 500);
            metrics.recordApdex(MetricNames.APDEX, config.getApdexT(), duration, failed);
            metrics.recordApdex(MetricNames.APDEX + "/" + partialName, config.getApdexT(), duration, failed);
        } else {
            metrics.recordValue(MetricNames.OTHER_TRANSACTION_ALL, duration);
            metrics.recordValue(transaction.getFullName(), duration);
            metrics.recordValue(MetricNames.OTHER_TRANSACTION_TOTAL_TIME, duration);
            metrics.recordValue(MetricNames.OTHER_TRANSACTION_TOTAL_TIME + "/" + partialName, duration);
        }
    }

    private void noticeTransactionError(Transaction transaction, Object error) {
        var effective = error != null ? error : transaction.getPendingError();
        var statusCode = transaction.getStatusCode();
        Optional<NoticedError> noticed;
        if (effective != null) {
            noticed = errors.add(transaction, effective);
        } else if (transaction.getKind() == TransactionKind.WEB && statusCode != null) {
            noticed = errors.addStatusCode(transaction, statusCode);
        } else {
            return;
        }
        noticed.ifPresent(transaction::setNoticedError);
    }

    // ===== Components =====

    public Tracer getTracer() {
        return tracer;
    }

    public InvocationWrapper getInvocationWrapper() {
        return invocationWrapper;
    }

    public AgentState getAgentState() {
        return agentState;
    }

    public MetricAggregator getMetrics() {
        return metrics;
    }

    public ErrorAggregator getErrors() {
        return errors;
    }

    public TransactionEventAggregator getTransactionEvents() {
        return transactionEvents;
    }
}
