// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring.harvest;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.lambda.monitoring.errors.ErrorAggregator;
import software.amazon.lambda.monitoring.events.TransactionEventAggregator;
import software.amazon.lambda.monitoring.exception.CollectorException;
import software.amazon.lambda.monitoring.metrics.MetricAggregator;
import software.amazon.lambda.monitoring.protocol.ErrorTraceSerializer;
import software.amazon.lambda.monitoring.protocol.MetricDataSerializer;
import software.amazon.lambda.monitoring.protocol.TransactionEventSerializer;
import software.amazon.lambda.monitoring.transaction.Transaction;
import software.amazon.lambda.monitoring.transaction.TransactionListener;

/**
 * Drains the aggregators and sends their contents to the collector.
 *
 * <p>Each endpoint is harvested on its own: a delivery failure on one endpoint puts that endpoint's data back into its
 * aggregator and does not affect the others. Nothing is drained while no run id is known or no client is configured.
 *
 * <p>Registered as a {@link TransactionListener}, the harvester sends after every finished transaction.
 */
public class Harvester implements TransactionListener {
    private static final Logger logger = LoggerFactory.getLogger(Harvester.class);

    private final CollectorClient client;
    private final MetricAggregator metrics;
    private final ErrorAggregator errors;
    private final TransactionEventAggregator events;
    private final Object harvestLock = new Object();

    public Harvester(
            CollectorClient client,
            MetricAggregator metrics,
            ErrorAggregator errors,
            TransactionEventAggregator events) {
        this.client = client;
        this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
        this.errors = Objects.requireNonNull(errors, "errors cannot be null");
        this.events = Objects.requireNonNull(events, "events cannot be null");
    }

    @Override
    public void onTransactionFinished(Transaction transaction) {
        harvest();
    }

    /**
     * Runs one harvest cycle.
     *
     * @return the endpoints that received a payload
     */
    public Set<CollectorMethod> harvest() {
        var sent = EnumSet.noneOf(CollectorMethod.class);
        var runId = errors.getRunId();
        if (client == null || runId == null) {
            logger.debug("Skipping harvest, collector session not established");
            return sent;
        }
        synchronized (harvestLock) {
            if (harvestMetrics(runId)) {
                sent.add(CollectorMethod.METRIC_DATA);
            }
            if (harvestErrors(runId)) {
                sent.add(CollectorMethod.ERROR_DATA);
            }
            if (harvestEvents(runId)) {
                sent.add(CollectorMethod.ANALYTIC_EVENT_DATA);
            }
        }
        return sent;
    }

    private boolean harvestMetrics(Object runId) {
        var data = metrics.drain();
        if (data.isEmpty()) {
            return false;
        }
        try {
            client.send(CollectorMethod.METRIC_DATA, MetricDataSerializer.serialize(runId, data));
            return true;
        } catch (CollectorException e) {
            logger.warn(
                    "Failed to send metric data, keeping {} metrics for the next harvest", data.metrics().size(), e);
            metrics.merge(data);
            return false;
        }
    }

    private boolean harvestErrors(Object runId) {
        var drained = errors.drain();
        if (drained.isEmpty()) {
            return false;
        }
        try {
            client.send(CollectorMethod.ERROR_DATA, ErrorTraceSerializer.serialize(runId, drained));
            return true;
        } catch (CollectorException e) {
            logger.warn("Failed to send error data, keeping {} errors for the next harvest", drained.size(), e);
            errors.merge(drained);
            return false;
        }
    }

    private boolean harvestEvents(Object runId) {
        var drained = events.drain();
        if (drained.events().isEmpty()) {
            return false;
        }
        try {
            client.send(
                    CollectorMethod.ANALYTIC_EVENT_DATA,
                    TransactionEventSerializer.serialize(
                            runId, events.getCapacity(), drained.seen(), drained.events()));
            return true;
        } catch (CollectorException e) {
            logger.warn(
                    "Failed to send transaction events, keeping {} events for the next harvest",
                    drained.events().size(),
                    e);
            events.merge(drained);
            return false;
        }
    }
}
