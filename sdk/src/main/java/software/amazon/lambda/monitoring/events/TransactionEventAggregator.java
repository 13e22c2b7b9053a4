// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring.events;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.lambda.monitoring.validation.ParameterValidator;

/** Collects transaction events between two harvests, keeping the first {@code capacity} of each cycle. */
public class TransactionEventAggregator {
    private static final Logger logger = LoggerFactory.getLogger(TransactionEventAggregator.class);

    public static final int DEFAULT_CAPACITY = 10_000;

    private final int capacity;
    private final Object lock = new Object();
    private final List<TransactionEvent> events = new ArrayList<>();
    private long seen;

    public TransactionEventAggregator(int capacity) {
        ParameterValidator.validatePositiveInteger(capacity, "capacity");
        this.capacity = capacity;
    }

    /** @return true if the event was kept */
    public boolean add(TransactionEvent event) {
        synchronized (lock) {
            seen++;
            if (events.size() >= capacity) {
                logger.debug("Transaction event limit of {} reached", capacity);
                return false;
            }
            events.add(event);
            return true;
        }
    }

    public int getCapacity() {
        return capacity;
    }

    public List<TransactionEvent> getEvents() {
        synchronized (lock) {
            return List.copyOf(events);
        }
    }

    /** Removes and returns the kept events together with the number of events seen in the cycle. */
    public Drained drain() {
        synchronized (lock) {
            var drained = new Drained(List.copyOf(events), seen);
            events.clear();
            seen = 0;
            return drained;
        }
    }

    /** Puts drained events back, e.g. after a failed harvest. */
    public void merge(Drained drained) {
        synchronized (lock) {
            var combined = new ArrayList<TransactionEvent>(drained.events());
            combined.addAll(events);
            events.clear();
            events.addAll(combined.subList(0, Math.min(capacity, combined.size())));
            seen += drained.seen();
        }
    }

    /**
     * Events of one harvest cycle.
     *
     * @param events the kept events
     * @param seen the number of events offered, kept or not
     */
    public record Drained(List<TransactionEvent> events, long seen) {}
}
