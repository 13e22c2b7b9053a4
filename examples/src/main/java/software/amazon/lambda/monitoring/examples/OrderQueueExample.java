// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring.examples;

import com.amazonaws.services.lambda.runtime.events.SQSEvent;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.lambda.monitoring.Callback;
import software.amazon.lambda.monitoring.InvocationContext;
import software.amazon.lambda.monitoring.LambdaHandler;
import software.amazon.lambda.monitoring.MonitoringAgent;

/**
 * SQS handler that processes each message of a batch on a worker pool and reports through the callback once the batch
 * is done.
 *
 * <p>The pool is wrapped by the agent's tracer, so work running on it belongs to the invocation that scheduled it:
 * invalid messages noticed on a worker thread are reported against the right transaction even when several batches
 * are in flight.
 */
public class OrderQueueExample implements LambdaHandler<SQSEvent, String> {
    private static final Logger logger = LoggerFactory.getLogger(OrderQueueExample.class);

    /** Raised for messages whose body is not a positive quantity. */
    public static class InvalidOrderException extends RuntimeException {
        public InvalidOrderException(String messageId, String body) {
            super("Order " + messageId + " has invalid quantity '" + body + "'");
        }
    }

    private final MonitoringAgent agent;
    private final ExecutorService workers;

    public OrderQueueExample(MonitoringAgent agent) {
        this.agent = agent;
        this.workers = agent.getTracer().wrap(Executors.newFixedThreadPool(4, runnable -> {
            var thread = new Thread(runnable, "order-worker");
            thread.setDaemon(true);
            return thread;
        }));
    }

    @Override
    public void handle(SQSEvent event, InvocationContext<String> context, Callback<String> callback) {
        var messages = event.getRecords() != null ? event.getRecords() : List.<SQSEvent.SQSMessage>of();
        var accepted = new AtomicInteger();
        var tasks = new ArrayList<CompletableFuture<Void>>();
        for (SQSEvent.SQSMessage message : messages) {
            tasks.add(CompletableFuture.runAsync(
                    () -> {
                        if (process(message)) {
                            accepted.incrementAndGet();
                        }
                    },
                    workers));
        }
        CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0])).whenComplete((ignored, failure) -> {
            if (failure != null) {
                callback.call(failure, null);
                return;
            }
            logger.info("Accepted {} of {} orders", accepted.get(), messages.size());
            callback.call(null, "accepted " + accepted.get() + " of " + messages.size());
        });
    }

    private boolean process(SQSEvent.SQSMessage message) {
        var quantity = parseQuantity(message.getBody());
        if (quantity <= 0) {
            agent.noticeError(new InvalidOrderException(message.getMessageId(), message.getBody()));
            return false;
        }
        agent.addCustomAttribute("order.lastQuantity", quantity);
        return true;
    }

    private static int parseQuantity(String body) {
        if (body == null) {
            return -1;
        }
        try {
            return Integer.parseInt(body.trim());
        } catch (NumberFormatException e) {
            logger.debug("Order body '{}' is not a number", body);
            return -1;
        }
    }
}
