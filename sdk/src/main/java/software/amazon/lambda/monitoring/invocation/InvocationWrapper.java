// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring.invocation;

import com.amazonaws.services.lambda.runtime.Context;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.util.Objects;
import java.util.function.BiFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.lambda.monitoring.AgentConfig;
import software.amazon.lambda.monitoring.AgentState;
import software.amazon.lambda.monitoring.Callback;
import software.amazon.lambda.monitoring.InvocationContext;
import software.amazon.lambda.monitoring.LambdaHandler;
import software.amazon.lambda.monitoring.attributes.AttributeKeys;
import software.amazon.lambda.monitoring.logging.InvocationLogger;
import software.amazon.lambda.monitoring.metrics.MetricAggregator;
import software.amazon.lambda.monitoring.metrics.MetricNames;
import software.amazon.lambda.monitoring.transaction.CompletionSignal;
import software.amazon.lambda.monitoring.transaction.Tracer;
import software.amazon.lambda.monitoring.transaction.Transaction;
import software.amazon.lambda.monitoring.transaction.TransactionKind;

/**
 * Instruments Lambda handlers.
 *
 * <p>Each invocation of an instrumented handler runs in its own transaction. The transaction is web when the event is
 * an API Gateway proxy request and background otherwise, and is named {@code <group>/<function name>}. It ends with
 * the first completion signal the handler gives, whichever of the callback, {@code context.done},
 * {@code context.succeed} or {@code context.fail} it is. The host always receives the handler's own signal with the
 * original arguments.
 *
 * <p>Instrumentation never changes what the caller sees: faults while reading the event, the context or the response
 * are logged and the invocation proceeds.
 */
public class InvocationWrapper {
    private static final Logger logger = LoggerFactory.getLogger(InvocationWrapper.class);

    private final AgentConfig config;
    private final AgentState agentState;
    private final Tracer tracer;
    private final MetricAggregator metrics;

    public InvocationWrapper(AgentConfig config, AgentState agentState, Tracer tracer, MetricAggregator metrics) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.agentState = Objects.requireNonNull(agentState, "agentState cannot be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
    }

    /**
     * Instruments a handler.
     *
     * @param handler the handler
     * @return the instrumented handler
     */
    public <I, O> LambdaHandler<I, O> wrap(LambdaHandler<I, O> handler) {
        Objects.requireNonNull(handler, "handler cannot be null");
        metrics.incrementCallCount(MetricNames.SUPPORTABILITY_RECORD_LAMBDA);
        return (event, context, callback) -> invoke(handler, event, context, callback);
    }

    /**
     * Instruments a value if it is a {@link LambdaHandler}. Any other value, null included, is returned unchanged and
     * nothing is recorded.
     */
    @SuppressWarnings("unchecked")
    public Object wrap(Object handler) {
        if (handler instanceof LambdaHandler<?, ?> lambdaHandler) {
            return wrap((LambdaHandler<Object, Object>) lambdaHandler);
        }
        logger.debug("Not wrapping {}, it is not a LambdaHandler", handler == null ? null : handler.getClass());
        return handler;
    }

    private <I, O> void invoke(LambdaHandler<I, O> handler, I event, InvocationContext<O> context, Callback<O> callback)
            throws Exception {
        var invocation = start(event, context);
        if (invocation == null) {
            handler.handle(event, context, callback);
            return;
        }
        var transaction = invocation.transaction();
        var latch = new CompletionLatch((signal, error, result) -> finish(transaction, signal, error, result));
        Callback<O> instrumentedCallback = (error, result) -> {
            latch.complete(CompletionSignal.CALLBACK, error, result);
            callback.call(error, result);
        };
        try (var ignored = tracer.activate(transaction)) {
            handler.handle(event, new InstrumentedContext<>(context, latch), instrumentedCallback);
        } catch (Exception | Error e) {
            invocation.log().debug("Handler threw {}", e.getClass().getSimpleName());
            latch.complete(CompletionSignal.RETURN, e, null);
            throw e;
        }
    }

    /**
     * Runs a handler that completes by returning, in a transaction that ends when it returns or throws.
     *
     * @param event the event
     * @param context the Lambda context
     * @param handler the handler
     * @return what the handler returned
     */
    public <I, O> O invokeSync(I event, Context context, BiFunction<I, Context, O> handler) {
        var invocation = start(event, context);
        if (invocation == null) {
            return handler.apply(event, context);
        }
        var transaction = invocation.transaction();
        var latch = new CompletionLatch((signal, error, result) -> finish(transaction, signal, error, result));
        O result;
        try (var ignored = tracer.activate(transaction)) {
            result = handler.apply(event, context);
        } catch (RuntimeException | Error e) {
            invocation.log().debug("Handler threw {}", e.getClass().getSimpleName());
            latch.complete(CompletionSignal.RETURN, e, null);
            throw e;
        }
        latch.complete(CompletionSignal.RETURN, null, result);
        return result;
    }

    // ===== Start =====

    private Invocation start(Object event, Context context) {
        try {
            var eventNode = toTree(event);
            var kind = isProxyEvent(eventNode) ? TransactionKind.WEB : TransactionKind.BACKGROUND;
            var functionName = context != null ? context.getFunctionName() : null;
            var transaction = tracer.begin(kind, config.getTransactionGroup() + "/" + functionName);
            var log = new InvocationLogger(
                    logger, context != null ? context.getAwsRequestId() : null, transaction.getFullName());
            captureIdentity(transaction, context);
            captureEventSource(transaction, eventNode);
            if (kind == TransactionKind.WEB) {
                captureRequest(transaction, eventNode);
            }
            log.debug("Started {} transaction, cold start: {}", kind, transaction.isColdStart());
            return new Invocation(transaction, log);
        } catch (Exception e) {
            logger.warn("Failed to start transaction, invoking handler without instrumentation", e);
            return null;
        }
    }

    private static JsonNode toTree(Object event) {
        try {
            return EventNodes.toTree(event);
        } catch (Exception e) {
            logger.debug("Event of type {} cannot be inspected", event.getClass().getName(), e);
            return MissingNode.getInstance();
        }
    }

    private static boolean isProxyEvent(JsonNode event) {
        try {
            return ApiGatewayProxy.isProxyEvent(event);
        } catch (Exception e) {
            logger.debug("Failed to inspect event shape", e);
            return false;
        }
    }

    private void captureIdentity(Transaction transaction, Context context) {
        try {
            if (transaction.isColdStart()) {
                transaction.addAgentAttribute(AttributeKeys.COLD_START, true);
            }
            transaction.addAgentAttribute(AttributeKeys.REGION, config.getRegion());
            if (context == null) {
                return;
            }
            agentState.captureLambdaArn(context.getInvokedFunctionArn());
            transaction.addAgentAttribute(AttributeKeys.LAMBDA_ARN, context.getInvokedFunctionArn());
            transaction.addAgentAttribute(AttributeKeys.REQUEST_ID, context.getAwsRequestId());
            transaction.addAgentAttribute(AttributeKeys.FUNCTION_NAME, context.getFunctionName());
            transaction.addAgentAttribute(AttributeKeys.FUNCTION_VERSION, context.getFunctionVersion());
            transaction.addAgentAttribute(AttributeKeys.MEMORY_LIMIT, String.valueOf(context.getMemoryLimitInMB()));
        } catch (Exception e) {
            logger.debug("Failed to capture invocation identity", e);
        }
    }

    private static void captureEventSource(Transaction transaction, JsonNode event) {
        try {
            EventSourceClassifier.classify(event)
                    .ifPresent(arn -> transaction.addAgentAttribute(AttributeKeys.EVENT_SOURCE_ARN, arn));
        } catch (Exception e) {
            logger.debug("Failed to classify event source", e);
        }
    }

    private static void captureRequest(Transaction transaction, JsonNode event) {
        try {
            ApiGatewayProxy.captureRequest(transaction, event);
        } catch (Exception e) {
            logger.debug("Failed to capture request attributes", e);
        }
    }

    // ===== Finish =====

    private void finish(Transaction transaction, CompletionSignal signal, Object error, Object result) {
        if (transaction.getKind() == TransactionKind.WEB) {
            captureResponse(transaction, result);
        }
        try {
            tracer.end(transaction, error, signal);
        } catch (Exception e) {
            logger.warn("Failed to end {}", transaction, e);
        }
    }

    private static void captureResponse(Transaction transaction, Object result) {
        try {
            var response = EventNodes.toTree(result);
            if (ApiGatewayProxy.isProxyResponse(response)) {
                ApiGatewayProxy.captureResponse(transaction, response);
            }
        } catch (Exception e) {
            logger.debug("Failed to capture response attributes", e);
        }
    }

    private record Invocation(Transaction transaction, InvocationLogger log) {}
}
