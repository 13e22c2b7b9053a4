// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring;

import static org.junit.jupiter.api.Assertions.*;

import com.amazonaws.services.lambda.runtime.events.SNSEvent;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.joda.time.DateTime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;
import software.amazon.lambda.monitoring.attributes.AttributeConfig;
import software.amazon.lambda.monitoring.attributes.AttributeDestination;
import software.amazon.lambda.monitoring.errors.ErrorCollectorConfig;
import software.amazon.lambda.monitoring.transaction.CompletionSignal;
import software.amazon.lambda.monitoring.transaction.Transaction;
import software.amazon.lambda.monitoring.transaction.TransactionKind;
import software.amazon.lambda.monitoring.transaction.TransactionListener;

class MonitoringAgentTest {
    private static final String BACKGROUND_NAME = "OtherTransaction/Function/testName";
    private static final String WEB_NAME = "WebTransaction/Function/testName";
    private static final String ERROR_MESSAGE = "sad day";

    static class SyntaxError extends RuntimeException {
        SyntaxError(String message) {
            super(message);
        }
    }

    private MonitoringAgent agent;
    private TestContext<Object> context;
    private List<Transaction> finished;
    private List<Object[]> callbackCalls;
    private Callback<Object> callback;

    @BeforeEach
    void setUp() {
        agent = new MonitoringAgent(TestUtils.testConfig().build());
        context = new TestContext<>();
        finished = new CopyOnWriteArrayList<>();
        agent.addListener(finished::add);
        callbackCalls = new CopyOnWriteArrayList<>();
        callback = (error, result) -> callbackCalls.add(new Object[] {error, result});
    }

    private static Map<String, Object> validResponse() {
        var response = new LinkedHashMap<String, Object>();
        response.put("isBase64Encoded", false);
        response.put("statusCode", 200);
        response.put("headers", Map.of("responseHeader", "headerValue"));
        response.put("body", "worked");
        return response;
    }

    private Transaction onlyFinished() {
        assertEquals(1, finished.size());
        return finished.get(0);
    }

    private Map<String, Object> agentAttributes(AttributeDestination destination) {
        return onlyFinished().getAgentAttributes().get(destination);
    }

    @Test
    void returnsOriginalValueIfNotAHandler() {
        var handler = new HashMap<String, Object>();

        assertSame(handler, agent.wrap((Object) handler));
        assertNull(agent.getMetrics().getMetric("Supportability/API/recordLambda"));
    }

    @Test
    void recordsSupportabilityMetric() {
        agent.wrap((event, ctx, cb) -> {});

        assertEquals(1, agent.getMetrics().getMetric("Supportability/API/recordLambda").getCallCount());
    }

    @Test
    void wrapsHandlerPassedAsObject() throws Exception {
        LambdaHandler<Object, Object> handler = (event, ctx, cb) -> cb.call(null, "worked");

        @SuppressWarnings("unchecked")
        var wrapped = (LambdaHandler<Object, Object>) agent.wrap((Object) handler);
        wrapped.handle(Map.of(), context, callback);

        assertNotSame(handler, wrapped);
        assertEquals(1, finished.size());
    }

    @Test
    void picksUpTheArn() throws Exception {
        assertNull(agent.getAgentState().getLambdaArn());

        agent.wrap((event, ctx, cb) -> cb.call(null, "worked")).handle(Map.of(), context, callback);

        assertEquals(TestContext.FUNCTION_ARN, agent.getAgentState().getLambdaArn());
    }

    @Test
    void keepsTheFirstArn() throws Exception {
        LambdaHandler<Object, Object> wrapped = agent.wrap((event, ctx, cb) -> cb.call(null, "worked"));

        wrapped.handle(Map.of(), context, callback);
        wrapped.handle(Map.of(), new TestContext<>("arn:other:function"), callback);

        assertEquals(TestContext.FUNCTION_ARN, agent.getAgentState().getLambdaArn());
        assertEquals(
                "arn:other:function",
                finished.get(1).getAgentAttributes().get(AttributeDestination.TRANS_TRACE).get("aws.lambda.arn"));
    }

    @Nested
    class NonWebEvent {

        @Test
        void createsBackgroundTransaction() throws Exception {
            var seen = new ArrayList<Transaction>();
            LambdaHandler<Object, Object> wrapped = agent.wrap((event, ctx, cb) -> {
                var transaction = agent.getTracer().getTransaction();
                seen.add(transaction);
                assertEquals(TransactionKind.BACKGROUND, transaction.getKind());
                assertEquals(BACKGROUND_NAME, transaction.getFullName());
                assertTrue(transaction.isActive());
                cb.call(null, "worked");
            });

            wrapped.handle(Map.of(), context, callback);

            assertEquals(1, seen.size());
            assertFalse(seen.get(0).isActive());
            assertSame(seen.get(0), onlyFinished());
        }

        @Test
        void recordsStandardBackgroundMetrics() throws Exception {
            agent.wrap((event, ctx, cb) -> cb.call(null, "worked")).handle(Map.of(), context, callback);

            var metrics = agent.getMetrics();
            assertEquals(1, metrics.getMetric("OtherTransaction/all").getCallCount());
            assertEquals(1, metrics.getMetric(BACKGROUND_NAME).getCallCount());
            assertEquals(1, metrics.getMetric("OtherTransactionTotalTime").getCallCount());
            assertEquals(1, metrics.getMetric("OtherTransactionTotalTime/Function/testName").getCallCount());
            assertNull(metrics.getMetric("WebTransaction"));
        }
    }

    @Nested
    class ApiGatewayProxyEvent {
        private Map<String, Object> event;

        @BeforeEach
        void loadEvent() {
            event = TestUtils.loadEvent("apiGatewayProxy");
        }

        private void invoke() throws Exception {
            agent.wrap((e, ctx, cb) -> cb.call(null, validResponse())).handle(event, context, callback);
        }

        @Test
        void createsWebTransaction() throws Exception {
            agent.wrap((e, ctx, cb) -> {
                        var transaction = agent.getTracer().getTransaction();
                        assertEquals(TransactionKind.WEB, transaction.getKind());
                        assertEquals(WEB_NAME, transaction.getFullName());
                        assertTrue(transaction.isActive());
                        cb.call(null, validResponse());
                    })
                    .handle(event, context, callback);

            var attributes = agentAttributes(AttributeDestination.TRANS_EVENT);
            assertEquals("GET", attributes.get("request.method"));
            assertEquals("/test/hello", attributes.get("request.uri"));
        }

        @Test
        void hidesRequestParametersByDefault() throws Exception {
            invoke();

            var attributes = agentAttributes(AttributeDestination.TRANS_EVENT);
            assertFalse(attributes.containsKey("request.parameters.name"));
            assertFalse(attributes.containsKey("request.parameters.team"));
            assertTrue(onlyFinished().getAgentAttributes().has("request.parameters.name"));
        }

        @Test
        void capturesRequestParametersWhenIncluded() throws Exception {
            agent.reconfigure(AttributeConfig.builder()
                    .enabled(true)
                    .include(List.of("request.parameters.*"))
                    .build());

            invoke();

            var attributes = agentAttributes(AttributeDestination.TRANS_EVENT);
            assertEquals("me", attributes.get("request.parameters.name"));
            assertEquals("node agent", attributes.get("request.parameters.team"));
            assertEquals("hello", attributes.get("request.parameters.proxy"));
        }

        @Test
        void capturesRequestHeaders() throws Exception {
            invoke();

            var attributes = agentAttributes(AttributeDestination.TRANS_EVENT);
            assertEquals(
                    "text/html,application/xhtml+xml,application/xml;q=0.9,image/webp,*/*;q=0.8",
                    attributes.get("request.headers.accept"));
            assertEquals("gzip, deflate, lzma, sdch, br", attributes.get("request.headers.acceptEncoding"));
            assertEquals("en-US,en;q=0.8", attributes.get("request.headers.acceptLanguage"));
            assertEquals("https", attributes.get("request.headers.cloudFrontForwardedProto"));
            assertEquals("true", attributes.get("request.headers.cloudFrontIsDesktopViewer"));
            assertEquals("false", attributes.get("request.headers.cloudFrontIsMobileViewer"));
            assertEquals("false", attributes.get("request.headers.cloudFrontIsSmartTVViewer"));
            assertEquals("false", attributes.get("request.headers.cloudFrontIsTabletViewer"));
            assertEquals("US", attributes.get("request.headers.cloudFrontViewerCountry"));
            assertEquals(
                    "wt6mne2s9k.execute-api.us-west-2.amazonaws.com", attributes.get("request.headers.host"));
            assertEquals("1", attributes.get("request.headers.upgradeInsecureRequests"));
            assertEquals(
                    "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_11_6)", attributes.get("request.headers.userAgent"));
            assertEquals(
                    "1.1 fb7cca60f0ecd82ce07790c9c5eef16c.cloudfront.net (CloudFront)",
                    attributes.get("request.headers.via"));
        }

        @Test
        void filtersRequestHeadersByExcludeRules() throws Exception {
            invoke();

            for (var destination : AttributeDestination.values()) {
                var attributes = agentAttributes(destination);
                for (var header : List.of("AmzCfId", "ForwardedFor", "ForwardedPort", "ForwardedProto")) {
                    assertFalse(attributes.containsKey("request.headers.x" + header), header);
                    assertFalse(attributes.containsKey("request.headers.X" + header), header);
                }
                assertFalse(attributes.containsKey("request.headers.X-Forwarded-For"));
                assertFalse(attributes.containsKey("request.headers.X-Amz-Cf-Id"));
            }
        }

        @Test
        void capturesStatusCodeAsString() throws Exception {
            invoke();

            var attributes = agentAttributes(AttributeDestination.TRANS_EVENT);
            assertEquals("200", attributes.get("httpResponseCode"));
            assertEquals("200", attributes.get("response.status"));
            assertEquals(200, onlyFinished().getStatusCode());
        }

        @Test
        void capturesResponseHeaders() throws Exception {
            invoke();

            var attributes = agentAttributes(AttributeDestination.TRANS_EVENT);
            assertEquals("headerValue", attributes.get("response.headers.responseHeader"));
        }

        @Test
        void recordsStandardWebMetrics() throws Exception {
            invoke();

            var metrics = agent.getMetrics();
            assertEquals(1, metrics.getMetric("HttpDispatcher").getCallCount());
            assertEquals(1, metrics.getApdexMetric("Apdex").getSatisfying());
            assertEquals(1, metrics.getApdexMetric("Apdex/Function/testName").getSatisfying());
            assertEquals(1, metrics.getMetric("WebTransaction").getCallCount());
            assertEquals(1, metrics.getMetric(WEB_NAME).getCallCount());
            assertEquals(1, metrics.getMetric("WebTransactionTotalTime").getCallCount());
            assertEquals(1, metrics.getMetric("WebTransactionTotalTime/Function/testName").getCallCount());
            assertNull(metrics.getMetric("OtherTransaction/all"));
        }

        @Test
        void noticesServerErrorStatus() throws Exception {
            var response = validResponse();
            response.put("statusCode", 503);

            agent.wrap((e, ctx, cb) -> cb.call(null, response)).handle(event, context, callback);

            var errors = agent.getErrors().getErrors();
            assertEquals(1, errors.size());
            assertEquals("HttpError 503", errors.get(0).message());
            assertEquals(WEB_NAME, errors.get(0).transactionName());
            assertNull(errors.get(0).stackTrace());
            assertEquals(1, agent.getMetrics().getApdexMetric("Apdex").getFrustrating());
        }

        @Test
        void doesNotNoticeClientErrorStatus() throws Exception {
            var response = validResponse();
            response.put("statusCode", 404);

            agent.wrap((e, ctx, cb) -> cb.call(null, response)).handle(event, context, callback);

            assertTrue(agent.getErrors().getErrors().isEmpty());
            assertEquals("404", agentAttributes(AttributeDestination.TRANS_EVENT).get("response.status"));
        }

        @Test
        void ignoresConfiguredServerErrorStatus() throws Exception {
            agent = new MonitoringAgent(TestUtils.testConfig()
                    .withErrorCollectorConfig(ErrorCollectorConfig.builder()
                            .ignoreStatusCodes(Set.of(503))
                            .build())
                    .build());
            agent.addListener(finished::add);
            var response = validResponse();
            response.put("statusCode", 503);

            agent.wrap((e, ctx, cb) -> cb.call(null, response)).handle(event, context, callback);

            assertTrue(agent.getErrors().getErrors().isEmpty());
            assertEquals("503", agentAttributes(AttributeDestination.TRANS_EVENT).get("response.status"));
        }

        @Test
        void skipsResponseAttributesForInvalidResponse() throws Exception {
            agent.wrap((e, ctx, cb) -> cb.call(null, "not a proxy response")).handle(event, context, callback);

            var attributes = agentAttributes(AttributeDestination.TRANS_EVENT);
            assertFalse(attributes.containsKey("httpResponseCode"));
            assertNull(onlyFinished().getStatusCode());
        }
    }

    @Nested
    class IdentityAttributes {

        @Test
        void capturesColdStartOnFirstInvocationOnly() throws Exception {
            LambdaHandler<Object, Object> wrapped = agent.wrap((event, ctx, cb) -> cb.call(null, "worked"));

            wrapped.handle(Map.of(), context, callback);
            wrapped.handle(Map.of(), context, callback);

            assertEquals(2, finished.size());
            var first = finished.get(0).getAgentAttributes().get(AttributeDestination.TRANS_EVENT);
            assertEquals(true, first.get("aws.lambda.coldStart"));
            for (var destination : AttributeDestination.values()) {
                assertFalse(finished.get(1).getAgentAttributes().get(destination).containsKey("aws.lambda.coldStart"));
            }
        }

        @Test
        void sendsAttributesToTheirDestinations() throws Exception {
            var event = Map.<String, Object>of("Records", List.of(Map.of("eventSourceARN", "stub:eventsource:arn")));

            agent.wrap((e, ctx, cb) -> cb.call(null, "worked")).handle(event, context, callback);

            var transactionEvent = agentAttributes(AttributeDestination.TRANS_EVENT);
            var trace = agentAttributes(AttributeDestination.TRANS_TRACE);
            var errorEvent = agentAttributes(AttributeDestination.ERROR_EVENT);

            assertEquals("nr-test", trace.get("aws.region"));
            assertEquals(TestContext.REQUEST_ID, trace.get("aws.requestId"));
            assertEquals(TestContext.FUNCTION_ARN, trace.get("aws.lambda.arn"));
            assertEquals(true, trace.get("aws.lambda.coldStart"));
            assertEquals("testName", trace.get("aws.lambda.functionName"));
            assertEquals("TestVersion", trace.get("aws.lambda.functionVersion"));
            assertEquals("128", trace.get("aws.lambda.memoryLimit"));
            assertEquals("stub:eventsource:arn", trace.get("aws.lambda.eventSource.arn"));

            for (var key : List.of("aws.region", "aws.requestId", "aws.lambda.arn", "aws.lambda.coldStart")) {
                assertTrue(transactionEvent.containsKey(key), key);
                assertTrue(errorEvent.containsKey(key), key);
            }
            for (var key : List.of(
                    "aws.lambda.functionName",
                    "aws.lambda.functionVersion",
                    "aws.lambda.memoryLimit",
                    "aws.lambda.eventSource.arn")) {
                assertFalse(transactionEvent.containsKey(key), key);
                assertTrue(errorEvent.containsKey(key), key);
            }
        }

        @ParameterizedTest
        @CsvSource({
            "kinesis, kinesis:eventsourcearn",
            "s3Put, bucketarn",
            "sns, eventsubscriptionarn",
            "dynamoDbUpdate, dynamodb:eventsourcearn",
            "codeCommit, arn:aws:codecommit:us-west-2:123456789012:my-repo",
            "firehose, aws:lambda:events"
        })
        void capturesEventSourceArn(String sample, String expectedArn) throws Exception {
            agent.wrap((e, ctx, cb) -> cb.call(null, "worked"))
                    .handle(TestUtils.loadEvent(sample), context, callback);

            var attributes = agentAttributes(AttributeDestination.TRANS_TRACE);
            assertEquals(expectedArn, attributes.get("aws.lambda.eventSource.arn"));
        }

        @Test
        void omitsEventSourceArnForCloudFrontEvents() throws Exception {
            agent.wrap((e, ctx, cb) -> cb.call(null, "worked"))
                    .handle(TestUtils.loadEvent("cloudFront"), context, callback);

            assertFalse(onlyFinished().getAgentAttributes().has("aws.lambda.eventSource.arn"));
        }

        @Test
        void capturesEventSourceArnOfTypedSnsEvent() throws Exception {
            var sns = new SNSEvent.SNS();
            sns.setTimestamp(new DateTime(0));
            var record = new SNSEvent.SNSRecord();
            record.setEventSubscriptionArn("arn:aws:sns:us-east-1:1:topic:subscription");
            record.setSns(sns);
            var event = new SNSEvent();
            event.setRecords(List.of(record));

            agent.wrap((e, ctx, cb) -> cb.call(null, "worked")).handle(event, context, callback);

            var attributes = agentAttributes(AttributeDestination.TRANS_TRACE);
            assertEquals("arn:aws:sns:us-east-1:1:topic:subscription", attributes.get("aws.lambda.eventSource.arn"));
        }
    }

    enum Style {
        CALLBACK,
        DONE,
        SUCCEED,
        FAIL
    }

    @Nested
    class CompletionSignals {

        private LambdaHandler<Object, Object> completingWith(Style style, Object error) {
            return agent.wrap((event, ctx, cb) -> {
                switch (style) {
                    case CALLBACK -> cb.call(error, error == null ? "worked" : "failed");
                    case DONE -> ctx.done(error, error == null ? "worked" : "failed");
                    case SUCCEED -> ctx.succeed("worked");
                    case FAIL -> ctx.fail(error);
                }
            });
        }

        @ParameterizedTest
        @EnumSource(Style.class)
        void endsTheTransaction(Style style) throws Exception {
            var inHandler = new ArrayList<Transaction>();
            LambdaHandler<Object, Object> wrapped = agent.wrap((event, ctx, cb) -> {
                inHandler.add(agent.getTracer().getTransaction());
                switch (style) {
                    case CALLBACK -> cb.call(null, "worked");
                    case DONE -> ctx.done(null, "worked");
                    case SUCCEED -> ctx.succeed("worked");
                    case FAIL -> ctx.fail(null);
                }
            });

            wrapped.handle(Map.of(), context, callback);

            var transaction = onlyFinished();
            assertSame(inHandler.get(0), transaction);
            assertFalse(transaction.isActive());
            assertEquals(CompletionSignal.valueOf(style.name()), transaction.getCompletionSignal());
            assertNull(agent.getTracer().getTransaction());
            assertTrue(agent.getErrors().getErrors().isEmpty());
        }

        @ParameterizedTest
        @EnumSource(value = Style.class, names = {"CALLBACK", "DONE", "FAIL"})
        void noticesTypedErrors(Style style) throws Exception {
            completingWith(style, new SyntaxError(ERROR_MESSAGE)).handle(Map.of(), context, callback);

            assertEquals(1, finished.size());
            var errors = agent.getErrors().getErrors();
            assertEquals(1, errors.size());
            assertEquals(BACKGROUND_NAME, errors.get(0).transactionName());
            assertEquals(ERROR_MESSAGE, errors.get(0).message());
            assertEquals("SyntaxError", errors.get(0).className());
            assertSame(errors.get(0), finished.get(0).getNoticedError());
        }

        @ParameterizedTest
        @EnumSource(value = Style.class, names = {"CALLBACK", "DONE", "FAIL"})
        void noticesStringErrors(Style style) throws Exception {
            completingWith(style, "failed").handle(Map.of(), context, callback);

            assertEquals(1, finished.size());
            var errors = agent.getErrors().getErrors();
            assertEquals(1, errors.size());
            assertEquals(BACKGROUND_NAME, errors.get(0).transactionName());
            assertEquals("failed", errors.get(0).message());
            assertEquals("Error", errors.get(0).className());
            assertNotNull(errors.get(0).stackTrace());
            assertFalse(errors.get(0).stackTrace().isEmpty());
        }

        @Test
        void forwardsOriginalArgumentsToTheHost() throws Exception {
            var error = new SyntaxError(ERROR_MESSAGE);

            completingWith(Style.CALLBACK, error).handle(Map.of(), context, callback);
            completingWith(Style.DONE, error).handle(Map.of(), context, callback);
            completingWith(Style.FAIL, error).handle(Map.of(), context, callback);

            assertEquals(1, callbackCalls.size());
            assertSame(error, callbackCalls.get(0)[0]);
            assertEquals("failed", callbackCalls.get(0)[1]);
            assertEquals(List.of("done", "fail"), context.signals);
            assertSame(error, context.errors.get(0));
            assertEquals("failed", context.results.get(0));
            assertSame(error, context.errors.get(1));
        }

        @Test
        void missingHostCallbackFailsAsItWouldUninstrumented() {
            LambdaHandler<Object, Object> wrapped = agent.wrap((event, ctx, cb) -> cb.call(null, "worked"));

            assertThrows(NullPointerException.class, () -> wrapped.handle(Map.of(), context, null));
            assertEquals(CompletionSignal.CALLBACK, onlyFinished().getCompletionSignal());
        }

        @Test
        void secondSignalIsANoOp() throws Exception {
            agent.wrap((event, ctx, cb) -> {
                        cb.call(null, "worked");
                        ctx.done(new SyntaxError(ERROR_MESSAGE), "late");
                        ctx.succeed("later");
                        ctx.fail("latest");
                    })
                    .handle(Map.of(), context, callback);

            assertEquals(1, finished.size());
            assertEquals(CompletionSignal.CALLBACK, finished.get(0).getCompletionSignal());
            assertTrue(agent.getErrors().getErrors().isEmpty());
            assertEquals(1, agent.getMetrics().getMetric("OtherTransaction/all").getCallCount());
            assertEquals(1, callbackCalls.size());
            assertEquals(List.of("done", "succeed", "fail"), context.signals);
        }

        @Test
        void hostCallbackSeesEndedTransaction() throws Exception {
            var inHandler = new ArrayList<Transaction>();
            var inHost = new ArrayList<Object>();
            Callback<Object> hostCallback = (error, result) -> {
                inHost.add(inHandler.get(0).isActive());
                inHost.add(agent.getTracer().getTransaction());
            };

            agent.wrap((event, ctx, cb) -> {
                        inHandler.add(agent.getTracer().getTransaction());
                        cb.call(null, "worked");
                    })
                    .handle(Map.of(), context, hostCallback);

            assertEquals(false, inHost.get(0));
            assertNull(inHost.get(1));
        }

        @Test
        void synchronousThrowCompletesAndRethrows() {
            var error = new SyntaxError(ERROR_MESSAGE);
            LambdaHandler<Object, Object> wrapped = agent.wrap((event, ctx, cb) -> {
                throw error;
            });

            var thrown = assertThrows(SyntaxError.class, () -> wrapped.handle(Map.of(), context, callback));

            assertSame(error, thrown);
            assertEquals(CompletionSignal.RETURN, onlyFinished().getCompletionSignal());
            assertEquals("SyntaxError", agent.getErrors().getErrors().get(0).className());
            assertTrue(callbackCalls.isEmpty());
        }

        @Test
        void completesFromAnotherThread() throws Exception {
            var executor = agent.getTracer().wrap(Executors.newSingleThreadExecutor());
            var inTask = new CopyOnWriteArrayList<Transaction>();
            try {
                agent.wrap((event, ctx, cb) -> executor.execute(() -> {
                            inTask.add(agent.getTracer().getTransaction());
                            cb.call(null, "worked");
                        }))
                        .handle(Map.of(), context, callback);
            } finally {
                executor.shutdown();
                assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
            }

            var transaction = onlyFinished();
            assertSame(transaction, inTask.get(0));
            assertEquals(1, callbackCalls.size());
        }
    }

    @Nested
    class ErrorsAndListeners {

        @Test
        void capturesErrorNoticedDuringInvocation() throws Exception {
            agent.wrap((event, ctx, cb) -> {
                        agent.noticeError(new IllegalStateException("noticed"));
                        cb.call(null, "worked");
                    })
                    .handle(Map.of(), context, callback);

            var errors = agent.getErrors().getErrors();
            assertEquals(1, errors.size());
            assertEquals("IllegalStateException", errors.get(0).className());
            assertEquals(BACKGROUND_NAME, errors.get(0).transactionName());
        }

        @Test
        void handlerErrorWinsOverNoticedError() throws Exception {
            agent.wrap((event, ctx, cb) -> {
                        agent.noticeError(new IllegalStateException("noticed"));
                        cb.call(new SyntaxError(ERROR_MESSAGE), null);
                    })
                    .handle(Map.of(), context, callback);

            var errors = agent.getErrors().getErrors();
            assertEquals(1, errors.size());
            assertEquals("SyntaxError", errors.get(0).className());
        }

        @Test
        void capturesErrorNoticedOutsideTransaction() {
            agent.noticeError("outside");

            var errors = agent.getErrors().getErrors();
            assertEquals(1, errors.size());
            assertEquals("Unknown", errors.get(0).transactionName());
            assertEquals(0, errors.get(0).timestamp());
        }

        @Test
        void recordsErrorMetrics() throws Exception {
            agent.wrap((event, ctx, cb) -> cb.call(new SyntaxError(ERROR_MESSAGE), null))
                    .handle(Map.of(), context, callback);

            var metrics = agent.getMetrics();
            assertEquals(1, metrics.getMetric("Errors/all").getCallCount());
            assertEquals(1, metrics.getMetric("Errors/allOther").getCallCount());
            assertEquals(1, metrics.getMetric("Errors/" + BACKGROUND_NAME).getCallCount());
            assertNull(metrics.getMetric("Errors/allWeb"));
        }

        @Test
        void addsCustomAttributesToCurrentTransaction() throws Exception {
            agent.wrap((event, ctx, cb) -> {
                        assertTrue(agent.addCustomAttribute("orderId", "1234"));
                        cb.call(null, "worked");
                    })
                    .handle(Map.of(), context, callback);

            assertEquals(
                    "1234", onlyFinished().getCustomAttributes().get(AttributeDestination.TRANS_EVENT).get("orderId"));
            assertFalse(agent.addCustomAttribute("late", "value"));
        }

        @Test
        void recordsTransactionEvent() throws Exception {
            agent.wrap((event, ctx, cb) -> cb.call(new SyntaxError(ERROR_MESSAGE), null))
                    .handle(Map.of(), context, callback);

            var events = agent.getTransactionEvents().getEvents();
            assertEquals(1, events.size());
            assertEquals(BACKGROUND_NAME, events.get(0).intrinsics().get("name"));
            assertEquals(true, events.get(0).intrinsics().get("error"));
            assertEquals(true, events.get(0).agentAttributes().get("aws.lambda.coldStart"));
        }

        @Test
        void listenerSeesSettledTransaction() throws Exception {
            var observed = new ArrayList<Object>();
            agent.addListener(transaction -> {
                observed.add(transaction.getAgentAttributes().isFrozen());
                observed.add(agent.getMetrics().getMetric(transaction.getFullName()).getCallCount());
                observed.add(agent.getErrors().getErrors().size());
            });

            agent.wrap((event, ctx, cb) -> cb.call("failed", null)).handle(Map.of(), context, callback);

            assertEquals(List.of(true, 1L, 1), observed);
        }

        @Test
        void failingListenerDoesNotAffectTheInvocation() throws Exception {
            agent.addListener(transaction -> {
                throw new IllegalStateException("listener failure");
            });
            var later = new ArrayList<Transaction>();
            agent.addListener(later::add);

            agent.wrap((event, ctx, cb) -> cb.call(null, "worked")).handle(Map.of(), context, callback);

            assertEquals(1, later.size());
            assertEquals(1, callbackCalls.size());
            assertEquals("worked", callbackCalls.get(0)[1]);
        }

        @Test
        void removedListenerIsNotNotified() throws Exception {
            var removed = new ArrayList<Transaction>();
            TransactionListener listener = removed::add;
            agent.addListener(listener);
            agent.removeListener(listener);

            agent.wrap((event, ctx, cb) -> cb.call(null, "worked")).handle(Map.of(), context, callback);

            assertTrue(removed.isEmpty());
            assertEquals(1, finished.size());
        }
    }

    @Test
    void uninspectableEventStillInvokesHandler() throws Exception {
        var event = new Object() {
            public String getBroken() {
                throw new IllegalStateException("broken getter");
            }
        };

        agent.wrap((e, ctx, cb) -> cb.call(null, "worked")).handle(event, context, callback);

        assertEquals(TransactionKind.BACKGROUND, onlyFinished().getKind());
        assertEquals("worked", callbackCalls.get(0)[1]);
    }
}
