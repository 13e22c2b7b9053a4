// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring.examples;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.lambda.monitoring.AgentConfig;
import software.amazon.lambda.monitoring.TracingRequestHandler;
import software.amazon.lambda.monitoring.attributes.AttributeConfig;

/**
 * API Gateway proxy handler traced as a web transaction.
 *
 * <p>The request method, path and headers are captured automatically, as is the response status. Query parameters are
 * hidden by default; this handler opts {@code name} back in. A 5xx response is reported as an error even though the
 * handler returns normally.
 */
public class GreetingApiExample
        extends TracingRequestHandler<APIGatewayProxyRequestEvent, APIGatewayProxyResponseEvent> {
    private static final Logger logger = LoggerFactory.getLogger(GreetingApiExample.class);

    @Override
    protected AgentConfig createConfiguration() {
        return AgentConfig.builder()
                .withTransactionGroup("Api")
                .withAttributeConfig(AttributeConfig.builder()
                        .include(List.of("request.parameters.name"))
                        .build())
                .build();
    }

    @Override
    protected APIGatewayProxyResponseEvent handleTracedRequest(APIGatewayProxyRequestEvent input, Context context) {
        var parameters = input.getQueryStringParameters();
        var name = parameters != null ? parameters.get("name") : null;
        if (name == null || name.isBlank()) {
            logger.info("Rejecting greeting request without a name");
            return respond(400, "name is required");
        }
        if ("teapot".equalsIgnoreCase(name)) {
            // simulates a failing downstream dependency
            return respond(503, "greeting service unavailable");
        }
        getAgent().addCustomAttribute("greeting.name", name);
        return respond(200, "Hello, " + name);
    }

    private static APIGatewayProxyResponseEvent respond(int statusCode, String message) {
        return new APIGatewayProxyResponseEvent()
                .withStatusCode(statusCode)
                .withHeaders(Map.of("Content-Type", "text/plain"))
                .withBody(message);
    }
}
