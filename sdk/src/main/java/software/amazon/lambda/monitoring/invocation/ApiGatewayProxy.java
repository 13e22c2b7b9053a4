// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring.invocation;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;
import software.amazon.lambda.monitoring.attributes.AttributeKeys;
import software.amazon.lambda.monitoring.attributes.HeaderNames;
import software.amazon.lambda.monitoring.transaction.Transaction;

/** Recognizes API Gateway Lambda proxy requests and responses and copies their HTTP details onto a transaction. */
final class ApiGatewayProxy {

    private ApiGatewayProxy() {}

    /** A proxy request carries an HTTP method, a path, headers and a request context. */
    static boolean isProxyEvent(JsonNode event) {
        return EventNodes.isPresent(EventNodes.field(event, "httpMethod"))
                && EventNodes.isPresent(EventNodes.field(event, "path"))
                && EventNodes.isPresent(EventNodes.field(event, "headers"))
                && EventNodes.isPresent(EventNodes.field(event, "requestContext"));
    }

    /** A proxy response carries a status code. */
    static boolean isProxyResponse(JsonNode response) {
        return EventNodes.isPresent(EventNodes.field(response, "statusCode"));
    }

    static void captureRequest(Transaction transaction, JsonNode event) {
        EventNodes.text(EventNodes.field(event, "httpMethod"))
                .ifPresent(method -> transaction.addAgentAttribute(AttributeKeys.REQUEST_METHOD, method));
        EventNodes.text(EventNodes.field(event, "path"))
                .ifPresent(path -> transaction.addAgentAttribute(AttributeKeys.REQUEST_URI, path));
        var parameters = AttributeKeys.REQUEST_PARAMETERS_PREFIX;
        copyFields(transaction, EventNodes.field(event, "queryStringParameters"), parameters, false);
        copyFields(transaction, EventNodes.field(event, "pathParameters"), parameters, false);
        copyFields(transaction, EventNodes.field(event, "headers"), AttributeKeys.REQUEST_HEADERS_PREFIX, true);
    }

    static void captureResponse(Transaction transaction, JsonNode response) {
        var statusCode = EventNodes.field(response, "statusCode").asInt(-1);
        if (statusCode >= 0) {
            var status = String.valueOf(statusCode);
            transaction.setStatusCode(statusCode);
            transaction.addAgentAttribute(AttributeKeys.HTTP_RESPONSE_CODE, status);
            transaction.addAgentAttribute(AttributeKeys.RESPONSE_STATUS, status);
        }
        copyFields(transaction, EventNodes.field(response, "headers"), AttributeKeys.RESPONSE_HEADERS_PREFIX, true);
    }

    private static void copyFields(Transaction transaction, JsonNode fields, String prefix, boolean headerNames) {
        if (fields == null || !fields.isObject()) {
            return;
        }
        var iterator = fields.fields();
        while (iterator.hasNext()) {
            Map.Entry<String, JsonNode> entry = iterator.next();
            var name = headerNames ? HeaderNames.toCamelCase(entry.getKey()) : entry.getKey();
            EventNodes.text(entry.getValue()).ifPresent(value -> transaction.addAgentAttribute(prefix + name, value));
        }
    }
}
