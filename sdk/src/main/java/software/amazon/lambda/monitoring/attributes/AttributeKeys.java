// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring.attributes;

/** Names of the agent attributes captured for an invocation. */
public final class AttributeKeys {
    public static final String REGION = "aws.region";
    public static final String REQUEST_ID = "aws.requestId";
    public static final String LAMBDA_ARN = "aws.lambda.arn";
    public static final String COLD_START = "aws.lambda.coldStart";
    public static final String FUNCTION_NAME = "aws.lambda.functionName";
    public static final String FUNCTION_VERSION = "aws.lambda.functionVersion";
    public static final String MEMORY_LIMIT = "aws.lambda.memoryLimit";
    public static final String EVENT_SOURCE_ARN = "aws.lambda.eventSource.arn";

    public static final String REQUEST_METHOD = "request.method";
    public static final String REQUEST_URI = "request.uri";
    public static final String REQUEST_PARAMETERS_PREFIX = "request.parameters.";
    public static final String REQUEST_HEADERS_PREFIX = "request.headers.";
    public static final String RESPONSE_HEADERS_PREFIX = "response.headers.";

    /** Legacy name of the response status attribute. */
    public static final String HTTP_RESPONSE_CODE = "httpResponseCode";

    public static final String RESPONSE_STATUS = "response.status";

    private AttributeKeys() {}
}
