// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring.metrics;

/** Names of the metrics recorded when a transaction ends. */
public final class MetricNames {
    public static final String WEB_TRANSACTION = "WebTransaction";
    public static final String WEB_TRANSACTION_TOTAL_TIME = "WebTransactionTotalTime";
    public static final String HTTP_DISPATCHER = "HttpDispatcher";
    public static final String APDEX = "Apdex";

    public static final String OTHER_TRANSACTION = "OtherTransaction";
    public static final String OTHER_TRANSACTION_ALL = "OtherTransaction/all";
    public static final String OTHER_TRANSACTION_TOTAL_TIME = "OtherTransactionTotalTime";

    public static final String ERRORS_ALL = "Errors/all";
    public static final String ERRORS_ALL_WEB = "Errors/allWeb";
    public static final String ERRORS_ALL_OTHER = "Errors/allOther";
    public static final String ERRORS_PREFIX = "Errors/";

    public static final String SUPPORTABILITY_RECORD_LAMBDA = "Supportability/API/recordLambda";

    private MetricNames() {}
}
