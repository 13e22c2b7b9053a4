// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring.attributes;

/** The output streams an attribute can be reported to. */
public enum AttributeDestination {
    /** Transaction events (analytic events). */
    TRANS_EVENT,
    /** Transaction traces. */
    TRANS_TRACE,
    /** Error events and error traces. */
    ERROR_EVENT
}
