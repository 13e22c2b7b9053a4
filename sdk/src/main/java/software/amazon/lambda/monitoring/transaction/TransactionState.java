// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring.transaction;

/** Lifecycle of a transaction. ENDED is terminal. */
public enum TransactionState {
    PENDING,
    ACTIVE,
    ENDED
}
