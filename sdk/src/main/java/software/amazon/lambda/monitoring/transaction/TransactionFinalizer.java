// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring.transaction;

/** Performs the work that follows the end of a transaction: metrics, error capture and notifications. */
@FunctionalInterface
public interface TransactionFinalizer {
    /**
     * @param transaction the transaction, already in state {@link TransactionState#ENDED}
     * @param error the error the handler completed with, or null
     */
    void finalizeTransaction(Transaction transaction, Object error);
}
