// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring.transaction;

/**
 * Observer of finished transactions. Called once per transaction, after its attributes are frozen, its metrics are
 * recorded and its error, if any, has been handed to the error aggregator.
 */
@FunctionalInterface
public interface TransactionListener {
    void onTransactionFinished(Transaction transaction);
}
