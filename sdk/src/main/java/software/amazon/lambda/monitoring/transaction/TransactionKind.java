// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.lambda.monitoring.transaction;

/** Kind of a transaction, which selects its name prefix and the metrics recorded for it. */
public enum TransactionKind {
    WEB("WebTransaction"),
    BACKGROUND("OtherTransaction");

    private final String namePrefix;

    TransactionKind(String namePrefix) {
        this.namePrefix = namePrefix;
    }

    public String getNamePrefix() {
        return namePrefix;
    }
}
