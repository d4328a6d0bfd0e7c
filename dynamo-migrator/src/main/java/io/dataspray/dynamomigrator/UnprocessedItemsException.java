// SPDX-FileCopyrightText: 2019-2022 Matus Faro <matus@smotana.com>
// SPDX-License-Identifier: Apache-2.0
package io.dataspray.dynamomigrator;

import lombok.Getter;

/**
 * The destination kept returning unprocessed items after every allowed retry.
 */
@Getter
public class UnprocessedItemsException extends RuntimeException {
    private final String tableName;
    private final int remainingItems;
    private final int retries;

    public UnprocessedItemsException(String tableName, int remainingItems, int retries) {
        super(remainingItems + " items still unprocessed for table " + tableName + " after " + retries + " retries");
        this.tableName = tableName;
        this.remainingItems = remainingItems;
        this.retries = retries;
    }
}
