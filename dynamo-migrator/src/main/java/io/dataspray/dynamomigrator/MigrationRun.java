// SPDX-FileCopyrightText: 2019-2022 Matus Faro <matus@smotana.com>
// SPDX-License-Identifier: Apache-2.0
package io.dataspray.dynamomigrator;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Handle on the table tasks started by one {@link MigrationCoordinator#synchronizeAll} call.
 * Tasks run whether or not anyone waits on this handle.
 */
public class MigrationRun {
    private final ImmutableMap<String, ListenableFuture<TableSyncResult>> tableFutures;

    MigrationRun(ImmutableMap<String, ListenableFuture<TableSyncResult>> tableFutures) {
        this.tableFutures = tableFutures;
    }

    public ImmutableSet<String> tableNames() {
        return tableFutures.keySet();
    }

    public ListenableFuture<TableSyncResult> future(String tableName) {
        checkArgument(tableFutures.containsKey(tableName), "Table %s is not part of this run", tableName);
        return tableFutures.get(tableName);
    }

    public boolean isDone() {
        return tableFutures.values().stream().allMatch(ListenableFuture::isDone);
    }

    /**
     * Blocks until every table task completed.
     */
    public ImmutableMap<String, TableSyncResult> awaitResults() {
        return ImmutableMap.copyOf(Maps.transformValues(tableFutures, Futures::getUnchecked));
    }
}
