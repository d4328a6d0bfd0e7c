// SPDX-FileCopyrightText: 2019-2022 Matus Faro <matus@smotana.com>
// SPDX-License-Identifier: Apache-2.0
package io.dataspray.dynamomigrator;

import lombok.NonNull;
import lombok.Value;

import java.util.Optional;

/**
 * Outcome of synchronizing one table.
 */
@Value
public class TableSyncResult {

    public enum Status {
        SUCCESS,
        /**
         * Destination table does not exist, nothing was written
         */
        NOT_FOUND,
        FAILED
    }

    @NonNull
    String tableName;
    @NonNull
    Status status;
    int pagesRead;
    long itemsWritten;
    int failedBatches;
    @NonNull
    Optional<Throwable> errorOpt;

    public static TableSyncResult success(String tableName, int pagesRead, WriteSummary summary) {
        return new TableSyncResult(tableName, Status.SUCCESS, pagesRead, summary.getItemsWritten(), summary.getFailedBatches(), Optional.empty());
    }

    public static TableSyncResult notFound(String tableName) {
        return new TableSyncResult(tableName, Status.NOT_FOUND, 0, 0L, 0, Optional.empty());
    }

    public static TableSyncResult failed(String tableName, Throwable error) {
        return failed(tableName, 0, WriteSummary.EMPTY, error);
    }

    /**
     * @param pagesRead source pages read before the failure
     * @param summary   items written before the failure
     */
    public static TableSyncResult failed(String tableName, int pagesRead, WriteSummary summary, Throwable error) {
        return new TableSyncResult(tableName, Status.FAILED, pagesRead, summary.getItemsWritten(), summary.getFailedBatches(), Optional.of(error));
    }
}
