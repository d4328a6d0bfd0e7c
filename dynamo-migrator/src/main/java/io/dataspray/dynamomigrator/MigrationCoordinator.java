// SPDX-FileCopyrightText: 2019-2022 Matus Faro <matus@smotana.com>
// SPDX-License-Identifier: Apache-2.0
package io.dataspray.dynamomigrator;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.eventbus.EventBus;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import io.dataspray.dynamomigrator.event.TableSyncFinishedEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Starts one independent task per table.
 */
@Slf4j
public class MigrationCoordinator {
    private final StoreClient source;
    private final MigrationConfig config;
    private final EventBus eventBus;
    private final ListeningExecutorService executor;
    private final TableSynchronizer synchronizer;

    public MigrationCoordinator(StoreClient source, StoreClient destination, MigrationConfig config, EventBus eventBus, ListeningExecutorService executor) {
        this.source = source;
        this.config = config;
        this.eventBus = eventBus;
        this.executor = executor;
        this.synchronizer = new TableSynchronizer(
                source,
                destination,
                new PageComparator(),
                new BatchWriter(destination, config, eventBus),
                eventBus);
    }

    /**
     * Starts synchronizing the given tables, or every source table if none are given, and returns without waiting.
     * Excluded tables are always skipped.
     */
    public MigrationRun synchronizeAll(List<String> tableNames) {
        List<String> candidates = tableNames.isEmpty() ? source.listTables() : tableNames;
        ImmutableList<String> tables = candidates.stream()
                .filter(tableName -> !config.getExcludedTables().contains(tableName))
                .distinct()
                .collect(ImmutableList.toImmutableList());
        log.info("Synchronizing {} tables: {}", tables.size(), tables);

        ImmutableMap.Builder<String, ListenableFuture<TableSyncResult>> futuresBuilder = ImmutableMap.builder();
        for (String tableName : tables) {
            futuresBuilder.put(tableName, executor.submit(() -> synchronizeTable(tableName)));
        }
        return new MigrationRun(futuresBuilder.build());
    }

    private TableSyncResult synchronizeTable(String tableName) {
        try {
            return synchronizer.synchronizeTable(tableName);
        } catch (RuntimeException ex) {
            TableSyncResult result = TableSyncResult.failed(tableName, ex);
            eventBus.post(new TableSyncFinishedEvent(result));
            return result;
        }
    }

    /**
     * Stops accepting new tables, running tables finish.
     */
    public void shutdown() {
        executor.shutdown();
    }
}
