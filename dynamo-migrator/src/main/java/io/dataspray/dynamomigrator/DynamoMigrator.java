// SPDX-FileCopyrightText: 2019-2022 Matus Faro <matus@smotana.com>
// SPDX-License-Identifier: Apache-2.0
package io.dataspray.dynamomigrator;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.eventbus.EventBus;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.dataspray.dynamomigrator.event.LoggingProgressListener;
import lombok.Builder;
import lombok.NonNull;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

import javax.annotation.Nullable;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Replicates tables, schema and data, from a source DynamoDB to a destination DynamoDB.
 * <p>
 * Typical use is {@link #copySchema} once, followed by {@link #migrateData} as many times as needed to catch up.
 */
public class DynamoMigrator {
    @VisibleForTesting
    final StoreClient source;
    @VisibleForTesting
    final StoreClient destination;
    private final SchemaReplicator schemaReplicator;
    private final MigrationCoordinator coordinator;

    @Builder
    private DynamoMigrator(
            @NonNull DynamoDbClient sourceDynamo,
            @Nullable String sourceName,
            @NonNull DynamoDbClient destinationDynamo,
            @Nullable String destinationName,
            @Nullable Integer scanLimit,
            @Nullable MigrationConfig config,
            @Nullable List<?> progressListeners,
            @Nullable ExecutorService executor) {
        this.source = DynamoStoreClient.builder()
                .dynamo(sourceDynamo)
                .name(sourceName != null ? sourceName : "source")
                .scanLimit(scanLimit)
                .build();
        this.destination = DynamoStoreClient.builder()
                .dynamo(destinationDynamo)
                .name(destinationName != null ? destinationName : "destination")
                .scanLimit(scanLimit)
                .build();
        EventBus eventBus = new EventBus("dynamo-migrator");
        eventBus.register(new LoggingProgressListener());
        if (progressListeners != null) {
            progressListeners.forEach(eventBus::register);
        }
        ListeningExecutorService listeningExecutor = MoreExecutors.listeningDecorator(executor != null
                ? executor
                : Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                .setNameFormat("dynamo-migrator-table-%d")
                .build()));
        this.schemaReplicator = new SchemaReplicator(source, destination);
        this.coordinator = new MigrationCoordinator(source, destination, config != null ? config : MigrationConfig.defaults(), eventBus, listeningExecutor);
    }

    /**
     * Creates the given tables at the destination, or every source table if none are given.
     */
    public ImmutableList<String> copySchema(String... tableNames) {
        return schemaReplicator.copySchema(ImmutableList.copyOf(tableNames));
    }

    /**
     * Starts copying missing items of the given tables, or of every source table if none are given. Destination
     * tables must already exist. Returns immediately; wait on the returned run to collect per-table results.
     */
    public MigrationRun migrateData(String... tableNames) {
        return coordinator.synchronizeAll(ImmutableList.copyOf(tableNames));
    }

    /**
     * Lets running table tasks finish and releases their threads afterwards.
     */
    public void shutdown() {
        coordinator.shutdown();
    }
}
