// SPDX-FileCopyrightText: 2019-2022 Matus Faro <matus@smotana.com>
// SPDX-License-Identifier: Apache-2.0
package io.dataspray.dynamomigrator;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.services.dynamodb.model.BillingMode;
import software.amazon.awssdk.services.dynamodb.model.CreateTableRequest;
import software.amazon.awssdk.services.dynamodb.model.GlobalSecondaryIndex;
import software.amazon.awssdk.services.dynamodb.model.GlobalSecondaryIndexDescription;
import software.amazon.awssdk.services.dynamodb.model.LocalSecondaryIndex;
import software.amazon.awssdk.services.dynamodb.model.ProvisionedThroughput;
import software.amazon.awssdk.services.dynamodb.model.ProvisionedThroughputDescription;
import software.amazon.awssdk.services.dynamodb.model.TableDescription;

import java.util.List;

/**
 * Creates destination tables with the same key schema, attributes, indexes and throughput as the source.
 */
@Slf4j
public class SchemaReplicator {
    private final StoreClient source;
    private final StoreClient destination;

    public SchemaReplicator(StoreClient source, StoreClient destination) {
        this.source = source;
        this.destination = destination;
    }

    /**
     * Creates the given tables, or every source table if none are given. Stops at the first failure,
     * e.g. when a table already exists at the destination.
     *
     * @return names of the tables created
     */
    public ImmutableList<String> copySchema(List<String> tableNames) {
        List<String> tables = tableNames.isEmpty() ? source.listTables() : tableNames;
        ImmutableList.Builder<String> createdBuilder = ImmutableList.builder();
        for (String tableName : tables) {
            destination.createTable(toCreateTableRequest(source.describeTable(tableName)));
            log.info("Created table {} in {}", tableName, destination.name());
            createdBuilder.add(tableName);
        }
        return createdBuilder.build();
    }

    @VisibleForTesting
    static CreateTableRequest toCreateTableRequest(TableDescription table) {
        boolean onDemand = table.billingModeSummary() != null
                && BillingMode.PAY_PER_REQUEST.equals(table.billingModeSummary().billingMode());
        CreateTableRequest.Builder builder = CreateTableRequest.builder()
                .tableName(table.tableName())
                .keySchema(table.keySchema())
                .attributeDefinitions(table.attributeDefinitions());
        if (onDemand) {
            builder.billingMode(BillingMode.PAY_PER_REQUEST);
        } else {
            builder.provisionedThroughput(throughput(table.provisionedThroughput()));
        }

        if (table.hasGlobalSecondaryIndexes() && !table.globalSecondaryIndexes().isEmpty()) {
            builder.globalSecondaryIndexes(table.globalSecondaryIndexes().stream()
                    .map(gsi -> toGlobalSecondaryIndex(gsi, onDemand))
                    .collect(ImmutableList.toImmutableList()));
        }
        if (table.hasLocalSecondaryIndexes() && !table.localSecondaryIndexes().isEmpty()) {
            builder.localSecondaryIndexes(table.localSecondaryIndexes().stream()
                    .map(lsi -> LocalSecondaryIndex.builder()
                            .indexName(lsi.indexName())
                            .keySchema(lsi.keySchema())
                            .projection(lsi.projection()).build())
                    .collect(ImmutableList.toImmutableList()));
        }
        return builder.build();
    }

    private static GlobalSecondaryIndex toGlobalSecondaryIndex(GlobalSecondaryIndexDescription gsi, boolean onDemand) {
        GlobalSecondaryIndex.Builder builder = GlobalSecondaryIndex.builder()
                .indexName(gsi.indexName())
                .keySchema(gsi.keySchema())
                .projection(gsi.projection());
        if (!onDemand) {
            builder.provisionedThroughput(throughput(gsi.provisionedThroughput()));
        }
        return builder.build();
    }

    /**
     * Only read and write capacity; the number of decreases today is assigned by the server and rejected on create.
     */
    private static ProvisionedThroughput throughput(ProvisionedThroughputDescription description) {
        return ProvisionedThroughput.builder()
                .readCapacityUnits(description.readCapacityUnits())
                .writeCapacityUnits(description.writeCapacityUnits())
                .build();
    }
}
