// SPDX-FileCopyrightText: 2019-2022 Matus Faro <matus@smotana.com>
// SPDX-License-Identifier: Apache-2.0
package io.dataspray.dynamomigrator;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.BatchWriteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.BatchWriteItemResponse;
import software.amazon.awssdk.services.dynamodb.model.CreateTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.PutRequest;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;
import software.amazon.awssdk.services.dynamodb.model.ScanResponse;
import software.amazon.awssdk.services.dynamodb.model.TableDescription;
import software.amazon.awssdk.services.dynamodb.model.WriteRequest;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * {@link StoreClient} backed by a DynamoDB client.
 */
@Slf4j
public class DynamoStoreClient implements StoreClient {
    private final DynamoDbClient dynamo;
    private final String name;
    private final Optional<Integer> scanLimitOpt;

    @Builder
    private DynamoStoreClient(
            @NonNull DynamoDbClient dynamo,
            @Nullable String name,
            @Nullable Integer scanLimit) {
        checkArgument(scanLimit == null || scanLimit > 0, "Scan limit must be greater than zero");
        this.dynamo = dynamo;
        this.name = name != null ? name : "dynamo";
        this.scanLimitOpt = Optional.ofNullable(scanLimit);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ImmutableList<String> listTables() {
        return ImmutableList.copyOf(dynamo.listTablesPaginator().tableNames());
    }

    @Override
    public TableDescription describeTable(String tableName) {
        return dynamo.describeTable(DescribeTableRequest.builder()
                        .tableName(tableName)
                        .build())
                .table();
    }

    @Override
    public void createTable(CreateTableRequest request) {
        dynamo.createTable(request);
    }

    @Override
    public ScanPage scan(String tableName, Optional<Map<String, AttributeValue>> exclusiveStartKeyOpt) {
        ScanRequest.Builder builder = ScanRequest.builder()
                .tableName(tableName);
        exclusiveStartKeyOpt.ifPresent(builder::exclusiveStartKey);
        scanLimitOpt.ifPresent(builder::limit);
        ScanResponse response = dynamo.scan(builder.build());
        return new ScanPage(
                ImmutableList.copyOf(response.items()),
                response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()
                        ? Optional.of(response.lastEvaluatedKey())
                        : Optional.empty());
    }

    @Override
    public ImmutableList<Map<String, AttributeValue>> batchWrite(String tableName, List<Map<String, AttributeValue>> items) {
        checkArgument(items.size() <= BatchWriter.MAX_BATCH_SIZE, "Batch of %s items exceeds %s", items.size(), BatchWriter.MAX_BATCH_SIZE);
        BatchWriteItemResponse response = dynamo.batchWriteItem(BatchWriteItemRequest.builder()
                .requestItems(ImmutableMap.of(tableName, items.stream()
                        .map(item -> WriteRequest.builder()
                                .putRequest(PutRequest.builder()
                                        .item(item).build()).build())
                        .collect(ImmutableList.toImmutableList())))
                .build());
        if (!response.hasUnprocessedItems()) {
            return ImmutableList.of();
        }
        return response.unprocessedItems().getOrDefault(tableName, List.of()).stream()
                .map(WriteRequest::putRequest)
                .filter(Objects::nonNull)
                .map(PutRequest::item)
                .collect(ImmutableList.toImmutableList());
    }

    @Override
    public ImmutableList<Map<String, AttributeValue>> scanAll(String tableName) {
        ImmutableList.Builder<Map<String, AttributeValue>> itemsBuilder = ImmutableList.builder();
        Optional<Map<String, AttributeValue>> cursorOpt = Optional.empty();
        try {
            do {
                ScanPage page = scan(tableName, cursorOpt);
                itemsBuilder.addAll(page.getItems());
                cursorOpt = page.getCursorOpt();
            } while (cursorOpt.isPresent());
        } catch (ResourceNotFoundException ex) {
            log.info("Table {} not found in {}, returning no items", tableName, name);
            return ImmutableList.of();
        }
        return itemsBuilder.build();
    }
}
