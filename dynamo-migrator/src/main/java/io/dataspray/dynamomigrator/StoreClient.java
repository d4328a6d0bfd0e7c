// SPDX-FileCopyrightText: 2019-2022 Matus Faro <matus@smotana.com>
// SPDX-License-Identifier: Apache-2.0
package io.dataspray.dynamomigrator;

import com.google.common.collect.ImmutableList;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.CreateTableRequest;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;
import software.amazon.awssdk.services.dynamodb.model.TableDescription;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Minimal view of a key-value store deployment that the migration needs. One instance per side,
 * source and destination are independent.
 */
public interface StoreClient {

    /**
     * Name of this store for log output, e.g. the region.
     */
    String name();

    ImmutableList<String> listTables();

    /**
     * @throws ResourceNotFoundException if the table does not exist
     */
    TableDescription describeTable(String tableName);

    /**
     * Fails if the table already exists. Never retried.
     */
    void createTable(CreateTableRequest request);

    /**
     * Reads one page of a table.
     *
     * @param exclusiveStartKeyOpt cursor returned by the previous page, empty for the first page
     * @throws ResourceNotFoundException if the table does not exist
     */
    ScanPage scan(String tableName, Optional<Map<String, AttributeValue>> exclusiveStartKeyOpt);

    /**
     * Best-effort write of at most {@link BatchWriter#MAX_BATCH_SIZE} items.
     *
     * @return items the store did not persist, empty if all were written
     */
    ImmutableList<Map<String, AttributeValue>> batchWrite(String tableName, List<Map<String, AttributeValue>> items);

    /**
     * Reads a whole table page by page. A missing table yields an empty list.
     */
    ImmutableList<Map<String, AttributeValue>> scanAll(String tableName);
}
