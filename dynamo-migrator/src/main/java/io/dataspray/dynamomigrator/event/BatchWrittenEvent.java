// SPDX-FileCopyrightText: 2019-2022 Matus Faro <matus@smotana.com>
// SPDX-License-Identifier: Apache-2.0
package io.dataspray.dynamomigrator.event;

import lombok.NonNull;
import lombok.Value;

@Value
public class BatchWrittenEvent {
    @NonNull
    String tableName;
    int page;
    /**
     * Starts at 1
     */
    int batch;
    int totalBatches;
    int items;
    /**
     * Resubmissions of unprocessed items this batch needed
     */
    int retries;
}
