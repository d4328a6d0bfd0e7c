// SPDX-FileCopyrightText: 2019-2022 Matus Faro <matus@smotana.com>
// SPDX-License-Identifier: Apache-2.0
package io.dataspray.dynamomigrator.event;

import lombok.NonNull;
import lombok.Value;

/**
 * A batch was skipped. Its remaining items were not written and will not be retried in this pass.
 */
@Value
public class BatchFailedEvent {
    @NonNull
    String tableName;
    int page;
    int batch;
    int totalBatches;
    /**
     * Items of the batch left unwritten
     */
    int items;
    @NonNull
    Throwable cause;
}
