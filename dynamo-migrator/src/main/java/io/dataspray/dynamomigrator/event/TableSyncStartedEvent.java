// SPDX-FileCopyrightText: 2019-2022 Matus Faro <matus@smotana.com>
// SPDX-License-Identifier: Apache-2.0
package io.dataspray.dynamomigrator.event;

import lombok.NonNull;
import lombok.Value;

@Value
public class TableSyncStartedEvent {
    @NonNull
    String tableName;
    @NonNull
    String sourceName;
    @NonNull
    String destinationName;
}
