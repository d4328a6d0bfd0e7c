// SPDX-FileCopyrightText: 2019-2022 Matus Faro <matus@smotana.com>
// SPDX-License-Identifier: Apache-2.0
package io.dataspray.dynamomigrator.event;

import io.dataspray.dynamomigrator.TableSyncResult;
import lombok.NonNull;
import lombok.Value;

@Value
public class TableSyncFinishedEvent {
    @NonNull
    TableSyncResult result;
}
