// SPDX-FileCopyrightText: 2019-2022 Matus Faro <matus@smotana.com>
// SPDX-License-Identifier: Apache-2.0
package io.dataspray.dynamomigrator.event;

import lombok.NonNull;
import lombok.Value;

/**
 * A write was requested with no items.
 */
@Value
public class TableEmptyEvent {
    @NonNull
    String tableName;
    int page;
}
