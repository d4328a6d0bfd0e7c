// SPDX-FileCopyrightText: 2019-2022 Matus Faro <matus@smotana.com>
// SPDX-License-Identifier: Apache-2.0
package io.dataspray.dynamomigrator.event;

import lombok.NonNull;
import lombok.Value;

import java.util.Optional;

/**
 * A source page was compared with the destination page at the same pagination position.
 */
@Value
public class PageComparedEvent {
    @NonNull
    String tableName;
    int page;
    boolean identical;
    int sourceItems;
    int destinationItems;
    int itemsToWrite;
    @NonNull
    Optional<String> sourceCursorOpt;
    @NonNull
    Optional<String> destinationCursorOpt;
}
