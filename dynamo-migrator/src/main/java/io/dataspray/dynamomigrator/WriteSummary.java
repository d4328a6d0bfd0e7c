// SPDX-FileCopyrightText: 2019-2022 Matus Faro <matus@smotana.com>
// SPDX-License-Identifier: Apache-2.0
package io.dataspray.dynamomigrator;

import lombok.Value;

@Value
public class WriteSummary {
    public static final WriteSummary EMPTY = new WriteSummary(0, 0);

    long itemsWritten;
    int failedBatches;

    public WriteSummary plus(WriteSummary other) {
        return new WriteSummary(
                itemsWritten + other.getItemsWritten(),
                failedBatches + other.getFailedBatches());
    }
}
