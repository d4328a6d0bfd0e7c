// SPDX-FileCopyrightText: 2019-2022 Matus Faro <matus@smotana.com>
// SPDX-License-Identifier: Apache-2.0
package io.dataspray.dynamomigrator;

import com.google.common.collect.ImmutableSet;
import lombok.Builder;
import lombok.Value;

import javax.annotation.Nullable;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;

@Value
public class MigrationConfig {
    /**
     * Operational tables that are never migrated.
     */
    public static final ImmutableSet<String> DEFAULT_EXCLUDED_TABLES = ImmutableSet.of(
            "Performance",
            "PerformanceMetrics",
            "ProductionPipelineErrors");

    int batchSize;
    ImmutableSet<String> excludedTables;
    ExponentialBackoff backoff;

    @Builder
    private MigrationConfig(
            @Nullable Integer batchSize,
            @Nullable Set<String> excludedTables,
            @Nullable ExponentialBackoff backoff) {
        this.batchSize = batchSize != null ? batchSize : BatchWriter.MAX_BATCH_SIZE;
        this.excludedTables = excludedTables != null ? ImmutableSet.copyOf(excludedTables) : DEFAULT_EXCLUDED_TABLES;
        this.backoff = backoff != null ? backoff : ExponentialBackoff.defaults();
        checkArgument(this.batchSize > 0 && this.batchSize <= BatchWriter.MAX_BATCH_SIZE,
                "Batch size must be between 1 and %s", BatchWriter.MAX_BATCH_SIZE);
    }

    public static MigrationConfig defaults() {
        return builder().build();
    }
}
