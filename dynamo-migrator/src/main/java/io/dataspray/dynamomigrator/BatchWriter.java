// SPDX-FileCopyrightText: 2019-2022 Matus Faro <matus@smotana.com>
// SPDX-License-Identifier: Apache-2.0
package io.dataspray.dynamomigrator;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.Lists;
import com.google.common.eventbus.EventBus;
import io.dataspray.dynamomigrator.event.BatchFailedEvent;
import io.dataspray.dynamomigrator.event.BatchWrittenEvent;
import io.dataspray.dynamomigrator.event.TableEmptyEvent;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Writes items to the destination in batches, resubmitting whatever the store reports as unprocessed.
 */
@Slf4j
public class BatchWriter {
    /**
     * Most items a single batch write call accepts
     */
    public static final int MAX_BATCH_SIZE = 25;

    private final StoreClient destination;
    private final int batchSize;
    private final ExponentialBackoff backoff;
    private final EventBus eventBus;

    public BatchWriter(StoreClient destination, MigrationConfig config, EventBus eventBus) {
        this.destination = destination;
        this.batchSize = config.getBatchSize();
        this.backoff = config.getBackoff();
        this.eventBus = eventBus;
    }

    /**
     * Writes items in batches, in order. A batch whose write call fails is reported and skipped,
     * the remaining batches are still written. A batch that runs out of retries counts the items the store
     * accepted as written and only skips the rest.
     *
     * @param page source page the items came from, for progress output
     */
    public WriteSummary writeItems(String tableName, List<Map<String, AttributeValue>> items, int page) {
        if (items.isEmpty()) {
            eventBus.post(new TableEmptyEvent(tableName, page));
            return WriteSummary.EMPTY;
        }
        List<List<Map<String, AttributeValue>>> batches = Lists.partition(items, batchSize);
        WriteSummary summary = WriteSummary.EMPTY;
        for (int i = 0; i < batches.size(); i++) {
            List<Map<String, AttributeValue>> batch = batches.get(i);
            try {
                int retries = writeBatch(tableName, batch);
                summary = summary.plus(new WriteSummary(batch.size(), 0));
                eventBus.post(new BatchWrittenEvent(tableName, page, i + 1, batches.size(), batch.size(), retries));
            } catch (UnprocessedItemsException ex) {
                summary = summary.plus(new WriteSummary(batch.size() - ex.getRemainingItems(), 1));
                eventBus.post(new BatchFailedEvent(tableName, page, i + 1, batches.size(), ex.getRemainingItems(), ex));
            } catch (RuntimeException ex) {
                summary = summary.plus(new WriteSummary(0, 1));
                eventBus.post(new BatchFailedEvent(tableName, page, i + 1, batches.size(), batch.size(), ex));
            }
        }
        return summary;
    }

    /**
     * @return number of resubmissions needed until nothing was left unprocessed
     * @throws UnprocessedItemsException if items remain unprocessed after the allowed retries
     */
    @VisibleForTesting
    int writeBatch(String tableName, List<Map<String, AttributeValue>> batch) {
        List<Map<String, AttributeValue>> unprocessed = destination.batchWrite(tableName, batch);
        int retry = 0;
        while (!unprocessed.isEmpty()) {
            retry++;
            if (!backoff.canRetry(retry)) {
                throw new UnprocessedItemsException(tableName, unprocessed.size(), retry - 1);
            }
            Duration delay = backoff.pause(retry);
            log.debug("Resubmitting {} unprocessed items for table {} after {}ms, retry {}",
                    unprocessed.size(), tableName, delay.toMillis(), retry);
            unprocessed = destination.batchWrite(tableName, unprocessed);
        }
        return retry;
    }
}
