// SPDX-FileCopyrightText: 2019-2022 Matus Faro <matus@smotana.com>
// SPDX-License-Identifier: Apache-2.0
package io.dataspray.dynamomigrator.event;

import com.google.common.eventbus.AllowConcurrentEvents;
import com.google.common.eventbus.Subscribe;
import io.dataspray.dynamomigrator.TableSyncResult;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes migration progress to the log. Events of different tables are logged concurrently.
 */
@Slf4j
public class LoggingProgressListener {

    @Subscribe
    @AllowConcurrentEvents
    public void tableStarted(TableSyncStartedEvent event) {
        log.info("Scanning table {} in source {} and destination {}",
                event.getTableName(), event.getSourceName(), event.getDestinationName());
    }

    @Subscribe
    @AllowConcurrentEvents
    public void pageCompared(PageComparedEvent event) {
        if (event.isIdentical()) {
            log.info("Page {} for table {} is identical to destination table", event.getPage(), event.getTableName());
        } else {
            log.info("Page {} for table {} differs from destination, {} of {} items missing",
                    event.getPage(), event.getTableName(), event.getItemsToWrite(), event.getSourceItems());
        }
        log.debug("Page {} for table {} source cursor {} destination cursor {}", event.getPage(), event.getTableName(),
                event.getSourceCursorOpt().orElse("<end>"), event.getDestinationCursorOpt().orElse("<end>"));
    }

    @Subscribe
    @AllowConcurrentEvents
    public void tableEmpty(TableEmptyEvent event) {
        log.info("Table {} is empty on page {}", event.getTableName(), event.getPage());
    }

    @Subscribe
    @AllowConcurrentEvents
    public void batchWritten(BatchWrittenEvent event) {
        log.info("Page {} batch {}/{} for table {} copied successfully",
                event.getPage(), event.getBatch(), event.getTotalBatches(), event.getTableName());
    }

    @Subscribe
    @AllowConcurrentEvents
    public void batchFailed(BatchFailedEvent event) {
        log.warn("Page {} batch {}/{} for table {} failed to copy, {} items skipped",
                event.getPage(), event.getBatch(), event.getTotalBatches(), event.getTableName(), event.getItems(),
                event.getCause());
    }

    @Subscribe
    @AllowConcurrentEvents
    public void tableFinished(TableSyncFinishedEvent event) {
        TableSyncResult result = event.getResult();
        switch (result.getStatus()) {
            case SUCCESS:
                log.info("Table {} synchronized, {} pages read, {} items written, {} batches failed",
                        result.getTableName(), result.getPagesRead(), result.getItemsWritten(), result.getFailedBatches());
                break;
            case NOT_FOUND:
                log.warn("Table {} was not found in destination, skipping", result.getTableName());
                break;
            case FAILED:
                log.error("Table {} failed to synchronize", result.getTableName(), result.getErrorOpt().orElse(null));
                break;
        }
    }
}
