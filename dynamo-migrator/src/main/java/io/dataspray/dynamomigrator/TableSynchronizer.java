// SPDX-FileCopyrightText: 2019-2022 Matus Faro <matus@smotana.com>
// SPDX-License-Identifier: Apache-2.0
package io.dataspray.dynamomigrator;

import com.google.common.collect.ImmutableList;
import com.google.common.eventbus.EventBus;
import io.dataspray.dynamomigrator.event.PageComparedEvent;
import io.dataspray.dynamomigrator.event.TableSyncFinishedEvent;
import io.dataspray.dynamomigrator.event.TableSyncStartedEvent;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;

import java.util.Map;
import java.util.Optional;

/**
 * Copies the items of one table that are missing at the destination.
 * <p>
 * Both tables are paged in lockstep while their cursors agree, copying only the items of each source page that
 * the matching destination page lacks. This skips prefixes an earlier run already copied, but it only holds while
 * both stores split the table into identical pages. As soon as the cursors diverge every remaining source page is
 * copied unconditionally.
 */
@Slf4j
public class TableSynchronizer {
    private final StoreClient source;
    private final StoreClient destination;
    private final PageComparator comparator;
    private final BatchWriter writer;
    private final EventBus eventBus;

    public TableSynchronizer(StoreClient source, StoreClient destination, PageComparator comparator, BatchWriter writer, EventBus eventBus) {
        this.source = source;
        this.destination = destination;
        this.comparator = comparator;
        this.writer = writer;
        this.eventBus = eventBus;
    }

    /**
     * A missing destination table ends the table as {@link TableSyncResult.Status#NOT_FOUND}. Any other store error
     * ends it as {@link TableSyncResult.Status#FAILED}, keeping the pages read and items written until then.
     */
    public TableSyncResult synchronizeTable(String tableName) {
        eventBus.post(new TableSyncStartedEvent(tableName, source.name(), destination.name()));

        int page = 0;
        WriteSummary summary = WriteSummary.EMPTY;
        try {
            ScanPage sourcePage = source.scan(tableName, Optional.empty());
            page++;
            ScanPage destPage;
            try {
                destPage = destination.scan(tableName, Optional.empty());
            } catch (ResourceNotFoundException ex) {
                log.debug("Table {} missing in {}", tableName, destination.name(), ex);
                return finish(TableSyncResult.notFound(tableName));
            }
            summary = copyMissing(tableName, page, sourcePage, destPage);

            // Lockstep
            while (sourcePage.getCursorOpt().isPresent()
                    && sourcePage.getCursorOpt().equals(destPage.getCursorOpt())) {
                sourcePage = source.scan(tableName, sourcePage.getCursorOpt());
                page++;
                destPage = destination.scan(tableName, destPage.getCursorOpt());
                summary = summary.plus(copyMissing(tableName, page, sourcePage, destPage));
            }

            // Tail copy
            while (sourcePage.getCursorOpt().isPresent()) {
                sourcePage = source.scan(tableName, sourcePage.getCursorOpt());
                page++;
                summary = summary.plus(writer.writeItems(tableName, sourcePage.getItems(), page));
            }
        } catch (RuntimeException ex) {
            return finish(TableSyncResult.failed(tableName, page, summary, ex));
        }

        return finish(TableSyncResult.success(tableName, page, summary));
    }

    private WriteSummary copyMissing(String tableName, int page, ScanPage sourcePage, ScanPage destPage) {
        boolean identical = comparator.identical(sourcePage.getItems(), destPage.getItems());
        ImmutableList<Map<String, AttributeValue>> itemsToWrite = identical
                ? ImmutableList.of()
                : comparator.diff(sourcePage.getItems(), destPage.getItems());
        eventBus.post(new PageComparedEvent(
                tableName,
                page,
                identical,
                sourcePage.getItems().size(),
                destPage.getItems().size(),
                itemsToWrite.size(),
                Cursors.serialize(sourcePage.getCursorOpt()),
                Cursors.serialize(destPage.getCursorOpt())));
        return itemsToWrite.isEmpty()
                ? WriteSummary.EMPTY
                : writer.writeItems(tableName, itemsToWrite, page);
    }

    private TableSyncResult finish(TableSyncResult result) {
        eventBus.post(new TableSyncFinishedEvent(result));
        return result;
    }
}
