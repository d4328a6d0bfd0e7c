// SPDX-FileCopyrightText: 2019-2022 Matus Faro <matus@smotana.com>
// SPDX-License-Identifier: Apache-2.0
package io.dataspray.dynamomigrator;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.eventbus.EventBus;
import io.dataspray.dynamomigrator.InMemoryStoreClient.BatchWriteCall;
import io.dataspray.dynamomigrator.event.BatchFailedEvent;
import io.dataspray.dynamomigrator.event.BatchWrittenEvent;
import io.dataspray.dynamomigrator.event.TableEmptyEvent;
import org.junit.Before;
import org.junit.Test;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static io.dataspray.dynamomigrator.InMemoryStoreClient.item;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class BatchWriterTest {
    private static final String TABLE = "table";

    private InMemoryStoreClient destination;
    private RecordingListener listener;
    private EventBus eventBus;
    private List<Duration> sleeps;

    @Before
    public void setup() {
        destination = new InMemoryStoreClient("destination", 100).createTable(TABLE);
        listener = new RecordingListener();
        eventBus = new EventBus();
        eventBus.register(listener);
        sleeps = Lists.newArrayList();
    }

    @Test(timeout = 10_000L)
    public void testThirtyItemsWrittenInTwoBatches() throws Exception {
        List<Map<String, AttributeValue>> items = items(30);

        WriteSummary summary = writer(3).writeItems(TABLE, items, 1);

        assertEquals(new WriteSummary(30, 0), summary);
        assertEquals(ImmutableList.of(25, 5), batchSizes());
        assertEquals(items, destination.items(TABLE));
        ImmutableList<BatchWrittenEvent> written = listener.eventsOf(BatchWrittenEvent.class);
        assertEquals(ImmutableList.of(
                new BatchWrittenEvent(TABLE, 1, 1, 2, 25, 0),
                new BatchWrittenEvent(TABLE, 1, 2, 2, 5, 0)), written);
    }

    @Test(timeout = 10_000L)
    public void testBatchesNeverExceedConfiguredSize() throws Exception {
        BatchWriter writer = new BatchWriter(destination, MigrationConfig.builder()
                .batchSize(10)
                .backoff(backoff(3))
                .build(), eventBus);

        writer.writeItems(TABLE, items(101), 4);

        assertEquals(11, destination.batchWriteCalls().size());
        assertTrue(batchSizes().stream().allMatch(size -> size <= 10));
        assertEquals(101, destination.items(TABLE).size());
    }

    @Test(timeout = 10_000L)
    public void testEmptyItemsWriteNothing() throws Exception {
        WriteSummary summary = writer(3).writeItems(TABLE, ImmutableList.of(), 2);

        assertEquals(WriteSummary.EMPTY, summary);
        assertEquals(ImmutableList.of(), destination.batchWriteCalls());
        assertEquals(ImmutableList.of(new TableEmptyEvent(TABLE, 2)), listener.eventsOf(TableEmptyEvent.class));
    }

    @Test(timeout = 10_000L)
    public void testUnprocessedItemsResubmittedUntilWritten() throws Exception {
        List<Map<String, AttributeValue>> items = items(25);
        destination.leaveUnprocessed(ImmutableList.of("item-03", "item-07"), 3);

        int retries = writer(10).writeBatch(TABLE, items);

        assertEquals(3, retries);
        ImmutableList<BatchWriteCall> calls = destination.batchWriteCalls();
        assertEquals(4, calls.size());
        assertEquals(items, calls.get(0).getItems());
        for (BatchWriteCall call : calls.subList(1, calls.size())) {
            assertEquals(ImmutableList.of(items.get(3), items.get(7)), call.getItems());
        }
        assertEquals(3, sleeps.size());
        assertEquals(items, destination.items(TABLE));
    }

    @Test(timeout = 10_000L)
    public void testRetryLimitSkipsBatch() throws Exception {
        destination.leaveUnprocessed(ImmutableList.of("item-01"), 5);

        WriteSummary summary = writer(2).writeItems(TABLE, items(30), 1);

        // Only the unprocessed item of the first batch is skipped
        assertEquals(new WriteSummary(29, 1), summary);
        // One initial write and two retries for the first batch, then the second batch
        assertEquals(4, destination.batchWriteCalls().size());
        ImmutableList<BatchFailedEvent> failed = listener.eventsOf(BatchFailedEvent.class);
        assertEquals(1, failed.size());
        assertEquals(1, failed.get(0).getBatch());
        assertEquals(1, failed.get(0).getItems());
        assertTrue(failed.get(0).getCause() instanceof UnprocessedItemsException);
        UnprocessedItemsException cause = (UnprocessedItemsException) failed.get(0).getCause();
        assertEquals(1, cause.getRemainingItems());
        assertEquals(2, cause.getRetries());
        assertEquals(29, destination.items(TABLE).size());
    }

    @Test(timeout = 10_000L)
    public void testFailedWriteSkipsBatchWithoutRetry() throws Exception {
        destination.failNextWrites(1);

        WriteSummary summary = writer(3).writeItems(TABLE, items(30), 1);

        assertEquals(new WriteSummary(5, 1), summary);
        assertEquals(2, destination.batchWriteCalls().size());
        assertEquals(5, destination.items(TABLE).size());
        ImmutableList<BatchFailedEvent> failed = listener.eventsOf(BatchFailedEvent.class);
        assertEquals(1, failed.size());
        assertEquals(25, failed.get(0).getItems());
        assertTrue(failed.get(0).getCause() instanceof SdkClientException);
        assertEquals(ImmutableList.of(new BatchWrittenEvent(TABLE, 1, 2, 2, 5, 0)),
                listener.eventsOf(BatchWrittenEvent.class));
    }

    private BatchWriter writer(int maxRetries) {
        return new BatchWriter(destination, MigrationConfig.builder()
                .backoff(backoff(maxRetries))
                .build(), eventBus);
    }

    private ExponentialBackoff backoff(int maxRetries) {
        return ExponentialBackoff.builder()
                .baseDelay(Duration.ofMillis(10))
                .maxRetries(maxRetries)
                .sleeper(sleeps::add)
                .build();
    }

    private ImmutableList<Integer> batchSizes() {
        return destination.batchWriteCalls().stream()
                .map(call -> call.getItems().size())
                .collect(ImmutableList.toImmutableList());
    }

    static ImmutableList<Map<String, AttributeValue>> items(int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> item(String.format("item-%02d", i)))
                .collect(ImmutableList.toImmutableList());
    }
}
