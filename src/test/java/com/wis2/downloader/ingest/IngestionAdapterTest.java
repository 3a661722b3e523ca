package com.wis2.downloader.ingest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wis2.downloader.core.model.DownloadJob;
import com.wis2.downloader.core.transport.NotificationListener;
import com.wis2.downloader.core.transport.NotificationTransport;
import com.wis2.downloader.metrics.DownloadMetrics;
import com.wis2.downloader.queue.JobQueue;
import com.wis2.downloader.subscription.SubscriptionTable;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IngestionAdapterTest {

    @TempDir
    Path defaultDir;

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final JobQueue queue = new JobQueue();
    private final SubscriptionTable table = new SubscriptionTable();
    private final NotificationTransport transport = mock(NotificationTransport.class);

    private IngestionAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new IngestionAdapter(
                new NotificationParser(new ObjectMapper()),
                queue,
                table,
                transport,
                new DownloadMetrics(registry, queue),
                defaultDir);
    }

    @Test
    void addingTheSameTopicTwiceShouldSubscribeOnce() {
        SubscriptionChange first = adapter.addSubscription("a");
        SubscriptionChange second = adapter.addSubscription("a");

        assertTrue(first.changed());
        assertFalse(second.changed());
        assertEquals(1, table.size());
        assertEquals(defaultDir.toString(), second.subscriptions().get("a"));
        verify(transport, times(1)).subscribe("a");
    }

    @Test
    void addWithDirectoryShouldUseIt(@TempDir Path custom) {
        SubscriptionChange change = adapter.addSubscription("a", custom.toString());

        assertEquals(custom.toAbsolutePath().normalize().toString(), change.subscriptions().get("a"));
    }

    @Test
    void addWithMissingDirectoryShouldBeRejectedBeforeSubscribing() {
        String missing = defaultDir.resolve("does-not-exist").toString();

        assertThrows(IllegalArgumentException.class, () -> adapter.addSubscription("a", missing));
        assertEquals(0, table.size());
        verify(transport, never()).subscribe(anyString());
    }

    @Test
    void failedSubscribeShouldRollBackTheTable() {
        doThrow(new IllegalStateException("broker down")).when(transport).subscribe("a");

        assertThrows(IllegalStateException.class, () -> adapter.addSubscription("a"));
        assertFalse(table.contains("a"));
    }

    @Test
    void deletingAnAbsentTopicShouldStillUnsubscribe() {
        table.add("other", defaultDir);

        SubscriptionChange change = adapter.deleteSubscription("a");

        assertFalse(change.changed());
        assertEquals(1, change.subscriptions().size());
        verify(transport).unsubscribe("a");
    }

    @Test
    void deleteShouldRemoveAndUnsubscribe() {
        adapter.addSubscription("a");

        SubscriptionChange change = adapter.deleteSubscription("a");

        assertTrue(change.changed());
        assertTrue(adapter.listSubscriptions().isEmpty());
        verify(transport).unsubscribe("a");
    }

    @Test
    void blankTopicShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> adapter.addSubscription(" "));
        assertThrows(IllegalArgumentException.class, () -> adapter.deleteSubscription(null));
    }

    @Test
    void validMessageShouldBeQueued() throws Exception {
        adapter.onMessage("a", bytes("{\"properties\": {\"data_id\": \"urn:x:1\"}, "
                + "\"links\": [{\"rel\": \"canonical\", \"href\": \"http://h/f.bin\"}]}"));

        assertEquals(1, queue.size());
        DownloadJob job = queue.dequeue();
        assertEquals("a", job.topic());
        assertEquals("urn:x:1", job.dataId());
        assertEquals(1.0, registry.get("wis2.notifications").tag("result", "accepted").counter().count());
    }

    @Test
    void malformedMessageShouldBeDroppedWithoutThrowing() {
        assertDoesNotThrow(() -> adapter.onMessage("a", bytes("{broken")));
        adapter.onMessage("a", bytes("{\"properties\": {\"data_id\": \"ok\"}}"));

        assertEquals(1, queue.size());
        assertEquals(1.0, registry.get("wis2.notifications").tag("result", "malformed").counter().count());
    }

    @Test
    void deleteOfAnUnrepresentableAbsentTopicShouldNotFail() {
        doThrow(new IllegalArgumentException("Illegal character")).when(transport).unsubscribe("a/b.c");

        SubscriptionChange change = adapter.deleteSubscription("a/b.c");

        assertFalse(change.changed());
        assertTrue(change.subscriptions().isEmpty());
    }

    @Test
    void unexpectedFailureShouldBeCountedApartFromMalformedInput() {
        NotificationParser failing = mock(NotificationParser.class);
        when(failing.parse(anyString(), any())).thenThrow(new IllegalStateException("bug"));
        IngestionAdapter broken = new IngestionAdapter(
                failing, queue, table, transport, new DownloadMetrics(registry, queue), defaultDir);

        assertDoesNotThrow(() -> broken.onMessage("a", bytes("{}")));

        assertEquals(1.0, registry.get("wis2.notifications").tag("result", "error").counter().count());
        assertEquals(0.0, registry.get("wis2.notifications").tag("result", "malformed").counter().count());
        assertEquals(0, queue.size());
    }

    @Test
    void concurrentDeleteAndAddShouldLeaveTableAndTransportInStep() throws Exception {
        RecordingTransport recording = new RecordingTransport();
        SubscriptionTable sharedTable = new SubscriptionTable();
        IngestionAdapter control = new IngestionAdapter(
                new NotificationParser(new ObjectMapper()),
                queue,
                sharedTable,
                recording,
                new DownloadMetrics(new SimpleMeterRegistry(), queue),
                defaultDir);
        control.addSubscription("a");

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<SubscriptionChange> delete = pool.submit(() -> control.deleteSubscription("a"));
            assertTrue(recording.unsubscribeEntered.await(5, TimeUnit.SECONDS));

            Future<SubscriptionChange> add = pool.submit(() -> {
                try {
                    return control.addSubscription("a");
                } finally {
                    recording.addFinished.countDown();
                }
            });

            delete.get(10, TimeUnit.SECONDS);
            add.get(10, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        control.addSubscription("a");

        assertEquals(sharedTable.snapshot().keySet(), recording.subscribed);
        assertEquals(Set.of("a"), recording.subscribed);
    }

    /**
     * Transport whose unsubscribe waits (bounded) for a concurrent add to finish, widening the window between the
     * table update and the transport call of a delete.
     */
    private static final class RecordingTransport implements NotificationTransport {

        final Set<String> subscribed = ConcurrentHashMap.newKeySet();
        final CountDownLatch unsubscribeEntered = new CountDownLatch(1);
        final CountDownLatch addFinished = new CountDownLatch(1);

        @Override
        public void open(NotificationListener listener) {
        }

        @Override
        public void subscribe(String topic) {
            subscribed.add(topic);
        }

        @Override
        public void unsubscribe(String topic) {
            unsubscribeEntered.countDown();
            try {
                addFinished.await(500, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            subscribed.remove(topic);
        }
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
