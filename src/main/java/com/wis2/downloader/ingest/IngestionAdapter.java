package com.wis2.downloader.ingest;

import com.wis2.downloader.core.model.DownloadJob;
import com.wis2.downloader.core.transport.NotificationListener;
import com.wis2.downloader.core.transport.NotificationTransport;
import com.wis2.downloader.metrics.DownloadMetrics;
import com.wis2.downloader.queue.JobQueue;
import com.wis2.downloader.subscription.SubscriptionTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * =====================================================================
 * IngestionAdapter
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Sits between the broker transport and the worker pool:
 *
 *   transport ──onMessage──▶ parse ──▶ JobQueue ──▶ workers
 *
 * and owns the subscription control operations, which keep the
 * SubscriptionTable and the transport subscriptions in step.
 *
 * RECEIVE PATH
 * ------------
 * onMessage never throws. A payload that cannot be parsed is logged,
 * counted and dropped; the next message is handled normally. Enqueueing
 * never blocks, so the transport's delivery thread is never held up by
 * slow downloads.
 *
 * CONTROL PATH
 * ------------
 * add and delete are serialized on this adapter, so the table update and
 * the matching transport call of one operation are never interleaved
 * with those of another. Workers read the table without this lock.
 *
 *  add    : table insert first; transport subscribe only on an actual
 *           insertion. If the subscribe fails the insertion is rolled
 *           back and the failure propagates to the caller.
 *  delete : table erase, then transport unsubscribe, always. A topic that
 *           was not in the table is logged, not reported as an error, even
 *           when the transport cannot express it.
 *  list   : point-in-time snapshot of the table.
 */
public class IngestionAdapter implements NotificationListener {

    private static final Logger log = LoggerFactory.getLogger(IngestionAdapter.class);

    private final NotificationParser parser;
    private final JobQueue queue;
    private final SubscriptionTable table;
    private final NotificationTransport transport;
    private final DownloadMetrics metrics;
    private final Path defaultDirectory;

    public IngestionAdapter(
            NotificationParser parser,
            JobQueue queue,
            SubscriptionTable table,
            NotificationTransport transport,
            DownloadMetrics metrics,
            Path defaultDirectory
    ) {
        this.parser = parser;
        this.queue = queue;
        this.table = table;
        this.transport = transport;
        this.metrics = metrics;
        this.defaultDirectory = defaultDirectory;
    }

    @Override
    public void onMessage(String topic, byte[] payload) {
        log.info("Message received under topic {}", topic);
        try {
            DownloadJob job = parser.parse(topic, payload);
            queue.enqueue(job);
            metrics.notificationAccepted();
            log.debug("Queued job for data_id={} ({} canonical link(s))", job.dataId(), job.canonicalLinks().size());
        } catch (MalformedNotificationException e) {
            metrics.notificationMalformed();
            log.warn("Dropping malformed notification on topic {}: {}", topic, e.getMessage());
        } catch (RuntimeException e) {
            metrics.notificationFailed();
            log.error("Unexpected error handling notification on topic {}", topic, e);
        }
    }

    public SubscriptionChange addSubscription(String topic) {
        return addSubscription(topic, null);
    }

    /**
     * Subscribes to {@code topic}, writing its files below {@code directory}, or below the default download directory
     * when {@code directory} is null or blank.
     *
     * @throws IllegalArgumentException if the topic is blank or the directory is not an existing writable directory
     */
    public synchronized SubscriptionChange addSubscription(String topic, String directory) {
        String t = requireTopic(topic);
        Path dir = resolveDirectory(directory);

        if (!table.add(t, dir)) {
            log.info("Topic {} already subscribed", t);
            return new SubscriptionChange(t, false, table.snapshot());
        }

        try {
            transport.subscribe(t);
        } catch (RuntimeException e) {
            table.remove(t, dir);
            throw e;
        }

        log.info("Subscribed to {} (directory={})", t, dir);
        return new SubscriptionChange(t, true, table.snapshot());
    }

    public synchronized SubscriptionChange deleteSubscription(String topic) {
        String t = requireTopic(topic);

        boolean removed = table.remove(t);
        try {
            transport.unsubscribe(t);
        } catch (IllegalArgumentException e) {
            if (removed) {
                throw e;
            }
            // Not representable by the transport, so it was never subscribed.
            log.debug("Unsubscribe of {} not attempted by transport: {}", t, e.getMessage());
        }

        if (removed) {
            log.info("Unsubscribed from {}", t);
        } else {
            log.info("Topic {} not found", t);
        }
        return new SubscriptionChange(t, removed, table.snapshot());
    }

    public Map<String, String> listSubscriptions() {
        return table.snapshot();
    }

    private static String requireTopic(String topic) {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("No topic passed");
        }
        return topic.trim();
    }

    private Path resolveDirectory(String directory) {
        if (directory == null || directory.isBlank()) {
            return defaultDirectory;
        }
        Path dir = Path.of(directory.trim()).toAbsolutePath().normalize();
        if (!Files.isDirectory(dir)) {
            throw new IllegalArgumentException("Directory does not exist: " + dir);
        }
        if (!Files.isWritable(dir)) {
            throw new IllegalArgumentException("Directory is not writable: " + dir);
        }
        return dir;
    }
}
