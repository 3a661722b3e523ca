package com.wis2.downloader.worker;

import com.wis2.downloader.bootstrap.SubscriptionsBootstrapCompleteEvent;
import com.wis2.downloader.core.model.DownloadJob;
import com.wis2.downloader.queue.JobQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.context.event.EventListener;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed pool of long-lived workers draining the {@link JobQueue}.
 *
 * <h2>Worker loop</h2>
 * <pre>
 * Idle ─▶ dequeue (blocks) ─▶ {@link JobProcessor#process} ─▶ Idle
 * </pre>
 *
 * <h2>Operational behavior</h2>
 * <ul>
 *   <li>Workers are symmetric daemon threads; any worker takes any job, with no per-topic affinity.</li>
 *   <li>Nothing thrown while processing a job ends a worker. It is logged and the worker goes back to the
 *       queue.</li>
 *   <li>Workers only stop when interrupted, which happens on shutdown.</li>
 *   <li>{@link #start()} is idempotent.</li>
 * </ul>
 */
public class DownloadWorkerPool implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(DownloadWorkerPool.class);

    /**
     * Processors left free for the ingestion callback and the control plane.
     */
    static final int RESERVED_PROCESSORS = 2;

    private final JobQueue queue;
    private final JobProcessor processor;
    private final int size;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile ExecutorService executor;

    public DownloadWorkerPool(JobQueue queue, JobProcessor processor, int size) {
        if (size < 1) {
            throw new IllegalArgumentException("size must be >= 1, was " + size);
        }
        this.queue = queue;
        this.processor = processor;
        this.size = size;
    }

    /**
     * Default pool size for a machine: {@code max(processors - 2, 1)}.
     */
    public static int defaultSize(int availableProcessors) {
        return Math.max(availableProcessors - RESERVED_PROCESSORS, 1);
    }

    /**
     * Pool size to use: the configured value when positive, otherwise the default for this machine.
     */
    public static int effectiveSize(int configured, int availableProcessors) {
        return configured > 0 ? configured : defaultSize(availableProcessors);
    }

    public int size() {
        return size;
    }

    /**
     * Workers start once the initial subscriptions are in place.
     */
    @EventListener(SubscriptionsBootstrapCompleteEvent.class)
    public void onBootstrapComplete() {
        start();
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        ExecutorService pool = Executors.newFixedThreadPool(size, new WorkerThreadFactory());
        for (int i = 0; i < size; i++) {
            pool.execute(this::runWorker);
        }
        executor = pool;
        log.info("Started {} download workers", size);
    }

    private void runWorker() {
        while (!Thread.currentThread().isInterrupted()) {
            DownloadJob job;
            try {
                log.debug("Messages in queue: {}", queue.size());
                job = queue.dequeue();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }

            try {
                processor.process(job);
            } catch (RuntimeException e) {
                // Keep the worker alive; the job is dropped.
                log.error("Unexpected failure processing data_id={} topic={}", job.dataId(), job.topic(), e);
            }
        }
        log.debug("Worker {} stopped", Thread.currentThread().getName());
    }

    /**
     * Interrupts all workers. Jobs still queued are lost; the queue is not durable.
     */
    @Override
    public void destroy() throws InterruptedException {
        ExecutorService pool = executor;
        if (pool == null) {
            return;
        }
        pool.shutdownNow();
        if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
            log.warn("Download workers did not stop within 5s (a download may still be in flight)");
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "download-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
