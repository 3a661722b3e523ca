package com.wis2.downloader.queue;

import com.wis2.downloader.core.model.DownloadJob;

import java.util.Objects;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Unbounded FIFO of {@link DownloadJob}s between the ingestion path and the worker pool.
 *
 * <ul>
 *   <li>{@link #enqueue} never blocks and never drops.</li>
 *   <li>{@link #dequeue} blocks the calling worker until a job is available; each job is handed to exactly one
 *       caller.</li>
 *   <li>No priority and no de-duplication: the same job enqueued twice is processed twice.</li>
 * </ul>
 *
 * <p>There is no capacity limit. If notifications durably outpace downloads the backlog grows in memory;
 * {@link #size()} is reported periodically so that growth is visible.</p>
 */
public class JobQueue {

    private final LinkedBlockingQueue<DownloadJob> jobs = new LinkedBlockingQueue<>();

    public void enqueue(DownloadJob job) {
        jobs.add(Objects.requireNonNull(job, "job"));
    }

    /**
     * Waits for the next job.
     *
     * @throws InterruptedException when the worker is being shut down
     */
    public DownloadJob dequeue() throws InterruptedException {
        return jobs.take();
    }

    /**
     * Approximate number of waiting jobs. Takes no lock beyond the queue's own.
     */
    public int size() {
        return jobs.size();
    }
}
