package com.wis2.downloader.worker;

import com.wis2.downloader.queue.JobQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Logs the size of the job queue at a fixed interval.
 *
 * Read-only with respect to the queue: it only calls {@link JobQueue#size()}.
 */
public class QueueSizeReporter implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(QueueSizeReporter.class);

    private final JobQueue queue;
    private final Duration interval;

    private final AtomicReference<Disposable> running = new AtomicReference<>();

    public QueueSizeReporter(JobQueue queue, Duration interval) {
        this.queue = queue;
        this.interval = interval;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onAppReady() {
        start();
    }

    public void start() {
        if (running.get() != null) {
            return;
        }
        Disposable d = Flux.interval(Duration.ZERO, interval)
                .subscribe(
                        tick -> log.info("Current queue size: {}", queue.size()),
                        err -> log.error("Queue size reporter terminated: {}", err.toString(), err)
                );
        if (!running.compareAndSet(null, d)) {
            d.dispose();
        }
    }

    public boolean isRunning() {
        Disposable d = running.get();
        return d != null && !d.isDisposed();
    }

    @Override
    public void destroy() {
        Disposable d = running.getAndSet(null);
        if (d != null && !d.isDisposed()) {
            d.dispose();
        }
    }
}
