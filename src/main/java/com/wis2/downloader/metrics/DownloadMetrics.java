package com.wis2.downloader.metrics;

import com.wis2.downloader.core.integrity.VerificationResult;
import com.wis2.downloader.core.model.LinkOutcome;
import com.wis2.downloader.queue.JobQueue;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.EnumMap;
import java.util.Map;

/**
 * Micrometer instrumentation for the download pipeline.
 *
 * <h3>Metric Catalogue</h3>
 * <table>
 *   <tr><th>Metric</th><th>Type</th><th>Tags</th></tr>
 *   <tr><td>wis2.notifications</td><td>Counter</td><td>result = accepted | malformed | error</td></tr>
 *   <tr><td>wis2.downloads</td><td>Counter</td><td>outcome = downloaded | skipped_existing | download_failed | persist_failed</td></tr>
 *   <tr><td>wis2.integrity</td><td>Counter</td><td>result = match | mismatch | skipped</td></tr>
 *   <tr><td>wis2.download.bytes</td><td>DistributionSummary</td><td>-</td></tr>
 *   <tr><td>wis2.queue.size</td><td>Gauge</td><td>-</td></tr>
 * </table>
 *
 * <p>Counters are registered up front so that every series exists (at zero) from startup.</p>
 */
public class DownloadMetrics {

    private final Counter notificationsAccepted;
    private final Counter notificationsMalformed;
    private final Counter notificationsFailed;
    private final Map<LinkOutcome, Counter> outcomes = new EnumMap<>(LinkOutcome.class);
    private final Map<VerificationResult, Counter> verifications = new EnumMap<>(VerificationResult.class);
    private final DistributionSummary downloadedBytes;

    public DownloadMetrics(MeterRegistry registry, JobQueue queue) {
        this.notificationsAccepted = Counter.builder("wis2.notifications")
                .description("Notifications received from the broker")
                .tag("result", "accepted")
                .register(registry);
        this.notificationsMalformed = Counter.builder("wis2.notifications")
                .description("Notifications received from the broker")
                .tag("result", "malformed")
                .register(registry);
        this.notificationsFailed = Counter.builder("wis2.notifications")
                .description("Notifications received from the broker")
                .tag("result", "error")
                .register(registry);

        for (LinkOutcome outcome : LinkOutcome.values()) {
            outcomes.put(outcome, Counter.builder("wis2.downloads")
                    .description("Canonical links processed, by outcome")
                    .tag("outcome", outcome.tag())
                    .register(registry));
        }
        for (VerificationResult result : VerificationResult.values()) {
            verifications.put(result, Counter.builder("wis2.integrity")
                    .description("Integrity checks of downloaded files, by result")
                    .tag("result", result.tag())
                    .register(registry));
        }

        this.downloadedBytes = DistributionSummary.builder("wis2.download.bytes")
                .description("Size of downloaded files")
                .baseUnit("bytes")
                .register(registry);

        Gauge.builder("wis2.queue.size", queue, JobQueue::size)
                .description("Jobs waiting for a worker")
                .register(registry);
    }

    public void notificationAccepted() {
        notificationsAccepted.increment();
    }

    public void notificationMalformed() {
        notificationsMalformed.increment();
    }

    /**
     * A notification was dropped by an unexpected failure, not by bad input.
     */
    public void notificationFailed() {
        notificationsFailed.increment();
    }

    public void linkOutcome(LinkOutcome outcome) {
        outcomes.get(outcome).increment();
    }

    public void verification(VerificationResult result) {
        verifications.get(result).increment();
    }

    public void downloaded(int bytes) {
        downloadedBytes.record(bytes);
    }
}
