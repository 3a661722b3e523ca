package com.wis2.downloader.worker;

import com.wis2.downloader.core.integrity.IntegrityVerifier;
import com.wis2.downloader.core.integrity.VerificationResult;
import com.wis2.downloader.core.model.DownloadJob;
import com.wis2.downloader.core.model.JobLink;
import com.wis2.downloader.core.model.LinkOutcome;
import com.wis2.downloader.core.path.OutputPathResolver;
import com.wis2.downloader.core.store.ArtifactStore;
import com.wis2.downloader.download.DownloadException;
import com.wis2.downloader.download.Downloader;
import com.wis2.downloader.metrics.DownloadMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Runs one {@link DownloadJob} through the pipeline:
 *
 * <pre>
 * resolve ─▶ for each canonical link:
 *              exists? ─yes─▶ skip
 *                 │no
 *                 ▼
 *              fetch ─▶ verify ─▶ persist
 * </pre>
 *
 * <h2>Error handling policy</h2>
 * <ul>
 *   <li>Failures are isolated per link: a failed link is logged and the next link is processed.</li>
 *   <li>Download failures are abandoned, never retried or requeued.</li>
 *   <li>An integrity mismatch is logged as a warning and the file is still written.</li>
 *   <li>Nothing thrown here is checked; a job that cannot even be resolved returns an empty result.</li>
 * </ul>
 *
 * <p>Holds no per-job state; a single instance is shared by every worker.</p>
 */
public class JobProcessor {

    private static final Logger log = LoggerFactory.getLogger(JobProcessor.class);

    private final OutputPathResolver resolver;
    private final ArtifactStore store;
    private final Downloader downloader;
    private final IntegrityVerifier verifier;
    private final DownloadMetrics metrics;

    public JobProcessor(OutputPathResolver resolver,
                        ArtifactStore store,
                        Downloader downloader,
                        IntegrityVerifier verifier,
                        DownloadMetrics metrics) {
        this.resolver = resolver;
        this.store = store;
        this.downloader = downloader;
        this.verifier = verifier;
        this.metrics = metrics;
    }

    /**
     * @return one outcome per canonical link, in link order
     */
    public List<LinkOutcome> process(DownloadJob job) {
        List<JobLink> canonical = job.canonicalLinks();
        if (canonical.isEmpty()) {
            log.debug("No canonical link in notification data_id={} topic={}", job.dataId(), job.topic());
            return List.of();
        }

        // Resolved once per job: the directory lookup and the date are fixed from here on.
        Path output;
        try {
            output = resolver.resolve(job);
        } catch (IllegalArgumentException e) {
            log.error("Cannot place data_id={} topic={}: {}", job.dataId(), job.topic(), e.getMessage());
            return List.of();
        }

        List<LinkOutcome> outcomes = new ArrayList<>(canonical.size());
        for (JobLink link : canonical) {
            LinkOutcome outcome = processLink(job, link, output);
            metrics.linkOutcome(outcome);
            outcomes.add(outcome);
        }
        return outcomes;
    }

    private LinkOutcome processLink(DownloadJob job, JobLink link, Path output) {
        String href = link.href();
        String filename = fileName(href);
        log.info("Attempting to download {}", filename);

        if (store.exists(output)) {
            log.info("File {} already downloaded. Skipping.", filename);
            return LinkOutcome.SKIPPED_EXISTING;
        }

        long started = System.nanoTime();

        byte[] data;
        try {
            data = downloader.fetch(href);
        } catch (DownloadException e) {
            log.error("Error downloading {}: {}", href, e.getMessage(), e.getCause());
            return LinkOutcome.DOWNLOAD_FAILED;
        }

        VerificationResult verification = verifier.verify(data, job.integrity());
        metrics.verification(verification);
        switch (verification) {
            case MATCH -> log.debug("Hashes match for {}", filename);
            case MISMATCH -> log.warn("Hashes do not match for {} (data_id={}, method={})",
                    filename, job.dataId(), job.integrity().method());
            case SKIPPED -> { }
        }

        try {
            store.write(output, data);
        } catch (IOException e) {
            log.error("Error saving to disk: {} ({})", output, e.toString());
            return LinkOutcome.PERSIST_FAILED;
        }

        double seconds = (System.nanoTime() - started) / 1_000_000_000.0;
        metrics.downloaded(data.length);
        log.info("Downloaded {} of size {}KB in {} seconds",
                filename,
                String.format(Locale.ROOT, "%.2f", data.length / 1024.0),
                String.format(Locale.ROOT, "%.2f", seconds));
        return LinkOutcome.DOWNLOADED;
    }

    /**
     * Last path segment of a URL, or the href itself when it cannot be parsed.
     */
    static String fileName(String href) {
        if (href == null) {
            return "";
        }
        try {
            String path = URI.create(href).getPath();
            if (path == null || path.isEmpty()) {
                return href;
            }
            int slash = path.lastIndexOf('/');
            return slash >= 0 ? path.substring(slash + 1) : path;
        } catch (IllegalArgumentException e) {
            return href;
        }
    }
}
