package com.wis2.downloader.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wis2.downloader.core.integrity.IntegrityVerifier;
import com.wis2.downloader.core.path.OutputPathResolver;
import com.wis2.downloader.core.store.ArtifactStore;
import com.wis2.downloader.core.transport.NotificationTransport;
import com.wis2.downloader.download.Downloader;
import com.wis2.downloader.download.HttpDownloader;
import com.wis2.downloader.ingest.IngestionAdapter;
import com.wis2.downloader.ingest.NotificationParser;
import com.wis2.downloader.metrics.DownloadMetrics;
import com.wis2.downloader.queue.JobQueue;
import com.wis2.downloader.subscription.SubscriptionTable;
import com.wis2.downloader.worker.DownloadWorkerPool;
import com.wis2.downloader.worker.JobProcessor;
import com.wis2.downloader.worker.QueueSizeReporter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the download pipeline.
 *
 * <h2>Shared state</h2>
 * <ul>
 *   <li>{@link SubscriptionTable} and {@link JobQueue} are singletons, constructed once here and injected into every
 *       component that touches them. Nothing else holds mutable state across jobs.</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link DownloadWorkerPool} starts on the subscriptions bootstrap event and stops on context close.</li>
 *   <li>{@link QueueSizeReporter} starts when the application is ready.</li>
 * </ul>
 */
@Configuration
@EnableConfigurationProperties(DownloaderProperties.class)
public class PipelineConfig {

    @Bean
    public SubscriptionTable subscriptionTable() {
        return new SubscriptionTable();
    }

    @Bean
    public JobQueue jobQueue() {
        return new JobQueue();
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public OutputPathResolver outputPathResolver(SubscriptionTable table, DownloaderProperties props, Clock clock) {
        return new OutputPathResolver(table, defaultDirectory(props), clock);
    }

    @Bean
    public ArtifactStore artifactStore() {
        return new ArtifactStore();
    }

    @Bean
    public Downloader downloader(DownloaderProperties props) {
        DownloaderProperties.Download d = props.getDownload();
        return new HttpDownloader(HttpDownloader.newClient(d.getConnectTimeout()), d.getRequestTimeout());
    }

    @Bean
    public IntegrityVerifier integrityVerifier() {
        return new IntegrityVerifier();
    }

    @Bean
    public DownloadMetrics downloadMetrics(MeterRegistry registry, JobQueue queue) {
        return new DownloadMetrics(registry, queue);
    }

    @Bean
    public JobProcessor jobProcessor(
            OutputPathResolver resolver,
            ArtifactStore store,
            Downloader downloader,
            IntegrityVerifier verifier,
            DownloadMetrics metrics
    ) {
        return new JobProcessor(resolver, store, downloader, verifier, metrics);
    }

    @Bean
    public DownloadWorkerPool downloadWorkerPool(JobQueue queue, JobProcessor processor, DownloaderProperties props) {
        int size = DownloadWorkerPool.effectiveSize(props.getWorkers(), Runtime.getRuntime().availableProcessors());
        return new DownloadWorkerPool(queue, processor, size);
    }

    @Bean
    public QueueSizeReporter queueSizeReporter(JobQueue queue, DownloaderProperties props) {
        return new QueueSizeReporter(queue, props.getQueueReportInterval());
    }

    @Bean
    public NotificationParser notificationParser(ObjectMapper mapper) {
        return new NotificationParser(mapper);
    }

    @Bean
    public IngestionAdapter ingestionAdapter(
            NotificationParser parser,
            JobQueue queue,
            SubscriptionTable table,
            NotificationTransport transport,
            DownloadMetrics metrics,
            DownloaderProperties props
    ) {
        return new IngestionAdapter(parser, queue, table, transport, metrics, defaultDirectory(props));
    }

    static Path defaultDirectory(DownloaderProperties props) {
        return Path.of(props.getDownloadDirectory()).toAbsolutePath().normalize();
    }
}
