package com.wis2.downloader.bootstrap;

import com.wis2.downloader.config.DownloaderProperties;
import com.wis2.downloader.core.transport.NotificationTransport;
import com.wis2.downloader.ingest.IngestionAdapter;
import com.wis2.downloader.ingest.SubscriptionChange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * =====================================================================
 * SubscriptionBootstrapper
 * =====================================================================
 *
 * Runs once, after the Spring context is refreshed:
 *
 *   1. validate the download directory       (fatal on failure)
 *   2. open the transport with the IngestionAdapter as listener
 *   3. subscribe every topic in wis2.topics through addSubscription,
 *      seeding the SubscriptionTable with the default directory
 *   4. publish SubscriptionsBootstrapCompleteEvent
 *
 * Any exception thrown here fails application startup. A pipeline that
 * cannot write its files must not start consuming notifications.
 */
@Component
public class SubscriptionBootstrapper implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionBootstrapper.class);

    private final DownloaderProperties props;

    private final NotificationTransport transport;

    private final IngestionAdapter adapter;

    private final ApplicationEventPublisher publisher;

    public SubscriptionBootstrapper(
            DownloaderProperties props,
            NotificationTransport transport,
            IngestionAdapter adapter,
            ApplicationEventPublisher publisher
    ) {
        this.props = props;
        this.transport = transport;
        this.adapter = adapter;
        this.publisher = publisher;
    }

    @Override
    public void run(ApplicationArguments args) {
        Path dir = validateDownloadDirectory(props.getDownloadDirectory());
        log.info("Download directory: {}", dir);

        transport.open(adapter);

        List<String> topics = props.getTopics() == null ? List.of() : props.getTopics();
        int subscribed = 0;
        for (String topic : topics) {
            if (topic == null || topic.isBlank()) {
                log.warn("Ignoring blank topic in configuration");
                continue;
            }
            SubscriptionChange change = adapter.addSubscription(topic);
            if (change.changed()) {
                subscribed++;
            }
        }

        publisher.publishEvent(new SubscriptionsBootstrapCompleteEvent(subscribed));

        log.info("Subscription bootstrap complete ({} topic(s) subscribed)", subscribed);
    }

    static Path validateDownloadDirectory(String configured) {
        if (configured == null || configured.isBlank()) {
            throw new IllegalStateException("wis2.download-directory is required");
        }
        Path dir = Path.of(configured).toAbsolutePath().normalize();
        if (!Files.isDirectory(dir)) {
            throw new IllegalStateException("Download directory does not exist or is not a directory: " + dir);
        }
        if (!Files.isWritable(dir)) {
            throw new IllegalStateException("Download directory is not writable: " + dir);
        }
        return dir;
    }
}
