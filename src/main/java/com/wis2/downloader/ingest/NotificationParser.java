package com.wis2.downloader.ingest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wis2.downloader.core.model.DownloadJob;
import com.wis2.downloader.core.model.Integrity;
import com.wis2.downloader.core.model.JobLink;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Translates a raw notification body into a {@link DownloadJob}.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>The body must be a JSON object with {@code properties.data_id} as a non-blank string.</li>
 *   <li>{@code properties.integrity} is optional. It is kept only when both {@code method} and {@code value} are
 *       present; whether the method is supported is decided later, at verification.</li>
 *   <li>{@code links} may be missing or empty (the job is then a no-op). Entries without {@code rel} are kept as
 *       non-canonical; entries without {@code href} are dropped.</li>
 * </ul>
 */
public class NotificationParser {

    private final ObjectMapper mapper;

    public NotificationParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @throws MalformedNotificationException if the body is not a usable notification
     */
    public DownloadJob parse(String topic, byte[] payload) {
        if (payload == null || payload.length == 0) {
            throw new MalformedNotificationException("Empty payload");
        }

        NotificationPayload n;
        try {
            n = mapper.readValue(payload, NotificationPayload.class);
        } catch (IOException e) {
            throw new MalformedNotificationException("Invalid notification JSON: " + e.getMessage(), e);
        }

        if (n == null || n.properties() == null) {
            throw new MalformedNotificationException("Missing 'properties'");
        }
        String dataId = n.properties().dataId();
        if (dataId == null || dataId.isBlank()) {
            throw new MalformedNotificationException("Missing 'properties.data_id'");
        }

        List<JobLink> links = new ArrayList<>();
        if (n.links() != null) {
            for (NotificationPayload.Link l : n.links()) {
                if (l != null && l.href() != null) {
                    links.add(new JobLink(l.rel(), l.href()));
                }
            }
        }

        Integrity integrity = null;
        NotificationPayload.IntegrityBlock block = n.properties().integrity();
        if (block != null && block.method() != null && block.value() != null) {
            integrity = new Integrity(block.method(), block.value());
        }

        return new DownloadJob(topic, dataId, links, integrity);
    }
}
