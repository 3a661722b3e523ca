package com.wis2.downloader.ingest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Wire shape of a WIS2 notification, reduced to the fields the pipeline reads.
 *
 * <pre>
 * {
 *   "properties": {
 *     "data_id": "...",
 *     "integrity": { "method": "sha512", "value": "&lt;base64&gt;" }
 *   },
 *   "links": [ { "rel": "canonical", "href": "https://..." } ]
 * }
 * </pre>
 *
 * Every other member of the notification (geometry, pubtime, etc.) is ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NotificationPayload(Properties properties, List<Link> links) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Properties(@JsonProperty("data_id") String dataId, IntegrityBlock integrity) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record IntegrityBlock(String method, String value) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Link(String rel, String href) {
    }
}
