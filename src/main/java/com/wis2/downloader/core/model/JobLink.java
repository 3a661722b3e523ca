package com.wis2.downloader.core.model;

/**
 * A link advertised by a notification.
 *
 * <p>{@code href} is kept as published. It is only turned into a URI when the
 * link is actually fetched, so a malformed href on a link that is never
 * downloaded cannot spoil the rest of the notification.</p>
 *
 * @param relation the {@code rel} value, e.g. {@code canonical}
 * @param href     the target URL as text
 */
public record JobLink(String relation, String href) {

    public boolean isCanonical() {
        return DownloadJob.CANONICAL.equals(relation);
    }
}
