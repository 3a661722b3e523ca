package com.wis2.downloader.core.transport;

/**
 * Callback for raw notifications delivered by a {@link NotificationTransport}.
 *
 * <p>Implementations must be thread-safe and must not throw: one bad message cannot be allowed to stop delivery of
 * the next.</p>
 */
@FunctionalInterface
public interface NotificationListener {

    /**
     * @param topic   concrete topic the message was published on
     * @param payload message body, as received
     */
    void onMessage(String topic, byte[] payload);
}
