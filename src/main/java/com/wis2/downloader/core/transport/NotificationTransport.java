package com.wis2.downloader.core.transport;

/**
 * =====================================================================
 * NotificationTransport
 * =====================================================================
 *
 * PURPOSE
 * -------
 * The pub/sub boundary of the pipeline. The core only needs three things
 * from the broker connection:
 *
 *   open(listener)     : where received notifications are pushed
 *   subscribe(topic)   : start receiving a topic
 *   unsubscribe(topic) : stop receiving a topic
 *
 * Connection handling, TLS and credentials live entirely behind this
 * interface.
 *
 * TOPICS
 * ------
 * Topics are WIS2 (MQTT-style) topics, '/'-separated with '+' and '#'
 * wildcards. Implementations translate to and from their own naming and
 * always hand concrete topics back to the listener.
 *
 * DELIVERY
 * --------
 * The listener may be called from any thread, possibly concurrently.
 * subscribe / unsubscribe are fire-and-forget: no acknowledgment is
 * awaited.
 */
public interface NotificationTransport {

    /**
     * Registers the listener that receives every notification. Must be called before {@link #subscribe}.
     */
    void open(NotificationListener listener);

    void subscribe(String topic);

    void unsubscribe(String topic);
}
