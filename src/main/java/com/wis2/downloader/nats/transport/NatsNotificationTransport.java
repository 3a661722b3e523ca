package com.wis2.downloader.nats.transport;

import com.wis2.downloader.core.transport.NotificationListener;
import com.wis2.downloader.core.transport.NotificationTransport;
import com.wis2.downloader.nats.naming.NatsSubjects;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * {@link NotificationTransport} over core NATS subscriptions.
 *
 * <p>All subscriptions share one {@link Dispatcher}, so messages are delivered to the listener on the dispatcher's
 * thread, one at a time. The listener only parses and enqueues, so this thread is never held by a download.</p>
 *
 * <p>Topics are translated with {@link NatsSubjects}; the listener always receives the WIS2 form of the subject a
 * message arrived on.</p>
 */
public class NatsNotificationTransport implements NotificationTransport {

    private static final Logger log = LoggerFactory.getLogger(NatsNotificationTransport.class);

    private final Connection connection;

    private volatile Dispatcher dispatcher;

    public NatsNotificationTransport(Connection connection) {
        this.connection = Objects.requireNonNull(connection, "connection");
    }

    @Override
    public synchronized void open(NotificationListener listener) {
        Objects.requireNonNull(listener, "listener");
        if (dispatcher != null) {
            throw new IllegalStateException("Transport already open");
        }
        dispatcher = connection.createDispatcher(msg -> deliver(listener, msg));
        log.info("Notification transport open (server={})", connection.getConnectedUrl());
    }

    @Override
    public void subscribe(String topic) {
        String subject = NatsSubjects.fromTopic(topic);
        requireOpen().subscribe(subject);
        log.debug("NATS subscribe topic={} subject={}", topic, subject);
    }

    @Override
    public void unsubscribe(String topic) {
        String subject = NatsSubjects.fromTopic(topic);
        requireOpen().unsubscribe(subject);
        log.debug("NATS unsubscribe topic={} subject={}", topic, subject);
    }

    private Dispatcher requireOpen() {
        Dispatcher d = dispatcher;
        if (d == null) {
            throw new IllegalStateException("Transport not open");
        }
        return d;
    }

    private static void deliver(NotificationListener listener, Message msg) {
        listener.onMessage(NatsSubjects.toTopic(msg.getSubject()), msg.getData());
    }
}
