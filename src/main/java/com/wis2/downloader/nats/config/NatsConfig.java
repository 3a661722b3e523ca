package com.wis2.downloader.nats.config;

import com.wis2.downloader.config.DownloaderProperties;
import com.wis2.downloader.core.transport.NotificationTransport;
import com.wis2.downloader.nats.transport.NatsNotificationTransport;
import io.nats.client.Connection;
import io.nats.client.ConnectionListener;
import io.nats.client.Nats;
import io.nats.client.Options;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration that wires up:
 * - the NATS {@link Connection} to the notification broker
 * - the {@link NotificationTransport} the pipeline subscribes through
 *
 * <h2>Connection options</h2>
 * <ul>
 *   <li>Auth: none, user/password, token or a creds file, whichever are configured.</li>
 *   <li>TLS when {@code wis2.broker-tls} is set.</li>
 *   <li>Unlimited reconnects. Subscriptions are restored by the client after a reconnect.</li>
 *   <li>Connection events are logged, secrets never are.</li>
 * </ul>
 */
@Configuration
public class NatsConfig {

    private static final Logger log = LoggerFactory.getLogger(NatsConfig.class);

    @Bean(destroyMethod = "close")
    public Connection natsConnection(DownloaderProperties props) throws Exception {
        Options options = buildOptions(props);
        Connection c = Nats.connect(options);

        log.info("Connected to NATS (url={}, tls={}, user={}, creds={})",
                props.getBrokerUrl(),
                props.isBrokerTls(),
                isSet(props.getBrokerUser()) ? mask(props.getBrokerUser()) : "",
                isSet(props.getBrokerCreds()) ? props.getBrokerCreds() : "");
        return c;
    }

    @Bean
    public NotificationTransport notificationTransport(Connection connection) {
        return new NatsNotificationTransport(connection);
    }

    static Options buildOptions(DownloaderProperties props) throws Exception {
        Options.Builder b = new Options.Builder()
                .server(props.getBrokerUrl())
                .maxReconnects(-1)
                .connectionListener(connectionLogger());

        if (props.isBrokerTls()) {
            b.secure();
        }

        if (isSet(props.getBrokerToken())) {
            b.token(props.getBrokerToken().toCharArray());
        }

        if (isSet(props.getBrokerUser())) {
            String pass = props.getBrokerPassword() == null ? "" : props.getBrokerPassword();
            b.userInfo(props.getBrokerUser().toCharArray(), pass.toCharArray());
        }

        if (isSet(props.getBrokerCreds())) {
            b.authHandler(Nats.credentials(props.getBrokerCreds()));
        }

        return b.build();
    }

    private static ConnectionListener connectionLogger() {
        return (conn, type) -> {
            switch (type) {
                case CONNECTED, RECONNECTED, RESUBSCRIBED -> log.info("NATS {}", type.name().toLowerCase());
                case DISCONNECTED, CLOSED -> log.warn("NATS {}", type.name().toLowerCase());
                default -> log.debug("NATS event {}", type);
            }
        };
    }

    private static boolean isSet(String s) {
        return s != null && !s.isBlank();
    }

    private static String mask(String s) {
        if (s.length() <= 2) {
            return "**";
        }
        return s.charAt(0) + "***" + s.charAt(s.length() - 1);
    }
}
