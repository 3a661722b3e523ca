package com.wis2.downloader.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "wis2")
@Validated
public class DownloaderProperties {

    // ---------------------------------------------------------------------
    // Broker connectivity
    // ---------------------------------------------------------------------

    private String brokerUrl = "nats://localhost:4222";

    // ---------------------------------------------------------------------
    // Optional authentication / TLS
    // ---------------------------------------------------------------------

    private String brokerUser;

    private String brokerPassword;

    private String brokerToken;

    private String brokerCreds;

    private boolean brokerTls = false;

    // ---------------------------------------------------------------------
    // Subscriptions and output
    // ---------------------------------------------------------------------

    /** Topics subscribed at startup, all writing below {@link #downloadDirectory}. */
    private List<String> topics = new ArrayList<>();

    @NotBlank
    private String downloadDirectory;

    // ---------------------------------------------------------------------
    // Workers
    // ---------------------------------------------------------------------

    /** Worker threads; 0 picks max(availableProcessors - 2, 1). */
    @Min(0)
    private int workers = 0;

    @NotNull
    private Duration queueReportInterval = Duration.ofSeconds(60);

    private Download download = new Download();

    // ---------------------------------------------------------------------
    // Getters / setters for Spring Boot binding
    // ---------------------------------------------------------------------

    public String getBrokerUrl() { return brokerUrl; }
    public void setBrokerUrl(String brokerUrl) { this.brokerUrl = brokerUrl; }

    public String getBrokerUser() { return brokerUser; }
    public void setBrokerUser(String brokerUser) { this.brokerUser = brokerUser; }

    public String getBrokerPassword() { return brokerPassword; }
    public void setBrokerPassword(String brokerPassword) { this.brokerPassword = brokerPassword; }

    public String getBrokerToken() { return brokerToken; }
    public void setBrokerToken(String brokerToken) { this.brokerToken = brokerToken; }

    public String getBrokerCreds() { return brokerCreds; }
    public void setBrokerCreds(String brokerCreds) { this.brokerCreds = brokerCreds; }

    public boolean isBrokerTls() { return brokerTls; }
    public void setBrokerTls(boolean brokerTls) { this.brokerTls = brokerTls; }

    public List<String> getTopics() { return topics; }
    public void setTopics(List<String> topics) { this.topics = topics; }

    public String getDownloadDirectory() { return downloadDirectory; }
    public void setDownloadDirectory(String downloadDirectory) { this.downloadDirectory = downloadDirectory; }

    public int getWorkers() { return workers; }
    public void setWorkers(int workers) { this.workers = workers; }

    public Duration getQueueReportInterval() { return queueReportInterval; }
    public void setQueueReportInterval(Duration queueReportInterval) { this.queueReportInterval = queueReportInterval; }

    public Download getDownload() { return download; }
    public void setDownload(Download download) { this.download = download; }

    public static class Download {

        private Duration connectTimeout = Duration.ofSeconds(10);

        /** Unset: no per-request timeout, a stalled transfer holds its worker. */
        private Duration requestTimeout;

        public Duration getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

        public Duration getRequestTimeout() { return requestTimeout; }
        public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }
    }
}
