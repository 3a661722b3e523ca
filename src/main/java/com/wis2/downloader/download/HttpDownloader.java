package com.wis2.downloader.download;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link Downloader} backed by the JDK {@link HttpClient}.
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>Plain {@code GET}, redirects followed.</li>
 *   <li>Any 2xx status is success; every other status is a {@link DownloadException} carrying the status code.</li>
 *   <li>The request timeout is optional. When it is {@code null} the client's own behavior applies.</li>
 * </ul>
 *
 * <p>The blocking {@link HttpClient#send} is intended: each worker owns its thread and the fetch is one of the two
 * places it is allowed to wait.</p>
 */
public class HttpDownloader implements Downloader {

    private static final Logger log = LoggerFactory.getLogger(HttpDownloader.class);

    private final HttpClient client;
    private final Duration requestTimeout;

    public HttpDownloader(HttpClient client, Duration requestTimeout) {
        this.client = Objects.requireNonNull(client, "client");
        this.requestTimeout = requestTimeout;
    }

    /**
     * Builds the shared client used by all workers.
     */
    public static HttpClient newClient(Duration connectTimeout) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL);
        if (connectTimeout != null && !connectTimeout.isZero() && !connectTimeout.isNegative()) {
            builder.connectTimeout(connectTimeout);
        }
        return builder.build();
    }

    @Override
    public byte[] fetch(String href) throws DownloadException {
        URI uri;
        try {
            uri = URI.create(href);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new DownloadException(href, "Invalid URL", e);
        }
        if (!uri.isAbsolute()) {
            throw new DownloadException(href, "URL is not absolute");
        }

        HttpResponse<byte[]> response;
        try {
            // newBuilder rejects schemes other than http/https
            HttpRequest.Builder request = HttpRequest.newBuilder(uri).GET();
            if (requestTimeout != null && !requestTimeout.isZero() && !requestTimeout.isNegative()) {
                request.timeout(requestTimeout);
            }
            response = client.send(request.build(), HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException | IllegalArgumentException e) {
            throw new DownloadException(href, "Request failed: " + e, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DownloadException(href, "Interrupted while downloading", e);
        }

        int status = response.statusCode();
        if (status < 200 || status > 299) {
            throw new DownloadException(href, "Unexpected HTTP status " + status);
        }

        byte[] body = response.body();
        log.debug("GET {} -> {} ({} bytes)", href, status, body == null ? 0 : body.length);
        return body == null ? new byte[0] : body;
    }
}
