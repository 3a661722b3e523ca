package com.wis2.downloader.download;

/**
 * A single fetch attempt failed. Carries the URL so that the failure can be logged without extra context.
 */
public class DownloadException extends Exception {

    private final String href;

    public DownloadException(String href, String message) {
        super(message);
        this.href = href;
    }

    public DownloadException(String href, String message, Throwable cause) {
        super(message, cause);
        this.href = href;
    }

    public String getHref() {
        return href;
    }
}
