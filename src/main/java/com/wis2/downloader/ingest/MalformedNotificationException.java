package com.wis2.downloader.ingest;

/**
 * A notification payload could not be turned into a job: invalid JSON or a missing required member.
 */
public class MalformedNotificationException extends RuntimeException {

    public MalformedNotificationException(String message) {
        super(message);
    }

    public MalformedNotificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
