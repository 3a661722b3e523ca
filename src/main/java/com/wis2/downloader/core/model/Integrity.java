package com.wis2.downloader.core.model;

/**
 * Integrity block of a notification: the declared hash method and the
 * expected digest, base64 encoded.
 *
 * <p>The method is kept as the raw name from the payload. Resolving it to an
 * algorithm happens at verification time, where an unknown name means the
 * check is skipped.</p>
 */
public record Integrity(String method, String expectedValueBase64) {
}
