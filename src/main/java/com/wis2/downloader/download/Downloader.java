package com.wis2.downloader.download;

/**
 * =====================================================================
 * Downloader
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Network-facing contract for fetching one announced file.
 *
 *   [ Worker ] ──href──▶ [ Downloader ] ──bytes──▶ [ Worker ]
 *
 * FAILURE SEMANTICS
 * -----------------
 * - One attempt per call. No retry, no backoff.
 * - Any failure (bad URL, connection error, non-success status)
 *   surfaces as {@link DownloadException}; the caller abandons the link.
 *
 * RESULT
 * ------
 * The complete response body, held in memory. Nothing is streamed to
 * disk here; placement is the worker's job.
 *
 * THREAD SAFETY
 * -------------
 * Implementations are shared by every worker and MUST be thread-safe.
 */
public interface Downloader {

    /**
     * Fetches the full payload behind {@code href}.
     *
     * @param href absolute URL as published in the notification
     * @return the response body
     * @throws DownloadException on any failure
     */
    byte[] fetch(String href) throws DownloadException;
}
