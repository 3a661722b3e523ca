package com.wis2.downloader.core.model;

/**
 * =====================================================================
 * LinkOutcome
 * =====================================================================
 *
 * PURPOSE
 * -------
 * What happened to one canonical link of a {@link DownloadJob}.
 *
 * Failure isolation is per link: a failed link never stops the remaining
 * links of the same job, nor the worker processing it.
 *
 *   Resolving ──exists──▶ SKIPPED_EXISTING
 *       │
 *       └─▶ Downloading ──fail──▶ DOWNLOAD_FAILED
 *               │
 *               └─▶ Verifying ─▶ Persisting ──fail──▶ PERSIST_FAILED
 *                                     │
 *                                     └─▶ DOWNLOADED
 *
 * An integrity mismatch is NOT an outcome of its own: the file is still
 * persisted and the link ends as DOWNLOADED.
 */
public enum LinkOutcome {

    /** Output file already existed; nothing fetched, treated as success. */
    SKIPPED_EXISTING,

    /** Fetched and written to its output path. */
    DOWNLOADED,

    /** Network fetch failed; link abandoned, no retry. */
    DOWNLOAD_FAILED,

    /** Fetched but could not be written to disk. */
    PERSIST_FAILED;

    /**
     * Lower-case tag value used when counting outcomes.
     */
    public String tag() {
        return name().toLowerCase();
    }
}
