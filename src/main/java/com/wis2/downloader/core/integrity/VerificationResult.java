package com.wis2.downloader.core.integrity;

/**
 * Result of comparing a downloaded payload against its integrity block.
 *
 * <p>None of these values is an error. {@link #MISMATCH} is reported for
 * monitoring only; the file is kept either way.</p>
 */
public enum VerificationResult {

    /** Recomputed base64 digest equals the expected value exactly. */
    MATCH,

    /** Recomputed digest differs from the expected value. */
    MISMATCH,

    /** No integrity block, or its method does not name a supported algorithm. */
    SKIPPED;

    public String tag() {
        return name().toLowerCase();
    }
}
