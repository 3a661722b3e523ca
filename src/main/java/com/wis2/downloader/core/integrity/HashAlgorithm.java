package com.wis2.downloader.core.integrity;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;
import java.util.Optional;

/**
 * =====================================================================
 * HashAlgorithm
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Closed vocabulary of the hash methods a notification may declare in
 * {@code properties.integrity.method}, each bound to its JCA algorithm name.
 *
 * Resolution is explicit: a method name either maps to one of these values
 * or it does not. An unknown name never fails the job; it only means the
 * integrity check is skipped.
 *
 * NAME MATCHING
 * -------------
 * Case-insensitive, ignoring '-' and '_', so all of these resolve:
 *   sha512, SHA512, sha-512, sha3_256, sha3-256
 *
 * ENUM VALUES
 * -----------
 */
public enum HashAlgorithm {

    md5("MD5"),
    sha1("SHA-1"),
    sha224("SHA-224"),
    sha256("SHA-256"),
    sha384("SHA-384"),
    sha512("SHA-512"),
    sha3_224("SHA3-224"),
    sha3_256("SHA3-256"),
    sha3_384("SHA3-384"),
    sha3_512("SHA3-512");

    private final String jcaName;

    HashAlgorithm(String jcaName) {
        this.jcaName = jcaName;
    }

    public String jcaName() {
        return jcaName;
    }

    /**
     * Looks up the algorithm for a declared method name.
     *
     * @return empty when the name is null, blank or not a supported method
     */
    public static Optional<HashAlgorithm> fromMethodName(String method) {
        if (method == null || method.isBlank()) {
            return Optional.empty();
        }
        String key = squash(method.trim().toLowerCase(Locale.ROOT));
        for (HashAlgorithm a : values()) {
            if (squash(a.name()).equals(key)) {
                return Optional.of(a);
            }
        }
        return Optional.empty();
    }

    /**
     * Digests the whole buffer in one pass.
     */
    public byte[] digest(byte[] data) {
        try {
            return MessageDigest.getInstance(jcaName).digest(data);
        } catch (NoSuchAlgorithmException e) {
            // Every value above ships with the JDK's SUN provider.
            throw new IllegalStateException("JCA algorithm not available: " + jcaName, e);
        }
    }

    private static String squash(String name) {
        return name.replace("-", "").replace("_", "");
    }
}
