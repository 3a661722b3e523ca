package com.wis2.downloader.core.integrity;

import com.wis2.downloader.core.model.Integrity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Base64;
import java.util.Optional;

/**
 * Checks a downloaded payload against the digest announced in its notification.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>No integrity block, or a method name that does not resolve to a {@link HashAlgorithm}:
 *       {@link VerificationResult#SKIPPED}.</li>
 *   <li>Otherwise the payload is digested, base64 encoded (standard alphabet, padded) and compared
 *       to the expected value as a case-sensitive string.</li>
 *   <li>A mismatch is returned, never thrown. Callers keep the file.</li>
 * </ul>
 *
 * <p>Stateless and thread-safe; one instance is shared by all workers.</p>
 */
public class IntegrityVerifier {

    private static final Logger log = LoggerFactory.getLogger(IntegrityVerifier.class);

    public VerificationResult verify(byte[] data, Integrity expected) {
        if (expected == null || expected.expectedValueBase64() == null) {
            log.debug("No hash function or expected hash found to compare");
            return VerificationResult.SKIPPED;
        }

        Optional<HashAlgorithm> algorithm = HashAlgorithm.fromMethodName(expected.method());
        if (algorithm.isEmpty()) {
            log.debug("Unsupported hash method '{}'; integrity check skipped", expected.method());
            return VerificationResult.SKIPPED;
        }

        String actual = Base64.getEncoder().encodeToString(algorithm.get().digest(data));
        return actual.equals(expected.expectedValueBase64())
                ? VerificationResult.MATCH
                : VerificationResult.MISMATCH;
    }
}
