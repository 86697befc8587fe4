package de.mirkosertic.vectorizer.corpus;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Derives document identities and content fingerprints.
 * Both are lowercase hex SHA-256 digests, so they are stable across processes,
 * platforms and runs.
 */
public class DocumentFingerprinter {

    private static final String ALGORITHM = "SHA-256";

    /**
     * Identity of a document, the primary key in the vector store.
     *
     * @param relativePath path relative to the corpus root with {@code /} separators
     */
    public String identityOf(final String relativePath) {
        return sha256(relativePath.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Change-detection fingerprint of the (already admission-filtered) content.
     */
    public String fingerprint(final String content) {
        return sha256(content.getBytes(StandardCharsets.UTF_8));
    }

    public String fingerprint(final byte[] content) {
        return sha256(content);
    }

    private static String sha256(final byte[] input) {
        final MessageDigest digest;
        try {
            digest = MessageDigest.getInstance(ALGORITHM);
        } catch (final NoSuchAlgorithmException e) {
            // Every Java platform is required to provide SHA-256
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
        final byte[] hash = digest.digest(input);
        final StringBuilder hexString = new StringBuilder(hash.length * 2);
        for (final byte b : hash) {
            final String hex = Integer.toHexString(0xff & b);
            if (hex.length() == 1) {
                hexString.append('0');
            }
            hexString.append(hex);
        }
        return hexString.toString();
    }
}
