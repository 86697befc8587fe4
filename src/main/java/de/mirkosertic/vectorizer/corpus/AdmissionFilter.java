package de.mirkosertic.vectorizer.corpus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Enforces the maximum content length before any embedding is requested.
 * <p>
 * Oversized content is cut down to the first {@code limit} code points rather than
 * rejected, so the document still gets a best-effort embedding. The caller must report
 * a non-admitted document as an abnormal run outcome.
 */
public class AdmissionFilter {

    private static final Logger logger = LoggerFactory.getLogger(AdmissionFilter.class);

    private final int limit;

    public AdmissionFilter(final int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Admission limit must be positive, was " + limit);
        }
        this.limit = limit;
    }

    public AdmissionResult admit(final String content) {
        final int length = content.codePointCount(0, content.length());
        if (length <= limit) {
            return new AdmissionResult(content, true, length);
        }

        // Cut on a code point boundary so a surrogate pair is never split
        final int endIndex = content.offsetByCodePoints(0, limit);
        logger.debug("Truncating content from {} to {} code points", length, limit);
        return new AdmissionResult(content.substring(0, endIndex), false, length);
    }
}
