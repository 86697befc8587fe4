package de.mirkosertic.vectorizer.sync;

/**
 * Overall result of a run, in decreasing order of severity.
 */
public enum RunOutcome {
    CANCELLED,
    COMPLETED_WITH_FAILURES,
    COMPLETED_WITH_TRUNCATIONS,
    SUCCESS
}
