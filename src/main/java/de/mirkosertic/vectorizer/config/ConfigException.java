package de.mirkosertic.vectorizer.config;

/**
 * Fatal configuration problem detected before any remote state is touched,
 * e.g. a missing corpus root, missing credentials or an index that was built
 * with a different embedding dimension.
 */
public class ConfigException extends RuntimeException {

    public ConfigException(final String message) {
        super(message);
    }

    public ConfigException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
