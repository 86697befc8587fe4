package de.mirkosertic.vectorizer.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for BuildInfo.
 */
@DisplayName("BuildInfo Tests")
class BuildInfoTest {

    @Test
    @DisplayName("Should load version and timestamp")
    void shouldLoadVersionAndTimestamp() {
        // When
        final String version = BuildInfo.getVersion();
        final String timestamp = BuildInfo.getBuildTimestamp();

        // Then: either the filtered Maven values or the IDE fallbacks
        assertThat(version)
                .as("Version should be either Maven version or 'dev'")
                .matches("^(\\d+\\.\\d+\\.\\d+.*|dev)$");
        assertThat(timestamp)
                .as("Timestamp should be either ISO format or 'unknown'")
                .matches("^(\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}Z|unknown)$");
    }
}
