package de.mirkosertic.vectorizer.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ApplicationConfig Tests")
class ApplicationConfigTest {

    @TempDir
    Path tempDir;

    private Properties baseProperties() {
        final Properties properties = new Properties();
        properties.setProperty("user.home", tempDir.toString());
        return properties;
    }

    private ApplicationConfig load(final Map<String, String> env, final String... args) {
        return ApplicationConfig.load(args, env, baseProperties(), tempDir.resolve("missing.yaml"));
    }

    @Nested
    @DisplayName("Defaults")
    class DefaultTests {

        @Test
        @DisplayName("Should apply the built-in defaults")
        void shouldApplyDefaults() {
            // When
            final ApplicationConfig config = load(Map.of());

            // Then
            assertThat(config.getMaxContentLength()).isEqualTo(10_000);
            assertThat(config.getConcurrency()).isEqualTo(4);
            assertThat(config.getEmbeddingModel()).isEqualTo("text-embedding-3-large");
            assertThat(config.getEmbeddingDimensions()).isEqualTo(3072);
            assertThat(config.getIncludePatterns()).containsExactly("*.md");
            assertThat(config.getIndexPath()).isEqualTo(tempDir.resolve(".vectorizer").resolve("index").toString());
            assertThat(config.hasOpenAiApiKey()).isFalse();
            assertThat(config.isSearchMode()).isFalse();
        }

        @Test
        @DisplayName("Should require a docs directory")
        void shouldRequireDocsPath() {
            // Given
            final ApplicationConfig config = load(Map.of());

            // When / Then
            assertThatThrownBy(config::validate)
                    .isInstanceOf(ConfigException.class)
                    .hasMessageContaining("Docs directory");
        }

        @Test
        @DisplayName("Should require an API key only when asked for it")
        void shouldRequireApiKeyLazily() {
            // Given
            final ApplicationConfig config = load(Map.of(), "--docs", "/docs");

            // When / Then
            config.validate();
            assertThatThrownBy(config::requireOpenAiApiKey)
                    .isInstanceOf(ConfigException.class)
                    .hasMessageContaining("OPENAI_API_KEY");
        }
    }

    @Nested
    @DisplayName("Precedence")
    class PrecedenceTests {

        @Test
        @DisplayName("Should let environment variables override the user config file")
        void shouldPreferEnvironmentOverUserFile() throws IOException {
            // Given
            final Path userConfig = tempDir.resolve("config.yaml");
            Files.writeString(userConfig, """
                    vectorizer:
                      docs:
                        path: /from-file
                      sync:
                        concurrency: 8
                        max-content-length: 500
                    """);

            // When
            final ApplicationConfig config = ApplicationConfig.load(new String[0],
                    Map.of(ApplicationConfig.ENV_DOCS_PATH, "/from-env"), baseProperties(), userConfig);

            // Then
            assertThat(config.getDocsPath()).isEqualTo("/from-env");
            assertThat(config.getConcurrency()).isEqualTo(8);
            assertThat(config.getMaxContentLength()).isEqualTo(500);
        }

        @Test
        @DisplayName("Should let command line options override everything else")
        void shouldPreferCommandLine() {
            // Given
            final Map<String, String> env = Map.of(
                    ApplicationConfig.ENV_DOCS_PATH, "/from-env",
                    ApplicationConfig.ENV_CONCURRENCY, "2",
                    ApplicationConfig.ENV_OPENAI_API_KEY, "sk-env");

            // When
            final ApplicationConfig config = load(env,
                    "--docs", "/from-cli", "--concurrency", "6", "--limit", "42", "--openai-key", "sk-cli",
                    "--db", "/index", "--report", "/tmp/report.json", "--dry-run");

            // Then
            assertThat(config.getDocsPath()).isEqualTo("/from-cli");
            assertThat(config.getConcurrency()).isEqualTo(6);
            assertThat(config.getMaxContentLength()).isEqualTo(42);
            assertThat(config.requireOpenAiApiKey()).isEqualTo("sk-cli");
            assertThat(config.getIndexPath()).isEqualTo("/index");
            assertThat(config.getReportPath()).isEqualTo("/tmp/report.json");
            assertThat(config.isDryRun()).isTrue();
        }

        @Test
        @DisplayName("Should read the API key from the environment")
        void shouldReadApiKeyFromEnvironment() {
            // When
            final ApplicationConfig config = load(Map.of(ApplicationConfig.ENV_OPENAI_API_KEY, "sk-env"));

            // Then
            assertThat(config.requireOpenAiApiKey()).isEqualTo("sk-env");
        }

        @Test
        @DisplayName("Should enable search mode with --query")
        void shouldEnableSearchMode() {
            // When
            final ApplicationConfig config = load(Map.of(), "--query", "how to deploy", "--top-k", "3");

            // Then
            assertThat(config.isSearchMode()).isTrue();
            assertThat(config.getQuery()).isEqualTo("how to deploy");
            assertThat(config.getTopK()).isEqualTo(3);
        }
    }

    @Nested
    @DisplayName("Invalid input")
    class InvalidInputTests {

        @Test
        @DisplayName("Should reject unknown options")
        void shouldRejectUnknownOption() {
            assertThatThrownBy(() -> load(Map.of(), "--verbose"))
                    .isInstanceOf(ConfigException.class)
                    .hasMessageContaining("--verbose");
        }

        @Test
        @DisplayName("Should reject an option without its value")
        void shouldRejectMissingValue() {
            assertThatThrownBy(() -> load(Map.of(), "--docs"))
                    .isInstanceOf(ConfigException.class)
                    .hasMessageContaining("requires a value");
        }

        @Test
        @DisplayName("Should reject a non-numeric limit")
        void shouldRejectNonNumericLimit() {
            assertThatThrownBy(() -> load(Map.of(), "--limit", "lots"))
                    .isInstanceOf(ConfigException.class);
        }

        @Test
        @DisplayName("Should reject a non-positive concurrency on validation")
        void shouldRejectZeroConcurrency() {
            // Given
            final ApplicationConfig config = load(Map.of(), "--docs", "/docs", "--concurrency", "0");

            // When / Then
            assertThatThrownBy(config::validate)
                    .isInstanceOf(ConfigException.class)
                    .hasMessageContaining("concurrency");
        }
    }
}
