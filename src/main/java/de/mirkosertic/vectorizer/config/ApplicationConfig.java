package de.mirkosertic.vectorizer.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Central configuration for a vectorizer run.
 * Loads configuration from YAML files, environment variables, system properties
 * and command line options. One instance is created at startup and handed to
 * every component's constructor; nothing reads process-wide state afterwards.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Command line options
 * 2. System properties
 * 3. Environment variables
 * 4. User config file (~/.vectorizer/config.yaml)
 * 5. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    static final String ENV_DOCS_PATH = "VECTORIZER_DOCS_PATH";
    static final String ENV_INDEX_PATH = "VECTORIZER_INDEX_PATH";
    static final String ENV_OPENAI_API_KEY = "OPENAI_API_KEY";
    static final String ENV_OPENAI_BASE_URL = "VECTORIZER_OPENAI_BASE_URL";
    static final String ENV_CONCURRENCY = "VECTORIZER_CONCURRENCY";
    static final String ENV_MAX_CONTENT_LENGTH = "VECTORIZER_MAX_CONTENT_LENGTH";

    private static final String CONFIG_DIR = ".vectorizer";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    private final Map<String, String> environment;
    private final Properties systemProperties;

    // Corpus settings
    private String docsPath;
    private List<String> includePatterns = List.of("*.md");
    private List<String> excludePatterns = List.of("**/.git/**");

    // Vector index settings
    private String indexPath;

    // Embedding provider settings
    private String openAiApiKey;
    private String openAiBaseUrl = "https://api.openai.com/v1";
    private String embeddingModel = "text-embedding-3-large";
    private int embeddingDimensions = 3072;
    private long connectTimeoutMs = 10_000;
    private long readTimeoutMs = 60_000;
    private int maxAttempts = 4;
    private long initialBackoffMs = 1_000;
    private long maxBackoffMs = 8_000;

    // Sync settings
    private int maxContentLength = 10_000;
    private int concurrency = 4;
    private long progressIntervalMs = 10_000;
    private boolean dryRun = false;
    private String reportPath;

    // Search mode
    private String query;
    private int topK = 5;

    // Profile settings
    private boolean deployedMode = false;

    private ApplicationConfig(final Map<String, String> environment, final Properties systemProperties) {
        this.environment = environment;
        this.systemProperties = systemProperties;
    }

    /**
     * Load configuration from all sources with proper priority.
     *
     * @param args command line options, may be empty
     * @throws ConfigException if a command line option is unknown or malformed
     */
    public static ApplicationConfig load(final String[] args) {
        return load(args, System.getenv(), System.getProperties(), getUserConfigPath());
    }

    static ApplicationConfig load(final String[] args,
                                  final Map<String, String> environment,
                                  final Properties systemProperties,
                                  final Path userConfigPath) {
        final ApplicationConfig config = new ApplicationConfig(environment, systemProperties);

        // Step 1: Load application defaults from classpath
        config.loadFromClasspath();

        // Step 2: Load user config file (may override some settings)
        config.loadFromUserConfig(userConfigPath);

        // Step 3: Environment variables, then system properties
        config.applyEnvironmentOverrides();
        config.applySystemPropertyOverrides();

        // Step 4: Command line options (highest priority)
        config.applyCommandLine(args);

        // Step 5: Determine profile/mode
        config.determineProfile();

        logger.info("Configuration loaded: docsPath={}, indexPath={}, model={}, maxContentLength={}, concurrency={}",
                config.docsPath, config.indexPath, config.embeddingModel, config.maxContentLength, config.concurrency);

        return config;
    }

    /**
     * Check the settings every run needs. Credentials are checked separately by the
     * caller, because a run whose plan needs no embeddings works without them.
     *
     * @throws ConfigException on the first invalid setting
     */
    public void validate() {
        if (docsPath == null || docsPath.isBlank()) {
            throw new ConfigException("Docs directory is required (--docs or " + ENV_DOCS_PATH + ")");
        }
        if (maxContentLength <= 0) {
            throw new ConfigException("max-content-length must be positive, was " + maxContentLength);
        }
        if (concurrency <= 0) {
            throw new ConfigException("concurrency must be positive, was " + concurrency);
        }
        if (embeddingDimensions <= 0) {
            throw new ConfigException("embedding dimensions must be positive, was " + embeddingDimensions);
        }
        if (maxAttempts <= 0) {
            throw new ConfigException("max-attempts must be positive, was " + maxAttempts);
        }
        if (topK <= 0) {
            throw new ConfigException("top-k must be positive, was " + topK);
        }
    }

    /**
     * @throws ConfigException if no API key was configured
     */
    public String requireOpenAiApiKey() {
        if (openAiApiKey == null || openAiApiKey.isBlank()) {
            throw new ConfigException("OpenAI API key required (--openai-key or " + ENV_OPENAI_API_KEY + ")");
        }
        return openAiApiKey;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig(final Path userConfigPath) {
        if (userConfigPath != null && Files.exists(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded user config from: {}", userConfigPath);
                }
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", userConfigPath, e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void applyYamlConfig(final Map<String, Object> config) {
        final Map<String, Object> root = (Map<String, Object>) config.get("vectorizer");
        if (root == null) {
            return;
        }

        final Map<String, Object> docsConfig = (Map<String, Object>) root.get("docs");
        if (docsConfig != null) {
            applyDocsConfig(docsConfig);
        }

        final Map<String, Object> indexConfig = (Map<String, Object>) root.get("index");
        if (indexConfig != null) {
            final Object path = indexConfig.get("path");
            if (path != null) {
                this.indexPath = resolveVariables(path.toString());
            }
        }

        final Map<String, Object> embeddingConfig = (Map<String, Object>) root.get("embedding");
        if (embeddingConfig != null) {
            applyEmbeddingConfig(embeddingConfig);
        }

        final Map<String, Object> syncConfig = (Map<String, Object>) root.get("sync");
        if (syncConfig != null) {
            if (syncConfig.containsKey("max-content-length")) {
                this.maxContentLength = ((Number) syncConfig.get("max-content-length")).intValue();
            }
            if (syncConfig.containsKey("concurrency")) {
                this.concurrency = ((Number) syncConfig.get("concurrency")).intValue();
            }
            if (syncConfig.containsKey("progress-interval-ms")) {
                this.progressIntervalMs = ((Number) syncConfig.get("progress-interval-ms")).longValue();
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void applyDocsConfig(final Map<String, Object> docsConfig) {
        final Object path = docsConfig.get("path");
        if (path != null) {
            this.docsPath = resolveVariables(path.toString());
        }
        if (docsConfig.get("include-patterns") instanceof List) {
            this.includePatterns = new ArrayList<>((List<String>) docsConfig.get("include-patterns"));
        }
        if (docsConfig.get("exclude-patterns") instanceof List) {
            this.excludePatterns = new ArrayList<>((List<String>) docsConfig.get("exclude-patterns"));
        }
    }

    private void applyEmbeddingConfig(final Map<String, Object> embeddingConfig) {
        if (embeddingConfig.get("base-url") != null) {
            this.openAiBaseUrl = resolveVariables(embeddingConfig.get("base-url").toString());
        }
        if (embeddingConfig.get("api-key") != null) {
            this.openAiApiKey = resolveVariables(embeddingConfig.get("api-key").toString());
        }
        if (embeddingConfig.get("model") != null) {
            this.embeddingModel = embeddingConfig.get("model").toString();
        }
        if (embeddingConfig.containsKey("dimensions")) {
            this.embeddingDimensions = ((Number) embeddingConfig.get("dimensions")).intValue();
        }
        if (embeddingConfig.containsKey("connect-timeout-ms")) {
            this.connectTimeoutMs = ((Number) embeddingConfig.get("connect-timeout-ms")).longValue();
        }
        if (embeddingConfig.containsKey("read-timeout-ms")) {
            this.readTimeoutMs = ((Number) embeddingConfig.get("read-timeout-ms")).longValue();
        }
        if (embeddingConfig.containsKey("max-attempts")) {
            this.maxAttempts = ((Number) embeddingConfig.get("max-attempts")).intValue();
        }
        if (embeddingConfig.containsKey("initial-backoff-ms")) {
            this.initialBackoffMs = ((Number) embeddingConfig.get("initial-backoff-ms")).longValue();
        }
        if (embeddingConfig.containsKey("max-backoff-ms")) {
            this.maxBackoffMs = ((Number) embeddingConfig.get("max-backoff-ms")).longValue();
        }
    }

    private void applyEnvironmentOverrides() {
        final String envDocsPath = trimmedOrNull(environment.get(ENV_DOCS_PATH));
        if (envDocsPath != null) {
            this.docsPath = envDocsPath;
            logger.info("Docs path from environment: {}", this.docsPath);
        }

        final String envIndexPath = trimmedOrNull(environment.get(ENV_INDEX_PATH));
        if (envIndexPath != null) {
            this.indexPath = envIndexPath;
            logger.info("Index path from environment: {}", this.indexPath);
        }

        final String envApiKey = trimmedOrNull(environment.get(ENV_OPENAI_API_KEY));
        if (envApiKey != null) {
            this.openAiApiKey = envApiKey;
        }

        final String envBaseUrl = trimmedOrNull(environment.get(ENV_OPENAI_BASE_URL));
        if (envBaseUrl != null) {
            this.openAiBaseUrl = envBaseUrl;
        }

        final String envConcurrency = trimmedOrNull(environment.get(ENV_CONCURRENCY));
        if (envConcurrency != null) {
            this.concurrency = parseInt(ENV_CONCURRENCY, envConcurrency);
        }

        final String envMaxContentLength = trimmedOrNull(environment.get(ENV_MAX_CONTENT_LENGTH));
        if (envMaxContentLength != null) {
            this.maxContentLength = parseInt(ENV_MAX_CONTENT_LENGTH, envMaxContentLength);
        }
    }

    private void applySystemPropertyOverrides() {
        final String propDocsPath = trimmedOrNull(systemProperties.getProperty("vectorizer.docs.path"));
        if (propDocsPath != null) {
            this.docsPath = propDocsPath;
        }

        final String propIndexPath = trimmedOrNull(systemProperties.getProperty("vectorizer.index.path"));
        if (propIndexPath != null) {
            this.indexPath = propIndexPath;
        }

        final String propConcurrency = trimmedOrNull(systemProperties.getProperty("vectorizer.concurrency"));
        if (propConcurrency != null) {
            this.concurrency = parseInt("vectorizer.concurrency", propConcurrency);
        }

        final String propMaxContentLength = trimmedOrNull(systemProperties.getProperty("vectorizer.max-content-length"));
        if (propMaxContentLength != null) {
            this.maxContentLength = parseInt("vectorizer.max-content-length", propMaxContentLength);
        }

        // Default index path if still not set
        if (this.indexPath == null || this.indexPath.isEmpty()) {
            this.indexPath = Paths.get(systemProperties.getProperty("user.home", "."), CONFIG_DIR, "index").toString();
        }
    }

    private void applyCommandLine(final String[] args) {
        if (args == null) {
            return;
        }
        for (int i = 0; i < args.length; i++) {
            final String option = args[i];
            switch (option) {
                case "--docs" -> this.docsPath = requireValue(args, ++i, option);
                case "--db" -> this.indexPath = requireValue(args, ++i, option);
                case "--openai-key" -> this.openAiApiKey = requireValue(args, ++i, option);
                case "--limit" -> this.maxContentLength = parseInt(option, requireValue(args, ++i, option));
                case "--concurrency" -> this.concurrency = parseInt(option, requireValue(args, ++i, option));
                case "--query" -> this.query = requireValue(args, ++i, option);
                case "--top-k" -> this.topK = parseInt(option, requireValue(args, ++i, option));
                case "--report" -> this.reportPath = requireValue(args, ++i, option);
                case "--dry-run" -> this.dryRun = true;
                default -> throw new ConfigException("Unknown option: " + option);
            }
        }
    }

    private void determineProfile() {
        this.deployedMode = LoggingConfigurator.isDeployedProfile(systemProperties);
    }

    private static String requireValue(final String[] args, final int index, final String option) {
        if (index >= args.length || args[index].startsWith("--")) {
            throw new ConfigException("Option " + option + " requires a value");
        }
        return args[index];
    }

    private static int parseInt(final String source, final String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (final NumberFormatException e) {
            throw new ConfigException("Invalid integer for " + source + ": " + value, e);
        }
    }

    private static String trimmedOrNull(final String value) {
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        return value.trim();
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    private String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf("}", start);
            if (end < 0) {
                break;
            }

            final String varExpr = result.substring(start + 2, end);
            final String[] parts = varExpr.split(":", 2);
            final String varName = parts[0];
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            // Check environment first, then system properties
            String replacement = environment.get(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = systemProperties.getProperty(varName, defaultValue);
            }

            // Handle nested ${user.home} type variables
            if (replacement.contains("${")) {
                replacement = resolveVariables(replacement);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    // Getters
    public String getDocsPath() {
        return docsPath;
    }

    public List<String> getIncludePatterns() {
        return includePatterns;
    }

    public List<String> getExcludePatterns() {
        return excludePatterns;
    }

    public String getIndexPath() {
        return indexPath;
    }

    public String getOpenAiBaseUrl() {
        return openAiBaseUrl;
    }

    public boolean hasOpenAiApiKey() {
        return openAiApiKey != null && !openAiApiKey.isBlank();
    }

    public String getEmbeddingModel() {
        return embeddingModel;
    }

    public int getEmbeddingDimensions() {
        return embeddingDimensions;
    }

    public long getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public long getReadTimeoutMs() {
        return readTimeoutMs;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getInitialBackoffMs() {
        return initialBackoffMs;
    }

    public long getMaxBackoffMs() {
        return maxBackoffMs;
    }

    public int getMaxContentLength() {
        return maxContentLength;
    }

    public int getConcurrency() {
        return concurrency;
    }

    /** Interval of the periodic progress log line, 0 disables it. */
    public long getProgressIntervalMs() {
        return progressIntervalMs;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public String getReportPath() {
        return reportPath;
    }

    public String getQuery() {
        return query;
    }

    public boolean isSearchMode() {
        return query != null && !query.isBlank();
    }

    public int getTopK() {
        return topK;
    }

    public boolean isDeployedMode() {
        return deployedMode;
    }
}
