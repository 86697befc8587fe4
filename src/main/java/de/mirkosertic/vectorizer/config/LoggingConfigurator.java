package de.mirkosertic.vectorizer.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Switches logging to the deployed setup when the vectorizer runs as a scheduled job.
 * <p>
 * The profile is taken from the {@code profile} system property, or the older
 * {@code spring.profiles.active}. With {@code deployed} the rolling file configuration is
 * loaded and writes below {@code ~/.vectorizer/log}. Any other profile keeps logback.xml.
 * <p>
 * Runs before the first logger is used, so problems are reported on stderr.
 */
public final class LoggingConfigurator {

    static final String DEPLOYED_PROFILE = "deployed";
    static final String LOG_DIR_PROPERTY = "VECTORIZER_LOG_DIR";
    private static final String DEPLOYED_CONFIG = "logback-deployed.xml";

    private LoggingConfigurator() {
    }

    /**
     * Configure logging from the JVM system properties.
     *
     * @return true if the deployed profile is active
     */
    public static boolean configure() {
        final boolean deployed = isDeployedProfile(System.getProperties());
        if (deployed) {
            final Path logDirectory = getLogDirectory();
            createLogDirectory(logDirectory);
            loadDeployedConfiguration(logDirectory);
        }
        return deployed;
    }

    public static boolean isDeployedProfile(final Properties systemProperties) {
        final String profile = systemProperties.getProperty("profile",
                systemProperties.getProperty("spring.profiles.active", "default"));
        return DEPLOYED_PROFILE.equalsIgnoreCase(profile.trim());
    }

    public static Path getLogDirectory() {
        return ApplicationConfig.getConfigDirectory().resolve("log");
    }

    private static void createLogDirectory(final Path logDirectory) {
        try {
            Files.createDirectories(logDirectory);
        } catch (final IOException e) {
            System.err.println("Warning: Could not create log directory " + logDirectory + ": " + e.getMessage());
        }
    }

    private static void loadDeployedConfiguration(final Path logDirectory) {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        try (InputStream configStream = LoggingConfigurator.class.getClassLoader()
                .getResourceAsStream(DEPLOYED_CONFIG)) {
            if (configStream == null) {
                System.err.println("Warning: " + DEPLOYED_CONFIG + " is missing, keeping console logging");
                return;
            }
            context.reset();
            context.putProperty(LOG_DIR_PROPERTY, logDirectory.toAbsolutePath().toString());

            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            configurator.doConfigure(configStream);
        } catch (final JoranException | IOException e) {
            System.err.println("Warning: Could not load " + DEPLOYED_CONFIG + ": " + e.getMessage());
        }
    }
}
