package de.mirkosertic.vectorizer.sync;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a {@link RunResult} as a JSON document, so callers can tell a truncation run
 * from a failure run without parsing log output.
 */
public final class RunReportWriter {

    private static final Logger logger = LoggerFactory.getLogger(RunReportWriter.class);

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private RunReportWriter() {
    }

    public static String toJson(final RunResult result) throws IOException {
        return OBJECT_MAPPER.writeValueAsString(RunReport.from(result));
    }

    public static void write(final RunResult result, final Path target) throws IOException {
        final Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, toJson(result));
        logger.info("Run report written to {}", target.toAbsolutePath());
    }
}
