package de.mirkosertic.vectorizer.embedding;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.core.RequestOptions;
import com.openai.core.Timeout;
import com.openai.errors.OpenAIException;
import com.openai.errors.OpenAIInvalidDataException;
import com.openai.errors.OpenAIIoException;
import com.openai.errors.OpenAIRetryableException;
import com.openai.errors.OpenAIServiceException;
import com.openai.models.embeddings.CreateEmbeddingResponse;
import com.openai.models.embeddings.Embedding;
import com.openai.models.embeddings.EmbeddingCreateParams;
import de.mirkosertic.vectorizer.config.ApplicationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Calls an OpenAI-compatible {@code /embeddings} endpoint through the OpenAI Java SDK.
 * <p>
 * The SDK's own retry loop is switched off; retries are the job of
 * {@link RetryingEmbeddingClient}, which relies on the transient flag this class sets
 * on every {@link ProviderException}.
 */
public class OpenAiEmbeddingProvider implements EmbeddingProvider, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(OpenAiEmbeddingProvider.class);

    private static final int MAX_ERROR_SNIPPET = 512;

    private static final int HTTP_REQUEST_TIMEOUT = 408;
    private static final int HTTP_CONFLICT = 409;
    private static final int HTTP_TOO_EARLY = 425;
    private static final int HTTP_TOO_MANY_REQUESTS = 429;
    private static final int HTTP_INTERNAL_SERVER_ERROR = 500;

    private final OpenAIClient client;
    private final String modelName;
    private final int dimensions;
    private final RequestOptions requestOptions;

    /**
     * Creates a provider for the endpoint and model named in the configuration.
     *
     * @throws de.mirkosertic.vectorizer.config.ConfigException if no API key is configured
     */
    public static OpenAiEmbeddingProvider create(final ApplicationConfig config) {
        final OpenAIClient client = OpenAIOkHttpClient.builder()
                .apiKey(config.requireOpenAiApiKey())
                .baseUrl(config.getOpenAiBaseUrl())
                .maxRetries(0)
                .build();
        logger.info("Embedding provider: model={}, baseUrl={}, dimensions={}",
                config.getEmbeddingModel(), config.getOpenAiBaseUrl(), config.getEmbeddingDimensions());
        return new OpenAiEmbeddingProvider(client, config.getEmbeddingModel(), config.getEmbeddingDimensions(),
                Duration.ofMillis(config.getConnectTimeoutMs()), Duration.ofMillis(config.getReadTimeoutMs()));
    }

    OpenAiEmbeddingProvider(final OpenAIClient client, final String modelName, final int dimensions,
                            final Duration connectTimeout, final Duration readTimeout) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("Embedding dimensions must be positive");
        }
        this.client = client;
        this.modelName = modelName;
        this.dimensions = dimensions;
        this.requestOptions = RequestOptions.builder()
                .timeout(Timeout.builder()
                        .connect(connectTimeout)
                        .request(readTimeout)
                        .read(readTimeout)
                        .build())
                .build();
    }

    @Override
    public float[] embed(final String text) throws ProviderException {
        final EmbeddingCreateParams params = EmbeddingCreateParams.builder()
                .model(modelName)
                .input(text)
                .build();

        final CreateEmbeddingResponse response;
        try {
            response = client.embeddings().create(params, requestOptions);
        } catch (final OpenAIServiceException e) {
            final int statusCode = e.statusCode();
            throw new ProviderException("Embedding request failed with HTTP " + statusCode + ": "
                    + sanitizeMessage(e.getMessage()), isTransientStatus(statusCode), e);
        } catch (final OpenAIException e) {
            if (e instanceof OpenAIInvalidDataException) {
                throw new ProviderException("Malformed embedding response: " + sanitizeMessage(e.getMessage()), false, e);
            }
            final boolean transientFailure = e instanceof OpenAIIoException || e instanceof OpenAIRetryableException;
            throw new ProviderException("Embedding request failed: " + sanitizeMessage(e.getMessage()),
                    transientFailure, e);
        }

        return toVector(response);
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    static boolean isTransientStatus(final int statusCode) {
        return statusCode == HTTP_TOO_MANY_REQUESTS
                || statusCode >= HTTP_INTERNAL_SERVER_ERROR
                || statusCode == HTTP_REQUEST_TIMEOUT
                || statusCode == HTTP_CONFLICT
                || statusCode == HTTP_TOO_EARLY;
    }

    private float[] toVector(final CreateEmbeddingResponse response) throws ProviderException {
        if (response == null || response.data().isEmpty()) {
            throw new ProviderException("Embedding response contained no data", false);
        }
        final Embedding entry = response.data().get(0);
        final List<Float> values = entry.embedding();
        if (values.size() != dimensions) {
            throw new ProviderException("Embedding dimension mismatch: expected " + dimensions
                    + " but received " + values.size(), false);
        }

        final float[] vector = new float[values.size()];
        for (int i = 0; i < vector.length; i++) {
            final Float value = values.get(i);
            if (value == null) {
                throw new ProviderException("Embedding response contained a null value at index " + i, false);
            }
            vector[i] = value;
        }
        return vector;
    }

    private static String sanitizeMessage(final String message) {
        if (message == null || message.isBlank()) {
            return "no details";
        }
        final String sanitized = message.replace("\r", " ").replace("\n", " ").trim();
        if (sanitized.length() > MAX_ERROR_SNIPPET) {
            return sanitized.substring(0, MAX_ERROR_SNIPPET) + "...";
        }
        return sanitized;
    }

    @Override
    public void close() {
        client.close();
    }
}
