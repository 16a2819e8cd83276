package com.clust.sdk.client;

import com.clust.sdk.json.MessagesJson;
import com.clust.sdk.models.MessagesRequestBody;
import okhttp3.MediaType;
import okhttp3.Request;
import okhttp3.RequestBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Builds OkHttp requests for the Messages API endpoint.
 *
 * <p>The factory only shapes the request; executing it, and retrying, is the caller's job.</p>
 *
 * <pre>{@code
 * MessagesRequestFactory factory = new MessagesRequestFactory(ClaudeApiConfig.fromEnvironment());
 * try (Response response = httpClient.newCall(factory.create(body)).execute()) {
 *     if (!response.isSuccessful()) {
 *         throw ApiErrors.fromResponse(response);
 *     }
 *     MessagesResponseBody result = MessagesJson.decode(response.body().string(), MessagesResponseBody.class);
 * }
 * }</pre>
 */
public class MessagesRequestFactory {

    private static final Logger logger = LoggerFactory.getLogger(MessagesRequestFactory.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    public static final String MESSAGES_PATH = "/v1/messages";

    static final String API_KEY_HEADER = "x-api-key";
    static final String VERSION_HEADER = "anthropic-version";
    static final String BETA_HEADER = "anthropic-beta";

    private final ClaudeApiConfig config;

    public MessagesRequestFactory(ClaudeApiConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Creates a {@code POST /v1/messages} request carrying the given body.
     */
    public Request create(MessagesRequestBody body) {
        Objects.requireNonNull(body, "body must not be null");
        String json = MessagesJson.encode(body);

        Request.Builder requestBuilder = new Request.Builder()
                .url(config.getBaseUrl() + MESSAGES_PATH)
                .header(API_KEY_HEADER, config.getApiKey())
                .header(VERSION_HEADER, config.getApiVersion())
                .header("Content-Type", "application/json")
                .header("Accept", body.isStreaming() ? "text/event-stream" : "application/json")
                .post(RequestBody.create(json, JSON));

        if (!config.getBetas().isEmpty()) {
            requestBuilder.header(BETA_HEADER, String.join(",", config.getBetas()));
        }

        logger.debug("Built messages request for model {} (stream={})", body.getModel(), body.isStreaming());
        return requestBuilder.build();
    }
}
