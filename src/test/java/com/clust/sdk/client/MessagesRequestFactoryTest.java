package com.clust.sdk.client;

import com.clust.sdk.exceptions.ApiErrors;
import com.clust.sdk.exceptions.ClaudeException;
import com.clust.sdk.exceptions.NotFoundException;
import com.clust.sdk.exceptions.RateLimitException;
import com.clust.sdk.json.MessagesJson;
import com.clust.sdk.models.ClaudeModel;
import com.clust.sdk.models.Message;
import com.clust.sdk.models.MessagesRequestBody;
import com.clust.sdk.models.MessagesResponseBody;
import com.clust.sdk.models.StopReason;
import com.clust.sdk.models.StreamOption;
import com.clust.sdk.streaming.StreamChunk;
import com.clust.sdk.streaming.StreamChunks;
import com.clust.sdk.streaming.StreamHandler;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.*;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MessagesRequestFactoryTest {

    private MockWebServer mockServer;
    private OkHttpClient httpClient;
    private MessagesRequestFactory factory;

    @BeforeEach
    void setUp() throws IOException {
        mockServer = new MockWebServer();
        mockServer.start();

        httpClient = new OkHttpClient();
        factory = new MessagesRequestFactory(ClaudeApiConfig.builder()
                .baseUrl(mockServer.url("/").toString())
                .apiKey("test-api-key")
                .betas(List.of("beta-a", "beta-b"))
                .build());
    }

    @AfterEach
    void tearDown() throws IOException {
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
        mockServer.shutdown();
    }

    private static String loadStream(String name) throws IOException {
        try (InputStream in = MessagesRequestFactoryTest.class.getResourceAsStream("/streams/" + name)) {
            assertNotNull(in, "missing fixture " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static MessagesRequestBody requestBody(StreamOption stream) {
        return MessagesRequestBody.builder()
                .model(ClaudeModel.CLAUDE_3_HAIKU_20240307)
                .addMessage(Message.user("Hello!"))
                .maxTokens(256)
                .stream(stream)
                .build();
    }

    @Test
    void testCreateRequest() {
        Request request = factory.create(requestBody(StreamOption.RETURN_ONCE));

        assertEquals("POST", request.method());
        assertEquals(mockServer.url("/v1/messages"), request.url());
        assertEquals("test-api-key", request.header("x-api-key"));
        assertEquals("2023-06-01", request.header("anthropic-version"));
        assertEquals("beta-a,beta-b", request.header("anthropic-beta"));
        assertEquals("application/json", request.header("Accept"));
    }

    @Test
    void testSendMessage() throws Exception {
        String responseJson = "{\"id\":\"msg_1\",\"type\":\"message\",\"role\":\"assistant\","
                + "\"content\":[{\"type\":\"text\",\"text\":\"Hello! How can I help you?\"}],"
                + "\"model\":\"claude-3-haiku-20240307\",\"stop_reason\":\"end_turn\",\"stop_sequence\":null,"
                + "\"usage\":{\"input_tokens\":9,\"output_tokens\":10}}";
        mockServer.enqueue(new MockResponse()
                .setBody(responseJson)
                .setHeader("Content-Type", "application/json"));

        MessagesRequestBody body = requestBody(null);
        MessagesResponseBody result;
        try (Response response = httpClient.newCall(factory.create(body)).execute()) {
            assertTrue(response.isSuccessful());
            result = MessagesJson.decode(response.body().string(), MessagesResponseBody.class);
        }

        assertEquals("msg_1", result.getId());
        assertEquals(StopReason.END_TURN, result.getStopReason());
        assertEquals("Hello! How can I help you?", result.getContent().flattenIntoText());

        RecordedRequest request = mockServer.takeRequest();
        assertEquals("POST", request.getMethod());
        assertEquals("/v1/messages", request.getPath());
        assertEquals("test-api-key", request.getHeader("x-api-key"));
        assertEquals("2023-06-01", request.getHeader("anthropic-version"));
        assertTrue(request.getHeader("Content-Type").startsWith("application/json"));
        assertEquals(body, MessagesJson.decode(request.getBody().readUtf8(), MessagesRequestBody.class));
    }

    @Test
    void testStreamMessage() throws Exception {
        mockServer.enqueue(new MockResponse()
                .setBody(loadStream("hello.txt"))
                .setHeader("Content-Type", "text/event-stream"));

        StringBuilder text = new StringBuilder();
        StreamHandler handler = new StreamHandler() {
            @Override
            public void onTextDelta(int index, String delta) {
                text.append(delta);
            }
        };

        List<StreamChunk> chunks;
        try (Response response = httpClient.newCall(factory.create(requestBody(StreamOption.RETURN_STREAM))).execute()) {
            chunks = StreamChunks.parseAll(response.body().string());
        }
        chunks.forEach(handler::handle);

        assertEquals(8, chunks.size());
        assertEquals("Hello!", text.toString());

        RecordedRequest request = mockServer.takeRequest();
        assertEquals("text/event-stream", request.getHeader("Accept"));
        assertTrue(request.getBody().readUtf8().contains("\"stream\":true"));
    }

    @Test
    void testNotFoundError() throws Exception {
        mockServer.enqueue(new MockResponse()
                .setResponseCode(404)
                .setHeader("request-id", "req_404")
                .setBody("{\"type\":\"error\",\"error\":{\"type\":\"not_found_error\",\"message\":\"model: claude-9\"}}"));

        ClaudeException ex;
        try (Response response = httpClient.newCall(factory.create(requestBody(null))).execute()) {
            ex = ApiErrors.fromResponse(response);
        }

        NotFoundException notFound = assertInstanceOf(NotFoundException.class, ex);
        assertEquals(404, notFound.getStatusCode());
        assertEquals("model: claude-9", notFound.getMessage());
        assertEquals("req_404", notFound.getRequestId());
    }

    @Test
    void testRateLimitError() throws Exception {
        mockServer.enqueue(new MockResponse()
                .setResponseCode(429)
                .setHeader("retry-after", "30")
                .setBody("{\"type\":\"error\",\"error\":{\"type\":\"rate_limit_error\",\"message\":\"Too many requests\"}}"));

        ClaudeException ex;
        try (Response response = httpClient.newCall(factory.create(requestBody(null))).execute()) {
            ex = ApiErrors.fromResponse(response);
        }

        RateLimitException rateLimit = assertInstanceOf(RateLimitException.class, ex);
        assertEquals(Long.valueOf(30), rateLimit.getRetryAfter());
        assertTrue(rateLimit.isRetryable());
    }
}
