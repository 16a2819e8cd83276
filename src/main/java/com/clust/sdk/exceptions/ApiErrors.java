package com.clust.sdk.exceptions;

import com.clust.sdk.json.MessagesJson;
import com.clust.sdk.models.ApiError;
import com.clust.sdk.models.ApiErrorType;
import com.clust.sdk.models.ErrorResponseBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Maps API error replies to {@link ClaudeException} subclasses.
 *
 * <p>The error type in the body decides the exception; the HTTP status is used when the
 * body cannot be decoded. Sending the request and reading the reply is left to the caller.</p>
 */
public final class ApiErrors {

    private static final Logger logger = LoggerFactory.getLogger(ApiErrors.class);

    static final String REQUEST_ID_HEADER = "request-id";
    static final String RETRY_AFTER_HEADER = "retry-after";

    private ApiErrors() {}

    /**
     * Maps a failed OkHttp response, consuming its body.
     */
    public static ClaudeException fromResponse(Response response) throws IOException {
        String body;
        try (ResponseBody responseBody = response.body()) {
            body = responseBody != null ? responseBody.string() : "";
        }
        return fromResponse(response.code(), body, response.header(REQUEST_ID_HEADER),
                parseRetryAfter(response.header(RETRY_AFTER_HEADER)));
    }

    /**
     * Maps an error reply given its status code and raw body.
     */
    public static ClaudeException fromResponse(int statusCode, String body, String requestId) {
        return fromResponse(statusCode, body, requestId, null);
    }

    static ClaudeException fromResponse(int statusCode, String body, String requestId, Long retryAfter) {
        ApiError error = null;
        if (body != null && !body.isBlank()) {
            try {
                ErrorResponseBody decoded = MessagesJson.decode(body, ErrorResponseBody.class);
                error = decoded.getError();
            } catch (DecodingException e) {
                logger.debug("Error body for status {} is not an API error object: {}", statusCode, e.getMessage());
            }
        }
        if (error == null || error.getType() == null) {
            String message = error != null && error.getMessage() != null ? error.getMessage() : fallbackMessage(statusCode, body);
            error = new ApiError(typeForStatus(statusCode), message);
        }
        return toException(statusCode, error, requestId, retryAfter);
    }

    /**
     * Maps a decoded error object, such as an {@code error} event received inside a stream.
     */
    public static ClaudeException fromError(ErrorResponseBody body) {
        ApiError error = body.getError();
        int statusCode = error.getType() != null ? error.getType().getStatusCode() : 0;
        return toException(statusCode, error, null, null);
    }

    private static ClaudeException toException(int statusCode, ApiError error, String requestId, Long retryAfter) {
        if (error.getType() == null) {
            if (statusCode >= 500) {
                return new ServerException(statusCode, error, requestId);
            }
            return new ClaudeException(statusCode, error, requestId);
        }
        switch (error.getType()) {
            case INVALID_REQUEST_ERROR:
                return new InvalidRequestException(error, requestId);
            case AUTHENTICATION_ERROR:
                return new AuthenticationException(error, requestId);
            case PERMISSION_ERROR:
                return new PermissionException(error, requestId);
            case NOT_FOUND_ERROR:
                return new NotFoundException(error, requestId);
            case RATE_LIMIT_ERROR:
                return new RateLimitException(error, requestId, retryAfter);
            case OVERLOADED_ERROR:
                return new OverloadedException(error, requestId);
            case API_ERROR:
            default:
                return new ServerException(statusCode >= 500 ? statusCode : 500, error, requestId);
        }
    }

    private static ApiErrorType typeForStatus(int statusCode) {
        for (ApiErrorType type : ApiErrorType.values()) {
            if (type.getStatusCode() == statusCode) {
                return type;
            }
        }
        return null;
    }

    private static String fallbackMessage(int statusCode, String body) {
        if (body == null || body.isBlank()) {
            return "HTTP " + statusCode;
        }
        return "HTTP " + statusCode + ": " + body;
    }

    private static Long parseRetryAfter(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.debug("Ignoring non-numeric retry-after header: {}", value);
            return null;
        }
    }
}
