package com.clust.sdk.exceptions;

import com.clust.sdk.models.ApiError;
import com.clust.sdk.models.ApiErrorType;
import com.clust.sdk.models.ErrorResponseBody;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ApiErrorsTest {

    private static String errorBody(String type, String message) {
        return "{\"type\":\"error\",\"error\":{\"type\":\"" + type + "\",\"message\":\"" + message + "\"}}";
    }

    @Test
    void testInvalidRequestError() {
        ClaudeException ex = ApiErrors.fromResponse(400,
                errorBody("invalid_request_error", "max_tokens: Field required"), "req_1");

        assertInstanceOf(InvalidRequestException.class, ex);
        assertEquals(400, ex.getStatusCode());
        assertEquals(ApiErrorType.INVALID_REQUEST_ERROR, ex.getErrorType());
        assertEquals("max_tokens: Field required", ex.getMessage());
        assertEquals("req_1", ex.getRequestId());
        assertFalse(ex.isRetryable());
    }

    @Test
    void testAuthenticationError() {
        ClaudeException ex = ApiErrors.fromResponse(401, errorBody("authentication_error", "invalid x-api-key"), null);

        assertInstanceOf(AuthenticationException.class, ex);
        assertTrue(ex.isUnauthorized());
    }

    @Test
    void testPermissionAndNotFoundErrors() {
        ClaudeException forbidden = ApiErrors.fromResponse(403, errorBody("permission_error", "no access"), null);
        ClaudeException notFound = ApiErrors.fromResponse(404, errorBody("not_found_error", "no such model"), null);

        assertInstanceOf(PermissionException.class, forbidden);
        assertTrue(forbidden.isForbidden());
        assertInstanceOf(NotFoundException.class, notFound);
        assertTrue(notFound.isNotFound());
    }

    @Test
    void testRateLimitError() {
        ClaudeException ex = ApiErrors.fromResponse(429, errorBody("rate_limit_error", "slow down"), null, 30L);

        RateLimitException rateLimit = assertInstanceOf(RateLimitException.class, ex);
        assertTrue(rateLimit.isRateLimited());
        assertTrue(rateLimit.isRetryable());
        assertEquals(Long.valueOf(30), rateLimit.getRetryAfter());
    }

    @Test
    void testServerErrors() {
        ClaudeException api = ApiErrors.fromResponse(500, errorBody("api_error", "internal"), null);
        ClaudeException overloaded = ApiErrors.fromResponse(529, errorBody("overloaded_error", "Overloaded"), null);

        assertInstanceOf(ServerException.class, api);
        assertTrue(api.isServerError());
        assertInstanceOf(OverloadedException.class, overloaded);
        assertTrue(overloaded.isOverloaded());
        assertTrue(overloaded.isRetryable());
    }

    @Test
    void testUndecodableBodyFallsBackToStatus() {
        ClaudeException notFound = ApiErrors.fromResponse(404, "<html>Not Found</html>", null);
        ClaudeException gateway = ApiErrors.fromResponse(502, "", null);
        ClaudeException teapot = ApiErrors.fromResponse(418, "short and stout", null);

        assertInstanceOf(NotFoundException.class, notFound);
        assertEquals("HTTP 404: <html>Not Found</html>", notFound.getMessage());
        assertInstanceOf(ServerException.class, gateway);
        assertEquals(502, gateway.getStatusCode());
        assertEquals("HTTP 502", gateway.getMessage());
        assertEquals(ClaudeException.class, teapot.getClass());
        assertEquals(418, teapot.getStatusCode());
        assertNull(teapot.getErrorType());
    }

    @Test
    void testNullOrIncompleteBodyFallsBackToStatus() {
        ClaudeException nullBody = ApiErrors.fromResponse(500, "null", "r1");
        ClaudeException noError = ApiErrors.fromResponse(529, "{\"type\":\"error\"}", null);

        assertInstanceOf(ServerException.class, nullBody);
        assertEquals(500, nullBody.getStatusCode());
        assertEquals("HTTP 500: null", nullBody.getMessage());
        assertEquals("r1", nullBody.getRequestId());
        assertInstanceOf(OverloadedException.class, noError);
    }

    @Test
    void testUnknownErrorTypeFallsBackToStatus() {
        ClaudeException ex = ApiErrors.fromResponse(400, errorBody("brand_new_error", "new"), null);

        assertInstanceOf(InvalidRequestException.class, ex);
    }

    @Test
    void testFromStreamError() {
        ClaudeException ex = ApiErrors.fromError(
                new ErrorResponseBody(new ApiError(ApiErrorType.API_ERROR, "boom")));

        assertInstanceOf(ServerException.class, ex);
        assertEquals(500, ex.getStatusCode());
        assertEquals("boom", ex.getMessage());
    }

    @Test
    void testToString() {
        ClaudeException ex = ApiErrors.fromResponse(404, errorBody("not_found_error", "missing"), "req_9");

        assertEquals("NotFoundException{statusCode=404, errorType=not_found_error, message='missing', requestId='req_9'}",
                ex.toString());
    }
}
