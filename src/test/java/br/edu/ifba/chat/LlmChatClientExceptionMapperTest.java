package br.edu.ifba.chat;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import br.edu.ifba.exception.ExternalServiceException;
import jakarta.ws.rs.core.Response;

/**
 * Unit tests for {@link LlmChatClientExceptionMapper}.
 */
class LlmChatClientExceptionMapperTest {

    private LlmChatClientExceptionMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = new LlmChatClientExceptionMapper();
    }

    private static Response response(Response.Status status, String body) {
        Response response = mock(Response.class);
        when(response.getStatus()).thenReturn(status.getStatusCode());
        when(response.getStatusInfo()).thenReturn(status);
        when(response.hasEntity()).thenReturn(body != null);
        when(response.readEntity(String.class)).thenReturn(body);
        return response;
    }

    @Test
    void testRateLimitIsRetryable() {
        ExternalServiceException error = mapper.toThrowable(
            response(Response.Status.TOO_MANY_REQUESTS, "{\"error\":\"slow down\"}"));

        assertNotNull(error);
        assertEquals(429, error.getStatus());
        assertTrue(error.isRetryable());
        assertEquals("LLM API returned 429 Too Many Requests - {\"error\":\"slow down\"}", error.getMessage());
    }

    @Test
    void testServerErrorIsRetryable() {
        ExternalServiceException error = mapper.toThrowable(response(Response.Status.SERVICE_UNAVAILABLE, null));

        assertTrue(error.isRetryable());
        assertEquals("LLM API returned 503 Service Unavailable", error.getMessage());
    }

    @Test
    void testClientErrorIsNotRetryable() {
        ExternalServiceException error = mapper.toThrowable(response(Response.Status.UNAUTHORIZED, "invalid api key"));

        assertFalse(error.isRetryable());
        assertEquals(401, error.getStatus());
    }

    @Test
    void testSuccessIsNotMapped() {
        assertNull(mapper.toThrowable(response(Response.Status.OK, "{}")));
    }

    @Test
    void testRetryableStatuses() {
        assertTrue(LlmChatClientExceptionMapper.isRetryable(408));
        assertTrue(LlmChatClientExceptionMapper.isRetryable(500));
        assertFalse(LlmChatClientExceptionMapper.isRetryable(400));
        assertFalse(LlmChatClientExceptionMapper.isRetryable(404));
    }
}
