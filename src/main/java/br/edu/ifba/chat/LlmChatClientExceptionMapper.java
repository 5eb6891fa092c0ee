package br.edu.ifba.chat;

import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.rest.client.ext.ResponseExceptionMapper;
import org.jboss.logging.Logger;

import br.edu.ifba.exception.ExternalServiceException;

/**
 * Turns error responses of the chat endpoint into {@link ExternalServiceException}.
 * Rate limits (429), request timeouts (408) and server errors (5xx) are retryable.
 */
public class LlmChatClientExceptionMapper implements ResponseExceptionMapper<ExternalServiceException> {

    private static final Logger LOG = Logger.getLogger(LlmChatClientExceptionMapper.class);

    private static final int MAX_BODY_LOG_LENGTH = 500;

    @Override
    public ExternalServiceException toThrowable(Response response) {
        int status = response.getStatus();
        if (status < 400) {
            return null;
        }

        String body = null;
        try {
            if (response.hasEntity()) {
                body = response.readEntity(String.class);
            }
        } catch (Exception e) {
            LOG.warn("Failed to read error response body", e);
        }

        boolean retryable = isRetryable(status);
        LOG.errorf("LLM API returned %d %s (retryable=%s): %s", status,
            response.getStatusInfo().getReasonPhrase(), retryable, truncate(body));

        return new ExternalServiceException(
            "LLM API returned " + status + " " + response.getStatusInfo().getReasonPhrase()
                + (body != null && !body.isBlank() ? " - " + truncate(body) : ""),
            status, retryable);
    }

    static boolean isRetryable(int status) {
        return status == 408 || status == 429 || status >= 500;
    }

    private static String truncate(String body) {
        if (body == null || body.isEmpty()) {
            return "(empty)";
        }
        return body.length() <= MAX_BODY_LOG_LENGTH ? body : body.substring(0, MAX_BODY_LOG_LENGTH) + "...";
    }

    @Override
    public int getPriority() {
        return 4000;
    }
}
