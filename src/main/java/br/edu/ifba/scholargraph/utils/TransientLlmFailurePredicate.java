package br.edu.ifba.scholargraph.utils;

import java.net.SocketTimeoutException;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import br.edu.ifba.exception.ExternalServiceException;
import jakarta.ws.rs.ProcessingException;

/**
 * Decides whether a failed call to the text-analysis capability is worth
 * retrying.
 *
 * <p>Retries on:</p>
 * <ul>
 *   <li>{@link ExternalServiceException} flagged retryable (429, 408, 5xx, no response)</li>
 *   <li>client-side I/O failures ({@link ProcessingException}) and timeouts</li>
 * </ul>
 * <p>Everything else, including other 4xx responses, fails immediately.</p>
 *
 * <pre>{@code
 * @Retry(maxRetries = 3, delay = 1000)
 * @RetryWhen(exception = TransientLlmFailurePredicate.class)
 * public CompletableFuture<Response> apply(Request request) { ... }
 * }</pre>
 */
public final class TransientLlmFailurePredicate implements Predicate<Throwable> {

    private static final Logger logger = LoggerFactory.getLogger(TransientLlmFailurePredicate.class);

    @Override
    public boolean test(final Throwable throwable) {
        Throwable current = throwable;
        int depth = 0;
        while (current != null && depth++ < 10) {
            if (current instanceof ExternalServiceException external) {
                logger.debug("LLM failure (status {}) retryable={}", external.getStatus(), external.isRetryable());
                return external.isRetryable();
            }
            if (current instanceof ProcessingException
                    || current instanceof TimeoutException
                    || current instanceof org.eclipse.microprofile.faulttolerance.exceptions.TimeoutException
                    || current instanceof SocketTimeoutException) {
                logger.debug("Transient LLM transport failure: {}", current.getMessage());
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }
}
