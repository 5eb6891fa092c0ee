package br.edu.ifba.exception;

/**
 * Timeout, rate limit or server-side failure reported by the text-analysis
 * capability.
 *
 * <p>{@link #isRetryable()} tells whether repeating the same request can
 * succeed (429, 5xx, timeouts). Papers failed by either kind can be
 * re-ingested through the reprocessing operation.</p>
 */
public class ExternalServiceException extends ScholarGraphException {

    private static final long serialVersionUID = 1L;

    private final int status;
    private final boolean retryable;

    public ExternalServiceException(final String message, final int status, final boolean retryable) {
        super(message);
        this.status = status;
        this.retryable = retryable;
    }

    public ExternalServiceException(final String message, final Throwable cause) {
        super(message, cause);
        this.status = -1;
        this.retryable = true;
    }

    /**
     * @return HTTP status of the failed call, or -1 when no response was received
     */
    public int getStatus() {
        return status;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
