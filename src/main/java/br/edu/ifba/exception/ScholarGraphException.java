package br.edu.ifba.exception;

/**
 * Base type for every failure raised by the ingestion engine.
 */
public class ScholarGraphException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ScholarGraphException(final String message) {
        super(message);
    }

    public ScholarGraphException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
