package br.edu.ifba.exception;

/**
 * The text-analysis capability returned content that does not match the
 * shape expected by the current extraction stage.
 */
public class ExtractionParseException extends ScholarGraphException {

    private static final long serialVersionUID = 1L;

    public ExtractionParseException(final String message) {
        super(message);
    }

    public ExtractionParseException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
