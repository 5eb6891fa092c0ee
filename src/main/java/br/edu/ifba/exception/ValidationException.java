package br.edu.ifba.exception;

/**
 * Malformed input to a store or pipeline operation. Fatal to that call only.
 */
public class ValidationException extends ScholarGraphException {

    private static final long serialVersionUID = 1L;

    public ValidationException(final String message) {
        super(message);
    }
}
