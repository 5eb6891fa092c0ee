package br.edu.ifba.exception;

public class PersistenceException extends ScholarGraphException {

    private static final long serialVersionUID = 1L;

    public PersistenceException(final String message) {
        super(message);
    }

    public PersistenceException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
