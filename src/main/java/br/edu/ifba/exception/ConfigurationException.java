package br.edu.ifba.exception;

/**
 * Required credentials or connection settings are missing. Raised during
 * startup, before any ingestion runs.
 */
public class ConfigurationException extends ScholarGraphException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(final String message) {
        super(message);
    }
}
