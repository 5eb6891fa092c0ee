package br.edu.ifba.scholargraph.core;

import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonValue;

import br.edu.ifba.exception.ValidationException;

/**
 * Closed set of directed relationship kinds.
 */
public enum EdgeKind {
    // paper to paper
    CITES("cites"),
    IMPROVES_ON("improves_on"),
    EXTENDS("extends"),
    COMPARES_WITH("compares_with"),
    BUILDS_UPON("builds_upon"),
    CONTRADICTS("contradicts"),
    // paper to concept
    INTRODUCES("introduces"),
    APPLIES("applies"),
    EVALUATES("evaluates"),
    ADDRESSES("addresses"),
    // concept to concept
    RELATED_TO("related_to"),
    ENABLES("enables"),
    REQUIRES("requires"),
    ALTERNATIVE_TO("alternative_to"),
    GENERALIZES("generalizes"),
    SPECIALIZES("specializes"),
    // method to method
    OUTPERFORMS("outperforms"),
    COMBINES_WITH("combines_with"),
    REPLACES("replaces"),
    // other
    AUTHORED_BY("authored_by"),
    USES_DATASET("uses_dataset"),
    MEASURES_WITH("measures_with"),
    SOLVES("solves"),
    INSPIRED_BY("inspired_by");

    private final String value;

    EdgeKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static Optional<EdgeKind> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        for (EdgeKind kind : values()) {
            if (kind.value.equalsIgnoreCase(trimmed)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    /**
     * Parses a persisted or caller-supplied kind.
     *
     * @throws ValidationException when the value is not a known edge kind
     */
    public static EdgeKind require(String value) {
        return fromValue(value)
                .orElseThrow(() -> new ValidationException("Unknown edge kind: " + value));
    }
}
