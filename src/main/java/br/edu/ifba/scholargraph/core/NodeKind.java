package br.edu.ifba.scholargraph.core;

import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonValue;

import br.edu.ifba.exception.ValidationException;

/**
 * Closed set of node kinds stored in the graph.
 */
public enum NodeKind {
    PAPER("paper"),
    CONCEPT("concept"),
    METHOD("method"),
    DATASET("dataset"),
    METRIC("metric"),
    AUTHOR("author"),
    TECHNIQUE("technique"),
    APPLICATION("application"),
    CHALLENGE("challenge"),
    RESULT("result");

    private final String value;

    NodeKind(String value) {
        this.value = value;
    }

    /**
     * @return the value persisted in the {@code nodes.kind} column and used by the extractor
     */
    @JsonValue
    public String value() {
        return value;
    }

    public static Optional<NodeKind> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        for (NodeKind kind : values()) {
            if (kind.value.equalsIgnoreCase(trimmed)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    /**
     * Parses a persisted or caller-supplied kind.
     *
     * @throws ValidationException when the value is not a known node kind
     */
    public static NodeKind require(String value) {
        return fromValue(value)
                .orElseThrow(() -> new ValidationException("Unknown node kind: " + value));
    }
}
