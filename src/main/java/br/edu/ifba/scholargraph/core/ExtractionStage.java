package br.edu.ifba.scholargraph.core;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Units of work recorded in the extraction audit log.
 */
public enum ExtractionStage {
    ENTITY("entity"),
    RELATIONSHIP("relationship"),
    VALIDATION("validation"),
    PIPELINE("pipeline");

    private final String value;

    ExtractionStage(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static ExtractionStage fromValue(String value) {
        for (ExtractionStage stage : values()) {
            if (stage.value.equals(value)) {
                return stage;
            }
        }
        throw new IllegalArgumentException("Unknown extraction stage: " + value);
    }
}
