package br.edu.ifba.scholargraph.core;

/**
 * Confidence scores live in {@code [0, 1]}.
 */
public final class Confidence {

    public static final double DEFAULT = 0.5;

    private Confidence() {
    }

    public static double clamp(double value) {
        if (Double.isNaN(value)) {
            return DEFAULT;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
