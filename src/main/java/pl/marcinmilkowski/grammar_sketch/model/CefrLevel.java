package pl.marcinmilkowski.grammar_sketch.model;

import java.util.Locale;

/**
 * CEFR proficiency levels, ordered from beginner to mastery.
 */
public enum CefrLevel {
    A1, A2, B1, B2, C1, C2;

    /**
     * Parses a level label such as {@code "b1"} or {@code "B1"}.
     *
     * @throws IllegalArgumentException if the label is not a CEFR level
     */
    public static CefrLevel parse(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Missing CEFR level");
        }
        try {
            return valueOf(label.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown CEFR level: " + label, e);
        }
    }

    public boolean atMost(CefrLevel other) {
        return compareTo(other) <= 0;
    }
}
