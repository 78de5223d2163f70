package pl.marcinmilkowski.grammar_sketch.detection;

import pl.marcinmilkowski.grammar_sketch.model.Sentence.Token;

/**
 * Reads morphological features from a token's feature map. Absent features
 * come back as {@link #UNKNOWN}.
 */
public final class Morphology {

    public static final String UNKNOWN = "unknown";

    private Morphology() {
    }

    public static String caseOf(Token token) {
        return valueOr(token, "Case");
    }

    public static String genderOf(Token token) {
        return valueOr(token, "Gender");
    }

    public static String numberOf(Token token) {
        return valueOr(token, "Number");
    }

    public static String tenseOf(Token token) {
        return valueOr(token, "Tense");
    }

    public static String moodOf(Token token) {
        return valueOr(token, "Mood");
    }

    public static String personOf(Token token) {
        return valueOr(token, "Person");
    }

    public static String verbFormOf(Token token) {
        return valueOr(token, "VerbForm");
    }

    public static boolean has(Token token, String feature, String value) {
        return value.equals(token.feature(feature));
    }

    public static boolean isKnown(String value) {
        return value != null && !UNKNOWN.equals(value);
    }

    public static boolean isReflexive(Token token) {
        return has(token, "Reflex", "Yes");
    }

    private static String valueOr(Token token, String feature) {
        String value = token.feature(feature);
        return value == null || value.isEmpty() ? UNKNOWN : value;
    }
}
