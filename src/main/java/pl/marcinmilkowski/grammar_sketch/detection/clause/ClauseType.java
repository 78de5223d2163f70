package pl.marcinmilkowski.grammar_sketch.detection.clause;

import java.util.Map;

/**
 * Syntactic clause type, derived from the marker kind, and the lookup of
 * the clause's semantic function by marker lemma.
 */
public enum ClauseType {
    COMPLETIVE("completive"),
    ADVERBIAL("adverbial"),
    RELATIVE("relative"),
    INFINITIVE("infinitive");

    private static final Map<String, String> CONJUNCTION_FUNCTIONS = Map.ofEntries(
        Map.entry("dass", "completive"),
        Map.entry("ob", "interrogative"),
        Map.entry("weil", "causal"),
        Map.entry("da", "causal"),
        Map.entry("wenn", "conditional"),
        Map.entry("falls", "conditional"),
        Map.entry("sofern", "conditional"),
        Map.entry("obwohl", "concessive"),
        Map.entry("obgleich", "concessive"),
        Map.entry("obschon", "concessive"),
        Map.entry("als", "temporal"),
        Map.entry("nachdem", "temporal"),
        Map.entry("bevor", "temporal"),
        Map.entry("während", "temporal"),
        Map.entry("bis", "temporal"),
        Map.entry("seit", "temporal"),
        Map.entry("sobald", "temporal"),
        Map.entry("sooft", "temporal"),
        Map.entry("damit", "purpose"),
        Map.entry("sodass", "result"),
        Map.entry("indem", "modal"));

    private static final Map<String, String> INFINITIVE_FUNCTIONS = Map.of(
        "um", "purpose",
        "ohne", "manner",
        "statt", "alternative",
        "anstatt", "alternative");

    private final String label;

    ClauseType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static ClauseType of(ClauseMarker marker) {
        return switch (marker.kind()) {
            case RELATIVE_PRONOUN -> RELATIVE;
            case INFINITIVE_MARKER -> INFINITIVE;
            case SUBORDINATING_CONJUNCTION ->
                "dass".equals(marker.lemma()) || "ob".equals(marker.lemma()) ? COMPLETIVE : ADVERBIAL;
        };
    }

    /**
     * Semantic function such as "causal" or "attributive".
     */
    public static String functionOf(ClauseMarker marker) {
        return switch (marker.kind()) {
            case RELATIVE_PRONOUN -> "attributive";
            case INFINITIVE_MARKER -> INFINITIVE_FUNCTIONS.getOrDefault(marker.lemma(), "infinitive");
            case SUBORDINATING_CONJUNCTION -> CONJUNCTION_FUNCTIONS.getOrDefault(marker.lemma(), "subordinate");
        };
    }

    static boolean isConjunctionMarker(String lemma) {
        return CONJUNCTION_FUNCTIONS.containsKey(lemma);
    }

    static boolean isInfinitiveMarker(String lemma) {
        return INFINITIVE_FUNCTIONS.containsKey(lemma);
    }
}
