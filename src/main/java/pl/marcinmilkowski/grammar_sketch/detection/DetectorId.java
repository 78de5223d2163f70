package pl.marcinmilkowski.grammar_sketch.detection;

/**
 * Stable identifiers of the detector families. The engine keys its registry
 * by these values.
 */
public enum DetectorId {
    COLLOCATION("collocation"),
    SUBORDINATE_CLAUSE("subordinate-clause"),
    SEPARABLE_VERB("separable-verb"),
    AGREEMENT("agreement"),
    WORD_ORDER("word-order"),
    PASSIVE("passive"),
    CAUSATIVE("causative"),
    TENSE("tense"),
    CASE("case"),
    PREPOSITION("preposition"),
    MODAL_VERB("modal-verb"),
    REFLEXIVE_VERB("reflexive-verb"),
    MOOD("mood"),
    CONDITIONAL("conditional"),
    EXTENDED_ADJECTIVE("extended-adjective");

    private final String key;

    DetectorId(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
