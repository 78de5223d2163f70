package pl.marcinmilkowski.grammar_sketch.model;

import java.util.HashMap;
import java.util.Map;

/**
 * Category a grammar point belongs to. The identifier is the lower-case,
 * hyphenated form used in catalog files and output.
 */
public enum GrammarCategory {
    TENSE("tense"),
    CASE("case"),
    VOICE("voice"),
    MOOD("mood"),
    AGREEMENT("agreement"),
    ARTICLE("article"),
    ADJECTIVE("adjective"),
    PRONOUN("pronoun"),
    PREPOSITION("preposition"),
    CONJUNCTION("conjunction"),
    VERB_FORM("verb-form"),
    WORD_ORDER("word-order"),
    SEPARABLE_VERB("separable-verb"),
    MODAL_VERB("modal-verb"),
    REFLEXIVE_VERB("reflexive-verb"),
    PASSIVE("passive"),
    COLLOCATION("collocation");

    private static final Map<String, GrammarCategory> BY_ID = new HashMap<>();

    static {
        for (GrammarCategory category : values()) {
            BY_ID.put(category.id, category);
        }
    }

    private final String id;

    GrammarCategory(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * @throws IllegalArgumentException for an unknown identifier
     */
    public static GrammarCategory fromId(String id) {
        GrammarCategory category = id == null ? null : BY_ID.get(id.trim().toLowerCase());
        if (category == null) {
            throw new IllegalArgumentException("Unknown grammar category: " + id);
        }
        return category;
    }
}
