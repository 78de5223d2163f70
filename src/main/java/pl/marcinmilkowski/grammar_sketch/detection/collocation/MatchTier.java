package pl.marcinmilkowski.grammar_sketch.detection.collocation;

/**
 * Matching strategies in the order they are tried. Earlier tiers always
 * score higher than later ones for the same definition.
 */
public enum MatchTier {
    /** Companion is a direct dependent of the verb with an allowed label. */
    STRICT("strict"),
    /** Companion is a descendant of the verb within the same clause. */
    LOOSE("loose"),
    /** Companion is reachable through determiner/modifier/case edges. */
    COLLAPSED("collapsed"),
    /** Companion is close to the verb in the surface string. */
    WINDOW("window");

    private final String label;

    MatchTier(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Base confidence of a match of {@code type} at this tier.
     * {@code extraHops} only affects {@link #COLLAPSED}.
     */
    public double confidence(CollocationType type, int extraHops) {
        return switch (this) {
            case STRICT -> type == CollocationType.REFLEXIVE_PREP ? 0.97
                : type == CollocationType.VERB_NOUN ? 0.93 : 0.95;
            case LOOSE -> type == CollocationType.REFLEXIVE_PREP ? 0.85
                : type == CollocationType.VERB_NOUN ? 0.78 : 0.80;
            case COLLAPSED -> Math.max(0.62, 0.70 - 0.02 * Math.max(0, extraHops));
            case WINDOW -> type == CollocationType.REFLEXIVE_PREP ? 0.60
                : type == CollocationType.VERB_NOUN ? 0.52 : 0.55;
        };
    }
}
