package pl.marcinmilkowski.grammar_sketch.detection.collocation;

/**
 * The four shapes a collocation definition can take.
 */
public enum CollocationType {
    REFLEXIVE_PREP("reflexive-prep"),
    VERB_PREP("verb-prep"),
    VERB_NOUN("verb-noun"),
    SEPARABLE("separable");

    private final String id;

    CollocationType(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * @throws IllegalArgumentException for an unknown type identifier
     */
    public static CollocationType fromId(String id) {
        for (CollocationType type : values()) {
            if (type.id.equals(id)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown collocation type: " + id);
    }
}
