package pl.marcinmilkowski.grammar_sketch.detection.clause;

/**
 * What kind of token introduces a subordinate clause.
 */
public enum MarkerKind {
    SUBORDINATING_CONJUNCTION,
    RELATIVE_PRONOUN,
    INFINITIVE_MARKER
}
