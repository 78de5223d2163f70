package pl.marcinmilkowski.grammar_sketch.detection.collocation;

/**
 * Role a companion token plays relative to the collocation's verb.
 */
public enum CompanionRole {
    REFLEXIVE,
    PREPOSITION,
    NOUN,
    PARTICLE
}
