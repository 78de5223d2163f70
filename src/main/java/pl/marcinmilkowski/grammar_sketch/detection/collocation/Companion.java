package pl.marcinmilkowski.grammar_sketch.detection.collocation;

/**
 * A required companion of the verb. {@code lemma} is null for the reflexive
 * pronoun (any person) and for a noun slot that accepts any noun.
 */
public record Companion(CompanionRole role, String lemma) {
}
