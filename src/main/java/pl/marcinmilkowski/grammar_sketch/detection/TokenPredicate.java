package pl.marcinmilkowski.grammar_sketch.detection;

import pl.marcinmilkowski.grammar_sketch.model.Sentence.Token;

/**
 * Functional interface for token tests used by the forward/backward scans
 * in {@link TokenClassifier}.
 */
@FunctionalInterface
public interface TokenPredicate {
    boolean test(Token token);

    default TokenPredicate and(TokenPredicate other) {
        return token -> this.test(token) && other.test(token);
    }
}
