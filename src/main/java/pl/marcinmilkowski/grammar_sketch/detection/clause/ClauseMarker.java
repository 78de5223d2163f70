package pl.marcinmilkowski.grammar_sketch.detection.clause;

import pl.marcinmilkowski.grammar_sketch.model.Sentence.Token;

/**
 * A clause-introducing token and its list position in the sentence.
 */
public record ClauseMarker(int position, Token token, MarkerKind kind) {

    public String lemma() {
        return token.lowerLemma();
    }
}
