package pl.marcinmilkowski.grammar_sketch.detection.clause;

import pl.marcinmilkowski.grammar_sketch.model.Sentence.Token;

/**
 * The verb heading a subordinate clause, with the auxiliary or modal that
 * completes a compound form ("gegangen ist", "kommen muss").
 *
 * @param auxiliaryPosition list position of the auxiliary, or -1
 */
public record ClauseVerb(int position, Token token, int auxiliaryPosition, Token auxiliary) {

    public boolean isCompound() {
        return auxiliary != null;
    }

    /** Last list position belonging to the verb complex. */
    public int lastPosition() {
        return Math.max(position, auxiliaryPosition);
    }
}
