package pl.marcinmilkowski.grammar_sketch.detection.clause;

/**
 * Clause extent as inclusive list positions and the matching character range.
 */
public record ClauseBoundary(int start, int end, int startChar, int endChar) {

    /**
     * True if {@code other} lies within this range and the ranges differ.
     */
    public boolean properlyContains(ClauseBoundary other) {
        boolean within = startChar <= other.startChar && other.endChar <= endChar;
        boolean same = startChar == other.startChar && endChar == other.endChar;
        return within && !same;
    }
}
