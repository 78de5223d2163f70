package pl.marcinmilkowski.grammar_sketch.detection;

import pl.marcinmilkowski.grammar_sketch.model.DetectionResult.Position;
import pl.marcinmilkowski.grammar_sketch.model.Sentence;
import pl.marcinmilkowski.grammar_sketch.model.Sentence.Token;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Maps tokens to character ranges in the sentence text.
 */
public final class Positions {

    private Positions() {
    }

    public static Position of(Token token) {
        return new Position(token.characterStart(), token.characterEnd());
    }

    /**
     * One range from the first token's start to the last token's end.
     */
    public static Position span(Token first, Token last) {
        return new Position(first.characterStart(), last.characterEnd());
    }

    /**
     * One range per token, in the given order, for non-contiguous highlighting.
     */
    public static List<Position> each(Collection<Token> tokens) {
        List<Position> result = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            result.add(of(token));
        }
        return result;
    }

    /**
     * Tokens at list positions {@code from..to} (inclusive) joined with spaces.
     */
    public static String rangeText(Sentence sentence, int from, int to) {
        StringBuilder sb = new StringBuilder();
        for (int p = Math.max(0, from); p <= to && p < sentence.tokenCount(); p++) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(sentence.getToken(p).text());
        }
        return sb.toString();
    }

    /**
     * Exact source substring covered by a range, or null if it falls outside the text.
     */
    public static String substring(Sentence sentence, Position position) {
        if (position.end() > sentence.text().length()) {
            return null;
        }
        return sentence.text().substring(position.start(), position.end());
    }
}
