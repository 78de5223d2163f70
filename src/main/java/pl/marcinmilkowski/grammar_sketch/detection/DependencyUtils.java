package pl.marcinmilkowski.grammar_sketch.detection;

import pl.marcinmilkowski.grammar_sketch.model.Sentence;
import pl.marcinmilkowski.grammar_sketch.model.Sentence.Token;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Dependency-tree queries over a parsed sentence. All arguments and return
 * values are token {@code index} values, not list positions.
 *
 * <p>Nothing here throws on bad input: an unknown index, a missing head or an
 * ambiguous textual head all come back as "not found".</p>
 */
public final class DependencyUtils {

    private DependencyUtils() {
    }

    /**
     * Resolves the head of the token carrying {@code index}.
     *
     * <p>A numeric head is accepted when a token with that index exists and it
     * is not the token itself (self-reference marks the root). A textual head
     * is accepted only when exactly one other token has that text or lemma.</p>
     */
    public static OptionalInt headIndex(Sentence sentence, int index) {
        Optional<Token> token = sentence.tokenAt(index);
        if (token.isEmpty() || token.get().head() == null) {
            return OptionalInt.empty();
        }
        String head = token.get().head();
        Integer numeric = parseIndex(head);
        if (numeric != null) {
            if (numeric == index || sentence.positionOf(numeric) < 0) {
                return OptionalInt.empty();
            }
            return OptionalInt.of(numeric);
        }
        int found = -1;
        for (Token candidate : sentence.tokens()) {
            if (candidate.index() == index) {
                continue;
            }
            if (head.equals(candidate.text()) || head.equals(candidate.lemma())) {
                if (found >= 0) {
                    return OptionalInt.empty();
                }
                found = candidate.index();
            }
        }
        return found >= 0 ? OptionalInt.of(found) : OptionalInt.empty();
    }

    public static Optional<Token> headToken(Sentence sentence, int index) {
        OptionalInt head = headIndex(sentence, index);
        return head.isPresent() ? sentence.tokenAt(head.getAsInt()) : Optional.empty();
    }

    /**
     * All tokens whose resolved head is {@code head}, in sentence order.
     */
    public static List<Token> children(Sentence sentence, int head) {
        List<Token> result = new ArrayList<>();
        for (Token token : sentence.tokens()) {
            OptionalInt h = headIndex(sentence, token.index());
            if (h.isPresent() && h.getAsInt() == head) {
                result.add(token);
            }
        }
        return result;
    }

    /**
     * Descendants of {@code head} down to {@code maxDepth} levels, breadth first.
     * A visited set guards against cycles in malformed parses.
     */
    public static List<Token> descendants(Sentence sentence, int head, int maxDepth) {
        List<Token> result = new ArrayList<>();
        if (maxDepth <= 0) {
            return result;
        }
        Set<Integer> visited = new HashSet<>();
        visited.add(head);
        List<Integer> frontier = List.of(head);
        for (int depth = 0; depth < maxDepth && !frontier.isEmpty(); depth++) {
            List<Integer> next = new ArrayList<>();
            for (int parent : frontier) {
                for (Token child : children(sentence, parent)) {
                    if (visited.add(child.index())) {
                        result.add(child);
                        next.add(child.index());
                    }
                }
            }
            frontier = next;
        }
        return result;
    }

    /**
     * False if a subordinating conjunction or a comma lies strictly between
     * the two tokens.
     */
    public static boolean inSameClause(Sentence sentence, int a, int b) {
        int lo = Math.min(a, b);
        int hi = Math.max(a, b);
        for (Token token : sentence.tokens()) {
            if (token.index() <= lo) {
                continue;
            }
            if (token.index() >= hi) {
                break;
            }
            if (TokenClassifier.isSubordinatingConjunction(token) || TokenClassifier.isComma(token)) {
                return false;
            }
        }
        return true;
    }

    private static Integer parseIndex(String head) {
        for (int i = 0; i < head.length(); i++) {
            char c = head.charAt(i);
            if (c < '0' || c > '9') {
                if (!(i == 0 && c == '-' && head.length() > 1)) {
                    return null;
                }
            }
        }
        try {
            return Integer.parseInt(head);
        } catch (NumberFormatException e) {
            // too long for an int; not an index
            return null;
        }
    }
}
