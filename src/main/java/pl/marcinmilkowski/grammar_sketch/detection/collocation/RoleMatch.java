package pl.marcinmilkowski.grammar_sketch.detection.collocation;

import pl.marcinmilkowski.grammar_sketch.model.Sentence.Token;

import java.util.List;

/**
 * Where one companion was found and how.
 *
 * @param path dependency labels from the verb down to the companion; empty for window matches
 * @param confidence tier confidence for this role alone
 */
public record RoleMatch(Companion companion, Token token, MatchTier tier, List<String> path, double confidence) {
    public RoleMatch {
        path = path == null ? List.of() : List.copyOf(path);
    }
}
