package pl.marcinmilkowski.grammar_sketch.detection.collocation;

import pl.marcinmilkowski.grammar_sketch.model.Sentence.Token;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * A full match of one definition: the content verb plus every required
 * companion. The overall tier and confidence are those of the weakest role.
 */
public record CollocationMatch(CollocationDefinition definition, Token verb, List<RoleMatch> roles) {

    public CollocationMatch {
        if (roles == null || roles.isEmpty()) {
            throw new IllegalArgumentException("A collocation match needs at least one companion");
        }
        roles = List.copyOf(roles);
    }

    public MatchTier tier() {
        MatchTier weakest = MatchTier.STRICT;
        for (RoleMatch role : roles) {
            if (role.tier().compareTo(weakest) > 0) {
                weakest = role.tier();
            }
        }
        return weakest;
    }

    public double confidence() {
        double min = 1.0;
        for (RoleMatch role : roles) {
            min = Math.min(min, role.confidence());
        }
        return min;
    }

    /**
     * Verb and companions in sentence order.
     */
    public List<Token> tokens() {
        List<Token> tokens = new ArrayList<>();
        tokens.add(verb);
        for (RoleMatch role : roles) {
            tokens.add(role.token());
        }
        tokens.sort(Comparator.comparingInt(Token::index));
        return tokens;
    }

    /**
     * Identity used to collapse matches reached from different candidate verbs.
     */
    public String key() {
        StringBuilder sb = new StringBuilder(definition.id());
        for (Token token : tokens()) {
            sb.append(':').append(token.index());
        }
        return sb.toString();
    }
}
