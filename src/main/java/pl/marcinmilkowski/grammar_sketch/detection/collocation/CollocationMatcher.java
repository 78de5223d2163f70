package pl.marcinmilkowski.grammar_sketch.detection.collocation;

import pl.marcinmilkowski.grammar_sketch.detection.DependencyUtils;
import pl.marcinmilkowski.grammar_sketch.detection.TokenClassifier;
import pl.marcinmilkowski.grammar_sketch.model.Sentence;
import pl.marcinmilkowski.grammar_sketch.model.Sentence.Token;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Matches collocation definitions against a dependency tree.
 *
 * <p>For every verb whose lemma fits the definition, each companion is
 * searched with a cascade of tiers: a direct dependent with an allowed label
 * (strict), any same-clause descendant within {@code maxDepth} (loose), a
 * path that may run through determiner/modifier/case edges for free
 * (collapsed), and finally a same-clause token near the verb (window).</p>
 */
public class CollocationMatcher {

    /** Edges a collapsed path crosses without cost. */
    static final Set<String> IGNORABLE_LABELS = Set.of("det", "amod", "case", "compound", "nk");

    /**
     * All matches of {@code definition} in {@code sentence}, one per distinct
     * token set.
     */
    public List<CollocationMatch> match(Sentence sentence, CollocationDefinition definition, MatchTraceSink sink) {
        Map<String, CollocationMatch> matches = new LinkedHashMap<>();
        for (Token candidate : sentence.tokens()) {
            if (!TokenClassifier.isVerbOrAux(candidate) || !verbMatches(candidate, definition)) {
                continue;
            }
            Token verb = canonicalVerb(sentence, candidate);
            Optional<CollocationMatch> match = matchAt(sentence, definition, candidate, verb, sink);
            if (match.isEmpty()) {
                continue;
            }
            String key = match.get().key();
            if (matches.containsKey(key)) {
                sink.accept(MatchTrace.attempt(definition, candidate.index(), verb.index(), MatchTrace.Event.DUPLICATE));
            } else {
                matches.put(key, match.get());
            }
        }
        return new ArrayList<>(matches.values());
    }

    private Optional<CollocationMatch> matchAt(Sentence sentence, CollocationDefinition definition,
                                               Token candidate, Token verb, MatchTraceSink sink) {
        Set<Integer> used = new HashSet<>();
        used.add(candidate.index());
        used.add(verb.index());
        List<RoleMatch> roles = new ArrayList<>();
        for (Companion companion : definition.companions()) {
            if (companion.role() == CompanionRole.PARTICLE && !particleDetached(candidate, verb, companion.lemma())) {
                sink.accept(new MatchTrace(definition.id(), candidate.index(), verb.index(),
                    MatchTrace.Event.ROLE_NOT_REQUIRED, companion.role(), null, -1));
                continue;
            }
            Optional<RoleMatch> found = findCompanion(sentence, definition, verb, companion, used);
            if (found.isEmpty()) {
                sink.accept(new MatchTrace(definition.id(), candidate.index(), verb.index(),
                    MatchTrace.Event.ROLE_MISSING, companion.role(), null, -1));
                return Optional.empty();
            }
            RoleMatch role = found.get();
            sink.accept(new MatchTrace(definition.id(), candidate.index(), verb.index(),
                MatchTrace.Event.ROLE_FOUND, companion.role(), role.tier(), role.token().index()));
            used.add(role.token().index());
            roles.add(role);
        }
        if (roles.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new CollocationMatch(definition, verb, roles));
    }

    /**
     * Candidate verbs match the definition's lemma leniently; a separable
     * definition also accepts the bare stem ("bereiten" for "vorbereiten").
     */
    static boolean verbMatches(Token token, CollocationDefinition definition) {
        if (LemmaMatcher.matches(token.lemma(), definition.verbLemma())) {
            return true;
        }
        String base = definition.baseLemma();
        return base != null && LemmaMatcher.matches(token.lemma(), base);
    }

    /**
     * An auxiliary or modal governed by a main verb is replaced by that verb,
     * so "kann ... erinnern" is matched on "erinnern".
     */
    static Token canonicalVerb(Sentence sentence, Token token) {
        if (!TokenClassifier.isAuxiliary(token)) {
            return token;
        }
        Optional<Token> head = DependencyUtils.headToken(sentence, token.index());
        if (head.isPresent() && "VERB".equals(head.get().pos())) {
            return head.get();
        }
        return token;
    }

    private static boolean particleDetached(Token candidate, Token verb, String particle) {
        String prefix = particle.toLowerCase();
        return !candidate.lowerText().startsWith(prefix) && !verb.lowerText().startsWith(prefix);
    }

    Optional<RoleMatch> findCompanion(Sentence sentence, CollocationDefinition definition, Token verb,
                                      Companion companion, Set<Integer> used) {
        Optional<RoleMatch> match = strict(sentence, definition, verb, companion, used);
        if (match.isEmpty()) {
            match = loose(sentence, definition, verb, companion, used);
        }
        if (match.isEmpty()) {
            match = collapsed(sentence, definition, verb, companion, used);
        }
        if (match.isEmpty()) {
            match = window(sentence, definition, verb, companion, used);
        }
        return match;
    }

    private Optional<RoleMatch> strict(Sentence sentence, CollocationDefinition definition, Token verb,
                                       Companion companion, Set<Integer> used) {
        DependencySignature signature = definition.signature();
        Set<String> labels = signature.labelsFor(companion.role());
        double confidence = MatchTier.STRICT.confidence(definition.type(), 0);
        List<Token> children = DependencyUtils.children(sentence, verb.index());
        for (Token child : children) {
            if (!used.contains(child.index()) && fits(child, companion) && labels.contains(child.dep())) {
                return Optional.of(new RoleMatch(companion, child, MatchTier.STRICT, List.of(child.dep()), confidence));
            }
        }
        if (companion.role() != CompanionRole.PREPOSITION) {
            return Optional.empty();
        }
        Set<String> hostLabels = signature.prepositionHostLabels();
        for (Token child : children) {
            boolean host = TokenClassifier.isNoun(child) || "PRON".equals(child.pos());
            if (!host || !hostLabels.contains(child.dep())) {
                continue;
            }
            for (Token grandchild : DependencyUtils.children(sentence, child.index())) {
                if (!used.contains(grandchild.index()) && fits(grandchild, companion) && labels.contains(grandchild.dep())) {
                    return Optional.of(new RoleMatch(companion, grandchild, MatchTier.STRICT,
                        List.of(child.dep(), grandchild.dep()), confidence));
                }
            }
        }
        return Optional.empty();
    }

    private Optional<RoleMatch> loose(Sentence sentence, CollocationDefinition definition, Token verb,
                                      Companion companion, Set<Integer> used) {
        int maxDepth = definition.signature().maxDepth();
        for (Token descendant : DependencyUtils.descendants(sentence, verb.index(), maxDepth)) {
            if (!used.contains(descendant.index()) && fits(descendant, companion)
                && DependencyUtils.inSameClause(sentence, verb.index(), descendant.index())) {
                return Optional.of(new RoleMatch(companion, descendant, MatchTier.LOOSE,
                    pathFrom(sentence, verb.index(), descendant, maxDepth),
                    MatchTier.LOOSE.confidence(definition.type(), 0)));
            }
        }
        return Optional.empty();
    }

    /**
     * Depth-first search where ignorable edges cost nothing. The cheapest
     * path wins; ties go to the path with more {@code shouldMatch} labels,
     * then to the earlier token.
     */
    private Optional<RoleMatch> collapsed(Sentence sentence, CollocationDefinition definition, Token verb,
                                          Companion companion, Set<Integer> used) {
        DependencySignature signature = definition.signature();
        PathSearch search = new PathSearch(sentence, verb.index(), companion, used,
            signature.collapsedTargetsFor(companion.role()), signature.shouldMatch(), signature.maxDepth());
        Set<Integer> onPath = new HashSet<>();
        onPath.add(verb.index());
        search.visit(verb.index(), 0, new ArrayList<>(), onPath);
        if (search.best == null) {
            return Optional.empty();
        }
        int extraHops = Math.max(0, search.bestCost - 1);
        return Optional.of(new RoleMatch(companion, search.best, MatchTier.COLLAPSED, search.bestPath,
            MatchTier.COLLAPSED.confidence(definition.type(), extraHops)));
    }

    private Optional<RoleMatch> window(Sentence sentence, CollocationDefinition definition, Token verb,
                                       Companion companion, Set<Integer> used) {
        int center = sentence.positionOf(verb.index());
        int size = definition.signature().window();
        for (int distance = 1; distance <= size; distance++) {
            for (int position : new int[]{center - distance, center + distance}) {
                Token token = sentence.getToken(position);
                if (token != null && !used.contains(token.index()) && fits(token, companion)
                    && DependencyUtils.inSameClause(sentence, verb.index(), token.index())) {
                    return Optional.of(new RoleMatch(companion, token, MatchTier.WINDOW, List.of(),
                        MatchTier.WINDOW.confidence(definition.type(), 0)));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Whether {@code token} can fill the companion's role at all, regardless
     * of where it sits in the tree.
     */
    static boolean fits(Token token, Companion companion) {
        return switch (companion.role()) {
            case REFLEXIVE -> TokenClassifier.isReflexivePronoun(token);
            case PREPOSITION -> TokenClassifier.matchesPreposition(token, companion.lemma());
            case NOUN -> TokenClassifier.isNoun(token)
                && (companion.lemma() == null
                    || LemmaMatcher.matches(token.lemma(), companion.lemma())
                    || token.text().equalsIgnoreCase(companion.lemma()));
            case PARTICLE -> isParticle(token, companion.lemma());
        };
    }

    private static boolean isParticle(Token token, String particle) {
        if (!token.text().equalsIgnoreCase(particle)) {
            return false;
        }
        String pos = token.pos();
        return TokenClassifier.isSeparableParticle(token)
            || "PART".equals(pos) || "ADP".equals(pos) || "ADV".equals(pos);
    }

    private static List<String> pathFrom(Sentence sentence, int verbIndex, Token target, int maxDepth) {
        List<String> labels = new ArrayList<>();
        Token current = target;
        for (int depth = 0; depth < maxDepth && current != null; depth++) {
            labels.add(0, current.dep());
            Optional<Token> head = DependencyUtils.headToken(sentence, current.index());
            if (head.isEmpty() || head.get().index() == verbIndex) {
                break;
            }
            current = head.get();
        }
        return labels;
    }

    private static final class PathSearch {
        private final Sentence sentence;
        private final int verbIndex;
        private final Companion companion;
        private final Set<Integer> used;
        private final Set<String> targets;
        private final List<String> shouldMatch;
        private final int maxCost;
        private final int maxLength;

        private Token best;
        private int bestCost = Integer.MAX_VALUE;
        private int bestScore = -1;
        private List<String> bestPath = List.of();

        PathSearch(Sentence sentence, int verbIndex, Companion companion, Set<Integer> used,
                   Set<String> targets, List<String> shouldMatch, int maxDepth) {
            this.sentence = sentence;
            this.verbIndex = verbIndex;
            this.companion = companion;
            this.used = used;
            this.targets = targets;
            this.shouldMatch = shouldMatch;
            this.maxCost = maxDepth;
            this.maxLength = maxDepth * 2 + 2;
        }

        void visit(int node, int cost, List<String> path, Set<Integer> onPath) {
            if (path.size() >= maxLength) {
                return;
            }
            for (Token child : DependencyUtils.children(sentence, node)) {
                if (!onPath.add(child.index())) {
                    continue;
                }
                int edgeCost = IGNORABLE_LABELS.contains(child.dep()) ? 0 : 1;
                int total = cost + edgeCost;
                path.add(child.dep());
                if (total <= maxCost) {
                    if (!used.contains(child.index()) && targets.contains(child.dep()) && fits(child, companion)
                            && DependencyUtils.inSameClause(sentence, verbIndex, child.index())) {
                        consider(child, Math.max(total, 1), path);
                    }
                    visit(child.index(), total, path, onPath);
                }
                path.remove(path.size() - 1);
                onPath.remove(child.index());
            }
        }

        private void consider(Token token, int cost, List<String> path) {
            int score = 0;
            for (String label : path) {
                if (shouldMatch.contains(label)) {
                    score++;
                }
            }
            boolean better = best == null
                || cost < bestCost
                || (cost == bestCost && score > bestScore)
                || (cost == bestCost && score == bestScore && token.index() < best.index());
            if (better) {
                best = token;
                bestCost = cost;
                bestScore = score;
                bestPath = List.copyOf(path);
            }
        }
    }
}
