package pl.marcinmilkowski.grammar_sketch.detection.clause;

import pl.marcinmilkowski.grammar_sketch.config.GrammarCatalogLoader;
import pl.marcinmilkowski.grammar_sketch.detection.DependencyUtils;
import pl.marcinmilkowski.grammar_sketch.detection.DetectorId;
import pl.marcinmilkowski.grammar_sketch.detection.GrammarDetector;
import pl.marcinmilkowski.grammar_sketch.detection.Positions;
import pl.marcinmilkowski.grammar_sketch.detection.TokenClassifier;
import pl.marcinmilkowski.grammar_sketch.detection.TokenPredicate;
import pl.marcinmilkowski.grammar_sketch.model.DetectionResult;
import pl.marcinmilkowski.grammar_sketch.model.DetectionResult.Position;
import pl.marcinmilkowski.grammar_sketch.model.GrammarPoint;
import pl.marcinmilkowski.grammar_sketch.model.Sentence;
import pl.marcinmilkowski.grammar_sketch.model.Sentence.Token;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Finds subordinate clauses in three stages: marker detection, location of
 * the clause's verb, and extension of the clause to its right boundary.
 * Clauses that contain or are contained in another clause are reported with
 * reduced confidence and flagged {@code nested}.
 */
public class SubordinateClauseDetector implements GrammarDetector {

    static final String SUBORDINATE_POINT = "b1-subordinate-clauses";
    static final String RELATIVE_POINT = "b1-relative-clauses";
    static final String INFINITIVE_POINT = "b2-infinitive-clauses";

    static final double NESTING_FACTOR = 0.9;

    private static final Set<String> RELATIVE_PRONOUNS = Set.of(
        "der", "die", "das", "dem", "den", "des", "dessen", "deren", "denen",
        "welcher", "welche", "welches", "welchem", "welchen");
    private static final Set<String> NON_RELATIVE_PRONOUN_TAGS = Set.of("PDS", "PPER", "ART", "PDAT");
    private static final Set<String> PERFECT_AUXILIARIES = Set.of("haben", "sein", "werden");
    private static final int ZU_LOOKAHEAD = 3;

    private final GrammarPoint subordinatePoint;
    private final GrammarPoint relativePoint;
    private final GrammarPoint infinitivePoint;

    public SubordinateClauseDetector(GrammarCatalogLoader catalog) {
        this.subordinatePoint = catalog.require(SUBORDINATE_POINT);
        this.relativePoint = catalog.require(RELATIVE_POINT);
        this.infinitivePoint = catalog.require(INFINITIVE_POINT);
    }

    @Override
    public DetectorId id() {
        return DetectorId.SUBORDINATE_CLAUSE;
    }

    private record Clause(ClauseMarker marker, ClauseVerb verb, ClauseBoundary boundary, double confidence) {
    }

    @Override
    public List<DetectionResult> detect(Sentence sentence) {
        List<Clause> clauses = new ArrayList<>();
        for (ClauseMarker marker : detectMarkers(sentence)) {
            Optional<ClauseVerb> verb = locateVerb(sentence, marker);
            if (verb.isEmpty()) {
                continue;
            }
            ClauseBoundary boundary = detectBoundary(sentence, marker, verb.get());
            clauses.add(new Clause(marker, verb.get(), boundary, confidence(marker, verb.get())));
        }

        List<DetectionResult> results = new ArrayList<>();
        for (Clause clause : clauses) {
            boolean nested = false;
            for (Clause other : clauses) {
                if (other != clause && (other.boundary().properlyContains(clause.boundary())
                    || clause.boundary().properlyContains(other.boundary()))) {
                    nested = true;
                    break;
                }
            }
            results.add(toResult(sentence, clause, nested));
        }
        return results;
    }

    /**
     * Stage 1: conjunctions from the closed marker set, relative pronouns,
     * and um/ohne/(an)statt followed by "zu" within three tokens.
     */
    List<ClauseMarker> detectMarkers(Sentence sentence) {
        List<ClauseMarker> markers = new ArrayList<>();
        for (int p = 0; p < sentence.tokenCount(); p++) {
            Token token = sentence.getToken(p);
            String lemma = token.lowerLemma();
            if (TokenClassifier.isSubordinatingConjunction(token) && ClauseType.isConjunctionMarker(lemma)) {
                markers.add(new ClauseMarker(p, token, MarkerKind.SUBORDINATING_CONJUNCTION));
            } else if (isRelativePronoun(token)) {
                markers.add(new ClauseMarker(p, token, MarkerKind.RELATIVE_PRONOUN));
            } else if (ClauseType.isInfinitiveMarker(lemma) && zuPosition(sentence, p, ZU_LOOKAHEAD) >= 0) {
                markers.add(new ClauseMarker(p, token, MarkerKind.INFINITIVE_MARKER));
            }
        }
        return markers;
    }

    static boolean isRelativePronoun(Token token) {
        if ("PRELS".equals(token.tag()) || "PRELAT".equals(token.tag())) {
            return true;
        }
        return "PRON".equals(token.pos())
            && RELATIVE_PRONOUNS.contains(token.lowerLemma())
            && !NON_RELATIVE_PRONOUN_TAGS.contains(token.tag());
    }

    /**
     * Stage 2: the verb heading the clause, by the first strategy that works.
     * The last resort takes the first verb or auxiliary of any form after the
     * marker, across punctuation.
     */
    Optional<ClauseVerb> locateVerb(Sentence sentence, ClauseMarker marker) {
        int found = headOfMarker(sentence, marker);
        if (found < 0 && marker.kind() == MarkerKind.RELATIVE_PRONOUN) {
            found = scanForward(sentence, marker.position(), true, Stop.COMMA);
        }
        if (found < 0 && marker.kind() == MarkerKind.INFINITIVE_MARKER) {
            found = infinitiveAfterZu(sentence, marker.position());
        }
        if (found < 0) {
            found = scanForward(sentence, marker.position(), true, Stop.PUNCTUATION_OR_CONJUNCTION);
        }
        if (found < 0) {
            found = scanForward(sentence, marker.position(), false, Stop.NONE);
        }
        if (found < 0) {
            return Optional.empty();
        }
        return Optional.of(withAuxiliary(sentence, found));
    }

    private enum Stop { NONE, COMMA, PUNCTUATION_OR_CONJUNCTION }

    private static int headOfMarker(Sentence sentence, ClauseMarker marker) {
        Optional<Token> head = DependencyUtils.headToken(sentence, marker.token().index());
        if (head.isPresent() && (TokenClassifier.isFiniteVerb(head.get()) || TokenClassifier.isVerbOrAux(head.get()))) {
            return sentence.positionOf(head.get().index());
        }
        return -1;
    }

    private static int scanForward(Sentence sentence, int from, boolean finiteOnly, Stop stop) {
        for (int p = from + 1; p < sentence.tokenCount(); p++) {
            Token token = sentence.getToken(p);
            boolean punctuation = "PUNCT".equals(token.pos()) || TokenClassifier.isClausePunctuation(token);
            if (stop == Stop.COMMA && TokenClassifier.isComma(token)) {
                return -1;
            }
            if (stop == Stop.PUNCTUATION_OR_CONJUNCTION
                && (punctuation || TokenClassifier.isSubordinatingConjunction(token))) {
                return -1;
            }
            if (finiteOnly ? TokenClassifier.isFiniteVerb(token) : TokenClassifier.isVerbOrAux(token)) {
                return p;
            }
        }
        return -1;
    }

    private static int zuPosition(Sentence sentence, int from, int lookahead) {
        int limit = Math.min(sentence.tokenCount(), from + 1 + lookahead);
        for (int p = from + 1; p < limit; p++) {
            if ("zu".equals(sentence.getToken(p).lowerLemma())) {
                return p;
            }
        }
        return -1;
    }

    private static int infinitiveAfterZu(Sentence sentence, int markerPosition) {
        int zu = zuPosition(sentence, markerPosition, ZU_LOOKAHEAD);
        if (zu < 0) {
            return -1;
        }
        for (int p = zu; p < sentence.tokenCount(); p++) {
            Token token = sentence.getToken(p);
            if ("PUNCT".equals(token.pos())) {
                return -1;
            }
            if ("VVINF".equals(token.tag()) || "VVIZU".equals(token.tag())
                || ("VERB".equals(token.pos()) && !"zu".equals(token.lowerLemma()))) {
                return p;
            }
        }
        return -1;
    }

    /**
     * Links a participle to haben/sein/werden and an infinitive to a modal,
     * looking backward first and then forward within the clause.
     */
    private static ClauseVerb withAuxiliary(Sentence sentence, int position) {
        Token verb = sentence.getToken(position);
        int auxiliary = -1;
        if (TokenClassifier.isPastParticiple(verb)) {
            auxiliary = findInClause(sentence, position, t -> PERFECT_AUXILIARIES.contains(t.lowerLemma()));
        } else if (TokenClassifier.isInfinitive(verb)) {
            auxiliary = findInClause(sentence, position, TokenClassifier::isModalVerb);
        }
        return new ClauseVerb(position, verb, auxiliary, auxiliary < 0 ? null : sentence.getToken(auxiliary));
    }

    private static int findInClause(Sentence sentence, int position,
                                    TokenPredicate predicate) {
        for (int p = position - 1; p >= 0; p--) {
            Token token = sentence.getToken(p);
            if (predicate.test(token)) {
                return p;
            }
            if (TokenClassifier.isSubordinatingConjunction(token) || "PUNCT".equals(token.pos())) {
                break;
            }
        }
        for (int p = position + 1; p < sentence.tokenCount(); p++) {
            Token token = sentence.getToken(p);
            if (TokenClassifier.isSubordinatingConjunction(token) || TokenClassifier.isCoordinatingConjunction(token)
                || "PUNCT".equals(token.pos()) || TokenClassifier.isClausePunctuation(token)) {
                break;
            }
            if (predicate.test(token)) {
                return p;
            }
        }
        return -1;
    }

    /**
     * Stage 3: from the marker to the verb complex, then forward until a
     * clause-ending token. Detached particles after the verb stay inside.
     */
    ClauseBoundary detectBoundary(Sentence sentence, ClauseMarker marker, ClauseVerb verb) {
        int start = marker.position();
        int end = Math.max(start, verb.lastPosition());
        for (int p = end + 1; p < sentence.tokenCount(); p++) {
            Token token = sentence.getToken(p);
            if (TokenClassifier.isClausePunctuation(token)
                || TokenClassifier.isCoordinatingConjunction(token)
                || TokenClassifier.isSubordinatingConjunction(token)
                || isRelativePronoun(token)) {
                break;
            }
            if (TokenClassifier.isSeparableParticle(token)) {
                end = p;
                continue;
            }
            if (marker.kind() == MarkerKind.INFINITIVE_MARKER && TokenClassifier.isFiniteVerb(token)) {
                break;
            }
            end = p;
        }
        Token first = sentence.getToken(start);
        Token last = sentence.getToken(end);
        return new ClauseBoundary(start, end, first.characterStart(), last.characterEnd());
    }

    static double confidence(ClauseMarker marker, ClauseVerb verb) {
        return switch (marker.kind()) {
            case SUBORDINATING_CONJUNCTION, RELATIVE_PRONOUN ->
                TokenClassifier.isFiniteVerb(verb.token()) || verb.isCompound() ? 0.95 : 0.85;
            case INFINITIVE_MARKER -> 0.80;
        };
    }

    private DetectionResult toResult(Sentence sentence, Clause clause, boolean nested) {
        ClauseMarker marker = clause.marker();
        ClauseVerb verb = clause.verb();
        ClauseType type = ClauseType.of(marker);
        GrammarPoint point = switch (type) {
            case RELATIVE -> relativePoint;
            case INFINITIVE -> infinitivePoint;
            default -> subordinatePoint;
        };

        Map<String, Object> details = new LinkedHashMap<>();
        switch (marker.kind()) {
            case SUBORDINATING_CONJUNCTION -> details.put("conjunction", marker.token().text());
            case RELATIVE_PRONOUN -> details.put("relativeWord", marker.token().text());
            case INFINITIVE_MARKER -> details.put("infinitiveMarker", marker.token().text());
        }
        details.put("verb", verb.token().text());
        details.put("verbLemma", verb.token().lemma());
        details.put("verbForm", describeVerbForm(verb));
        details.put("type", type.label());
        details.put("clauseFunction", ClauseType.functionOf(marker));
        details.put("hasAuxiliary", verb.isCompound());
        if (verb.isCompound()) {
            details.put("auxiliary", verb.auxiliary().text());
        }
        details.put("clauseText", Positions.rangeText(sentence, clause.boundary().start(), clause.boundary().end()));
        details.put("tokenRange", List.of(
            sentence.getToken(clause.boundary().start()).index(),
            sentence.getToken(clause.boundary().end()).index()));
        details.put("nested", nested);

        double confidence = nested ? clause.confidence() * NESTING_FACTOR : clause.confidence();
        Position position = new Position(clause.boundary().startChar(), clause.boundary().endChar());
        return DetectionResult.of(point, List.of(position), confidence, details);
    }

    private static String describeVerbForm(ClauseVerb verb) {
        if (verb.isCompound()) {
            return "compound";
        }
        Token token = verb.token();
        if (TokenClassifier.isFiniteVerb(token)) {
            return "finite";
        }
        if ("VVIZU".equals(token.tag()) || TokenClassifier.isInfinitive(token)) {
            return "infinitive";
        }
        if (TokenClassifier.isPastParticiple(token)) {
            return "participle";
        }
        return "unknown";
    }
}
