package pl.marcinmilkowski.grammar_sketch.detection.rules;

import pl.marcinmilkowski.grammar_sketch.config.GrammarCatalogLoader;
import pl.marcinmilkowski.grammar_sketch.detection.DetectorId;
import pl.marcinmilkowski.grammar_sketch.detection.GrammarDetector;
import pl.marcinmilkowski.grammar_sketch.detection.Morphology;
import pl.marcinmilkowski.grammar_sketch.detection.Positions;
import pl.marcinmilkowski.grammar_sketch.detection.TokenClassifier;
import pl.marcinmilkowski.grammar_sketch.detection.TokenPredicate;
import pl.marcinmilkowski.grammar_sketch.model.DetectionResult;
import pl.marcinmilkowski.grammar_sketch.model.GrammarPoint;
import pl.marcinmilkowski.grammar_sketch.model.Sentence;
import pl.marcinmilkowski.grammar_sketch.model.Sentence.Token;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A full verb with a reflexive pronoun at most three tokens away.
 * Known reflexive verbs accept any reflexive form ("mich", "uns");
 * other verbs need a pronoun that morphology marks as reflexive.
 */
public class ReflexiveVerbDetector implements GrammarDetector {

    static final String GRAMMAR_POINT = "a2-reflexive-verbs";

    private static final Set<String> REFLEXIVE_VERBS = Set.of(
        "waschen", "anziehen", "ausziehen", "umziehen", "fühlen", "setzen", "treffen", "freuen",
        "interessieren", "erinnern", "vorstellen", "beeilen", "ausruhen", "konzentrieren", "kämmen",
        "rasieren", "duschen", "putzen", "ärgern", "kümmern", "gewöhnen", "entscheiden", "verlieben",
        "bedanken", "entschuldigen", "beschweren", "bewerben", "sorgen", "unterhalten", "vorbereiten");
    private static final int WINDOW = 3;

    private static final TokenPredicate MARKED_REFLEXIVE =
        ((TokenPredicate) TokenClassifier::isReflexivePronoun).and(Morphology::isReflexive);

    private final GrammarPoint point;

    public ReflexiveVerbDetector(GrammarCatalogLoader catalog) {
        this.point = catalog.require(GRAMMAR_POINT);
    }

    @Override
    public DetectorId id() {
        return DetectorId.REFLEXIVE_VERB;
    }

    @Override
    public List<DetectionResult> detect(Sentence sentence) {
        List<DetectionResult> results = new ArrayList<>();
        for (int p = 0; p < sentence.tokenCount(); p++) {
            Token verb = sentence.getToken(p);
            if (!"VERB".equals(verb.pos())) {
                continue;
            }
            boolean known = REFLEXIVE_VERBS.contains(verb.lowerLemma());
            TokenPredicate pronoun = known ? TokenClassifier::isReflexivePronoun : MARKED_REFLEXIVE;
            int pronounPosition = nearest(sentence, p, pronoun);
            if (pronounPosition < 0) {
                continue;
            }
            Token reflexive = sentence.getToken(pronounPosition);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("verb", verb.text());
            details.put("reflexivePronoun", reflexive.text());
            details.put("verbLemma", verb.lemma());
            details.put("position", pronounPosition > p ? "verb-first" : "pronoun-first");
            details.put("knownReflexive", known);
            Token first = pronounPosition > p ? verb : reflexive;
            Token last = pronounPosition > p ? reflexive : verb;
            results.add(DetectionResult.of(point, List.of(Positions.span(first, last)), known ? 0.95 : 0.85,
                details));
        }
        return results;
    }

    /** Closest match on either side, the following token winning ties. */
    private static int nearest(Sentence sentence, int position, TokenPredicate predicate) {
        int after = TokenClassifier.findNext(sentence, position, predicate, WINDOW);
        int before = TokenClassifier.findPrevious(sentence, position, predicate, WINDOW);
        if (after < 0) {
            return before;
        }
        if (before < 0 || after - position <= position - before) {
            return after;
        }
        return before;
    }
}
