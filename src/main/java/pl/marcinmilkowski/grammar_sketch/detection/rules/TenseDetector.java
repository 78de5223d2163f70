package pl.marcinmilkowski.grammar_sketch.detection.rules;

import pl.marcinmilkowski.grammar_sketch.config.GrammarCatalogLoader;
import pl.marcinmilkowski.grammar_sketch.detection.DetectorId;
import pl.marcinmilkowski.grammar_sketch.detection.GrammarDetector;
import pl.marcinmilkowski.grammar_sketch.detection.Morphology;
import pl.marcinmilkowski.grammar_sketch.detection.Positions;
import pl.marcinmilkowski.grammar_sketch.detection.TokenClassifier;
import pl.marcinmilkowski.grammar_sketch.model.DetectionResult;
import pl.marcinmilkowski.grammar_sketch.model.GrammarPoint;
import pl.marcinmilkowski.grammar_sketch.model.Sentence;
import pl.marcinmilkowski.grammar_sketch.model.Sentence.Token;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Present, simple past and present perfect, read from the Tense and
 * VerbForm features. A finite verb without a Tense feature is not reported.
 */
public class TenseDetector implements GrammarDetector {

    static final String PRESENT_POINT = "a1-present-tense";
    static final String SIMPLE_PAST_POINT = "a2-simple-past";
    static final String PERFECT_POINT = "a2-present-perfect";
    static final String PERFECT_SEIN_POINT = "b1-present-perfect-sein";

    private static final Set<String> PERFECT_AUXILIARIES = Set.of("haben", "sein");

    private final GrammarPoint presentPoint;
    private final GrammarPoint simplePastPoint;
    private final GrammarPoint perfectPoint;
    private final GrammarPoint perfectSeinPoint;

    public TenseDetector(GrammarCatalogLoader catalog) {
        this.presentPoint = catalog.require(PRESENT_POINT);
        this.simplePastPoint = catalog.require(SIMPLE_PAST_POINT);
        this.perfectPoint = catalog.require(PERFECT_POINT);
        this.perfectSeinPoint = catalog.require(PERFECT_SEIN_POINT);
    }

    @Override
    public DetectorId id() {
        return DetectorId.TENSE;
    }

    @Override
    public List<DetectionResult> detect(Sentence sentence) {
        List<DetectionResult> results = new ArrayList<>();
        Set<Integer> pairedAuxiliaries = new HashSet<>();
        for (int p = 0; p < sentence.tokenCount(); p++) {
            Token token = sentence.getToken(p);
            if (!TokenClassifier.isVerbOrAux(token)) {
                continue;
            }
            String tense = Morphology.tenseOf(token);
            if ("Fin".equals(Morphology.verbFormOf(token))) {
                if ("Pres".equals(tense)) {
                    results.add(simple(presentPoint, token, "present"));
                } else if ("Past".equals(tense)) {
                    results.add(simple(simplePastPoint, token, "simple-past"));
                }
            } else if (TokenClassifier.isPastParticiple(token)) {
                detectPerfect(sentence, p, pairedAuxiliaries, results);
            }
        }
        return results;
    }

    private DetectionResult simple(GrammarPoint point, Token verb, String tense) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("tense", tense);
        details.put("word", verb.text());
        details.put("lemma", verb.lemma());
        details.put("person", Morphology.isKnown(Morphology.personOf(verb)) ? Morphology.personOf(verb) : null);
        return DetectionResult.of(point, List.of(Positions.of(verb)), 0.98, details);
    }

    /**
     * haben/sein in the present, before the participle in a main clause or
     * after it in a verb-final clause. Each auxiliary pairs with one
     * participle, so "ist gebaut worden" is reported once.
     */
    private void detectPerfect(Sentence sentence, int participlePosition, Set<Integer> pairedAuxiliaries,
                               List<DetectionResult> results) {
        int clauseStart = TokenClassifier.findClauseStart(sentence, participlePosition);
        int auxPosition = TokenClassifier.findPrevious(sentence, participlePosition,
            TenseDetector::isPerfectAuxiliary, participlePosition - clauseStart);
        if (auxPosition < 0) {
            int clauseEnd = TokenClassifier.findClauseEnd(sentence, participlePosition);
            auxPosition = TokenClassifier.findNext(sentence, participlePosition,
                TenseDetector::isPerfectAuxiliary, clauseEnd - participlePosition);
        }
        if (auxPosition < 0 || !pairedAuxiliaries.add(auxPosition)) {
            return;
        }
        Token auxiliary = sentence.getToken(auxPosition);
        Token participle = sentence.getToken(participlePosition);
        // Plusquamperfekt has no catalog point; its auxiliary is already reported as simple past
        if (isPastOrSubjunctive(auxiliary)) {
            return;
        }
        Token next = sentence.getToken(participlePosition + 1);
        boolean passive = next != null && "worden".equals(next.lowerText());
        boolean sein = "sein".equals(auxiliary.lowerLemma());
        // "ist geöffnet" is a statal passive
        if (sein && !passive && !TokenClassifier.SEIN_PERFECT_VERBS.contains(participle.lowerLemma())) {
            return;
        }
        Token first = auxPosition < participlePosition ? auxiliary : participle;
        Token last = auxPosition < participlePosition ? participle : auxiliary;

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("tense", "present-perfect");
        details.put("auxiliary", auxiliary.text());
        details.put("participle", participle.text());
        details.put("lemma", participle.lemma());
        results.add(DetectionResult.of(perfectPoint, List.of(Positions.span(first, last)), 0.95, details));

        if (sein && !passive) {
            Map<String, Object> seinDetails = new LinkedHashMap<>(details);
            seinDetails.put("auxiliaryLemma", "sein");
            results.add(DetectionResult.of(perfectSeinPoint, List.of(Positions.span(first, last)), 0.90,
                seinDetails));
        }
    }

    private static boolean isPerfectAuxiliary(Token token) {
        return TokenClassifier.isFiniteVerb(token) && PERFECT_AUXILIARIES.contains(token.lowerLemma());
    }

    /**
     * Morphology first; without it, "hatte"/"war" forms count as past.
     */
    private static boolean isPastOrSubjunctive(Token auxiliary) {
        String tense = Morphology.tenseOf(auxiliary);
        if (Morphology.isKnown(tense)) {
            return !"Pres".equals(tense) || MoodDetector.isSubjunctive(auxiliary);
        }
        String text = auxiliary.lowerText();
        return text.startsWith("hatt") || text.startsWith("war") || MoodDetector.isSubjunctive(auxiliary);
    }
}
