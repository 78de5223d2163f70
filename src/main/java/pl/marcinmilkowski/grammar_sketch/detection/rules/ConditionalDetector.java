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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Conditional clauses introduced by wenn/falls/sofern, classified as real
 * or unreal by the mood of their verb, and mixed conditionals that combine
 * present and past subjunctive.
 */
public class ConditionalDetector implements GrammarDetector {

    static final String GRAMMAR_POINT = "b2-conditional-sentences";

    private static final Set<String> CONDITIONAL_CONJUNCTIONS = Set.of(
        "wenn", "falls", "sofern", "vorausgesetzt", "gesetzt", "angenommen");

    private final GrammarPoint point;

    public ConditionalDetector(GrammarCatalogLoader catalog) {
        this.point = catalog.require(GRAMMAR_POINT);
    }

    @Override
    public DetectorId id() {
        return DetectorId.CONDITIONAL;
    }

    @Override
    public List<DetectionResult> detect(Sentence sentence) {
        List<DetectionResult> results = new ArrayList<>();
        for (int p = 0; p < sentence.tokenCount(); p++) {
            Token conjunction = sentence.getToken(p);
            if (!CONDITIONAL_CONJUNCTIONS.contains(conjunction.lowerLemma())) {
                continue;
            }
            int clauseEnd = TokenClassifier.findClauseEnd(sentence, p);
            int verbPosition = TokenClassifier.findNext(sentence, p, TokenClassifier::isFiniteVerb, clauseEnd - p);
            if (verbPosition < 0) {
                continue;
            }
            Token verb = sentence.getToken(verbPosition);
            String tense = Morphology.tenseOf(verb);
            String type;
            if (MoodDetector.isSubjunctive(verb)) {
                type = "unreal";
            } else if ("Past".equals(tense)) {
                type = "past-unreal";
            } else {
                type = "real";
            }
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("conjunction", conjunction.text());
            details.put("verb", verb.text());
            details.put("conditionalType", type);
            details.put("mood", known(Morphology.moodOf(verb)));
            details.put("tense", known(tense));
            results.add(DetectionResult.of(point, List.of(Positions.span(conjunction, verb)), 0.90, details));
        }
        detectMixed(sentence, results);
        return results;
    }

    private static String known(String value) {
        return Morphology.isKnown(value) ? value : null;
    }

    private void detectMixed(Sentence sentence, List<DetectionResult> results) {
        boolean presentSubjunctive = false;
        boolean pastSubjunctive = false;
        for (Token token : sentence.tokens()) {
            if (!TokenClassifier.isVerbOrAux(token) || !MoodDetector.isSubjunctive(token)) {
                continue;
            }
            String tense = Morphology.tenseOf(token);
            presentSubjunctive |= "Pres".equals(tense);
            pastSubjunctive |= "Past".equals(tense);
        }
        if (presentSubjunctive && pastSubjunctive && sentence.tokenCount() > 0) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("conditionalType", "mixed");
            details.put("hasPresentSubjunctive", true);
            details.put("hasPastSubjunctive", true);
            results.add(DetectionResult.of(point, List.of(Positions.span(sentence.getToken(0),
                sentence.getToken(sentence.tokenCount() - 1))), 0.85, details));
        }
    }
}
