package pl.marcinmilkowski.grammar_sketch.detection.rules;

import pl.marcinmilkowski.grammar_sketch.config.GrammarCatalogLoader;
import pl.marcinmilkowski.grammar_sketch.detection.DetectorId;
import pl.marcinmilkowski.grammar_sketch.detection.GrammarDetector;
import pl.marcinmilkowski.grammar_sketch.detection.Positions;
import pl.marcinmilkowski.grammar_sketch.detection.TokenClassifier;
import pl.marcinmilkowski.grammar_sketch.model.DetectionResult;
import pl.marcinmilkowski.grammar_sketch.model.GrammarPoint;
import pl.marcinmilkowski.grammar_sketch.model.Sentence;
import pl.marcinmilkowski.grammar_sketch.model.Sentence.Token;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Verb-second order in main clauses.
 */
public class WordOrderDetector implements GrammarDetector {

    static final String GRAMMAR_POINT = "a2-svo-word-order";

    private static final Set<String> FRONTABLE_POS = Set.of("ADV", "PRON", "NOUN", "DET");

    private final GrammarPoint point;

    public WordOrderDetector(GrammarCatalogLoader catalog) {
        this.point = catalog.require(GRAMMAR_POINT);
    }

    @Override
    public DetectorId id() {
        return DetectorId.WORD_ORDER;
    }

    @Override
    public List<DetectionResult> detect(Sentence sentence) {
        if (sentence.tokenCount() < 2) {
            return List.of();
        }
        Token first = sentence.getToken(0);
        if (TokenClassifier.isSubordinatingConjunction(first)) {
            return afterFrontedClause(sentence);
        }
        int verb = TokenClassifier.findNext(sentence, -1, TokenClassifier::isFiniteVerb, sentence.tokenCount());
        if (verb <= 0) {
            return List.of();
        }
        if (verb == 1) {
            return List.of(result(sentence, verb, 0.80, null, "main"));
        }
        if (FRONTABLE_POS.contains(first.pos()) && noClauseBreak(sentence, verb)) {
            return List.of(result(sentence, verb, 0.70, Positions.rangeText(sentence, 0, verb - 1), "main"));
        }
        return List.of();
    }

    /**
     * "Als ich ankam, regnete es": the finite verb directly after the comma
     * closing the fronted clause.
     */
    private List<DetectionResult> afterFrontedClause(Sentence sentence) {
        int comma = TokenClassifier.findNext(sentence, 0, TokenClassifier::isComma, sentence.tokenCount());
        if (comma < 0 || comma + 1 >= sentence.tokenCount()) {
            return List.of();
        }
        int verb = comma + 1;
        if (!TokenClassifier.isFiniteVerb(sentence.getToken(verb))) {
            return List.of();
        }
        return List.of(result(sentence, verb, 0.75, Positions.rangeText(sentence, 0, comma - 1),
            "main-after-subordinate"));
    }

    private static boolean noClauseBreak(Sentence sentence, int verb) {
        for (int p = 1; p < verb; p++) {
            Token token = sentence.getToken(p);
            if (TokenClassifier.isComma(token) || TokenClassifier.isSubordinatingConjunction(token)) {
                return false;
            }
        }
        return true;
    }

    private DetectionResult result(Sentence sentence, int verb, double confidence, String fronted, String clauseType) {
        Token verbToken = sentence.getToken(verb);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("verbPosition", "second");
        details.put("verb", verbToken.text());
        details.put("pattern", "V2");
        details.put("clauseType", clauseType);
        details.put("frontedElement", fronted);
        return DetectionResult.of(point, List.of(Positions.span(sentence.getToken(0), verbToken)), confidence, details);
    }
}
