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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * lassen + infinitive: "Ich lasse mein Auto reparieren", and the
 * verb-final order "..., weil ich das Auto reparieren lasse".
 */
public class CausativeDetector implements GrammarDetector {

    static final String GRAMMAR_POINT = "b2-causative-construction";

    private static final int SEARCH_DISTANCE = 4;

    private final GrammarPoint point;

    public CausativeDetector(GrammarCatalogLoader catalog) {
        this.point = catalog.require(GRAMMAR_POINT);
    }

    @Override
    public DetectorId id() {
        return DetectorId.CAUSATIVE;
    }

    @Override
    public List<DetectionResult> detect(Sentence sentence) {
        List<DetectionResult> results = new ArrayList<>();
        for (int p = 0; p < sentence.tokenCount(); p++) {
            Token lassen = sentence.getToken(p);
            if (!TokenClassifier.isVerbOrAux(lassen) || !"lassen".equals(lassen.lowerLemma())) {
                continue;
            }
            int infinitive = TokenClassifier.findNext(sentence, p, CausativeDetector::isMainVerb, SEARCH_DISTANCE);
            if (infinitive >= 0 && sentence.getToken(infinitive).lowerText().endsWith("en")) {
                results.add(result(lassen, sentence.getToken(infinitive), "lassen-infinitive"));
                continue;
            }
            if (p > 0 && isClauseFinal(sentence, p)) {
                Token previous = sentence.getToken(p - 1);
                if (isMainVerb(previous) && TokenClassifier.isInfinitive(previous)) {
                    results.add(result(lassen, previous, "infinitive-lassen"));
                }
            }
        }
        return results;
    }

    private static boolean isMainVerb(Token token) {
        return "VERB".equals(token.pos()) || token.tag().startsWith("VV");
    }

    private static boolean isClauseFinal(Sentence sentence, int position) {
        return position + 1 >= sentence.tokenCount()
            || TokenClassifier.isClausePunctuation(sentence.getToken(position + 1));
    }

    private DetectionResult result(Token lassen, Token infinitive, String construction) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("causativeVerb", lassen.text());
        details.put("infinitive", infinitive.text());
        details.put("construction", construction);
        details.put("lemma", infinitive.lemma());
        List<Token> ordered = lassen.index() < infinitive.index() ? List.of(lassen, infinitive) : List.of(infinitive, lassen);
        return DetectionResult.of(point, Positions.each(ordered), 0.90, details);
    }
}
