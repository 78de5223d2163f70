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
 * Modal verb + infinitive, in either order ("Ich kann schwimmen",
 * "..., weil ich schwimmen kann"). A modal without an infinitive is
 * reported only in questions.
 */
public class ModalVerbDetector implements GrammarDetector {

    static final String GRAMMAR_POINT = "b1-modal-verbs";

    private final GrammarPoint point;

    public ModalVerbDetector(GrammarCatalogLoader catalog) {
        this.point = catalog.require(GRAMMAR_POINT);
    }

    @Override
    public DetectorId id() {
        return DetectorId.MODAL_VERB;
    }

    @Override
    public List<DetectionResult> detect(Sentence sentence) {
        List<DetectionResult> results = new ArrayList<>();
        boolean question = sentence.tokens().stream().anyMatch(t -> "?".equals(t.text()));
        for (int p = 0; p < sentence.tokenCount(); p++) {
            Token modal = sentence.getToken(p);
            if (!TokenClassifier.isVerbOrAux(modal) || !TokenClassifier.isModalVerb(modal)) {
                continue;
            }
            int infinitivePosition = findInfinitive(sentence, p, 1);
            if (infinitivePosition < 0) {
                infinitivePosition = findInfinitive(sentence, p, -1);
            }
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("modalVerb", modal.text());
            details.put("modalLemma", modal.lemma());
            if (infinitivePosition >= 0) {
                Token infinitive = sentence.getToken(infinitivePosition);
                details.put("infinitive", infinitive.text());
                details.put("infinitiveLemma", infinitive.lemma());
                Token first = p < infinitivePosition ? modal : infinitive;
                Token last = p < infinitivePosition ? infinitive : modal;
                results.add(DetectionResult.of(point, List.of(Positions.span(first, last)), 0.95, details));
            } else if (question) {
                details.put("standalone", true);
                results.add(DetectionResult.of(point, List.of(Positions.of(modal)), 0.80, details));
            }
        }
        return results;
    }

    /**
     * Walks from the modal in {@code step} direction; any other non-infinitive
     * verb ends the search.
     */
    private static int findInfinitive(Sentence sentence, int modalPosition, int step) {
        for (int p = modalPosition + step; p >= 0 && p < sentence.tokenCount(); p += step) {
            Token token = sentence.getToken(p);
            if (!TokenClassifier.isVerbOrAux(token)) {
                continue;
            }
            if (TokenClassifier.isInfinitive(token) && !TokenClassifier.isModalVerb(token)) {
                return p;
            }
            return -1;
        }
        return -1;
    }
}
