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
 * Prepositions whose object carries the case they govern: dative
 * prepositions with a dative object, accusative prepositions with an
 * accusative one. Two-way prepositions count for whichever case the object
 * shows. Contracted forms ("zum", "im") are read as their base preposition.
 */
public class PrepositionDetector implements GrammarDetector {

    static final String DATIVE_POINT = "a2-dative-prepositions";
    static final String ACCUSATIVE_POINT = "a2-accusative-prepositions";

    private static final Set<String> DATIVE_PREPOSITIONS = Set.of(
        "mit", "bei", "von", "zu", "aus", "nach", "seit", "ab", "gegenüber", "außer");
    private static final Set<String> ACCUSATIVE_PREPOSITIONS = Set.of(
        "durch", "für", "gegen", "ohne", "um", "bis", "entlang");
    private static final Set<String> TWO_WAY_PREPOSITIONS = Set.of(
        "in", "an", "auf", "unter", "über", "vor", "hinter", "neben", "zwischen");
    private static final Set<String> OBJECT_POS = Set.of("NOUN", "PROPN", "PRON", "DET");
    private static final int OBJECT_DISTANCE = 3;

    private final GrammarPoint dativePoint;
    private final GrammarPoint accusativePoint;

    public PrepositionDetector(GrammarCatalogLoader catalog) {
        this.dativePoint = catalog.require(DATIVE_POINT);
        this.accusativePoint = catalog.require(ACCUSATIVE_POINT);
    }

    @Override
    public DetectorId id() {
        return DetectorId.PREPOSITION;
    }

    @Override
    public List<DetectionResult> detect(Sentence sentence) {
        List<DetectionResult> results = new ArrayList<>();
        for (int p = 0; p < sentence.tokenCount(); p++) {
            Token preposition = sentence.getToken(p);
            if (!TokenClassifier.isPreposition(preposition) || TokenClassifier.isSeparableParticle(preposition)) {
                continue;
            }
            String lemma = TokenClassifier.prepositionLemma(preposition);
            boolean twoWay = TWO_WAY_PREPOSITIONS.contains(lemma);
            if (!twoWay && !DATIVE_PREPOSITIONS.contains(lemma) && !ACCUSATIVE_PREPOSITIONS.contains(lemma)) {
                continue;
            }
            int objectPosition = findObject(sentence, p);
            if (objectPosition < 0) {
                continue;
            }
            Token object = sentence.getToken(objectPosition);
            String objectCase = Morphology.caseOf(object);
            GrammarPoint point;
            String required;
            if ("Dat".equals(objectCase) && (twoWay || DATIVE_PREPOSITIONS.contains(lemma))) {
                point = dativePoint;
                required = "dative";
            } else if ("Acc".equals(objectCase) && (twoWay || ACCUSATIVE_PREPOSITIONS.contains(lemma))) {
                point = accusativePoint;
                required = "accusative";
            } else {
                continue;
            }
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("preposition", preposition.text());
            details.put("prepositionLemma", lemma);
            details.put("object", object.text());
            details.put("requiredCase", required);
            details.put("actualCase", objectCase);
            details.put("twoWay", twoWay);
            details.put("contracted", TokenClassifier.isContractedPreposition(preposition));
            details.put("pos", object.pos());
            results.add(DetectionResult.of(point, List.of(Positions.span(preposition, object)), 0.90, details));
        }
        return results;
    }

    /**
     * First noun, pronoun or determiner after the preposition, stopping at
     * verbs and punctuation.
     */
    private static int findObject(Sentence sentence, int prepositionPosition) {
        int limit = Math.min(sentence.tokenCount(), prepositionPosition + 1 + OBJECT_DISTANCE);
        for (int p = prepositionPosition + 1; p < limit; p++) {
            Token token = sentence.getToken(p);
            if (OBJECT_POS.contains(token.pos())) {
                return p;
            }
            if (TokenClassifier.isVerbOrAux(token) || "PUNCT".equals(token.pos())) {
                break;
            }
        }
        return -1;
    }
}
