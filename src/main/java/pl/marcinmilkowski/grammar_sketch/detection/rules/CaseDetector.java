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
import java.util.regex.Pattern;

/**
 * One result per case-marked noun, determiner, adjective, pronoun or
 * numeral. A dative result also records whether the token is temporal,
 * governed by a preposition, or most likely an indirect object.
 */
public class CaseDetector implements GrammarDetector {

    static final String NOMINATIVE_POINT = "a1-nominative-case";
    static final String ACCUSATIVE_POINT = "a1-accusative-case";
    static final String DATIVE_POINT = "a2-dative-case";
    static final String GENITIVE_POINT = "a2-genitive-case";

    private static final Set<String> CASE_BEARING_POS = Set.of("NOUN", "DET", "ADJ", "PRON", "NUM");
    private static final Set<String> TEMPORAL_NOUNS = Set.of(
        "sommer", "herbst", "winter", "frühling", "frühjahr", "monat", "januar", "februar", "märz", "april",
        "mai", "juni", "juli", "august", "september", "oktober", "november", "dezember", "saison", "jahr",
        "zeit", "woche", "wochenende", "tag", "stunde", "minute", "sekunde", "morgen", "mittag", "abend", "nacht");
    private static final Pattern DATE_NUMBER = Pattern.compile("(?i)^(\\d+|[ivxl]+)\\.?$");
    private static final Pattern ORDINAL = Pattern.compile("^(erst|zweit|dritt|viert|fünft|sechst|siebt|acht|neunt|zehnt)");
    private static final int PREPOSITION_DISTANCE = 3;

    private final GrammarPoint nominativePoint;
    private final GrammarPoint accusativePoint;
    private final GrammarPoint dativePoint;
    private final GrammarPoint genitivePoint;

    public CaseDetector(GrammarCatalogLoader catalog) {
        this.nominativePoint = catalog.require(NOMINATIVE_POINT);
        this.accusativePoint = catalog.require(ACCUSATIVE_POINT);
        this.dativePoint = catalog.require(DATIVE_POINT);
        this.genitivePoint = catalog.require(GENITIVE_POINT);
    }

    @Override
    public DetectorId id() {
        return DetectorId.CASE;
    }

    @Override
    public List<DetectionResult> detect(Sentence sentence) {
        List<DetectionResult> results = new ArrayList<>();
        for (int p = 0; p < sentence.tokenCount(); p++) {
            Token token = sentence.getToken(p);
            if (!CASE_BEARING_POS.contains(token.pos())) {
                continue;
            }
            switch (Morphology.caseOf(token)) {
                case "Nom" -> results.add(result(nominativePoint, token, "nominative", 0.95, null));
                case "Acc" -> results.add(result(accusativePoint, token, "accusative", 0.95, null));
                case "Dat" -> results.add(result(dativePoint, token, "dative", 0.95, dativeContext(sentence, p)));
                case "Gen" -> results.add(result(genitivePoint, token, "genitive", 0.90, null));
                default -> {
                }
            }
        }
        return results;
    }

    /**
     * "temporal" for dates and time nouns, "prepositional" after a
     * preposition within the same phrase, otherwise "indirect-object".
     */
    static String dativeContext(Sentence sentence, int position) {
        Token token = sentence.getToken(position);
        String text = token.lowerText();
        if (("NUM".equals(token.pos()) || "ADJ".equals(token.pos()))
            && (DATE_NUMBER.matcher(text).matches() || ORDINAL.matcher(text).find())) {
            return "temporal";
        }
        if ("NOUN".equals(token.pos()) && TEMPORAL_NOUNS.contains(token.lowerLemma())) {
            return "temporal";
        }
        int preposition = TokenClassifier.findPrevious(sentence, position, TokenClassifier::isPreposition,
            PREPOSITION_DISTANCE);
        if (preposition >= 0 && noVerbBetween(sentence, preposition, position)) {
            return "prepositional";
        }
        return "indirect-object";
    }

    private static boolean noVerbBetween(Sentence sentence, int from, int to) {
        for (int p = from + 1; p < to; p++) {
            if (TokenClassifier.isVerbOrAux(sentence.getToken(p))) {
                return false;
            }
        }
        return true;
    }

    private DetectionResult result(GrammarPoint point, Token token, String caseName, double confidence,
                                   String dativeContext) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("case", caseName);
        details.put("word", token.text());
        details.put("pos", token.pos());
        details.put("dativeContext", dativeContext);
        return DetectionResult.of(point, List.of(Positions.of(token)), confidence, details);
    }
}
