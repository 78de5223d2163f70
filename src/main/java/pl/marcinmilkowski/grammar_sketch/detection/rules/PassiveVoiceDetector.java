package pl.marcinmilkowski.grammar_sketch.detection.rules;

import pl.marcinmilkowski.grammar_sketch.config.GrammarCatalogLoader;
import pl.marcinmilkowski.grammar_sketch.detection.DetectorId;
import pl.marcinmilkowski.grammar_sketch.detection.GrammarDetector;
import pl.marcinmilkowski.grammar_sketch.detection.Morphology;
import pl.marcinmilkowski.grammar_sketch.detection.Positions;
import pl.marcinmilkowski.grammar_sketch.detection.TokenClassifier;
import pl.marcinmilkowski.grammar_sketch.model.DetectionResult;
import pl.marcinmilkowski.grammar_sketch.model.DetectionResult.Position;
import pl.marcinmilkowski.grammar_sketch.model.GrammarPoint;
import pl.marcinmilkowski.grammar_sketch.model.Sentence;
import pl.marcinmilkowski.grammar_sketch.model.Sentence.Token;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dynamic passive (werden + participle) in present and past, the agent
 * phrase with von/durch, and the statal passive (sein + participle).
 */
public class PassiveVoiceDetector implements GrammarDetector {

    static final String PRESENT_POINT = "b1-passive-voice-present";
    static final String PAST_POINT = "b1-passive-voice-past";
    static final String AGENT_POINT = "b2-passive-von-durch";
    static final String STATAL_POINT = "b2-statal-passive";

    private static final int PARTICIPLE_SEARCH = 10;
    private static final int AGENT_SEARCH = 6;

    private final GrammarPoint presentPoint;
    private final GrammarPoint pastPoint;
    private final GrammarPoint agentPoint;
    private final GrammarPoint statalPoint;

    public PassiveVoiceDetector(GrammarCatalogLoader catalog) {
        this.presentPoint = catalog.require(PRESENT_POINT);
        this.pastPoint = catalog.require(PAST_POINT);
        this.agentPoint = catalog.require(AGENT_POINT);
        this.statalPoint = catalog.require(STATAL_POINT);
    }

    @Override
    public DetectorId id() {
        return DetectorId.PASSIVE;
    }

    @Override
    public List<DetectionResult> detect(Sentence sentence) {
        List<DetectionResult> results = new ArrayList<>();
        for (int p = 0; p < sentence.tokenCount(); p++) {
            Token token = sentence.getToken(p);
            if (TokenClassifier.isPassiveAuxiliary(token, "werden")) {
                detectDynamic(sentence, p, results);
            } else if (TokenClassifier.isPassiveAuxiliary(token, "sein")) {
                detectStatal(sentence, p, results);
            }
        }
        return results;
    }

    private void detectDynamic(Sentence sentence, int auxPosition, List<DetectionResult> results) {
        int participlePosition = TokenClassifier.findNextParticiple(sentence, auxPosition, PARTICIPLE_SEARCH, true);
        if (participlePosition < 0) {
            return;
        }
        Token auxiliary = sentence.getToken(auxPosition);
        Token participle = sentence.getToken(participlePosition);
        String tense = tenseOf(auxiliary);
        GrammarPoint point = "Past".equals(tense) ? pastPoint : presentPoint;

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("passiveType", "Past".equals(tense) ? "past" : "present");
        details.put("auxiliary", auxiliary.text());
        details.put("participle", participle.text());
        details.put("lemma", participle.lemma());
        details.put("tense", tense);
        results.add(DetectionResult.of(point,
            List.of(Positions.of(auxiliary), Positions.of(participle)), 0.95, details));

        int[] agent = findAgentPhrase(sentence, auxPosition + 1);
        if (agent != null) {
            Token preposition = sentence.getToken(agent[0]);
            Token noun = sentence.getToken(agent[1]);
            Map<String, Object> agentDetails = new LinkedHashMap<>();
            agentDetails.put("passiveType", "passive-with-agent");
            agentDetails.put("auxiliary", auxiliary.text());
            agentDetails.put("participle", participle.text());
            agentDetails.put("preposition", preposition.text());
            agentDetails.put("agent", noun.text());
            agentDetails.put("lemma", participle.lemma());
            List<Position> positions = new ArrayList<>(List.of(
                Positions.of(auxiliary), Positions.of(participle), Positions.span(preposition, noun)));
            positions.sort(Comparator.comparingInt(Position::start));
            results.add(DetectionResult.of(agentPoint, positions, 0.95, agentDetails));
        }
    }

    private void detectStatal(Sentence sentence, int auxPosition, List<DetectionResult> results) {
        int participlePosition = TokenClassifier.findNextParticiple(sentence, auxPosition, 1, false);
        if (participlePosition < 0) {
            return;
        }
        Token auxiliary = sentence.getToken(auxPosition);
        Token participle = sentence.getToken(participlePosition);
        if (TokenClassifier.SEIN_PERFECT_VERBS.contains(participle.lowerLemma())) {
            return;
        }
        // "ist gebaut worden" is the perfect of the werden-passive
        Token next = sentence.getToken(participlePosition + 1);
        if (next != null && "worden".equals(next.lowerText())) {
            return;
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("passiveType", "statal-passive");
        details.put("auxiliary", auxiliary.text());
        details.put("participle", participle.text());
        details.put("tense", tenseOf(auxiliary));
        details.put("lemma", participle.lemma());
        results.add(DetectionResult.of(statalPoint,
            List.of(Positions.span(auxiliary, participle)), 0.90, details));
    }

    /**
     * von/durch followed by a noun within three tokens; returns the list
     * positions of the preposition and the noun.
     */
    private static int[] findAgentPhrase(Sentence sentence, int from) {
        int limit = Math.min(sentence.tokenCount(), from + AGENT_SEARCH);
        for (int p = from; p < limit; p++) {
            Token token = sentence.getToken(p);
            if (!TokenClassifier.matchesPreposition(token, "von") && !TokenClassifier.matchesPreposition(token, "durch")) {
                continue;
            }
            int nounLimit = Math.min(sentence.tokenCount(), p + 4);
            for (int q = p + 1; q < nounLimit; q++) {
                if (TokenClassifier.isNoun(sentence.getToken(q))) {
                    return new int[]{p, q};
                }
            }
        }
        return null;
    }

    /**
     * Surface form first ("wurde"/"wird"), then morphology.
     */
    static String tenseOf(Token auxiliary) {
        String text = auxiliary.lowerText();
        if (text.startsWith("wurde") || text.startsWith("wurd") || text.equals("war") || text.startsWith("waren")
            || text.equals("warst") || text.equals("wart")) {
            return "Past";
        }
        String tense = Morphology.tenseOf(auxiliary);
        return Morphology.isKnown(tense) ? tense : "Pres";
    }
}
