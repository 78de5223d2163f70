package pl.marcinmilkowski.grammar_sketch.detection.rules;

import pl.marcinmilkowski.grammar_sketch.config.GrammarCatalogLoader;
import pl.marcinmilkowski.grammar_sketch.detection.DependencyUtils;
import pl.marcinmilkowski.grammar_sketch.detection.DetectorId;
import pl.marcinmilkowski.grammar_sketch.detection.GrammarDetector;
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
import java.util.Optional;
import java.util.Set;

/**
 * Separable verbs, either split ("stehe ... auf") or in one of the forms
 * where prefix and stem stay together (infinitive, participle, verb-final
 * subordinate clause).
 */
public class SeparableVerbDetector implements GrammarDetector {

    static final String GRAMMAR_POINT = "b1-separable-verbs";

    private final GrammarPoint point;

    public SeparableVerbDetector(GrammarCatalogLoader catalog) {
        this.point = catalog.require(GRAMMAR_POINT);
    }

    @Override
    public DetectorId id() {
        return DetectorId.SEPARABLE_VERB;
    }

    @Override
    public List<DetectionResult> detect(Sentence sentence) {
        List<DetectionResult> results = new ArrayList<>();
        Set<Integer> verbsWithParticle = new HashSet<>();
        detectSeparated(sentence, results, verbsWithParticle);
        detectCombined(sentence, results, verbsWithParticle);
        return results;
    }

    /**
     * A particle tagged PTKVZ or labelled svp whose head is a verb.
     */
    private void detectSeparated(Sentence sentence, List<DetectionResult> results, Set<Integer> verbsWithParticle) {
        Set<String> seen = new HashSet<>();
        for (Token particle : sentence.tokens()) {
            if (!TokenClassifier.isSeparableParticle(particle)) {
                continue;
            }
            Optional<Token> verb = DependencyUtils.headToken(sentence, particle.index());
            if (verb.isEmpty() || !TokenClassifier.isVerbOrAux(verb.get())) {
                continue;
            }
            if (!seen.add(verb.get().index() + "-" + particle.index())) {
                continue;
            }
            verbsWithParticle.add(verb.get().index());

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("verb", verb.get().text());
            details.put("prefix", particle.text());
            details.put("fullVerb", fullVerb(particle.lowerText(), verb.get().lowerLemma()));
            details.put("pattern", "separated");
            details.put("tokenIndices", List.of(verb.get().index(), particle.index()));
            results.add(DetectionResult.of(point, List.of(Positions.of(verb.get()), Positions.of(particle)),
                0.95, details));
        }
    }

    private void detectCombined(Sentence sentence, List<DetectionResult> results, Set<Integer> verbsWithParticle) {
        boolean hasModal = false;
        for (Token token : sentence.tokens()) {
            if (TokenClassifier.isVerbOrAux(token) && TokenClassifier.isModalVerb(token)) {
                hasModal = true;
                break;
            }
        }
        for (int p = 0; p < sentence.tokenCount(); p++) {
            Token token = sentence.getToken(p);
            if (!TokenClassifier.isVerbOrAux(token) || verbsWithParticle.contains(token.index())) {
                continue;
            }
            Optional<String> prefix = TokenClassifier.separablePrefix(token.lemma());
            if (prefix.isEmpty() || !token.lowerText().startsWith(prefix.get())) {
                continue;
            }
            String context;
            double confidence;
            if ("VVINF".equals(token.tag()) || "VVIZU".equals(token.tag())) {
                context = "infinitive";
                confidence = hasModal ? 0.90 : 0.85;
            } else if (token.tag().endsWith("PP")) {
                context = "participle";
                confidence = 0.90;
            } else if (followsSubordinator(sentence, p)) {
                context = "subordinate";
                confidence = 0.85;
            } else {
                continue;
            }
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("verb", token.text());
            details.put("prefix", prefix.get());
            details.put("fullVerb", token.lemma());
            details.put("pattern", "combined");
            details.put("context", context);
            details.put("tokenIndices", List.of(token.index()));
            results.add(DetectionResult.of(point, List.of(Positions.of(token)), confidence, details));
        }
    }

    private static boolean followsSubordinator(Sentence sentence, int position) {
        for (int p = 0; p < position; p++) {
            if ("KOUS".equals(sentence.getToken(p).tag()) || "SCONJ".equals(sentence.getToken(p).pos())) {
                return true;
            }
        }
        return false;
    }

    private static String fullVerb(String particle, String lemma) {
        return lemma.startsWith(particle) ? lemma : particle + lemma;
    }
}
