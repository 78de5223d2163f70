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
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Extended attributes: more than one modifier before a noun, typically a
 * participle with its own complements ("der von allen geliebte Lehrer").
 *
 * <p>The phrase is collected leftwards from the noun. Adjectives and
 * participles always join it. Once a participle is in the phrase, its
 * complements (adverbs, prepositions and their noun phrases) join too.
 * A leading article belongs to the head noun and is dropped.</p>
 */
public class ExtendedAdjectiveDetector implements GrammarDetector {

    static final String GRAMMAR_POINT = "b2-extended-adjectives";

    private static final Set<String> ATTRIBUTIVE_PREPOSITIONS = Set.of(
        "von", "mit", "für", "aus", "in", "auf", "über", "unter", "vor", "nach", "bei", "seit", "zu", "an");
    private static final Set<String> COMPLEMENT_POS = Set.of("ADV", "NOUN", "PROPN", "PRON", "DET");
    private static final Pattern DATE_NUMBER = Pattern.compile("^\\d+\\.?$");

    private final GrammarPoint point;

    public ExtendedAdjectiveDetector(GrammarCatalogLoader catalog) {
        this.point = catalog.require(GRAMMAR_POINT);
    }

    @Override
    public DetectorId id() {
        return DetectorId.EXTENDED_ADJECTIVE;
    }

    @Override
    public List<DetectionResult> detect(Sentence sentence) {
        List<DetectionResult> results = new ArrayList<>();
        for (int p = 1; p < sentence.tokenCount(); p++) {
            Token noun = sentence.getToken(p);
            if (!"NOUN".equals(noun.pos())) {
                continue;
            }
            LinkedList<Token> phrase = collectPhrase(sentence, p);
            if (phrase.size() <= 1) {
                continue;
            }
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("noun", noun.text());
            details.put("modifiers", phrase.stream().map(Token::text).toList());
            details.put("phraseLength", phrase.size());
            details.put("type", classify(phrase));
            results.add(DetectionResult.of(point, List.of(Positions.span(phrase.getFirst(), noun)), 0.90, details));
        }
        return results;
    }

    private static LinkedList<Token> collectPhrase(Sentence sentence, int nounPosition) {
        LinkedList<Token> phrase = new LinkedList<>();
        boolean participle = false;
        for (int p = nounPosition - 1; p >= 0; p--) {
            Token token = sentence.getToken(p);
            if ("PUNCT".equals(token.pos())) {
                break;
            }
            if (isParticiple(token)) {
                participle = true;
                phrase.addFirst(token);
                continue;
            }
            if (TokenClassifier.isVerbOrAux(token)) {
                break;
            }
            if ("NUM".equals(token.pos()) || DATE_NUMBER.matcher(token.text()).matches()) {
                continue;
            }
            if ("ADJ".equals(token.pos())) {
                phrase.addFirst(token);
            } else if (participle && TokenClassifier.isPreposition(token)
                && ATTRIBUTIVE_PREPOSITIONS.contains(TokenClassifier.prepositionLemma(token))) {
                phrase.addFirst(token);
            } else if (participle && COMPLEMENT_POS.contains(token.pos())) {
                phrase.addFirst(token);
            } else {
                break;
            }
        }
        while (!phrase.isEmpty() && "DET".equals(phrase.getFirst().pos())) {
            phrase.removeFirst();
        }
        return phrase;
    }

    private static boolean isParticiple(Token token) {
        boolean attributive = "ADJ".equals(token.pos()) || TokenClassifier.isVerbOrAux(token);
        return attributive && (TokenClassifier.isPastParticiple(token) || TokenClassifier.isPresentParticiple(token));
    }

    private static String classify(List<Token> phrase) {
        boolean participle = phrase.stream().anyMatch(ExtendedAdjectiveDetector::isParticiple);
        boolean preposition = phrase.stream().anyMatch(TokenClassifier::isPreposition);
        if (participle && preposition) {
            return "participle-with-preposition";
        }
        if (participle) {
            return "participle";
        }
        if (preposition) {
            return "prepositional";
        }
        return "multiple-adjectives";
    }
}
