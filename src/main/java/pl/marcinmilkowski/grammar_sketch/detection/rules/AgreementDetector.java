package pl.marcinmilkowski.grammar_sketch.detection.rules;

import pl.marcinmilkowski.grammar_sketch.config.GrammarCatalogLoader;
import pl.marcinmilkowski.grammar_sketch.detection.DependencyUtils;
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
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Case, gender and number agreement inside noun phrases.
 *
 * <p>A noun phrase is a nominal head plus its dependents reached over
 * NP-internal relations. Each phrase ends up in one of three states:
 * correct (every marked token agrees), error (two different values for a
 * feature) or uncertain (a feature is not marked at all).</p>
 */
public class AgreementDetector implements GrammarDetector {

    static final String GRAMMAR_POINT = "b1-adjective-agreement";

    private static final Set<String> NOMINAL_HEAD_POS = Set.of("NOUN", "PROPN");
    private static final Set<String> HEAD_POS = Set.of("NOUN", "PROPN", "PRON", "NUM");
    private static final Set<String> NP_RELATIONS = Set.of(
        "det", "amod", "compound", "nmod", "appos", "advmod", "case", "conj", "nk");
    private static final Set<String> NP_POS = Set.of("NOUN", "PROPN", "PRON", "NUM", "ADJ", "DET");
    private static final Set<String> INFLECTED_POS = Set.of("DET", "ADJ", "NOUN", "NUM", "PRON");

    enum State {
        CORRECT("correct", 0.90),
        ERROR("error", 0.85),
        UNCERTAIN("uncertain", 0.65);

        private final String label;
        private final double confidence;

        State(String label, double confidence) {
            this.label = label;
            this.confidence = confidence;
        }

        String label() {
            return label;
        }
    }

    private final GrammarPoint point;

    public AgreementDetector(GrammarCatalogLoader catalog) {
        this.point = catalog.require(GRAMMAR_POINT);
    }

    @Override
    public DetectorId id() {
        return DetectorId.AGREEMENT;
    }

    @Override
    public List<DetectionResult> detect(Sentence sentence) {
        List<DetectionResult> results = new ArrayList<>();
        for (List<Token> phrase : nounPhrases(sentence)) {
            if (phrase.size() < 2 || phrase.stream().anyMatch(token -> isName(sentence, phrase, token))) {
                continue;
            }
            DetectionResult result = check(phrase);
            if (result != null) {
                results.add(result);
            }
        }
        return results;
    }

    /**
     * Noun phrases, nominal heads first, then pronoun and numeral heads. A
     * token belongs to at most one phrase.
     */
    List<List<Token>> nounPhrases(Sentence sentence) {
        List<List<Token>> phrases = new ArrayList<>();
        Set<Integer> visited = new HashSet<>();
        for (Set<String> heads : List.of(NOMINAL_HEAD_POS, HEAD_POS)) {
            for (Token token : sentence.tokens()) {
                if (!heads.contains(token.pos()) || visited.contains(token.index())) {
                    continue;
                }
                Set<Token> phrase = new LinkedHashSet<>();
                collect(sentence, token, phrase, visited);
                List<Token> ordered = new ArrayList<>(phrase);
                ordered.sort(Comparator.comparingInt(Token::index));
                phrases.add(ordered);
            }
        }
        phrases.sort(Comparator.comparingInt(phrase -> phrase.get(0).index()));
        return phrases;
    }

    private static void collect(Sentence sentence, Token token, Set<Token> phrase, Set<Integer> visited) {
        if (!visited.add(token.index())) {
            return;
        }
        phrase.add(token);
        for (Token child : DependencyUtils.children(sentence, token.index())) {
            if (NP_RELATIONS.contains(child.dep()) && NP_POS.contains(child.pos())) {
                collect(sentence, child, phrase, visited);
            }
        }
    }

    private DetectionResult check(List<Token> phrase) {
        List<Token> inflected = phrase.stream().filter(t -> INFLECTED_POS.contains(t.pos())).toList();
        if (inflected.size() < 2) {
            return null;
        }
        Set<String> cases = values(inflected, Morphology::caseOf);
        Set<String> numbers = values(inflected, Morphology::numberOf);
        Set<String> genders = values(inflected, Morphology::genderOf);
        boolean plural = numbers.size() == 1 && numbers.contains("Plur");

        List<String> missing = new ArrayList<>();
        if (cases.isEmpty()) {
            missing.add("case");
        }
        if (numbers.isEmpty()) {
            missing.add("number");
        }
        if (genders.isEmpty() && !plural) {
            missing.add("gender");
        }

        State state;
        if (cases.size() > 1 || numbers.size() > 1 || (!plural && genders.size() > 1)) {
            state = State.ERROR;
        } else if (!missing.isEmpty()) {
            state = State.UNCERTAIN;
        } else {
            state = State.CORRECT;
        }
        if (state == State.CORRECT && phrase.stream().noneMatch(t -> "ADJ".equals(t.pos()))) {
            return null;
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("npTokens", phrase.stream().map(Token::text).toList());
        details.put("state", state.label());
        details.put("case", single(cases));
        details.put("gender", plural ? null : single(genders));
        details.put("number", single(numbers));
        details.put("missing", missing);
        details.put("correct", state == State.CORRECT);
        details.put("tokenIndices", phrase.stream().map(Token::index).toList());
        return DetectionResult.of(point, List.of(Positions.span(phrase.get(0), phrase.get(phrase.size() - 1))),
            state.confidence, details);
    }

    private static Set<String> values(List<Token> tokens, Function<Token, String> feature) {
        Set<String> values = new LinkedHashSet<>();
        for (Token token : tokens) {
            String value = feature.apply(token);
            if (Morphology.isKnown(value)) {
                values.add(value);
            }
        }
        return values;
    }

    private static String single(Set<String> values) {
        return values.size() == 1 ? values.iterator().next() : null;
    }

    /**
     * Proper nouns, person/place/organisation entities, and phrases that
     * contain a whole multi-token entity ("die Neue Zürcher Zeitung").
     */
    private static boolean isName(Sentence sentence, List<Token> phrase, Token token) {
        if ("PROPN".equals(token.pos()) || TokenClassifier.isNamedEntity(token)) {
            return true;
        }
        if (!TokenClassifier.isPartOfEntity(token)) {
            return false;
        }
        List<Token> entity = TokenClassifier.entityTokens(sentence, token);
        return entity.size() > 1 && phrase.containsAll(entity);
    }
}
