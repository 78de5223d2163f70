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
 * Verb mood: the würde-conditional, Konjunktiv II of the irregular verbs,
 * Konjunktiv I in reported speech, and the imperative.
 */
public class MoodDetector implements GrammarDetector {

    static final String CONDITIONAL_POINT = "b1-konjunktiv-II-conditional";
    static final String SUBJUNCTIVE_POINT = "b1-konjunktiv-II-subjunctive";
    static final String KONJUNKTIV_I_POINT = "b2-konjunktiv-I";
    static final String IMPERATIVE_POINT = "a1-imperative";

    private static final Set<String> SUBJUNCTIVE_MOODS = Set.of("Sub", "Subj");

    /** Konjunktiv II forms that cannot be read as indicative. */
    private static final Set<String> UNAMBIGUOUS_KONJUNKTIV_II = Set.of(
        "wäre", "wärest", "wärst", "wären", "wäret", "wärt",
        "hätte", "hättest", "hätten", "hättet",
        "würde", "würdest", "würden", "würdet",
        "könnte", "könntest", "könnten", "könntet",
        "müsste", "müsstest", "müssten", "müsstet",
        "dürfte", "dürftest", "dürften", "dürftet",
        "möchte", "möchtest", "möchten", "möchtet",
        "käme", "kämen", "ginge", "gingen", "gäbe", "gäben", "wüsste", "wüssten");

    /** Konjunktiv II forms that equal the indicative past; counted only with Mood=Sub. */
    private static final Set<String> AMBIGUOUS_KONJUNKTIV_II = Set.of(
        "sollte", "solltest", "sollten", "solltet", "wollte", "wolltest", "wollten", "wolltet");

    private static final Set<String> REPORTING_VERBS = Set.of(
        "sagen", "erzählen", "berichten", "meinen", "behaupten", "denken", "glauben", "erklären", "schreiben");

    private final GrammarPoint conditionalPoint;
    private final GrammarPoint subjunctivePoint;
    private final GrammarPoint konjunktivIPoint;
    private final GrammarPoint imperativePoint;

    public MoodDetector(GrammarCatalogLoader catalog) {
        this.conditionalPoint = catalog.require(CONDITIONAL_POINT);
        this.subjunctivePoint = catalog.require(SUBJUNCTIVE_POINT);
        this.konjunktivIPoint = catalog.require(KONJUNKTIV_I_POINT);
        this.imperativePoint = catalog.require(IMPERATIVE_POINT);
    }

    @Override
    public DetectorId id() {
        return DetectorId.MOOD;
    }

    @Override
    public List<DetectionResult> detect(Sentence sentence) {
        List<DetectionResult> results = new ArrayList<>();
        for (int p = 0; p < sentence.tokenCount(); p++) {
            Token token = sentence.getToken(p);
            if (!TokenClassifier.isVerbOrAux(token)) {
                continue;
            }
            String mood = Morphology.moodOf(token);
            String text = token.lowerText();
            if ("werden".equals(token.lowerLemma()) && text.startsWith("würd")) {
                results.add(result(conditionalPoint, token, "konjunktiv-II-conditional", null, 0.98));
            } else if (UNAMBIGUOUS_KONJUNKTIV_II.contains(text)
                || (SUBJUNCTIVE_MOODS.contains(mood) && AMBIGUOUS_KONJUNKTIV_II.contains(text))) {
                results.add(result(subjunctivePoint, token, "konjunktiv-II-subjunctive", "irregular-verb", 0.90));
            } else if (SUBJUNCTIVE_MOODS.contains(mood) && followsReportingVerb(sentence, p)) {
                results.add(result(konjunktivIPoint, token, "konjunktiv-I", "indirect-speech", 0.85));
            } else if ("Imp".equals(mood) && "Fin".equals(Morphology.verbFormOf(token))) {
                results.add(result(imperativePoint, token, "imperative", null, 0.95));
            }
        }
        return results;
    }

    /**
     * Mood=Sub, or a form that is Konjunktiv II on its face.
     */
    static boolean isSubjunctive(Token token) {
        return SUBJUNCTIVE_MOODS.contains(Morphology.moodOf(token))
            || UNAMBIGUOUS_KONJUNKTIV_II.contains(token.lowerText());
    }

    private static boolean followsReportingVerb(Sentence sentence, int position) {
        return TokenClassifier.findPrevious(sentence, position,
            token -> TokenClassifier.isVerbOrAux(token) && REPORTING_VERBS.contains(token.lowerLemma()),
            position) >= 0;
    }

    private DetectionResult result(GrammarPoint point, Token verb, String mood, String type, double confidence) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("mood", mood);
        details.put("word", verb.text());
        details.put("lemma", verb.lemma());
        details.put("type", type);
        String person = Morphology.personOf(verb);
        details.put("person", Morphology.isKnown(person) ? person : null);
        return DetectionResult.of(point, List.of(Positions.of(verb)), confidence, details);
    }
}
