package pl.marcinmilkowski.grammar_sketch.detection.collocation;

import pl.marcinmilkowski.grammar_sketch.detection.DetectorId;
import pl.marcinmilkowski.grammar_sketch.detection.GrammarDetector;
import pl.marcinmilkowski.grammar_sketch.detection.Positions;
import pl.marcinmilkowski.grammar_sketch.model.CefrLevel;
import pl.marcinmilkowski.grammar_sketch.model.DetectionResult;
import pl.marcinmilkowski.grammar_sketch.model.GrammarCategory;
import pl.marcinmilkowski.grammar_sketch.model.GrammarPoint;
import pl.marcinmilkowski.grammar_sketch.model.Sentence;
import pl.marcinmilkowski.grammar_sketch.model.Sentence.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Detects verb collocations from the loaded catalog.
 *
 * <p>Separable definitions are matched (and traced) like all others but
 * never emitted: separable verbs are reported by the separable-verb
 * detector.</p>
 */
public class CollocationDetector implements GrammarDetector {

    public static final String GRAMMAR_POINT_ID = "b1-collocations";
    public static final String RESULT_ID_PREFIX = "collocation-";

    private final List<CollocationDefinition> definitions;
    private final GrammarPoint grammarPoint;
    private final CollocationMatcher matcher;
    private final MatchTraceSink traceSink;

    public CollocationDetector(List<CollocationDefinition> definitions, GrammarPoint grammarPoint) {
        this(definitions, grammarPoint, MatchTraceSink.NONE);
    }

    public CollocationDetector(List<CollocationDefinition> definitions, GrammarPoint grammarPoint,
                               MatchTraceSink traceSink) {
        if (grammarPoint.category() != GrammarCategory.COLLOCATION) {
            throw new IllegalArgumentException("Grammar point '" + grammarPoint.id() + "' is not a collocation point");
        }
        this.definitions = List.copyOf(definitions);
        this.grammarPoint = grammarPoint;
        this.matcher = new CollocationMatcher();
        this.traceSink = traceSink == null ? MatchTraceSink.NONE : traceSink;
    }

    @Override
    public DetectorId id() {
        return DetectorId.COLLOCATION;
    }

    @Override
    public List<DetectionResult> detect(Sentence sentence) {
        List<DetectionResult> results = new ArrayList<>();
        for (CollocationDefinition definition : definitions) {
            for (CollocationMatch match : matcher.match(sentence, definition, traceSink)) {
                if (definition.type() == CollocationType.SEPARABLE) {
                    traceSink.accept(MatchTrace.attempt(definition, match.verb().index(), match.verb().index(),
                        MatchTrace.Event.SUPPRESSED));
                    continue;
                }
                traceSink.accept(MatchTrace.attempt(definition, match.verb().index(), match.verb().index(),
                    MatchTrace.Event.MATCHED));
                results.add(toResult(match));
            }
        }
        return results;
    }

    /**
     * Every match attempt for every definition, including suppressed
     * separable ones. For diagnostics only.
     */
    public List<MatchTrace> explain(Sentence sentence) {
        List<MatchTrace> traces = new ArrayList<>();
        MatchTraceSink collector = traces::add;
        for (CollocationDefinition definition : definitions) {
            for (CollocationMatch match : matcher.match(sentence, definition, collector)) {
                MatchTrace.Event event = definition.type() == CollocationType.SEPARABLE
                    ? MatchTrace.Event.SUPPRESSED : MatchTrace.Event.MATCHED;
                traces.add(MatchTrace.attempt(definition, match.verb().index(), match.verb().index(), event));
            }
        }
        return traces;
    }

    public List<CollocationDefinition> getDefinitions() {
        return definitions;
    }

    private DetectionResult toResult(CollocationMatch match) {
        CollocationDefinition definition = match.definition();
        List<Token> tokens = match.tokens();

        List<String> words = new ArrayList<>();
        List<String> lemmas = new ArrayList<>();
        List<String> deps = new ArrayList<>();
        List<Integer> indices = new ArrayList<>();
        for (Token token : tokens) {
            words.add(token.text());
            lemmas.add(token.lemma());
            deps.add(token.dep());
            indices.add(token.index());
        }
        Map<String, String> roleTiers = new LinkedHashMap<>();
        for (RoleMatch role : match.roles()) {
            roleTiers.put(role.companion().role().name().toLowerCase(), role.tier().label());
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("collocation", definition.label());
        details.put("collocationId", definition.id());
        details.put("type", definition.type().id());
        details.put("tier", match.tier().label());
        details.put("roleTiers", Collections.unmodifiableMap(roleTiers));
        details.put("words", List.copyOf(words));
        details.put("lemmas", List.copyOf(lemmas));
        details.put("deps", List.copyOf(deps));
        details.put("tokenIndices", List.copyOf(indices));
        details.put("meaning", definition.info().meaning());

        CefrLevel level = definition.info().level() != null ? definition.info().level() : grammarPoint.level();
        return new DetectionResult(RESULT_ID_PREFIX + definition.id(), GrammarCategory.COLLOCATION, level,
            Positions.each(tokens), match.confidence(), details);
    }
}
