package pl.marcinmilkowski.grammar_sketch.engine;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pl.marcinmilkowski.grammar_sketch.SentenceFixtures;
import pl.marcinmilkowski.grammar_sketch.config.CollocationCatalogLoader;
import pl.marcinmilkowski.grammar_sketch.config.EngineConfig;
import pl.marcinmilkowski.grammar_sketch.config.GrammarCatalogLoader;
import pl.marcinmilkowski.grammar_sketch.detection.DetectorId;
import pl.marcinmilkowski.grammar_sketch.detection.GrammarDetector;
import pl.marcinmilkowski.grammar_sketch.detection.Positions;
import pl.marcinmilkowski.grammar_sketch.detection.rules.SeparableVerbDetector;
import pl.marcinmilkowski.grammar_sketch.model.CefrLevel;
import pl.marcinmilkowski.grammar_sketch.model.DetectionResult;
import pl.marcinmilkowski.grammar_sketch.model.DetectionResult.Position;
import pl.marcinmilkowski.grammar_sketch.model.GrammarCategory;
import pl.marcinmilkowski.grammar_sketch.model.GrammarPoint;
import pl.marcinmilkowski.grammar_sketch.model.Sentence;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class DetectionEngineTest {

    private static GrammarCatalogLoader catalog;
    private static DetectionEngine engine;

    @BeforeAll
    static void setUp() {
        catalog = GrammarCatalogLoader.createDefault();
        EngineConfig config = new EngineConfig(0.5, 2, false, EngineConfig.AiSettings.disabled());
        engine = DetectionEngine.create(catalog, CollocationCatalogLoader.createDefault(), config);
    }

    static Sentence freuenAuf() {
        return SentenceFixtures.sentence()
            .tok("Ich", "ich", "PRON", "PPER", "nsubj", 1)
            .tok("freue", "freuen", "VERB", "VVFIN", "ROOT", -1).morph("VerbForm=Fin|Tense=Pres")
            .tok("mich", "sich", "PRON", "PRF", "obj", 1).morph("Reflex=Yes")
            .tok("auf", "auf", "ADP", "APPR", "case", 5)
            .tok("das", "der", "DET", "ART", "det", 5)
            .tok("Konzert", "Konzert", "NOUN", "NN", "obl", 1)
            .punct(".", 1)
            .build();
    }

    static Sentence stehAuf() {
        return SentenceFixtures.sentence()
            .tok("Ich", "ich", "PRON", "PPER", "nsubj", 1)
            .tok("stehe", "stehen", "VERB", "VVFIN", "ROOT", -1).morph("VerbForm=Fin")
            .tok("früh", "früh", "ADV", "ADJD", "advmod", 1)
            .tok("auf", "auf", "ADP", "PTKVZ", "compound:prt", 1)
            .punct(".", 1)
            .build();
    }

    static Sentence hallo() {
        return SentenceFixtures.sentence()
            .tok("Hallo", "hallo", "INTJ", "ITJ", "ROOT", -1)
            .tok("Welt", "Welt", "NOUN", "NN", "vocative", 0)
            .punct("!", 0)
            .build();
    }

    private static GrammarDetector throwing(DetectorId id) {
        return new GrammarDetector() {
            @Override
            public DetectorId id() {
                return id;
            }

            @Override
            public List<DetectionResult> detect(Sentence sentence) {
                throw new IllegalStateException("broken detector");
            }
        };
    }

    private static AiFallbackAnnotator annotator(long timeoutMillis, CompletableFuture<List<DetectionResult>> answer,
                                                 AtomicInteger calls) {
        return new AiFallbackAnnotator() {
            @Override
            public CompletableFuture<List<DetectionResult>> annotateAsync(Sentence sentence) {
                calls.incrementAndGet();
                return answer;
            }

            @Override
            public long timeoutMillis() {
                return timeoutMillis;
            }
        };
    }

    private static DetectionResult aiResult() {
        return new DetectionResult("ai-separable-verb", GrammarCategory.SEPARABLE_VERB, CefrLevel.B1,
            List.of(new Position(0, 5)), 0.7, Map.of("aiGenerated", true));
    }

    @Test
    void testAllDetectorsRegistered() {
        assertEquals(DetectorId.values().length, engine.getDetectors().size());
        assertTrue(engine.getDetector(DetectorId.COLLOCATION).isPresent());
    }

    @Test
    void testDuplicateRegistrationRejected() {
        DetectionEngine.Builder builder = DetectionEngine.builder().register(throwing(DetectorId.PASSIVE));
        assertThrows(IllegalArgumentException.class, () -> builder.register(throwing(DetectorId.PASSIVE)));
    }

    @Test
    void testAnalyzeFindsCollocation() {
        Sentence s = freuenAuf();
        AnalysisResult result = engine.analyze(s);
        DetectionResult collocation = result.grammarPoints().stream()
            .filter(r -> r.grammarPointId().equals("collocation-sich-freuen-auf"))
            .findFirst().orElseThrow();
        assertEquals(List.of(collocation), result.byCategory().get(GrammarCategory.COLLOCATION));
        assertTrue(result.byLevel().get(collocation.level()).contains(collocation));
    }

    @Test
    void testRuleDetectorsReportAlongsideCollocation() {
        AnalysisResult result = engine.analyze(freuenAuf());
        assertTrue(result.grammarPoints().stream().anyMatch(r -> r.grammarPointId().equals("a2-reflexive-verbs")));
        assertTrue(result.grammarPoints().stream().anyMatch(r -> r.grammarPointId().equals("a1-present-tense")));
        assertFalse(result.byCategory().get(GrammarCategory.TENSE).isEmpty());
    }

    @Test
    @DisplayName("Every position covers exactly the surface text of real tokens")
    void testPositionsMatchTokens() {
        Sentence s = freuenAuf();
        for (DetectionResult r : engine.analyze(s).grammarPoints()) {
            for (Position p : r.positions()) {
                String covered = Positions.substring(s, p);
                assertTrue(s.tokens().stream().anyMatch(t -> t.characterStart() == p.start()),
                    r.grammarPointId() + " starts inside a token: " + covered);
                assertTrue(s.tokens().stream().anyMatch(t -> t.characterEnd() == p.end()),
                    r.grammarPointId() + " ends inside a token: " + covered);
            }
        }
    }

    @Test
    void testAnalyzeIsIdempotent() {
        Sentence s = freuenAuf();
        assertEquals(engine.analyze(s), engine.analyze(s));
    }

    @Test
    void testResultsSortedByStart() {
        List<DetectionResult> points = engine.analyze(freuenAuf()).grammarPoints();
        for (int i = 1; i < points.size(); i++) {
            assertTrue(points.get(i - 1).start() <= points.get(i).start());
        }
    }

    @Test
    void testViewsHaveEveryKey() {
        AnalysisResult result = engine.analyze(hallo());
        assertEquals(CefrLevel.values().length, result.byLevel().size());
        assertEquals(GrammarCategory.values().length, result.byCategory().size());
        assertEquals(0, result.toJson().getJSONObject("summary").getIntValue("totalPoints"));
        assertEquals(0, result.toJson().getJSONObject("summary").getJSONObject("levels").getIntValue("B1"));
    }

    @Test
    @DisplayName("A split separable verb is reported once, by the separable-verb detector")
    void testSeparableVerbNotReportedAsCollocation() {
        List<DetectionResult> points = engine.analyze(stehAuf()).grammarPoints();
        assertTrue(points.stream().anyMatch(r -> r.grammarPointId().equals("b1-separable-verbs")));
        assertTrue(points.stream().noneMatch(r -> r.category() == GrammarCategory.COLLOCATION));
    }

    @Test
    void testFailingDetectorIsIsolated() {
        DetectionEngine partial = DetectionEngine.builder()
            .register(throwing(DetectorId.PASSIVE))
            .register(new SeparableVerbDetector(catalog))
            .build();
        AnalysisResult result = partial.analyze(stehAuf());
        assertEquals(1, result.totalPoints());
        assertEquals("b1-separable-verbs", result.grammarPoints().get(0).grammarPointId());
    }

    @Test
    void testPostProcess() {
        Sentence s = hallo();
        GrammarPoint point = catalog.require("a1-present-tense");
        DetectionResult weak = DetectionResult.of(point, List.of(new Position(0, 5)), 0.6, Map.of());
        DetectionResult strong = DetectionResult.of(point, List.of(new Position(0, 5)), 0.9, Map.of());
        DetectionResult low = DetectionResult.of(point, List.of(new Position(6, 10)), 0.3, Map.of());
        DetectionResult outside = DetectionResult.of(point, List.of(new Position(6, 99)), 0.9, Map.of());
        DetectionResult later = DetectionResult.of(point, List.of(new Position(6, 10)), 0.8, Map.of());

        List<DetectionResult> input = new ArrayList<>(List.of(later, weak, low, outside, strong));
        input.add(null);
        List<DetectionResult> merged = DetectionEngine.builder().build().postProcess(input, s);
        assertEquals(List.of(strong, later), merged);
    }

    @Test
    void testAiFallbackOnlyWhenNothingFound() {
        AtomicInteger calls = new AtomicInteger();
        DetectionEngine withAi = DetectionEngine.builder()
            .register(new SeparableVerbDetector(catalog))
            .aiAnnotator(annotator(1000, CompletableFuture.completedFuture(List.of(aiResult())), calls))
            .build();

        AnalysisResult ruleBased = withAi.analyze(stehAuf());
        assertEquals(0, calls.get());
        assertTrue(ruleBased.grammarPoints().stream().noneMatch(r -> r.details().containsKey("aiGenerated")));

        AnalysisResult fallback = withAi.analyze(hallo());
        assertEquals(1, calls.get());
        assertEquals(List.of(aiResult()), fallback.grammarPoints());
    }

    @Test
    void testAiFailureLeavesEmptyResult() {
        CompletableFuture<List<DetectionResult>> failed = new CompletableFuture<>();
        failed.completeExceptionally(new DeepSeekAnnotator.AiAnnotationException("HTTP 500"));
        DetectionEngine withAi = DetectionEngine.builder()
            .aiAnnotator(annotator(1000, failed, new AtomicInteger()))
            .build();
        AnalysisResult result = withAi.analyze(hallo());
        assertTrue(result.isEmpty());
        assertEquals("Hallo Welt!", result.sentence());
    }

    @Test
    void testAiTimeoutLeavesEmptyResult() {
        DetectionEngine withAi = DetectionEngine.builder()
            .aiAnnotator(annotator(50, new CompletableFuture<>(), new AtomicInteger()))
            .build();
        assertTrue(withAi.analyze(hallo()).isEmpty());
    }

    @Test
    void testAnalyzeAllKeepsOrder() {
        List<Sentence> sentences = List.of(freuenAuf(), hallo(), stehAuf(), freuenAuf());
        List<AnalysisResult> results = engine.analyzeAll(sentences);
        assertEquals(sentences.size(), results.size());
        for (int i = 0; i < sentences.size(); i++) {
            assertEquals(sentences.get(i).text(), results.get(i).sentence());
            assertEquals(engine.analyze(sentences.get(i)), results.get(i));
        }
        assertTrue(engine.analyzeAll(List.of()).isEmpty());
    }
}
