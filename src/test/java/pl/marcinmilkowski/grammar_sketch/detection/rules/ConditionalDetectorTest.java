package pl.marcinmilkowski.grammar_sketch.detection.rules;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import pl.marcinmilkowski.grammar_sketch.SentenceFixtures;
import pl.marcinmilkowski.grammar_sketch.config.GrammarCatalogLoader;
import pl.marcinmilkowski.grammar_sketch.detection.Positions;
import pl.marcinmilkowski.grammar_sketch.model.DetectionResult;
import pl.marcinmilkowski.grammar_sketch.model.Sentence;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConditionalDetectorTest {

    private static ConditionalDetector detector;

    @BeforeAll
    static void setUp() {
        detector = new ConditionalDetector(GrammarCatalogLoader.createDefault());
    }

    @Test
    void testRealConditional() {
        Sentence s = SentenceFixtures.sentence()
            .tok("Wenn", "wenn", "SCONJ", "KOUS", "mark", 2)
            .tok("es", "es", "PRON", "PPER", "expl", 2)
            .tok("regnet", "regnen", "VERB", "VVFIN", "advcl", 5).morph("Mood=Ind|Tense=Pres|VerbForm=Fin")
            .punct(",", 2)
            .tok("bleibe", "bleiben", "VERB", "VVFIN", "ROOT", -1).morph("Mood=Ind|Tense=Pres|VerbForm=Fin")
            .tok("ich", "ich", "PRON", "PPER", "nsubj", 4)
            .punct(".", 4)
            .build();
        List<DetectionResult> results = detector.detect(s);
        assertEquals(1, results.size());
        DetectionResult r = results.get(0);
        assertEquals("b2-conditional-sentences", r.grammarPointId());
        assertEquals("real", r.details().get("conditionalType"));
        assertEquals("Wenn es regnet", Positions.substring(s, r.positions().get(0)));
        assertEquals("Pres", r.details().get("tense"));
    }

    @Test
    void testUnrealConditional() {
        Sentence s = SentenceFixtures.sentence()
            .tok("Wenn", "wenn", "SCONJ", "KOUS", "mark", 3)
            .tok("ich", "ich", "PRON", "PPER", "nsubj", 3)
            .tok("Zeit", "Zeit", "NOUN", "NN", "obj", 3)
            .tok("hätte", "haben", "VERB", "VAFIN", "advcl", 5).morph("Mood=Sub|Tense=Past|VerbForm=Fin")
            .punct(",", 3)
            .tok("würde", "werden", "AUX", "VAFIN", "ROOT", -1).morph("Mood=Sub|Tense=Past|VerbForm=Fin")
            .tok("ich", "ich", "PRON", "PPER", "nsubj", 5)
            .tok("reisen", "reisen", "VERB", "VVINF", "xcomp", 5).morph("VerbForm=Inf")
            .punct(".", 5)
            .build();
        List<DetectionResult> results = detector.detect(s);
        assertEquals(1, results.size());
        assertEquals("unreal", results.get(0).details().get("conditionalType"));
        assertEquals("Sub", results.get(0).details().get("mood"));
    }

    @Test
    void testMixedConditional() {
        Sentence s = SentenceFixtures.sentence()
            .tok("Falls", "falls", "SCONJ", "KOUS", "mark", 2)
            .tok("er", "er", "PRON", "PPER", "nsubj", 2)
            .tok("komme", "kommen", "VERB", "VVFIN", "advcl", 4).morph("Mood=Sub|Tense=Pres|VerbForm=Fin")
            .punct(",", 2)
            .tok("hätte", "haben", "VERB", "VAFIN", "ROOT", -1).morph("Mood=Sub|Tense=Past|VerbForm=Fin")
            .tok("ich", "ich", "PRON", "PPER", "nsubj", 4)
            .tok("Zeit", "Zeit", "NOUN", "NN", "obj", 4)
            .punct(".", 4)
            .build();
        List<DetectionResult> results = detector.detect(s);
        assertEquals(2, results.size());
        DetectionResult mixed = results.stream()
            .filter(r -> "mixed".equals(r.details().get("conditionalType")))
            .findFirst().orElseThrow();
        assertEquals(0.85, mixed.confidence(), 1e-9);
        assertEquals(s.text(), Positions.substring(s, mixed.positions().get(0)));
    }

    @Test
    void testConjunctionWithoutVerb() {
        Sentence s = SentenceFixtures.sentence()
            .tok("Wenn", "wenn", "SCONJ", "KOUS", "mark", 1)
            .tok("nötig", "nötig", "ADJ", "ADJD", "ROOT", -1)
            .punct(".", 1)
            .build();
        assertTrue(detector.detect(s).isEmpty());
    }
}
