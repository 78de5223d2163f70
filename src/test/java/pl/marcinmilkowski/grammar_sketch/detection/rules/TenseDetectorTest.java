package pl.marcinmilkowski.grammar_sketch.detection.rules;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pl.marcinmilkowski.grammar_sketch.SentenceFixtures;
import pl.marcinmilkowski.grammar_sketch.config.GrammarCatalogLoader;
import pl.marcinmilkowski.grammar_sketch.detection.Positions;
import pl.marcinmilkowski.grammar_sketch.model.DetectionResult;
import pl.marcinmilkowski.grammar_sketch.model.Sentence;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TenseDetectorTest {

    private static TenseDetector detector;

    @BeforeAll
    static void setUp() {
        detector = new TenseDetector(GrammarCatalogLoader.createDefault());
    }

    private static List<DetectionResult> withId(List<DetectionResult> results, String id) {
        return results.stream().filter(r -> r.grammarPointId().equals(id)).toList();
    }

    @Test
    void testPresentTense() {
        Sentence s = SentenceFixtures.sentence()
            .tok("Ich", "ich", "PRON", "PPER", "nsubj", 1)
            .tok("lerne", "lernen", "VERB", "VVFIN", "ROOT", -1).morph("Person=1|Tense=Pres|VerbForm=Fin")
            .tok("Deutsch", "Deutsch", "NOUN", "NN", "obj", 1)
            .punct(".", 1)
            .build();
        List<DetectionResult> results = detector.detect(s);
        assertEquals(1, results.size());
        DetectionResult r = results.get(0);
        assertEquals("a1-present-tense", r.grammarPointId());
        assertEquals("1", r.details().get("person"));
        assertEquals(0.98, r.confidence(), 1e-9);
    }

    @Test
    void testFiniteVerbWithoutTenseIgnored() {
        Sentence s = SentenceFixtures.sentence()
            .tok("Ich", "ich", "PRON", "PPER", "nsubj", 1)
            .tok("lerne", "lernen", "VERB", "VVFIN", "ROOT", -1).morph("VerbForm=Fin")
            .punct(".", 1)
            .build();
        assertTrue(detector.detect(s).isEmpty());
    }

    @Test
    void testPerfectWithHaben() {
        Sentence s = SentenceFixtures.sentence()
            .tok("Ich", "ich", "PRON", "PPER", "nsubj", 4)
            .tok("habe", "haben", "AUX", "VAFIN", "aux", 4).morph("Tense=Pres|VerbForm=Fin")
            .tok("das", "der", "DET", "ART", "det", 3)
            .tok("Buch", "Buch", "NOUN", "NN", "obj", 4)
            .tok("gelesen", "lesen", "VERB", "VVPP", "ROOT", -1).morph("VerbForm=Part")
            .punct(".", 4)
            .build();
        List<DetectionResult> results = detector.detect(s);
        List<DetectionResult> perfect = withId(results, "a2-present-perfect");
        assertEquals(1, perfect.size());
        assertEquals("habe das Buch gelesen", Positions.substring(s, perfect.get(0).positions().get(0)));
        assertEquals("lesen", perfect.get(0).details().get("lemma"));
        assertTrue(withId(results, "b1-present-perfect-sein").isEmpty());
        assertEquals(1, withId(results, "a1-present-tense").size());
    }

    @Test
    void testPerfectWithSein() {
        Sentence s = SentenceFixtures.sentence()
            .tok("Er", "er", "PRON", "PPER", "nsubj", 4)
            .tok("ist", "sein", "AUX", "VAFIN", "aux", 4).morph("Tense=Pres|VerbForm=Fin")
            .tok("nach", "nach", "ADP", "APPR", "case", 3)
            .tok("Hause", "Haus", "NOUN", "NN", "obl", 4)
            .tok("gegangen", "gehen", "VERB", "VVPP", "ROOT", -1).morph("VerbForm=Part")
            .punct(".", 4)
            .build();
        List<DetectionResult> results = detector.detect(s);
        assertEquals(1, withId(results, "a2-present-perfect").size());
        List<DetectionResult> sein = withId(results, "b1-present-perfect-sein");
        assertEquals(1, sein.size());
        assertEquals(0.90, sein.get(0).confidence(), 1e-9);
    }

    @Test
    @DisplayName("sein with the participle of a transitive verb is a state, not a perfect")
    void testStatalPassiveIsNotPerfect() {
        Sentence s = SentenceFixtures.sentence()
            .tok("Die", "der", "DET", "ART", "det", 1)
            .tok("Tür", "Tür", "NOUN", "NN", "nsubj", 3)
            .tok("ist", "sein", "AUX", "VAFIN", "cop", 3).morph("Tense=Pres|VerbForm=Fin")
            .tok("geöffnet", "öffnen", "VERB", "VVPP", "ROOT", -1).morph("VerbForm=Part")
            .punct(".", 3)
            .build();
        assertTrue(withId(detector.detect(s), "a2-present-perfect").isEmpty());
    }

    @Test
    @DisplayName("Plusquamperfekt is reported through its auxiliary only")
    void testPastPerfectNotReportedAsPresentPerfect() {
        Sentence s = SentenceFixtures.sentence()
            .tok("Ich", "ich", "PRON", "PPER", "nsubj", 2)
            .tok("hatte", "haben", "AUX", "VAFIN", "aux", 2).morph("Tense=Past|VerbForm=Fin")
            .tok("gegessen", "essen", "VERB", "VVPP", "ROOT", -1).morph("VerbForm=Part")
            .punct(".", 2)
            .build();
        List<DetectionResult> results = detector.detect(s);
        assertEquals(1, results.size());
        assertEquals("a2-simple-past", results.get(0).grammarPointId());
    }

    @Test
    void testVerbFinalPerfect() {
        Sentence s = SentenceFixtures.sentence()
            .tok("Ich", "ich", "PRON", "PPER", "nsubj", 1)
            .tok("weiß", "wissen", "VERB", "VVFIN", "ROOT", -1).morph("Tense=Pres|VerbForm=Fin")
            .punct(",", 1)
            .tok("dass", "dass", "SCONJ", "KOUS", "mark", 5)
            .tok("er", "er", "PRON", "PPER", "nsubj", 5)
            .tok("gekommen", "kommen", "VERB", "VVPP", "ccomp", 1).morph("VerbForm=Part")
            .tok("ist", "sein", "AUX", "VAFIN", "aux", 5).morph("Tense=Pres|VerbForm=Fin")
            .punct(".", 1)
            .build();
        List<DetectionResult> perfect = withId(detector.detect(s), "a2-present-perfect");
        assertEquals(1, perfect.size());
        assertEquals("gekommen ist", Positions.substring(s, perfect.get(0).positions().get(0)));
    }

    @Test
    void testPerfectPassiveReportedOnce() {
        Sentence s = SentenceFixtures.sentence()
            .tok("Das", "der", "DET", "ART", "det", 1)
            .tok("Haus", "Haus", "NOUN", "NN", "nsubj:pass", 3)
            .tok("ist", "sein", "AUX", "VAFIN", "aux", 3).morph("Tense=Pres|VerbForm=Fin")
            .tok("gebaut", "bauen", "VERB", "VVPP", "ROOT", -1).morph("VerbForm=Part")
            .tok("worden", "werden", "AUX", "VAPP", "aux:pass", 3).morph("VerbForm=Part")
            .punct(".", 3)
            .build();
        List<DetectionResult> results = detector.detect(s);
        assertEquals(1, withId(results, "a2-present-perfect").size());
        assertTrue(withId(results, "b1-present-perfect-sein").isEmpty());
    }
}
