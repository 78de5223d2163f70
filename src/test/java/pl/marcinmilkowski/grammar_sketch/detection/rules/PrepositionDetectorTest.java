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

class PrepositionDetectorTest {

    private static PrepositionDetector detector;

    @BeforeAll
    static void setUp() {
        detector = new PrepositionDetector(GrammarCatalogLoader.createDefault());
    }

    private static Sentence withObject(String preposition, String lemma, String tag, String article, String noun,
                                       String objectCase) {
        return SentenceFixtures.sentence()
            .tok("Ich", "ich", "PRON", "PPER", "nsubj", 1)
            .tok("gehe", "gehen", "VERB", "VVFIN", "ROOT", -1).morph("VerbForm=Fin")
            .tok(preposition, lemma, "ADP", tag, "case", 4)
            .tok(article, "der", "DET", "ART", "det", 4).morph("Case=" + objectCase)
            .tok(noun, noun, "NOUN", "NN", "obl", 1).morph("Case=" + objectCase)
            .punct(".", 1)
            .build();
    }

    @Test
    void testDativePreposition() {
        Sentence s = withObject("mit", "mit", "APPR", "dem", "Bus", "Dat");
        List<DetectionResult> results = detector.detect(s);
        assertEquals(1, results.size());
        DetectionResult r = results.get(0);
        assertEquals("a2-dative-prepositions", r.grammarPointId());
        assertEquals("mit dem", Positions.substring(s, r.positions().get(0)));
        assertEquals("dative", r.details().get("requiredCase"));
        assertEquals(false, r.details().get("twoWay"));
    }

    @Test
    void testAccusativePreposition() {
        List<DetectionResult> results = detector.detect(withObject("durch", "durch", "APPR", "den", "Park", "Acc"));
        assertEquals(1, results.size());
        assertEquals("a2-accusative-prepositions", results.get(0).grammarPointId());
    }

    @Test
    void testTwoWayPrepositionFollowsObjectCase() {
        List<DetectionResult> motion = detector.detect(withObject("in", "in", "APPR", "die", "Schule", "Acc"));
        assertEquals("a2-accusative-prepositions", motion.get(0).grammarPointId());
        assertEquals(true, motion.get(0).details().get("twoWay"));

        List<DetectionResult> location = detector.detect(withObject("in", "in", "APPR", "der", "Schule", "Dat"));
        assertEquals("a2-dative-prepositions", location.get(0).grammarPointId());
    }

    @Test
    void testContractedPreposition() {
        Sentence s = SentenceFixtures.sentence()
            .tok("Ich", "ich", "PRON", "PPER", "nsubj", 1)
            .tok("gehe", "gehen", "VERB", "VVFIN", "ROOT", -1).morph("VerbForm=Fin")
            .tok("zum", "zu", "ADP", "APPRART", "case", 3)
            .tok("Arzt", "Arzt", "NOUN", "NN", "obl", 1).morph("Case=Dat")
            .punct(".", 1)
            .build();
        List<DetectionResult> results = detector.detect(s);
        assertEquals(1, results.size());
        DetectionResult r = results.get(0);
        assertEquals("a2-dative-prepositions", r.grammarPointId());
        assertEquals("zu", r.details().get("prepositionLemma"));
        assertEquals("Arzt", r.details().get("object"));
        assertEquals(true, r.details().get("contracted"));
    }

    @Test
    void testCaseMismatchNotReported() {
        assertTrue(detector.detect(withObject("mit", "mit", "APPR", "den", "Bus", "Acc")).isEmpty());
    }

    @Test
    void testSeparableParticleIsNotAPreposition() {
        Sentence s = SentenceFixtures.sentence()
            .tok("Ich", "ich", "PRON", "PPER", "nsubj", 1)
            .tok("rufe", "rufen", "VERB", "VVFIN", "ROOT", -1).morph("VerbForm=Fin")
            .tok("dich", "du", "PRON", "PPER", "obj", 1).morph("Case=Acc")
            .tok("an", "an", "ADP", "PTKVZ", "compound:prt", 1)
            .punct(".", 1)
            .build();
        assertTrue(detector.detect(s).isEmpty());
    }
}
