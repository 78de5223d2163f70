package pl.marcinmilkowski.grammar_sketch.detection.rules;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pl.marcinmilkowski.grammar_sketch.SentenceFixtures;
import pl.marcinmilkowski.grammar_sketch.config.GrammarCatalogLoader;
import pl.marcinmilkowski.grammar_sketch.model.DetectionResult;
import pl.marcinmilkowski.grammar_sketch.model.Sentence;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MoodDetectorTest {

    private static MoodDetector detector;

    @BeforeAll
    static void setUp() {
        detector = new MoodDetector(GrammarCatalogLoader.createDefault());
    }

    @Test
    void testWuerdeConditional() {
        Sentence s = SentenceFixtures.sentence()
            .tok("Ich", "ich", "PRON", "PPER", "nsubj", 3)
            .tok("würde", "werden", "AUX", "VAFIN", "aux", 3).morph("Mood=Sub|Person=1|VerbForm=Fin")
            .tok("gern", "gern", "ADV", "ADV", "advmod", 3)
            .tok("kommen", "kommen", "VERB", "VVINF", "ROOT", -1).morph("VerbForm=Inf")
            .punct(".", 3)
            .build();
        List<DetectionResult> results = detector.detect(s);
        assertEquals(1, results.size());
        assertEquals("b1-konjunktiv-II-conditional", results.get(0).grammarPointId());
        assertEquals("1", results.get(0).details().get("person"));
        assertEquals(0.98, results.get(0).confidence(), 1e-9);
    }

    @Test
    void testIrregularKonjunktivII() {
        Sentence s = SentenceFixtures.sentence()
            .tok("Ich", "ich", "PRON", "PPER", "nsubj", 1)
            .tok("hätte", "haben", "VERB", "VAFIN", "ROOT", -1)
            .tok("gern", "gern", "ADV", "ADV", "advmod", 1)
            .tok("Zeit", "Zeit", "NOUN", "NN", "obj", 1)
            .punct(".", 1)
            .build();
        List<DetectionResult> results = detector.detect(s);
        assertEquals(1, results.size());
        assertEquals("b1-konjunktiv-II-subjunctive", results.get(0).grammarPointId());
        assertEquals("irregular-verb", results.get(0).details().get("type"));
    }

    @Test
    @DisplayName("sollte counts as Konjunktiv II only when morphology says so")
    void testAmbiguousFormNeedsMood() {
        Sentence indicative = SentenceFixtures.sentence()
            .tok("Er", "er", "PRON", "PPER", "nsubj", 1)
            .tok("sollte", "sollen", "VERB", "VMFIN", "ROOT", -1).morph("Mood=Ind|Tense=Past|VerbForm=Fin")
            .punct(".", 1)
            .build();
        assertTrue(detector.detect(indicative).isEmpty());

        Sentence subjunctive = SentenceFixtures.sentence()
            .tok("Er", "er", "PRON", "PPER", "nsubj", 1)
            .tok("sollte", "sollen", "VERB", "VMFIN", "ROOT", -1).morph("Mood=Sub|Tense=Past|VerbForm=Fin")
            .punct(".", 1)
            .build();
        assertEquals("b1-konjunktiv-II-subjunctive", detector.detect(subjunctive).get(0).grammarPointId());
    }

    @Test
    void testKonjunktivIAfterReportingVerb() {
        Sentence s = SentenceFixtures.sentence()
            .tok("Er", "er", "PRON", "PPER", "nsubj", 1)
            .tok("sagt", "sagen", "VERB", "VVFIN", "ROOT", -1).morph("Mood=Ind|VerbForm=Fin")
            .punct(",", 1)
            .tok("er", "er", "PRON", "PPER", "nsubj", 5)
            .tok("sei", "sein", "AUX", "VAFIN", "cop", 5).morph("Mood=Sub|Tense=Pres|VerbForm=Fin")
            .tok("krank", "krank", "ADJ", "ADJD", "ccomp", 1)
            .punct(".", 1)
            .build();
        List<DetectionResult> results = detector.detect(s);
        assertEquals(1, results.size());
        assertEquals("b2-konjunktiv-I", results.get(0).grammarPointId());
        assertEquals("indirect-speech", results.get(0).details().get("type"));
    }

    @Test
    void testKonjunktivIWithoutReportingVerbIgnored() {
        Sentence s = SentenceFixtures.sentence()
            .tok("Es", "es", "PRON", "PPER", "expl", 1)
            .tok("lebe", "leben", "VERB", "VVFIN", "ROOT", -1).morph("Mood=Sub|Tense=Pres|VerbForm=Fin")
            .tok("der", "der", "DET", "ART", "det", 3)
            .tok("König", "König", "NOUN", "NN", "nsubj", 1)
            .punct("!", 1)
            .build();
        assertTrue(detector.detect(s).isEmpty());
    }

    @Test
    void testImperative() {
        Sentence s = SentenceFixtures.sentence()
            .tok("Komm", "kommen", "VERB", "VVIMP", "ROOT", -1).morph("Mood=Imp|VerbForm=Fin")
            .tok("her", "her", "ADV", "ADV", "advmod", 0)
            .punct("!", 0)
            .build();
        List<DetectionResult> results = detector.detect(s);
        assertEquals(1, results.size());
        assertEquals("a1-imperative", results.get(0).grammarPointId());
    }
}
