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

class PassiveVoiceDetectorTest {

    private static PassiveVoiceDetector detector;

    @BeforeAll
    static void setUp() {
        detector = new PassiveVoiceDetector(GrammarCatalogLoader.createDefault());
    }

    private static DetectionResult find(List<DetectionResult> results, String id) {
        return results.stream().filter(r -> r.grammarPointId().equals(id)).findFirst().orElse(null);
    }

    @Test
    void testPastPassiveWithAgent() {
        Sentence s = SentenceFixtures.sentence()
            .tok("Das", "der", "DET", "ART", "det", 1)
            .tok("Haus", "Haus", "NOUN", "NN", "nsubj:pass", 6)
            .tok("wurde", "werden", "AUX", "VAFIN", "aux:pass", 6).morph("Tense=Past|VerbForm=Fin")
            .tok("von", "von", "ADP", "APPR", "case", 5)
            .tok("dem", "der", "DET", "ART", "det", 5)
            .tok("Architekten", "Architekt", "NOUN", "NN", "obl:agent", 6)
            .tok("gebaut", "bauen", "VERB", "VVPP", "ROOT", -1).morph("VerbForm=Part")
            .punct(".", 6)
            .build();
        List<DetectionResult> results = detector.detect(s);
        assertEquals(2, results.size());

        DetectionResult passive = find(results, "b1-passive-voice-past");
        assertNotNull(passive);
        assertEquals(0.95, passive.confidence(), 1e-9);
        assertEquals("Past", passive.details().get("tense"));
        assertEquals("gebaut", passive.details().get("participle"));
        assertEquals("wurde", Positions.substring(s, passive.positions().get(0)));

        DetectionResult agent = find(results, "b2-passive-von-durch");
        assertNotNull(agent);
        assertEquals("Architekten", agent.details().get("agent"));
        assertEquals(3, agent.positions().size());
        assertEquals("von dem Architekten", Positions.substring(s, agent.positions().get(1)));
        assertEquals("gebaut", Positions.substring(s, agent.positions().get(2)));
    }

    @Test
    void testPresentPassive() {
        Sentence s = SentenceFixtures.sentence()
            .tok("Hier", "hier", "ADV", "ADV", "advmod", 3)
            .tok("wird", "werden", "AUX", "VAFIN", "aux:pass", 3).morph("VerbForm=Fin")
            .tok("Deutsch", "Deutsch", "NOUN", "NN", "nsubj:pass", 3)
            .tok("gesprochen", "sprechen", "VERB", "VVPP", "ROOT", -1).morph("VerbForm=Part")
            .punct(".", 3)
            .build();
        List<DetectionResult> results = detector.detect(s);
        assertEquals(1, results.size());
        assertEquals("b1-passive-voice-present", results.get(0).grammarPointId());
        assertEquals("Pres", results.get(0).details().get("tense"));
    }

    @Test
    void testFutureIsNotPassive() {
        Sentence s = SentenceFixtures.sentence()
            .tok("Er", "er", "PRON", "PPER", "nsubj", 2)
            .tok("wird", "werden", "AUX", "VAFIN", "aux", 2).morph("VerbForm=Fin")
            .tok("kommen", "kommen", "VERB", "VVINF", "ROOT", -1).morph("VerbForm=Inf")
            .punct(".", 2)
            .build();
        assertTrue(detector.detect(s).isEmpty());
    }

    @Test
    void testStatalPassive() {
        Sentence s = SentenceFixtures.sentence()
            .tok("Die", "der", "DET", "ART", "det", 1)
            .tok("Tür", "Tür", "NOUN", "NN", "nsubj", 3)
            .tok("ist", "sein", "AUX", "VAFIN", "cop", 3).morph("VerbForm=Fin")
            .tok("geöffnet", "öffnen", "VERB", "VVPP", "ROOT", -1).morph("VerbForm=Part")
            .punct(".", 3)
            .build();
        List<DetectionResult> results = detector.detect(s);
        assertEquals(1, results.size());
        DetectionResult r = results.get(0);
        assertEquals("b2-statal-passive", r.grammarPointId());
        assertEquals(0.90, r.confidence(), 1e-9);
        assertEquals("ist geöffnet", Positions.substring(s, r.positions().get(0)));
    }

    @Test
    void testPerfectWithSeinIsNotStatal() {
        Sentence s = SentenceFixtures.sentence()
            .tok("Er", "er", "PRON", "PPER", "nsubj", 2)
            .tok("ist", "sein", "AUX", "VAFIN", "aux", 2).morph("VerbForm=Fin")
            .tok("gegangen", "gehen", "VERB", "VVPP", "ROOT", -1).morph("VerbForm=Part")
            .punct(".", 2)
            .build();
        assertTrue(detector.detect(s).isEmpty());
    }

    @Test
    @DisplayName("Das Haus ist gebaut worden: perfect of the werden-passive, not statal")
    void testPerfectPassiveIsNotStatal() {
        Sentence s = SentenceFixtures.sentence()
            .tok("Das", "der", "DET", "ART", "det", 1)
            .tok("Haus", "Haus", "NOUN", "NN", "nsubj:pass", 3)
            .tok("ist", "sein", "AUX", "VAFIN", "aux", 3).morph("VerbForm=Fin|Tense=Pres")
            .tok("gebaut", "bauen", "VERB", "VVPP", "ROOT", -1).morph("VerbForm=Part")
            .tok("worden", "werden", "AUX", "VAPP", "aux:pass", 3).morph("VerbForm=Part")
            .punct(".", 3)
            .build();
        assertTrue(detector.detect(s).stream().noneMatch(r -> r.grammarPointId().equals("b2-statal-passive")));
    }

    @Test
    void testTenseOf() {
        Sentence s = SentenceFixtures.sentence()
            .tok("wurden", "werden", "AUX", "VAFIN", "aux", -1)
            .tok("wird", "werden", "AUX", "VAFIN", "aux", -1)
            .build();
        assertEquals("Past", PassiveVoiceDetector.tenseOf(s.getToken(0)));
        assertEquals("Pres", PassiveVoiceDetector.tenseOf(s.getToken(1)));
    }
}
