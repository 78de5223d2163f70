package pl.marcinmilkowski.grammar_sketch.io;

import com.alibaba.fastjson2.JSON;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import pl.marcinmilkowski.grammar_sketch.SentenceFixtures;
import pl.marcinmilkowski.grammar_sketch.config.CollocationCatalogLoader;
import pl.marcinmilkowski.grammar_sketch.config.EngineConfig;
import pl.marcinmilkowski.grammar_sketch.config.GrammarCatalogLoader;
import pl.marcinmilkowski.grammar_sketch.detection.DependencyUtils;
import pl.marcinmilkowski.grammar_sketch.engine.AnalysisResult;
import pl.marcinmilkowski.grammar_sketch.engine.DetectionEngine;
import pl.marcinmilkowski.grammar_sketch.model.Sentence;
import pl.marcinmilkowski.grammar_sketch.model.Sentence.Token;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SentenceJsonReaderTest {

    @TempDir
    Path tempDir;

    @Test
    void testFixture() {
        List<Sentence> sentences = SentenceFixtures.fromResource("sentences/freuen.json");
        assertEquals(2, sentences.size());

        Sentence s = sentences.get(0);
        assertEquals(9, s.tokenCount());
        Token freue = s.getToken(1);
        assertNull(freue.head());
        assertEquals("Fin", freue.feature("VerbForm"));
        assertEquals("Nom", s.getToken(0).feature("Case"));
        assertTrue(s.getToken(3).morph().isEmpty());

        Token berlin = s.getToken(7);
        assertEquals("Konzert", berlin.head());
        assertEquals(5, DependencyUtils.headIndex(s, 7).getAsInt());
        assertEquals("LOC", berlin.entity().type());
        assertEquals(List.of(new Sentence.Entity("LOC", "Berlin", 7, 7)), s.entities());

        Sentence hallo = sentences.get(1);
        assertEquals(0, hallo.getToken(0).index());
        assertEquals(1, hallo.getToken(1).index());
    }

    @Test
    void testReadFileAndAnalyze() throws IOException {
        Path file = tempDir.resolve("input.json");
        try (InputStream is = getClass().getClassLoader().getResourceAsStream("sentences/freuen.json")) {
            assertNotNull(is);
            Files.copy(is, file);
        }
        List<Sentence> sentences = SentenceJsonReader.read(file);
        DetectionEngine engine = DetectionEngine.create(GrammarCatalogLoader.createDefault(),
            CollocationCatalogLoader.createDefault(),
            new EngineConfig(0.5, 1, false, EngineConfig.AiSettings.disabled()));
        AnalysisResult result = engine.analyze(sentences.get(0));
        assertTrue(result.grammarPoints().stream()
            .anyMatch(r -> r.grammarPointId().equals("collocation-sich-freuen-auf")));
    }

    @Test
    void testMissingFile() {
        assertThrows(IOException.class, () -> SentenceJsonReader.read(tempDir.resolve("missing.json")));
    }

    @Test
    void testSingleObject() {
        Sentence s = SentenceJsonReader.parseSentence("""
            {"text": "Ja.", "tokens": [
              {"text": "Ja", "lemma": "ja", "pos": "PART", "tag": "PTKANT", "dep": "ROOT",
               "characterStart": 0, "characterEnd": 2},
              {"text": ".", "lemma": ".", "pos": "PUNCT", "tag": "$.", "dep": "punct", "head": "0",
               "characterStart": 2, "characterEnd": 3}]}""");
        assertEquals("Ja.", s.text());
        assertEquals(0, DependencyUtils.headIndex(s, 1).getAsInt());
    }

    @Test
    void testInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> SentenceJsonReader.parse("{\"text\": "));
        assertThrows(IllegalArgumentException.class, () -> SentenceJsonReader.parse("42"));
        assertThrows(IllegalArgumentException.class, () -> SentenceJsonReader.parse("{\"tokens\": []}"));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> SentenceJsonReader.parse(
            "[{\"text\": \"Ja\", \"tokens\": [{\"text\": \"Ja\"}]}]"));
        assertTrue(e.getMessage().contains("token 0"), e.getMessage());
    }

    @Test
    void testMorphologyFormats() {
        assertEquals(Map.of("Case", "Dat", "Number", "Plur"), SentenceJsonReader.morph("Case=Dat|Number=Plur"));
        assertTrue(SentenceJsonReader.morph("_").isEmpty());
        assertTrue(SentenceJsonReader.morph(null).isEmpty());
        assertEquals(Map.of("Tense", "Past"), SentenceJsonReader.morph(JSON.parseObject("{\"Tense\": \"Past\"}")));
    }
}
