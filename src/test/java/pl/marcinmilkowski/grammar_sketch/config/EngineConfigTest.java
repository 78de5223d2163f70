package pl.marcinmilkowski.grammar_sketch.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class EngineConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void testMissingFileGivesDefaults() throws IOException {
        EngineConfig config = EngineConfig.load(tempDir.resolve("absent.json"));
        assertEquals(EngineConfig.DEFAULT_MIN_CONFIDENCE, config.getMinConfidence());
        assertFalse(config.isTrace());
        assertTrue(config.getThreads() >= 1);
        assertEquals("DEEPSEEK_API_KEY", config.getAi().apiKeyEnv());
    }

    @Test
    void testParse() throws IOException {
        Path file = tempDir.resolve("engine.json");
        Files.writeString(file, """
            {"min_confidence": 0.7, "threads": 2, "trace": true,
             "ai": {"enabled": false, "model": "other-model", "timeout_ms": 2500}}""");
        EngineConfig config = EngineConfig.load(file);
        assertEquals(0.7, config.getMinConfidence(), 1e-9);
        assertEquals(2, config.getThreads());
        assertTrue(config.isTrace());
        assertFalse(config.getAi().enabled());
        assertEquals("other-model", config.getAi().model());
        assertEquals(2500, config.getAi().timeoutMs());
        assertEquals(EngineConfig.DEFAULT_ENDPOINT, config.getAi().endpoint());
    }

    @Test
    void testBundledConfig() {
        EngineConfig config = EngineConfig.createDefault();
        assertEquals(0.5, config.getMinConfidence(), 1e-9);
        assertEquals(10_000, config.getAi().timeoutMs());
    }

    @Test
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.parse("{\"min_confidence\": 1.5}", "t"));
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.parse("{\"threads\": 0}", "t"));
        assertThrows(IllegalArgumentException.class,
            () -> EngineConfig.parse("{\"ai\": {\"timeout_ms\": -1}}", "t"));
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.parse("[1, 2", "t"));
    }
}
