package pl.marcinmilkowski.grammar_sketch.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pl.marcinmilkowski.grammar_sketch.detection.collocation.CollocationDefinition;
import pl.marcinmilkowski.grammar_sketch.detection.collocation.CollocationType;
import pl.marcinmilkowski.grammar_sketch.model.CefrLevel;

import static org.junit.jupiter.api.Assertions.*;

class CollocationCatalogLoaderTest {

    @Test
    void testDefaultCatalog() {
        CollocationCatalogLoader catalog = CollocationCatalogLoader.createDefault();
        assertFalse(catalog.getDefinitions().isEmpty());
        CollocationDefinition freuen = catalog.getDefinition("sich-freuen-auf").orElseThrow();
        assertInstanceOf(CollocationDefinition.ReflexivePrep.class, freuen);
        assertEquals(CollocationType.REFLEXIVE_PREP, freuen.type());
        assertEquals("sich freuen auf", freuen.label());
        assertEquals(CefrLevel.B1, freuen.info().level());
        assertTrue(freuen.signature().reflexiveDeps().contains("expl:pv"), "own labels merged");
        assertTrue(freuen.signature().reflexiveDeps().contains("obj"), "default labels kept");
    }

    @Test
    @DisplayName("Per-definition signature is merged with the catalog defaults")
    void testSignatureMerge() {
        CollocationCatalogLoader catalog = new CollocationCatalogLoader("""
            {"version": "1",
             "defaults": {"verbDeps": ["obj"], "prepDeps": ["case"], "maxDepth": 2, "window": 4},
             "collocations": [
               {"id": "warten-auf", "type": "verb-prep", "verb": {"lemma": "warten"}, "prep": {"lemma": "auf"},
                "depSignature": {"verbDeps": ["obl"], "window": 6},
                "mustMatch": ["obl"]}
             ]}""", "test");
        CollocationDefinition warten = catalog.getDefinition("warten-auf").orElseThrow();
        assertTrue(warten.signature().verbDeps().contains("obj"));
        assertTrue(warten.signature().verbDeps().contains("obl"));
        assertEquals(2, warten.signature().maxDepth());
        assertEquals(6, warten.signature().window());
        assertEquals("warten auf", warten.label());
    }

    @Test
    void testVariantFieldsAreValidated() {
        IllegalArgumentException noPrep = assertThrows(IllegalArgumentException.class,
            () -> new CollocationCatalogLoader("""
                {"version": "1", "collocations": [
                  {"id": "warten-auf", "type": "verb-prep", "verb": {"lemma": "warten"}}]}""", "t"));
        assertTrue(noPrep.getMessage().contains("warten-auf"), noPrep.getMessage());

        assertThrows(IllegalArgumentException.class, () -> new CollocationCatalogLoader("""
            {"version": "1", "collocations": [
              {"id": "x", "type": "verb-noun", "verb": {"lemma": "haben"}}]}""", "t"));

        assertThrows(IllegalArgumentException.class, () -> new CollocationCatalogLoader("""
            {"version": "1", "collocations": [
              {"id": "x", "type": "separable", "verb": {"lemma": "stehen"}}]}""", "t"));

        assertThrows(IllegalArgumentException.class, () -> new CollocationCatalogLoader("""
            {"version": "1", "collocations": [
              {"id": "x", "type": "idiom", "verb": {"lemma": "stehen"}}]}""", "t"));

        assertThrows(IllegalArgumentException.class, () -> new CollocationCatalogLoader("""
            {"version": "1", "collocations": [
              {"id": "x", "type": "verb-prep", "prep": {"lemma": "auf"}}]}""", "t"));

        assertThrows(IllegalArgumentException.class, () -> new CollocationCatalogLoader("""
            {"version": "1", "collocations": [
              {"id": "x", "type": "verb-prep", "verb": {"lemma": "warten"}, "prep": {"lemma": "auf"},
               "depSignature": {"maxDepth": 0}}]}""", "t"));

        IllegalArgumentException duplicate = assertThrows(IllegalArgumentException.class,
            () -> new CollocationCatalogLoader("""
                {"version": "1", "collocations": [
                  {"id": "x", "type": "verb-prep", "verb": {"lemma": "warten"}, "prep": {"lemma": "auf"}},
                  {"id": "x", "type": "verb-prep", "verb": {"lemma": "denken"}, "prep": {"lemma": "an"}}]}""", "t"));
        assertTrue(duplicate.getMessage().contains("Duplicate"));
    }

    @Test
    void testOptionalParticle() {
        CollocationCatalogLoader catalog = new CollocationCatalogLoader("""
            {"version": "1", "collocations": [
              {"id": "sich-vorbereiten-auf", "type": "reflexive-prep", "verb": {"lemma": "vorbereiten"},
               "prep": {"lemma": "auf"}, "separable": {"particle": "vor"}}]}""", "t");
        CollocationDefinition def = catalog.getDefinitions().get(0);
        assertEquals("vor", def.particle());
        assertEquals("bereiten", def.baseLemma());
    }
}
