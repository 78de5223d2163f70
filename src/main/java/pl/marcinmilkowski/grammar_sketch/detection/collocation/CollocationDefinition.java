package pl.marcinmilkowski.grammar_sketch.detection.collocation;

import pl.marcinmilkowski.grammar_sketch.model.CefrLevel;

import java.util.ArrayList;
import java.util.List;

/**
 * A canonical collocation, loaded once from the catalog. Each variant
 * requires exactly the fields its shape needs.
 */
public sealed interface CollocationDefinition
    permits CollocationDefinition.ReflexivePrep, CollocationDefinition.VerbPrep,
            CollocationDefinition.VerbNoun, CollocationDefinition.Separable {

    /**
     * Display and grading data shared by all variants.
     */
    record Info(String label, CefrLevel level, String meaning, List<String> examples) {
        public Info {
            examples = examples == null ? List.of() : List.copyOf(examples);
        }

        public static Info empty() {
            return new Info(null, null, null, List.of());
        }
    }

    /** "sich freuen auf"; {@code particle} set for separable verbs like "sich vorbereiten auf". */
    record ReflexivePrep(String id, String verbLemma, String preposition, String particle,
                         DependencySignature signature, Info info) implements CollocationDefinition {
        public ReflexivePrep {
            requireText(id, "id");
            requireText(verbLemma, "verb lemma of " + id);
            requireText(preposition, "preposition of " + id);
        }

        @Override
        public CollocationType type() {
            return CollocationType.REFLEXIVE_PREP;
        }

        @Override
        public List<Companion> companions() {
            List<Companion> list = new ArrayList<>();
            list.add(new Companion(CompanionRole.REFLEXIVE, null));
            list.add(new Companion(CompanionRole.PREPOSITION, preposition));
            if (particle != null) {
                list.add(new Companion(CompanionRole.PARTICLE, particle));
            }
            return list;
        }

        @Override
        public String defaultLabel() {
            return "sich " + verbLemma + " " + preposition;
        }
    }

    /** "warten auf". */
    record VerbPrep(String id, String verbLemma, String preposition, String particle,
                    DependencySignature signature, Info info) implements CollocationDefinition {
        public VerbPrep {
            requireText(id, "id");
            requireText(verbLemma, "verb lemma of " + id);
            requireText(preposition, "preposition of " + id);
        }

        @Override
        public CollocationType type() {
            return CollocationType.VERB_PREP;
        }

        @Override
        public List<Companion> companions() {
            List<Companion> list = new ArrayList<>();
            list.add(new Companion(CompanionRole.PREPOSITION, preposition));
            if (particle != null) {
                list.add(new Companion(CompanionRole.PARTICLE, particle));
            }
            return list;
        }

        @Override
        public String defaultLabel() {
            return verbLemma + " " + preposition;
        }
    }

    /** "Angst haben". */
    record VerbNoun(String id, String verbLemma, String noun,
                    DependencySignature signature, Info info) implements CollocationDefinition {
        public VerbNoun {
            requireText(id, "id");
            requireText(verbLemma, "verb lemma of " + id);
            requireText(noun, "noun of " + id);
        }

        @Override
        public CollocationType type() {
            return CollocationType.VERB_NOUN;
        }

        @Override
        public List<Companion> companions() {
            return List.of(new Companion(CompanionRole.NOUN, noun));
        }

        @Override
        public String defaultLabel() {
            return noun + " " + verbLemma;
        }

        @Override
        public String particle() {
            return null;
        }
    }

    /** "aufstehen" as stehen + auf. */
    record Separable(String id, String verbLemma, String particle,
                     DependencySignature signature, Info info) implements CollocationDefinition {
        public Separable {
            requireText(id, "id");
            requireText(verbLemma, "verb lemma of " + id);
            requireText(particle, "particle of " + id);
        }

        @Override
        public CollocationType type() {
            return CollocationType.SEPARABLE;
        }

        @Override
        public List<Companion> companions() {
            return List.of(new Companion(CompanionRole.PARTICLE, particle));
        }

        @Override
        public String defaultLabel() {
            return particle + verbLemma;
        }
    }

    String id();

    CollocationType type();

    String verbLemma();

    /** Detached particle of a separable verb, or null. */
    String particle();

    DependencySignature signature();

    Info info();

    /** Companions in the order they appear in the label. */
    List<Companion> companions();

    String defaultLabel();

    default String label() {
        return info().label() != null ? info().label() : defaultLabel();
    }

    /**
     * Verb lemma with the separable particle removed ("vorbereiten" → "bereiten"),
     * or null if the definition has no particle or the lemma does not carry it.
     */
    default String baseLemma() {
        String particle = particle();
        if (particle == null) {
            return null;
        }
        String lemma = verbLemma().toLowerCase();
        String prefix = particle.toLowerCase();
        return lemma.startsWith(prefix) && lemma.length() > prefix.length()
            ? lemma.substring(prefix.length()) : null;
    }

    private static void requireText(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Collocation definition is missing " + what);
        }
    }
}
