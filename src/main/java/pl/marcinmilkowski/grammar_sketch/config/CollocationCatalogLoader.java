package pl.marcinmilkowski.grammar_sketch.config;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.grammar_sketch.detection.collocation.CollocationDefinition;
import pl.marcinmilkowski.grammar_sketch.detection.collocation.CollocationDefinition.Info;
import pl.marcinmilkowski.grammar_sketch.detection.collocation.CollocationType;
import pl.marcinmilkowski.grammar_sketch.detection.collocation.DependencySignature;
import pl.marcinmilkowski.grammar_sketch.model.CefrLevel;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Loads collocation definitions and validates each against its variant.
 *
 * Expected JSON structure:
 * {
 *   "version": "1.0",
 *   "defaults": {
 *     "verbDeps": ["obj", ...], "reflexiveDeps": [...], "prepDeps": [...],
 *     "nounDeps": [...], "particleDeps": [...], "maxDepth": 3, "window": 5
 *   },
 *   "collocations": [
 *     {
 *       "id": "sich-freuen-auf",
 *       "type": "reflexive-prep",
 *       "verb": {"lemma": "freuen"},
 *       "prep": {"lemma": "auf"},
 *       "depSignature": {"reflexiveDeps": ["expl:pv"]},
 *       "mustMatch": [], "shouldMatch": [],
 *       "label": "sich freuen auf", "level": "B1",
 *       "meaning": "...", "examples": ["..."]
 *     },
 *     ...
 *   ]
 * }
 *
 * A definition's signature is merged with the defaults: label lists are
 * unioned, an explicit {@code maxDepth}/{@code window} wins.
 */
public class CollocationCatalogLoader {
    private static final Logger logger = LoggerFactory.getLogger(CollocationCatalogLoader.class);

    public static final String DEFAULT_RESOURCE = "grammar/collocations.json";

    private final String version;
    private final DependencySignature defaults;
    private final List<CollocationDefinition> definitions;

    /**
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if a definition is invalid
     */
    public CollocationCatalogLoader(Path configPath) throws IOException {
        this(GrammarCatalogLoader.readFile(configPath), configPath.toString());
    }

    CollocationCatalogLoader(String content, String source) {
        JSONObject root;
        try {
            root = JSON.parseObject(content);
        } catch (JSONException e) {
            throw new IllegalArgumentException("Collocation catalog " + source + " is not valid JSON", e);
        }
        if (root == null) {
            throw new IllegalArgumentException("Collocation catalog " + source + " is empty");
        }

        String parsedVersion = root.getString("version");
        if (parsedVersion == null || parsedVersion.isBlank()) {
            throw new IllegalArgumentException("Missing 'version' field in collocation catalog");
        }
        this.version = parsedVersion;
        this.defaults = parseDefaults(root.getJSONObject("defaults"));

        JSONArray array = root.getJSONArray("collocations");
        if (array == null) {
            throw new IllegalArgumentException("Missing 'collocations' array in collocation catalog");
        }
        List<CollocationDefinition> loaded = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < array.size(); i++) {
            JSONObject obj = array.getJSONObject(i);
            if (obj == null) {
                throw new IllegalArgumentException("Invalid collocation at index " + i);
            }
            String id = obj.getString("id");
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("Missing 'id' field for collocation at index " + i);
            }
            CollocationDefinition definition;
            try {
                definition = parseDefinition(id, obj);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Collocation '" + id + "': " + e.getMessage(), e);
            }
            if (!ids.add(id)) {
                throw new IllegalArgumentException("Duplicate collocation id: " + id);
            }
            loaded.add(definition);
        }
        this.definitions = Collections.unmodifiableList(loaded);

        logger.info("Loaded collocation catalog version {}: {} definitions from {}", version, definitions.size(), source);
    }

    /**
     * @throws IOException if the resource is missing or unreadable
     */
    public static CollocationCatalogLoader fromClasspath(String resource) throws IOException {
        return new CollocationCatalogLoader(GrammarCatalogLoader.readResource(resource), "classpath:" + resource);
    }

    public static CollocationCatalogLoader createDefault() {
        try {
            return fromClasspath(DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load default collocation catalog: " + DEFAULT_RESOURCE, e);
        }
    }

    public String getVersion() {
        return version;
    }

    public DependencySignature getDefaults() {
        return defaults;
    }

    public List<CollocationDefinition> getDefinitions() {
        return definitions;
    }

    public Optional<CollocationDefinition> getDefinition(String id) {
        return definitions.stream().filter(d -> d.id().equals(id)).findFirst();
    }

    private static DependencySignature parseDefaults(JSONObject obj) {
        if (obj == null) {
            return new DependencySignature(
                Set.of("obj", "dobj", "oa", "obl", "nk"),
                Set.of("obj", "iobj", "refl", "oa", "dobj"),
                Set.of("case", "op", "mnr"),
                Set.of("obj", "nmod", "obl"),
                Set.of("svp", "compound:prt"),
                DependencySignature.DEFAULT_MAX_DEPTH,
                DependencySignature.DEFAULT_WINDOW,
                List.of(),
                List.of());
        }
        return new DependencySignature(
            labelSet(obj.getJSONArray("verbDeps")),
            labelSet(obj.getJSONArray("reflexiveDeps")),
            labelSet(obj.getJSONArray("prepDeps")),
            labelSet(obj.getJSONArray("nounDeps")),
            labelSet(obj.getJSONArray("particleDeps")),
            obj.getIntValue("maxDepth", DependencySignature.DEFAULT_MAX_DEPTH),
            obj.getIntValue("window", DependencySignature.DEFAULT_WINDOW),
            List.of(),
            List.of());
    }

    private CollocationDefinition parseDefinition(String id, JSONObject obj) {
        CollocationType type = CollocationType.fromId(obj.getString("type"));
        String verbLemma = lemmaOf(obj.getJSONObject("verb"));
        if (verbLemma == null) {
            throw new IllegalArgumentException("missing 'verb.lemma'");
        }

        JSONObject sig = obj.getJSONObject("depSignature");
        if (sig == null) {
            sig = new JSONObject();
        }
        Set<String> reflexiveDeps = labelSet(sig.getJSONArray("reflexiveDeps"));
        JSONObject reflexive = obj.getJSONObject("reflexive");
        if (reflexive != null) {
            reflexiveDeps.addAll(labelSet(reflexive.getJSONArray("dep")));
        }
        DependencySignature signature = DependencySignature.merge(
            defaults,
            labelSet(sig.getJSONArray("verbDeps")),
            reflexiveDeps,
            labelSet(sig.getJSONArray("prepDeps")),
            labelSet(sig.getJSONArray("nounDeps")),
            labelSet(sig.getJSONArray("particleDeps")),
            sig.getInteger("maxDepth"),
            sig.getInteger("window"),
            GrammarCatalogLoader.stringList(obj.getJSONArray("mustMatch")),
            GrammarCatalogLoader.stringList(obj.getJSONArray("shouldMatch")));

        String level = obj.getString("level");
        Info info = new Info(
            obj.getString("label"),
            level == null ? null : CefrLevel.parse(level),
            obj.getString("meaning"),
            GrammarCatalogLoader.stringList(obj.getJSONArray("examples")));

        String prep = lemmaOf(obj.getJSONObject("prep"));
        String particle = particleOf(obj.getJSONObject("separable"));

        return switch (type) {
            case REFLEXIVE_PREP -> new CollocationDefinition.ReflexivePrep(id, verbLemma, prep, particle, signature, info);
            case VERB_PREP -> new CollocationDefinition.VerbPrep(id, verbLemma, prep, particle, signature, info);
            case VERB_NOUN -> new CollocationDefinition.VerbNoun(id, verbLemma, lemmaOf(obj.getJSONObject("noun")), signature, info);
            case SEPARABLE -> new CollocationDefinition.Separable(id, verbLemma, particle, signature, info);
        };
    }

    private static String lemmaOf(JSONObject obj) {
        if (obj == null) {
            return null;
        }
        String lemma = obj.getString("lemma");
        return lemma == null || lemma.isBlank() ? null : lemma.trim();
    }

    private static String particleOf(JSONObject obj) {
        if (obj == null) {
            return null;
        }
        String particle = obj.getString("particle");
        return particle == null || particle.isBlank() ? null : particle.trim();
    }

    private static Set<String> labelSet(JSONArray array) {
        return new LinkedHashSet<>(GrammarCatalogLoader.stringList(array));
    }
}
