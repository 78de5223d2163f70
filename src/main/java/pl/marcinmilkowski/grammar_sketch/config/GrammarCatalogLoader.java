package pl.marcinmilkowski.grammar_sketch.config;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.grammar_sketch.model.CefrLevel;
import pl.marcinmilkowski.grammar_sketch.model.GrammarCategory;
import pl.marcinmilkowski.grammar_sketch.model.GrammarPoint;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Loads and provides access to the grammar point catalog.
 *
 * Expected JSON structure:
 * {
 *   "version": "1.0",
 *   "grammar_points": [
 *     {
 *       "id": "b1-separable-verbs",
 *       "category": "separable-verb",
 *       "level": "B1",
 *       "name": "...",
 *       "description": "...",
 *       "examples": ["..."],
 *       "explanation": "..."
 *     },
 *     ...
 *   ]
 * }
 */
public class GrammarCatalogLoader {
    private static final Logger logger = LoggerFactory.getLogger(GrammarCatalogLoader.class);

    public static final String DEFAULT_RESOURCE = "grammar/grammar-points.json";

    private final String version;
    private final List<GrammarPoint> points;
    private final Map<String, GrammarPoint> pointsById;

    /**
     * Load the catalog from the specified path.
     *
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the file is invalid
     */
    public GrammarCatalogLoader(Path configPath) throws IOException {
        this(readFile(configPath), configPath.toString());
    }

    GrammarCatalogLoader(String content, String source) {
        JSONObject root;
        try {
            root = JSON.parseObject(content);
        } catch (JSONException e) {
            throw new IllegalArgumentException("Grammar catalog " + source + " is not valid JSON", e);
        }
        if (root == null) {
            throw new IllegalArgumentException("Grammar catalog " + source + " is empty");
        }

        String parsedVersion = root.getString("version");
        if (parsedVersion == null || parsedVersion.isBlank()) {
            throw new IllegalArgumentException("Missing 'version' field in grammar catalog");
        }
        this.version = parsedVersion;

        JSONArray array = root.getJSONArray("grammar_points");
        if (array == null || array.isEmpty()) {
            throw new IllegalArgumentException("Missing or empty 'grammar_points' array in grammar catalog");
        }

        List<GrammarPoint> loaded = new ArrayList<>();
        Map<String, GrammarPoint> loadedById = new LinkedHashMap<>();
        for (int i = 0; i < array.size(); i++) {
            JSONObject obj = array.getJSONObject(i);
            if (obj == null) {
                throw new IllegalArgumentException("Invalid grammar point at index " + i);
            }
            String id = obj.getString("id");
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("Missing 'id' field for grammar point at index " + i);
            }
            GrammarPoint point;
            try {
                point = new GrammarPoint(
                    id,
                    GrammarCategory.fromId(obj.getString("category")),
                    CefrLevel.parse(obj.getString("level")),
                    obj.getString("name"),
                    obj.getString("description"),
                    stringList(obj.getJSONArray("examples")),
                    obj.getString("explanation"));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Grammar point '" + id + "': " + e.getMessage(), e);
            }
            if (loadedById.containsKey(id)) {
                throw new IllegalArgumentException("Duplicate grammar point id: " + id);
            }
            loaded.add(point);
            loadedById.put(id, point);
        }
        this.points = Collections.unmodifiableList(loaded);
        this.pointsById = Collections.unmodifiableMap(loadedById);

        logger.info("Loaded grammar catalog version {}: {} grammar points from {}", version, points.size(), source);
    }

    /**
     * Load a catalog bundled on the classpath.
     *
     * @throws IOException if the resource is missing or unreadable
     */
    public static GrammarCatalogLoader fromClasspath(String resource) throws IOException {
        return new GrammarCatalogLoader(readResource(resource), "classpath:" + resource);
    }

    /**
     * The catalog shipped with the library.
     */
    public static GrammarCatalogLoader createDefault() {
        try {
            return fromClasspath(DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load default grammar catalog: " + DEFAULT_RESOURCE, e);
        }
    }

    public String getVersion() {
        return version;
    }

    public List<GrammarPoint> getGrammarPoints() {
        return points;
    }

    public Optional<GrammarPoint> getGrammarPoint(String id) {
        return Optional.ofNullable(pointsById.get(id));
    }

    /**
     * @throws IllegalArgumentException if the catalog has no such point
     */
    public GrammarPoint require(String id) {
        GrammarPoint point = pointsById.get(id);
        if (point == null) {
            throw new IllegalArgumentException("Grammar catalog has no grammar point '" + id + "'");
        }
        return point;
    }

    public List<GrammarPoint> byLevel(CefrLevel level) {
        return points.stream().filter(p -> p.level() == level).collect(Collectors.toList());
    }

    public List<GrammarPoint> byCategory(GrammarCategory category) {
        return points.stream().filter(p -> p.category() == category).collect(Collectors.toList());
    }

    /**
     * All points at or below {@code level}, e.g. everything a B1 learner should know.
     */
    public List<GrammarPoint> upToLevel(CefrLevel level) {
        return points.stream().filter(p -> p.level().atMost(level)).collect(Collectors.toList());
    }

    public JSONObject toJson() {
        JSONObject root = new JSONObject();
        root.put("version", version);
        JSONArray array = new JSONArray();
        for (GrammarPoint point : points) {
            array.add(point.toJson());
        }
        root.put("grammar_points", array);
        return root;
    }

    static String readFile(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Config file not found: " + path);
        }
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    static String readResource(String resource) throws IOException {
        InputStream is = GrammarCatalogLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IOException("Classpath resource not found: " + resource);
        }
        try (is) {
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    static List<String> stringList(JSONArray array) {
        if (array == null) {
            return List.of();
        }
        List<String> result = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            String value = array.getString(i);
            if (value != null && !value.isBlank()) {
                result.add(value);
            }
        }
        return result;
    }
}
