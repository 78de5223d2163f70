package pl.marcinmilkowski.grammar_sketch.io;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import pl.marcinmilkowski.grammar_sketch.model.Sentence;
import pl.marcinmilkowski.grammar_sketch.model.Sentence.EntityMark;
import pl.marcinmilkowski.grammar_sketch.model.Sentence.Token;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads sentences in the parser service's JSON format:
 *
 * <pre>
 * {
 *   "text": "Ich stehe auf.",
 *   "tokens": [
 *     {"index": 0, "text": "Ich", "lemma": "ich", "pos": "PRON", "tag": "PPER",
 *      "dep": "sb", "head": "1", "morph": {"Case": "Nom"},
 *      "characterStart": 0, "characterEnd": 3,
 *      "entity_type": "PER", "entity_id": 1, "is_entity_start": true,
 *      "is_entity_end": true, "entity_text": "..."},
 *     ...
 *   ],
 *   "entities": [{"type": "LOC", "text": "Berlin", "token_indices": [3]}]
 * }
 * </pre>
 *
 * The input may be one such object or an array of them. {@code head} may be
 * a number or a string; {@code morph} an object or a {@code Key=Val|Key=Val}
 * string.
 */
public final class SentenceJsonReader {

    private SentenceJsonReader() {
    }

    public static List<Sentence> read(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Sentence file not found: " + path);
        }
        return parse(Files.readString(path, StandardCharsets.UTF_8));
    }

    /**
     * @throws IllegalArgumentException if the input is not valid sentence JSON
     */
    public static List<Sentence> parse(String json) {
        Object root;
        try {
            root = JSON.parse(json);
        } catch (JSONException e) {
            throw new IllegalArgumentException("Input is not valid JSON", e);
        }
        if (root instanceof JSONObject obj) {
            return List.of(toSentence(obj, 0));
        }
        if (root instanceof JSONArray array) {
            List<Sentence> sentences = new ArrayList<>(array.size());
            for (int i = 0; i < array.size(); i++) {
                JSONObject obj = array.getJSONObject(i);
                if (obj == null) {
                    throw new IllegalArgumentException("Sentence " + i + " is not an object");
                }
                sentences.add(toSentence(obj, i));
            }
            return sentences;
        }
        throw new IllegalArgumentException("Expected a sentence object or an array of sentences");
    }

    public static Sentence parseSentence(String json) {
        List<Sentence> sentences = parse(json);
        if (sentences.size() != 1) {
            throw new IllegalArgumentException("Expected exactly one sentence, got " + sentences.size());
        }
        return sentences.get(0);
    }

    static Sentence toSentence(JSONObject obj, int sentenceIndex) {
        String text = obj.getString("text");
        if (text == null) {
            throw new IllegalArgumentException("Sentence " + sentenceIndex + " has no 'text'");
        }
        JSONArray tokens = obj.getJSONArray("tokens");
        if (tokens == null) {
            throw new IllegalArgumentException("Sentence " + sentenceIndex + " has no 'tokens' array");
        }
        Sentence.Builder builder = Sentence.builder().text(text);
        for (int i = 0; i < tokens.size(); i++) {
            JSONObject token = tokens.getJSONObject(i);
            if (token == null) {
                throw new IllegalArgumentException("Sentence " + sentenceIndex + ": token " + i + " is not an object");
            }
            try {
                builder.addToken(toToken(token, i));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Sentence " + sentenceIndex + ", token " + i + ": "
                    + e.getMessage(), e);
            }
        }
        JSONArray entities = obj.getJSONArray("entities");
        if (entities != null) {
            for (int i = 0; i < entities.size(); i++) {
                JSONObject entity = entities.getJSONObject(i);
                Sentence.Entity parsed = entity == null ? null : toEntity(entity);
                if (parsed != null) {
                    builder.addEntity(parsed);
                }
            }
        }
        return builder.build();
    }

    private static Token toToken(JSONObject obj, int position) {
        if (!obj.containsKey("characterStart") || !obj.containsKey("characterEnd")) {
            throw new IllegalArgumentException("missing characterStart/characterEnd");
        }
        int index = obj.containsKey("index") ? obj.getIntValue("index") : position;
        Object head = obj.get("head");
        EntityMark entity = null;
        String entityType = obj.getString("entity_type");
        if (entityType != null && !entityType.isBlank()) {
            entity = new EntityMark(entityType,
                obj.getIntValue("entity_id"),
                obj.getBooleanValue("is_entity_start"),
                obj.getBooleanValue("is_entity_end"),
                obj.getString("entity_text"));
        }
        return new Token(
            index,
            obj.getString("text"),
            obj.getString("lemma"),
            obj.getString("pos"),
            obj.getString("tag"),
            obj.getString("dep"),
            head == null ? null : String.valueOf(head),
            morph(obj.get("morph")),
            obj.getIntValue("characterStart"),
            obj.getIntValue("characterEnd"),
            entity);
    }

    static Map<String, String> morph(Object value) {
        Map<String, String> features = new LinkedHashMap<>();
        if (value instanceof JSONObject obj) {
            obj.forEach((k, v) -> {
                if (v != null) {
                    features.put(k, String.valueOf(v));
                }
            });
        } else if (value instanceof String str && !str.isBlank() && !"_".equals(str)) {
            for (String pair : str.split("\\|")) {
                int eq = pair.indexOf('=');
                if (eq > 0 && eq < pair.length() - 1) {
                    features.put(pair.substring(0, eq).trim(), pair.substring(eq + 1).trim());
                }
            }
        }
        return features;
    }

    private static Sentence.Entity toEntity(JSONObject obj) {
        JSONArray indices = obj.getJSONArray("token_indices");
        if (indices == null || indices.isEmpty()) {
            return null;
        }
        int first = Integer.MAX_VALUE;
        int last = Integer.MIN_VALUE;
        for (int i = 0; i < indices.size(); i++) {
            int index = indices.getIntValue(i);
            first = Math.min(first, index);
            last = Math.max(last, index);
        }
        return new Sentence.Entity(obj.getString("type"), obj.getString("text"), first, last);
    }
}
