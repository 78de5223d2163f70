package pl.marcinmilkowski.grammar_sketch.model;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One detected occurrence of a grammar point. Never mutated after creation;
 * the {@code with*} methods return copies.
 */
public record DetectionResult(
    String grammarPointId,
    GrammarCategory category,
    CefrLevel level,
    List<Position> positions,
    double confidence,
    Map<String, Object> details
) {
    /**
     * A highlighted character range {@code [start, end)} in the sentence text.
     */
    public record Position(int start, int end) {
        public Position {
            if (start < 0 || end <= start) {
                throw new IllegalArgumentException("Invalid position [" + start + ", " + end + ")");
            }
        }

        public JSONObject toJson() {
            JSONObject obj = new JSONObject();
            obj.put("start", start);
            obj.put("end", end);
            return obj;
        }
    }

    public DetectionResult {
        if (grammarPointId == null || grammarPointId.isBlank()) {
            throw new IllegalArgumentException("Detection result needs a grammar point id");
        }
        if (category == null || level == null) {
            throw new IllegalArgumentException("Detection result '" + grammarPointId + "' needs category and level");
        }
        if (positions == null || positions.isEmpty()) {
            throw new IllegalArgumentException("Detection result '" + grammarPointId + "' has no positions");
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence out of range for '" + grammarPointId + "': " + confidence);
        }
        positions = List.copyOf(positions);
        Map<String, Object> copy = new LinkedHashMap<>();
        if (details != null) {
            details.forEach((k, v) -> {
                if (v != null) {
                    copy.put(k, v);
                }
            });
        }
        details = Collections.unmodifiableMap(copy);
    }

    public static DetectionResult of(GrammarPoint point, List<Position> positions,
                                     double confidence, Map<String, Object> details) {
        return new DetectionResult(point.id(), point.category(), point.level(), positions, confidence, details);
    }

    /** Smallest start offset over all positions. */
    public int start() {
        int min = Integer.MAX_VALUE;
        for (Position p : positions) {
            min = Math.min(min, p.start());
        }
        return min;
    }

    /** Largest end offset over all positions. */
    public int end() {
        int max = 0;
        for (Position p : positions) {
            max = Math.max(max, p.end());
        }
        return max;
    }

    public DetectionResult withConfidence(double newConfidence) {
        return new DetectionResult(grammarPointId, category, level, positions, newConfidence, details);
    }

    public DetectionResult withDetail(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(details);
        copy.put(key, value);
        return new DetectionResult(grammarPointId, category, level, positions, confidence, copy);
    }

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("grammarPointId", grammarPointId);
        obj.put("category", category.id());
        obj.put("level", level.name());
        JSONArray pos = new JSONArray();
        for (Position p : positions) {
            pos.add(p.toJson());
        }
        obj.put("positions", pos);
        obj.put("confidence", confidence);
        obj.put("details", new JSONObject(details));
        return obj;
    }
}
