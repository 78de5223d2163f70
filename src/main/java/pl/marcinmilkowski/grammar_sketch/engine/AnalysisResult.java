package pl.marcinmilkowski.grammar_sketch.engine;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import pl.marcinmilkowski.grammar_sketch.model.CefrLevel;
import pl.marcinmilkowski.grammar_sketch.model.DetectionResult;
import pl.marcinmilkowski.grammar_sketch.model.GrammarCategory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Everything found in one sentence, as a flat list and grouped by level and
 * by category. Every level and category is present in the groupings, empty
 * or not.
 */
public record AnalysisResult(
    String sentence,
    List<DetectionResult> grammarPoints,
    Map<CefrLevel, List<DetectionResult>> byLevel,
    Map<GrammarCategory, List<DetectionResult>> byCategory
) {
    public AnalysisResult {
        grammarPoints = List.copyOf(grammarPoints);
        byLevel = Collections.unmodifiableMap(new EnumMap<>(byLevel));
        byCategory = Collections.unmodifiableMap(new EnumMap<>(byCategory));
    }

    public static AnalysisResult of(String sentence, List<DetectionResult> results) {
        Map<CefrLevel, List<DetectionResult>> levels = new EnumMap<>(CefrLevel.class);
        for (CefrLevel level : CefrLevel.values()) {
            levels.put(level, new ArrayList<>());
        }
        Map<GrammarCategory, List<DetectionResult>> categories = new EnumMap<>(GrammarCategory.class);
        for (GrammarCategory category : GrammarCategory.values()) {
            categories.put(category, new ArrayList<>());
        }
        for (DetectionResult result : results) {
            levels.get(result.level()).add(result);
            categories.get(result.category()).add(result);
        }
        levels.replaceAll((k, v) -> List.copyOf(v));
        categories.replaceAll((k, v) -> List.copyOf(v));
        return new AnalysisResult(sentence, results, levels, categories);
    }

    public static AnalysisResult empty(String sentence) {
        return of(sentence, List.of());
    }

    public int totalPoints() {
        return grammarPoints.size();
    }

    public boolean isEmpty() {
        return grammarPoints.isEmpty();
    }

    public JSONObject toJson() {
        JSONObject root = new JSONObject();
        root.put("sentence", sentence);
        root.put("grammarPoints", toArray(grammarPoints));

        JSONObject levels = new JSONObject();
        JSONObject levelCounts = new JSONObject();
        byLevel.forEach((level, list) -> {
            levels.put(level.name(), toArray(list));
            levelCounts.put(level.name(), list.size());
        });
        root.put("byLevel", levels);

        JSONObject categories = new JSONObject();
        JSONObject categoryCounts = new JSONObject();
        byCategory.forEach((category, list) -> {
            categories.put(category.id(), toArray(list));
            categoryCounts.put(category.id(), list.size());
        });
        root.put("byCategory", categories);

        JSONObject summary = new JSONObject();
        summary.put("totalPoints", grammarPoints.size());
        summary.put("levels", levelCounts);
        summary.put("categories", categoryCounts);
        root.put("summary", summary);
        return root;
    }

    private static JSONArray toArray(List<DetectionResult> results) {
        JSONArray array = new JSONArray();
        for (DetectionResult result : results) {
            array.add(result.toJson());
        }
        return array;
    }
}
