package pl.marcinmilkowski.grammar_sketch.model;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.util.List;

/**
 * Static catalog entry describing one teachable grammar point.
 */
public record GrammarPoint(
    String id,
    GrammarCategory category,
    CefrLevel level,
    String name,
    String description,
    List<String> examples,
    String explanation
) {
    public GrammarPoint {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Grammar point id must not be blank");
        }
        if (category == null || level == null) {
            throw new IllegalArgumentException("Grammar point '" + id + "' needs a category and a level");
        }
        name = name == null ? id : name;
        description = description == null ? "" : description;
        examples = examples == null ? List.of() : List.copyOf(examples);
    }

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("id", id);
        obj.put("category", category.id());
        obj.put("level", level.name());
        obj.put("name", name);
        obj.put("description", description);
        obj.put("examples", new JSONArray(examples));
        if (explanation != null) {
            obj.put("explanation", explanation);
        }
        return obj;
    }
}
