package pl.marcinmilkowski.grammar_sketch.engine;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.grammar_sketch.config.EngineConfig;
import pl.marcinmilkowski.grammar_sketch.config.GrammarCatalogLoader;
import pl.marcinmilkowski.grammar_sketch.model.CefrLevel;
import pl.marcinmilkowski.grammar_sketch.model.DetectionResult;
import pl.marcinmilkowski.grammar_sketch.model.DetectionResult.Position;
import pl.marcinmilkowski.grammar_sketch.model.GrammarCategory;
import pl.marcinmilkowski.grammar_sketch.model.GrammarPoint;
import pl.marcinmilkowski.grammar_sketch.model.Sentence;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Asks a chat-completions endpoint (DeepSeek by default) for grammar points
 * in a sentence the rule-based detectors could not annotate.
 *
 * <p>The model answers with a JSON array of
 * {@code {category, level, pattern, explanation, position: {start, end}, confidence}}.
 * Answers are capped at {@value #MAX_CONFIDENCE} confidence and flagged
 * {@code aiGenerated}.</p>
 */
public class DeepSeekAnnotator implements AiFallbackAnnotator {
    private static final Logger logger = LoggerFactory.getLogger(DeepSeekAnnotator.class);

    static final double MAX_CONFIDENCE = 0.8;
    static final String AI_ID_PREFIX = "ai-";
    private static final double TEMPERATURE = 0.3;
    private static final int MAX_TOKENS = 500;

    private final HttpClient client;
    private final URI endpoint;
    private final String model;
    private final String apiKey;
    private final Duration timeout;
    private final GrammarCatalogLoader catalog;

    public DeepSeekAnnotator(EngineConfig.AiSettings settings, String apiKey, GrammarCatalogLoader catalog) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("AI annotator needs an API key");
        }
        this.endpoint = URI.create(settings.endpoint());
        this.model = settings.model();
        this.apiKey = apiKey;
        this.timeout = Duration.ofMillis(settings.timeoutMs());
        this.catalog = catalog;
        this.client = HttpClient.newBuilder().connectTimeout(timeout).build();
    }

    /**
     * An annotator for the given settings, or empty if AI fallback is disabled
     * or the key variable is not set.
     */
    public static Optional<AiFallbackAnnotator> fromEnvironment(EngineConfig.AiSettings settings,
                                                                GrammarCatalogLoader catalog) {
        if (!settings.enabled()) {
            return Optional.empty();
        }
        String key = System.getenv(settings.apiKeyEnv());
        if (key == null || key.isBlank()) {
            logger.info("{} not set, AI fallback disabled", settings.apiKeyEnv());
            return Optional.empty();
        }
        return Optional.of(new DeepSeekAnnotator(settings, key, catalog));
    }

    @Override
    public long timeoutMillis() {
        return timeout.toMillis();
    }

    @Override
    public CompletableFuture<List<DetectionResult>> annotateAsync(Sentence sentence) {
        HttpRequest request = HttpRequest.newBuilder(endpoint)
            .timeout(timeout)
            .header("Authorization", "Bearer " + apiKey)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(requestBody(sentence.text()), StandardCharsets.UTF_8))
            .build();
        return client.sendAsync(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8))
            .thenApply(response -> {
                if (response.statusCode() / 100 != 2) {
                    throw new AiAnnotationException("AI endpoint returned HTTP " + response.statusCode());
                }
                return parseResponse(response.body(), sentence);
            });
    }

    String requestBody(String text) {
        JSONObject message = new JSONObject();
        message.put("role", "system");
        message.put("content", prompt(text));
        JSONObject body = new JSONObject();
        body.put("model", model);
        body.put("messages", JSONArray.of(message));
        body.put("temperature", TEMPERATURE);
        body.put("max_tokens", MAX_TOKENS);
        return body.toJSONString();
    }

    static String prompt(String text) {
        return "Analyze this German sentence for B1-level grammar patterns: \"" + text + "\"\n\n"
            + "Look for: separable verbs, modal verbs, case usage, adjective endings, word order, compound nouns.\n\n"
            + "Return JSON array with: category, level, pattern, explanation, position {start,end}, confidence.\n\n"
            + "Example: [{\"category\":\"separable-verb\",\"level\":\"B1\",\"pattern\":\"aufmachen\","
            + "\"explanation\":\"Separable verb\",\"position\":{\"start\":10,\"end\":18},\"confidence\":0.9}]\n\n"
            + "Return only valid JSON array, empty [] if none found.";
    }

    /**
     * Convert a chat-completions response into results. Malformed entries are
     * skipped; a response without usable content yields an empty list.
     */
    List<DetectionResult> parseResponse(String responseBody, Sentence sentence) {
        JSONObject root;
        try {
            root = JSON.parseObject(responseBody);
        } catch (JSONException e) {
            throw new AiAnnotationException("AI response is not valid JSON", e);
        }
        if (root == null) {
            return List.of();
        }
        JSONArray choices = root.getJSONArray("choices");
        if (choices == null || choices.isEmpty()) {
            return List.of();
        }
        JSONObject message = choices.getJSONObject(0).getJSONObject("message");
        String content = message == null ? null : message.getString("content");
        if (content == null || content.isBlank()) {
            return List.of();
        }
        return parseContent(content, sentence);
    }

    List<DetectionResult> parseContent(String content, Sentence sentence) {
        JSONArray points;
        try {
            points = JSON.parseArray(stripCodeFence(content));
        } catch (JSONException e) {
            logger.warn("AI answer for '{}' is not a JSON array", sentence.text());
            return List.of();
        }
        if (points == null) {
            return List.of();
        }
        List<DetectionResult> results = new ArrayList<>();
        for (int i = 0; i < points.size(); i++) {
            try {
                JSONObject point = points.getJSONObject(i);
                if (point != null) {
                    toResult(point, sentence).ifPresent(results::add);
                }
            } catch (JSONException | IllegalArgumentException e) {
                logger.debug("Skipping AI grammar point {}: {}", i, e.getMessage());
            }
        }
        return results;
    }

    private Optional<DetectionResult> toResult(JSONObject point, Sentence sentence) {
        JSONObject position = point.getJSONObject("position");
        if (position == null || !position.containsKey("start") || !position.containsKey("end")) {
            return Optional.empty();
        }
        int start = position.getIntValue("start");
        int end = position.getIntValue("end");
        if (start < 0 || end <= start || end > sentence.text().length()) {
            return Optional.empty();
        }

        GrammarCategory category = GrammarCategory.fromId(point.getString("category"));
        String pattern = point.getString("pattern");
        Optional<GrammarPoint> known = findGrammarPoint(category, pattern);
        CefrLevel level = known.map(GrammarPoint::level)
            .orElseGet(() -> CefrLevel.parse(point.getString("level")));
        String id = known.map(GrammarPoint::id).orElse(AI_ID_PREFIX + category.id());
        double confidence = Math.min(Math.max(point.getDoubleValue("confidence"), 0.0), MAX_CONFIDENCE);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("pattern", pattern);
        details.put("explanation", point.getString("explanation"));
        details.put("aiGenerated", true);
        return Optional.of(new DetectionResult(id, category, level, List.of(new Position(start, end)),
            confidence, details));
    }

    /**
     * A catalog point of the same category whose name contains the pattern,
     * or is contained in it.
     */
    private Optional<GrammarPoint> findGrammarPoint(GrammarCategory category, String pattern) {
        if (catalog == null || pattern == null || pattern.isBlank()) {
            return Optional.empty();
        }
        String needle = pattern.toLowerCase(Locale.ROOT);
        for (GrammarPoint point : catalog.byCategory(category)) {
            String name = point.name().toLowerCase(Locale.ROOT);
            if (name.contains(needle) || needle.contains(name)) {
                return Optional.of(point);
            }
        }
        return Optional.empty();
    }

    private static String stripCodeFence(String content) {
        String trimmed = content.trim();
        if (trimmed.startsWith("```")) {
            int firstNewline = trimmed.indexOf('\n');
            int lastFence = trimmed.lastIndexOf("```");
            if (firstNewline > 0 && lastFence > firstNewline) {
                return trimmed.substring(firstNewline + 1, lastFence).trim();
            }
        }
        return trimmed;
    }

    /**
     * The AI endpoint answered with an error or an unreadable body.
     */
    public static class AiAnnotationException extends RuntimeException {
        public AiAnnotationException(String message) {
            super(message);
        }

        public AiAnnotationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
