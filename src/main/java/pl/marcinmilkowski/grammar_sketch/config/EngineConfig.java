package pl.marcinmilkowski.grammar_sketch.config;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Settings for {@code DetectionEngine}.
 *
 * Expected JSON structure (every field optional):
 * {
 *   "min_confidence": 0.5,
 *   "threads": 4,
 *   "trace": false,
 *   "ai": {
 *     "enabled": true,
 *     "endpoint": "https://api.deepseek.com/chat/completions",
 *     "model": "deepseek-chat",
 *     "timeout_ms": 10000,
 *     "api_key_env": "DEEPSEEK_API_KEY"
 *   }
 * }
 */
public class EngineConfig {
    private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);

    public static final String DEFAULT_RESOURCE = "grammar-engine.json";

    public static final double DEFAULT_MIN_CONFIDENCE = 0.5;
    public static final String DEFAULT_ENDPOINT = "https://api.deepseek.com/chat/completions";
    public static final String DEFAULT_MODEL = "deepseek-chat";
    public static final long DEFAULT_TIMEOUT_MS = 10_000L;
    public static final String DEFAULT_API_KEY_ENV = "DEEPSEEK_API_KEY";

    private final double minConfidence;
    private final int threads;
    private final boolean trace;
    private final AiSettings ai;

    /**
     * AI fallback settings. The key itself is never stored in configuration,
     * only the name of the environment variable holding it.
     */
    public record AiSettings(boolean enabled, String endpoint, String model, long timeoutMs, String apiKeyEnv) {
        public AiSettings {
            if (timeoutMs <= 0) {
                throw new IllegalArgumentException("AI timeout must be positive: " + timeoutMs);
            }
            endpoint = endpoint == null || endpoint.isBlank() ? DEFAULT_ENDPOINT : endpoint;
            model = model == null || model.isBlank() ? DEFAULT_MODEL : model;
            apiKeyEnv = apiKeyEnv == null || apiKeyEnv.isBlank() ? DEFAULT_API_KEY_ENV : apiKeyEnv;
        }

        public static AiSettings defaults() {
            return new AiSettings(true, DEFAULT_ENDPOINT, DEFAULT_MODEL, DEFAULT_TIMEOUT_MS, DEFAULT_API_KEY_ENV);
        }

        public static AiSettings disabled() {
            return new AiSettings(false, DEFAULT_ENDPOINT, DEFAULT_MODEL, DEFAULT_TIMEOUT_MS, DEFAULT_API_KEY_ENV);
        }
    }

    public EngineConfig(double minConfidence, int threads, boolean trace, AiSettings ai) {
        if (Double.isNaN(minConfidence) || minConfidence < 0.0 || minConfidence > 1.0) {
            throw new IllegalArgumentException("min_confidence must be within [0, 1]: " + minConfidence);
        }
        if (threads <= 0) {
            throw new IllegalArgumentException("threads must be positive: " + threads);
        }
        this.minConfidence = minConfidence;
        this.threads = threads;
        this.trace = trace;
        this.ai = ai == null ? AiSettings.disabled() : ai;
    }

    public static EngineConfig defaults() {
        return new EngineConfig(DEFAULT_MIN_CONFIDENCE, defaultThreads(), false, AiSettings.defaults());
    }

    /**
     * Load settings from a file. A missing file yields the defaults.
     *
     * @throws IOException if the file exists but cannot be read
     * @throws IllegalArgumentException if the file is invalid
     */
    public static EngineConfig load(Path path) throws IOException {
        if (!Files.exists(path)) {
            logger.info("Engine config {} not found, using defaults", path);
            return defaults();
        }
        return parse(GrammarCatalogLoader.readFile(path), path.toString());
    }

    /**
     * Settings bundled on the classpath, or the defaults if there are none.
     */
    public static EngineConfig fromClasspath(String resource) throws IOException {
        if (EngineConfig.class.getClassLoader().getResource(resource) == null) {
            logger.info("Engine config classpath:{} not found, using defaults", resource);
            return defaults();
        }
        return parse(GrammarCatalogLoader.readResource(resource), "classpath:" + resource);
    }

    public static EngineConfig createDefault() {
        try {
            return fromClasspath(DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load default engine config: " + DEFAULT_RESOURCE, e);
        }
    }

    static EngineConfig parse(String content, String source) {
        JSONObject root;
        try {
            root = JSON.parseObject(content);
        } catch (JSONException e) {
            throw new IllegalArgumentException("Engine config " + source + " is not valid JSON", e);
        }
        if (root == null) {
            root = new JSONObject();
        }

        double minConfidence = root.containsKey("min_confidence")
            ? root.getDoubleValue("min_confidence") : DEFAULT_MIN_CONFIDENCE;
        int threads = root.containsKey("threads") ? root.getIntValue("threads") : defaultThreads();
        boolean trace = root.getBooleanValue("trace");

        AiSettings ai;
        JSONObject aiObj = root.getJSONObject("ai");
        if (aiObj == null) {
            ai = AiSettings.defaults();
        } else {
            ai = new AiSettings(
                !aiObj.containsKey("enabled") || aiObj.getBooleanValue("enabled"),
                aiObj.getString("endpoint"),
                aiObj.getString("model"),
                aiObj.containsKey("timeout_ms") ? aiObj.getLongValue("timeout_ms") : DEFAULT_TIMEOUT_MS,
                aiObj.getString("api_key_env"));
        }

        EngineConfig config = new EngineConfig(minConfidence, threads, trace, ai);
        logger.info("Loaded engine config from {}: min_confidence={}, threads={}, ai={}",
            source, minConfidence, threads, ai.enabled() ? ai.model() : "off");
        return config;
    }

    private static int defaultThreads() {
        return Math.max(1, Math.min(4, Runtime.getRuntime().availableProcessors()));
    }

    public double getMinConfidence() {
        return minConfidence;
    }

    public int getThreads() {
        return threads;
    }

    public boolean isTrace() {
        return trace;
    }

    public AiSettings getAi() {
        return ai;
    }
}
