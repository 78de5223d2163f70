package pl.marcinmilkowski.grammar_sketch.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.grammar_sketch.config.CollocationCatalogLoader;
import pl.marcinmilkowski.grammar_sketch.config.EngineConfig;
import pl.marcinmilkowski.grammar_sketch.config.GrammarCatalogLoader;
import pl.marcinmilkowski.grammar_sketch.detection.DetectorId;
import pl.marcinmilkowski.grammar_sketch.detection.GrammarDetector;
import pl.marcinmilkowski.grammar_sketch.detection.clause.SubordinateClauseDetector;
import pl.marcinmilkowski.grammar_sketch.detection.collocation.CollocationDetector;
import pl.marcinmilkowski.grammar_sketch.detection.collocation.LoggingTraceSink;
import pl.marcinmilkowski.grammar_sketch.detection.collocation.MatchTraceSink;
import pl.marcinmilkowski.grammar_sketch.detection.rules.AgreementDetector;
import pl.marcinmilkowski.grammar_sketch.detection.rules.CaseDetector;
import pl.marcinmilkowski.grammar_sketch.detection.rules.CausativeDetector;
import pl.marcinmilkowski.grammar_sketch.detection.rules.ConditionalDetector;
import pl.marcinmilkowski.grammar_sketch.detection.rules.ExtendedAdjectiveDetector;
import pl.marcinmilkowski.grammar_sketch.detection.rules.ModalVerbDetector;
import pl.marcinmilkowski.grammar_sketch.detection.rules.MoodDetector;
import pl.marcinmilkowski.grammar_sketch.detection.rules.PassiveVoiceDetector;
import pl.marcinmilkowski.grammar_sketch.detection.rules.PrepositionDetector;
import pl.marcinmilkowski.grammar_sketch.detection.rules.ReflexiveVerbDetector;
import pl.marcinmilkowski.grammar_sketch.detection.rules.SeparableVerbDetector;
import pl.marcinmilkowski.grammar_sketch.detection.rules.TenseDetector;
import pl.marcinmilkowski.grammar_sketch.detection.rules.WordOrderDetector;
import pl.marcinmilkowski.grammar_sketch.model.DetectionResult;
import pl.marcinmilkowski.grammar_sketch.model.DetectionResult.Position;
import pl.marcinmilkowski.grammar_sketch.model.Sentence;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs every registered detector over a sentence and merges what they find.
 *
 * <p>Each detector runs in isolation: an exception from one detector is
 * logged and its contribution for that sentence is empty. The optional AI
 * annotator is only consulted when no detector found anything, and its
 * failure leaves the (empty) rule-based result in place.</p>
 */
public class DetectionEngine {
    private static final Logger logger = LoggerFactory.getLogger(DetectionEngine.class);

    private final Map<DetectorId, GrammarDetector> detectors;
    private final double minConfidence;
    private final int threads;
    private final AiFallbackAnnotator aiAnnotator;

    private DetectionEngine(Builder builder) {
        this.detectors = Collections.unmodifiableMap(new EnumMap<>(builder.detectors));
        this.minConfidence = builder.minConfidence;
        this.threads = builder.threads;
        this.aiAnnotator = builder.aiAnnotator;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Engine with the bundled catalogs, the bundled engine config and every
     * detector registered. AI fallback is enabled only if its key variable is set.
     */
    public static DetectionEngine createDefault() {
        return create(GrammarCatalogLoader.createDefault(), CollocationCatalogLoader.createDefault(),
            EngineConfig.createDefault());
    }

    public static DetectionEngine create(GrammarCatalogLoader catalog, CollocationCatalogLoader collocations,
                                         EngineConfig config) {
        MatchTraceSink traceSink = config.isTrace() ? new LoggingTraceSink() : MatchTraceSink.NONE;
        Builder builder = builder()
            .minConfidence(config.getMinConfidence())
            .threads(config.getThreads())
            .register(new CollocationDetector(collocations.getDefinitions(),
                catalog.require(CollocationDetector.GRAMMAR_POINT_ID), traceSink))
            .register(new SubordinateClauseDetector(catalog))
            .register(new SeparableVerbDetector(catalog))
            .register(new AgreementDetector(catalog))
            .register(new WordOrderDetector(catalog))
            .register(new PassiveVoiceDetector(catalog))
            .register(new CausativeDetector(catalog))
            .register(new TenseDetector(catalog))
            .register(new CaseDetector(catalog))
            .register(new PrepositionDetector(catalog))
            .register(new ModalVerbDetector(catalog))
            .register(new ReflexiveVerbDetector(catalog))
            .register(new MoodDetector(catalog))
            .register(new ConditionalDetector(catalog))
            .register(new ExtendedAdjectiveDetector(catalog));
        DeepSeekAnnotator.fromEnvironment(config.getAi(), catalog).ifPresent(builder::aiAnnotator);
        DetectionEngine engine = builder.build();
        logger.info("Detection engine ready: {} detectors, min confidence {}, AI fallback {}",
            engine.detectors.size(), engine.minConfidence, engine.aiAnnotator != null ? "on" : "off");
        return engine;
    }

    public Optional<GrammarDetector> getDetector(DetectorId id) {
        return Optional.ofNullable(detectors.get(id));
    }

    public Map<DetectorId, GrammarDetector> getDetectors() {
        return detectors;
    }

    public AnalysisResult analyze(Sentence sentence) {
        List<DetectionResult> collected = new ArrayList<>();
        for (GrammarDetector detector : detectors.values()) {
            collected.addAll(runDetector(detector, sentence));
        }
        List<DetectionResult> merged = postProcess(collected, sentence);
        if (merged.isEmpty() && aiAnnotator != null) {
            merged = postProcess(runAiFallback(sentence), sentence);
        }
        logger.debug("{} grammar points in '{}'", merged.size(), sentence.text());
        return AnalysisResult.of(sentence.text(), merged);
    }

    /**
     * Analyze independent sentences on a fixed worker pool. Results come back
     * in input order; a sentence whose analysis fails gets an empty result.
     */
    public List<AnalysisResult> analyzeAll(List<Sentence> sentences) {
        if (sentences.isEmpty()) {
            return List.of();
        }
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(threads, sentences.size()));
        try {
            List<Future<AnalysisResult>> futures = new ArrayList<>(sentences.size());
            for (Sentence sentence : sentences) {
                futures.add(executor.submit(() -> analyze(sentence)));
            }
            List<AnalysisResult> results = new ArrayList<>(sentences.size());
            for (int i = 0; i < futures.size(); i++) {
                Sentence sentence = sentences.get(i);
                try {
                    results.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    logger.warn("Analysis failed for '{}'", sentence.text(), e.getCause());
                    results.add(AnalysisResult.empty(sentence.text()));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    logger.warn("Interrupted while analyzing '{}'", sentence.text());
                    results.add(AnalysisResult.empty(sentence.text()));
                }
            }
            return results;
        } finally {
            executor.shutdown();
        }
    }

    private List<DetectionResult> runDetector(GrammarDetector detector, Sentence sentence) {
        try {
            List<DetectionResult> results = detector.detect(sentence);
            return results == null ? List.of() : results;
        } catch (RuntimeException e) {
            logger.warn("Detector {} failed on '{}'", detector.id().key(), sentence.text(), e);
            return List.of();
        }
    }

    private List<DetectionResult> runAiFallback(Sentence sentence) {
        try {
            List<DetectionResult> results = aiAnnotator.annotateAsync(sentence)
                .get(aiAnnotator.timeoutMillis(), TimeUnit.MILLISECONDS);
            return results == null ? List.of() : results;
        } catch (TimeoutException e) {
            logger.warn("AI fallback timed out after {} ms for '{}'", aiAnnotator.timeoutMillis(), sentence.text());
        } catch (ExecutionException e) {
            logger.warn("AI fallback failed for '{}': {}", sentence.text(), String.valueOf(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for AI fallback on '{}'", sentence.text());
        } catch (RuntimeException e) {
            logger.warn("AI fallback failed for '{}'", sentence.text(), e);
        }
        return List.of();
    }

    /**
     * Drop out-of-text and low-confidence results, collapse exact duplicates
     * (same point, same positions) to the most confident one, sort by start.
     */
    List<DetectionResult> postProcess(List<DetectionResult> results, Sentence sentence) {
        Map<String, DetectionResult> unique = new LinkedHashMap<>();
        int length = sentence.text().length();
        for (DetectionResult result : results) {
            if (result == null) {
                continue;
            }
            if (result.end() > length) {
                logger.warn("Dropping {} at [{}, {}): outside sentence of length {}",
                    result.grammarPointId(), result.start(), result.end(), length);
                continue;
            }
            if (result.confidence() < minConfidence) {
                continue;
            }
            String key = duplicateKey(result);
            DetectionResult existing = unique.get(key);
            if (existing == null || result.confidence() > existing.confidence()) {
                unique.put(key, result);
            }
        }
        List<DetectionResult> merged = new ArrayList<>(unique.values());
        merged.sort(Comparator.comparingInt(DetectionResult::start));
        return merged;
    }

    private static String duplicateKey(DetectionResult result) {
        StringBuilder sb = new StringBuilder(result.grammarPointId());
        for (Position position : result.positions()) {
            sb.append('|').append(position.start()).append('-').append(position.end());
        }
        return sb.toString();
    }

    public static class Builder {
        private final Map<DetectorId, GrammarDetector> detectors = new EnumMap<>(DetectorId.class);
        private double minConfidence = EngineConfig.DEFAULT_MIN_CONFIDENCE;
        private int threads = 1;
        private AiFallbackAnnotator aiAnnotator;

        /**
         * @throws IllegalArgumentException if a detector with the same id is already registered
         */
        public Builder register(GrammarDetector detector) {
            Objects.requireNonNull(detector, "detector");
            if (detectors.putIfAbsent(detector.id(), detector) != null) {
                throw new IllegalArgumentException("Detector already registered: " + detector.id().key());
            }
            return this;
        }

        public Builder minConfidence(double minConfidence) {
            if (Double.isNaN(minConfidence) || minConfidence < 0.0 || minConfidence > 1.0) {
                throw new IllegalArgumentException("minConfidence must be within [0, 1]: " + minConfidence);
            }
            this.minConfidence = minConfidence;
            return this;
        }

        public Builder threads(int threads) {
            if (threads <= 0) {
                throw new IllegalArgumentException("threads must be positive: " + threads);
            }
            this.threads = threads;
            return this;
        }

        public Builder aiAnnotator(AiFallbackAnnotator aiAnnotator) {
            this.aiAnnotator = aiAnnotator;
            return this;
        }

        public DetectionEngine build() {
            return new DetectionEngine(this);
        }
    }
}
