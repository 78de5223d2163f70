package pl.marcinmilkowski.grammar_sketch.engine;

import pl.marcinmilkowski.grammar_sketch.model.DetectionResult;
import pl.marcinmilkowski.grammar_sketch.model.Sentence;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * External annotator consulted when no rule-based detector found anything.
 * Implementations must not block the caller; the engine applies its own
 * timeout to the returned future.
 */
public interface AiFallbackAnnotator {

    CompletableFuture<List<DetectionResult>> annotateAsync(Sentence sentence);

    /**
     * Upper bound the engine waits for {@link #annotateAsync}, in milliseconds.
     */
    long timeoutMillis();
}
