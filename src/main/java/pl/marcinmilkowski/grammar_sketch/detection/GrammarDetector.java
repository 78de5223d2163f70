package pl.marcinmilkowski.grammar_sketch.detection;

import pl.marcinmilkowski.grammar_sketch.model.DetectionResult;
import pl.marcinmilkowski.grammar_sketch.model.Sentence;

import java.util.List;

/**
 * A family of grammar-point detectors. Implementations must be stateless with
 * respect to the sentence: {@link #detect} may be called concurrently from
 * several threads.
 */
public interface GrammarDetector {

    DetectorId id();

    /**
     * Detects all occurrences of this family's grammar points.
     *
     * @return results in any order; never null
     */
    List<DetectionResult> detect(Sentence sentence);
}
