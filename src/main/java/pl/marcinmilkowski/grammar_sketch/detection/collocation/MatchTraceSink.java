package pl.marcinmilkowski.grammar_sketch.detection.collocation;

/**
 * Receives match-attempt events from {@link CollocationMatcher}. Tracing is
 * off unless a sink other than {@link #NONE} is supplied.
 */
@FunctionalInterface
public interface MatchTraceSink {

    MatchTraceSink NONE = trace -> { };

    void accept(MatchTrace trace);
}
