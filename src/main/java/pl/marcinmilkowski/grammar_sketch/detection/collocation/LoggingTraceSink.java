package pl.marcinmilkowski.grammar_sketch.detection.collocation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes match-attempt events to the debug log.
 */
public class LoggingTraceSink implements MatchTraceSink {
    private static final Logger logger = LoggerFactory.getLogger(LoggingTraceSink.class);

    @Override
    public void accept(MatchTrace trace) {
        if (!logger.isDebugEnabled()) {
            return;
        }
        if (trace.role() == null) {
            logger.debug("[{}] verb {} (canonical {}): {}",
                trace.definitionId(), trace.verbIndex(), trace.canonicalIndex(), trace.event());
        } else {
            logger.debug("[{}] verb {} (canonical {}): {} {} tier={} token={}",
                trace.definitionId(), trace.verbIndex(), trace.canonicalIndex(), trace.role(), trace.event(),
                trace.tier() == null ? "-" : trace.tier().label(), trace.companionIndex());
        }
    }
}
