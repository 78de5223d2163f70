package pl.marcinmilkowski.grammar_sketch.detection.collocation;

/**
 * One step of a collocation match attempt.
 *
 * @param role the companion role concerned, null for whole-attempt events
 * @param tier the tier that found the companion, null if none did
 * @param companionIndex token index of the companion, or -1
 */
public record MatchTrace(
    String definitionId,
    int verbIndex,
    int canonicalIndex,
    Event event,
    CompanionRole role,
    MatchTier tier,
    int companionIndex
) {
    public enum Event {
        /** A companion was found. */
        ROLE_FOUND,
        /** No tier found the companion; the attempt fails. */
        ROLE_MISSING,
        /** The particle is attached to the verb form itself. */
        ROLE_NOT_REQUIRED,
        /** All companions found; a result is emitted. */
        MATCHED,
        /** All companions found but the definition is never emitted. */
        SUPPRESSED,
        /** Same tokens already matched from another candidate verb. */
        DUPLICATE
    }

    static MatchTrace attempt(CollocationDefinition definition, int verbIndex, int canonicalIndex, Event event) {
        return new MatchTrace(definition.id(), verbIndex, canonicalIndex, event, null, null, -1);
    }
}
