package pl.marcinmilkowski.grammar_sketch.detection.collocation;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Dependency labels a collocation accepts for each role, plus traversal limits.
 *
 * <p>{@code mustMatch}, when non-empty, replaces the role's own label set as
 * the acceptable final relation of a collapsed path. {@code shouldMatch} only
 * ranks competing paths.</p>
 */
public record DependencySignature(
    Set<String> verbDeps,
    Set<String> reflexiveDeps,
    Set<String> prepDeps,
    Set<String> nounDeps,
    Set<String> particleDeps,
    int maxDepth,
    int window,
    List<String> mustMatch,
    List<String> shouldMatch
) {
    public static final int DEFAULT_MAX_DEPTH = 3;
    public static final int DEFAULT_WINDOW = 5;

    public DependencySignature {
        verbDeps = copy(verbDeps);
        reflexiveDeps = copy(reflexiveDeps);
        prepDeps = copy(prepDeps);
        nounDeps = copy(nounDeps);
        particleDeps = copy(particleDeps);
        mustMatch = mustMatch == null ? List.of() : List.copyOf(mustMatch);
        shouldMatch = shouldMatch == null ? List.of() : List.copyOf(shouldMatch);
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, got " + maxDepth);
        }
        if (window <= 0) {
            throw new IllegalArgumentException("window must be positive, got " + window);
        }
    }

    /**
     * Labels acceptable on the edge that attaches a companion of {@code role}.
     */
    public Set<String> labelsFor(CompanionRole role) {
        return switch (role) {
            case REFLEXIVE -> reflexiveDeps;
            case PREPOSITION -> prepDeps;
            case NOUN -> verbDeps;
            case PARTICLE -> particleDeps;
        };
    }

    /**
     * Labels acceptable on a noun that carries a preposition for the verb.
     */
    public Set<String> prepositionHostLabels() {
        Set<String> labels = new LinkedHashSet<>(verbDeps);
        labels.addAll(nounDeps);
        return labels;
    }

    /**
     * Final-edge labels a collapsed path may end in for {@code role}.
     */
    public Set<String> collapsedTargetsFor(CompanionRole role) {
        return mustMatch.isEmpty() ? labelsFor(role) : Set.copyOf(mustMatch);
    }

    /**
     * Merges a definition's own signature with catalog defaults: label lists
     * are unioned, explicit limits win.
     *
     * @param maxDepth the definition's depth, or null to inherit
     * @param window the definition's window, or null to inherit
     */
    public static DependencySignature merge(DependencySignature defaults,
                                            Collection<String> verbDeps,
                                            Collection<String> reflexiveDeps,
                                            Collection<String> prepDeps,
                                            Collection<String> nounDeps,
                                            Collection<String> particleDeps,
                                            Integer maxDepth,
                                            Integer window,
                                            List<String> mustMatch,
                                            List<String> shouldMatch) {
        return new DependencySignature(
            union(verbDeps, defaults.verbDeps),
            union(reflexiveDeps, defaults.reflexiveDeps),
            union(prepDeps, defaults.prepDeps),
            union(nounDeps, defaults.nounDeps),
            union(particleDeps, defaults.particleDeps),
            maxDepth != null ? maxDepth : defaults.maxDepth,
            window != null ? window : defaults.window,
            mustMatch,
            shouldMatch);
    }

    private static Set<String> union(Collection<String> own, Collection<String> defaults) {
        Set<String> out = new LinkedHashSet<>();
        if (own != null) {
            out.addAll(own);
        }
        out.addAll(defaults);
        return out;
    }

    private static Set<String> copy(Set<String> labels) {
        return labels == null ? Set.of() : Set.copyOf(labels);
    }
}
