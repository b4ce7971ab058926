package no.cantara.ksg.config;

import java.util.Set;

/**
 * Tunables of the knowledge graph. Load with {@link KsgConfigLoader}; {@link #defaults()} gives
 * the built-in values.
 */
public record KsgConfig(Patterns patterns, Transfer transfer, Generalization generalization, Guards guards) {

    /**
     * @param defaultSimilarity similarity assumed for a candidate when no embeddings are available
     * @param minSimilarity     floor for similar-pattern search
     * @param topK              search breadth
     */
    public record Patterns(double defaultSimilarity, double minSimilarity, int topK) {}

    /**
     * @param minFieldScore      a heuristic field match must score above this
     * @param persistConfidence  transfers at or above this confidence are stored
     * @param fallbackConfidence confidence used when a reasoning reply cannot be parsed
     */
    public record Transfer(double minFieldScore, double persistConfidence, double fallbackConfidence) {}

    /**
     * @param minSimilar    exemplars needed, the triggering concept included
     * @param minSimilarity similarity a peer needs to count
     * @param commonRatio   share of exemplars a selector or step must appear in to be kept
     */
    public record Generalization(int minSimilar, double minSimilarity, double commonRatio) {}

    public record Guards(Set<String> trueTokens, Set<String> falseTokens) {
        public Guards {
            trueTokens = Set.copyOf(trueTokens);
            falseTokens = Set.copyOf(falseTokens);
        }
    }

    public static KsgConfig defaults() {
        return new KsgConfig(
                new Patterns(0.7, 0.5, 5),
                new Transfer(0.5, 0.6, 0.5),
                new Generalization(2, 0.75, 0.5),
                new Guards(Set.of("true", "always", "yes"), Set.of("false", "never", "no")));
    }
}
