package no.cantara.ksg;

import java.util.List;

/**
 * Text embedding supplied by the host (local model, remote API, test stub).
 * Optional everywhere: components that receive {@code null} fall back to heuristics.
 */
@FunctionalInterface
public interface EmbeddingFunction {

    List<Double> embed(String text);
}
