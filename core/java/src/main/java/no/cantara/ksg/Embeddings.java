package no.cantara.ksg;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Calls an optional {@link EmbeddingFunction} without letting its absence or failure escape.
 */
public final class Embeddings {

    private static final Logger log = LoggerFactory.getLogger(Embeddings.class);

    private Embeddings() {}

    /**
     * @return the embedding, or {@code null} when no function is configured, the text is blank,
     *         or the function failed
     */
    public static List<Double> embedOrNull(EmbeddingFunction fn, String text) {
        if (fn == null || text == null || text.isBlank()) return null;
        try {
            List<Double> v = fn.embed(text);
            return v == null || v.isEmpty() ? null : List.copyOf(v);
        } catch (RuntimeException e) {
            log.warn("Embedding function failed for '{}'; continuing without embedding: {}", abbreviate(text), e.toString());
            return null;
        }
    }

    private static String abbreviate(String text) {
        return text.length() <= 40 ? text : text.substring(0, 37) + "...";
    }
}
