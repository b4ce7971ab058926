package no.cantara.ksg.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Origin of a write. Every upsert carries one; it is recorded but never gates read visibility.
 *
 * @param source     origin tag ("user", "tool", "doc", ...)
 * @param timestamp  when the write was made
 * @param confidence confidence in [0,1]
 * @param traceId    correlates a batch of writes
 */
public record Provenance(String source, Instant timestamp, double confidence, String traceId) {

    public Provenance {
        source = source != null ? source : "user";
        timestamp = timestamp != null ? timestamp : Instant.now();
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("Provenance confidence must be within [0,1], got " + confidence);
        }
        traceId = traceId != null ? traceId : UUID.randomUUID().toString();
    }

    public static Provenance of(String source, String traceId) {
        return new Provenance(source, Instant.now(), 1.0, traceId);
    }

    public static Provenance user(String traceId) {
        return of("user", traceId);
    }

    public static Provenance tool(String traceId) {
        return of("tool", traceId);
    }
}
