package no.cantara.ksg.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A node in the knowledge graph: a prototype, a concrete concept, a procedure, a step or a pattern.
 *
 * <p>{@code props} is an open map. Core algorithms only read the keys listed in {@link ReservedKeys}.
 * A concept never owns its prototype; {@code prototype_uuid} is a weak back-reference.
 *
 * @param uuid      unique id, assigned at creation
 * @param kind      one of {@link Kinds} or a domain kind
 * @param labels    ordered tags
 * @param props     property map, may hold nested lists and maps; stored as a deep read-only copy
 * @param embedding optional embedding vector, {@code null} when absent
 * @param status    optional lifecycle tag ("active", "deprecated", ...)
 */
public record Concept(
        String uuid,
        String kind,
        List<String> labels,
        Map<String, Object> props,
        List<Double> embedding,
        String status
) implements GraphEntity {

    public Concept {
        if (uuid == null || uuid.isBlank()) {
            throw new IllegalArgumentException("Concept uuid is required");
        }
        kind = kind != null ? kind : Kinds.CONCEPT;
        labels = labels != null ? List.copyOf(labels) : List.of();
        props = Props.copyOf(props);
        embedding = embedding != null ? List.copyOf(embedding) : null;
    }

    public static Concept create(String kind, List<String> labels, Map<String, Object> props) {
        return new Concept(UUID.randomUUID().toString(), kind, labels, props, null, null);
    }

    public static Concept create(String kind, List<String> labels, Map<String, Object> props, List<Double> embedding) {
        return new Concept(UUID.randomUUID().toString(), kind, labels, props, embedding, null);
    }

    public Concept withProps(Map<String, Object> newProps) {
        return new Concept(uuid, kind, labels, newProps, embedding, status);
    }

    public Concept withEmbedding(List<Double> newEmbedding) {
        return new Concept(uuid, kind, labels, props, newEmbedding, status);
    }

    public Concept withStatus(String newStatus) {
        return new Concept(uuid, kind, labels, props, embedding, newStatus);
    }

    /** A mutable copy of the props, for read-modify-write updates. */
    public Map<String, Object> mutableProps() {
        return new LinkedHashMap<>(props);
    }

    public boolean hasEmbedding() {
        return embedding != null && !embedding.isEmpty();
    }

    /** Display name: {@code name}, then {@code title}, then {@code label}, then the first label. */
    public String name() {
        for (String key : List.of(ReservedKeys.NAME, ReservedKeys.TITLE, "label")) {
            Object v = props.get(key);
            if (v instanceof String s && !s.isBlank()) return s;
        }
        return labels.isEmpty() ? null : labels.get(0);
    }

    public String description() {
        Object v = props.get(ReservedKeys.DESCRIPTION);
        return v instanceof String s ? s : null;
    }

    public String stringProp(String key) {
        Object v = props.get(key);
        return v != null ? v.toString() : null;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> mapProp(String key) {
        Object v = props.get(key);
        return v instanceof Map<?, ?> m ? (Map<String, Object>) m : Map.of();
    }
}
