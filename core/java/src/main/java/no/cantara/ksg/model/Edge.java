package no.cantara.ksg.model;

import java.util.Map;
import java.util.UUID;

/**
 * A directed, typed relationship between two concepts. Edges are immutable once written;
 * changing a relationship means adding a new edge.
 *
 * @param uuid     unique id
 * @param fromNode source concept uuid
 * @param toNode   target concept uuid
 * @param rel      relationship type, one of {@link Relations} or a free-form association label
 * @param props    edge metadata such as {@code strength} or {@code order}
 */
public record Edge(
        String uuid,
        String fromNode,
        String toNode,
        String rel,
        Map<String, Object> props
) implements GraphEntity {

    public Edge {
        if (uuid == null || uuid.isBlank()) {
            throw new IllegalArgumentException("Edge uuid is required");
        }
        if (fromNode == null || toNode == null) {
            throw new IllegalArgumentException("Edge requires both from_node and to_node");
        }
        if (rel == null || rel.isBlank()) {
            throw new IllegalArgumentException("Edge rel is required");
        }
        props = Props.copyOf(props);
    }

    public static Edge create(String fromNode, String toNode, String rel, Map<String, Object> props) {
        return new Edge(UUID.randomUUID().toString(), fromNode, toNode, rel, props);
    }

    public static Edge create(String fromNode, String toNode, String rel) {
        return create(fromNode, toNode, rel, Map.of());
    }

    /** Fuzzy membership strength in [0,1], or {@code null} for a crisp relationship. */
    public Double strength() {
        Object v = props.get(ReservedKeys.STRENGTH);
        return v instanceof Number n ? n.doubleValue() : null;
    }

    /** The {@code order} hint, or {@code fallback} when absent. */
    public int order(int fallback) {
        Object v = props.get(ReservedKeys.ORDER);
        return v instanceof Number n ? n.intValue() : fallback;
    }
}
