package no.cantara.ksg.concept;

import no.cantara.ksg.model.ReservedKeys;

import java.util.List;
import java.util.Map;

/**
 * Shape of one item found under a nesting key during recursive construction.
 *
 * <p>{@link Atomic} items carry a {@code tool} and no nested structure of their own;
 * {@link Composite} items have nested structure (or no tool); anything that is not a mapping is
 * {@link Malformed}.
 */
public sealed interface NestedItem permits NestedItem.Atomic, NestedItem.Composite, NestedItem.Malformed {

    /** Keys whose list values hold nested items. */
    List<String> NESTING_KEYS = List.of("steps", "children", "sub_procedures", "sub_concepts", "nodes");

    record Atomic(Map<String, Object> data, String tool) implements NestedItem {}

    record Composite(Map<String, Object> data) implements NestedItem {}

    record Malformed(Object raw, String reason) implements NestedItem {}

    @SuppressWarnings("unchecked")
    static NestedItem classify(Object raw) {
        if (!(raw instanceof Map<?, ?> m)) {
            return new Malformed(raw, "not a mapping");
        }
        Map<String, Object> data = (Map<String, Object>) m;
        if (hasNestedStructure(data)) {
            return new Composite(data);
        }
        Object tool = data.get(ReservedKeys.TOOL);
        if (tool instanceof String t && !t.isBlank()) {
            return new Atomic(data, t);
        }
        return new Composite(data);
    }

    /**
     * Whether an item found under {@code key} becomes its own concept. Under {@code children}
     * every well-formed item is promoted; under the other nesting keys only composites are, and
     * atomic items stay inline in the parent.
     */
    static boolean promotes(String key, NestedItem item) {
        if (item instanceof Composite) return true;
        if (item instanceof Atomic) return ReservedKeys.CHILDREN.equals(key);
        return false;
    }

    static boolean hasNestedStructure(Map<String, Object> data) {
        for (String key : NESTING_KEYS) {
            if (data.get(key) instanceof List<?> list && !list.isEmpty()) {
                return true;
            }
        }
        return false;
    }
}
