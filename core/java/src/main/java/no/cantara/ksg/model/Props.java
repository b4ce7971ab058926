package no.cantara.ksg.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Deep, read-only copies of property maps. Nested maps and lists are copied too; null values are kept. */
final class Props {

    private Props() {}

    @SuppressWarnings("unchecked")
    static Map<String, Object> copyOf(Map<String, Object> props) {
        return props != null ? (Map<String, Object>) copyValue(props) : Map.of();
    }

    private static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> out = new LinkedHashMap<>();
            map.forEach((k, v) -> out.put(k, copyValue(v)));
            return Collections.unmodifiableMap(out);
        }
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            list.forEach(v -> out.add(copyValue(v)));
            return Collections.unmodifiableList(out);
        }
        return value;
    }
}
