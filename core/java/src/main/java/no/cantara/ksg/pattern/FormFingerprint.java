package no.cantara.ksg.pattern;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Token-set summary of a page, used for approximate pattern matching.
 *
 * @param version format version, currently 1
 * @param domain  lower-cased URL authority, empty when unknown
 * @param path    URL path, empty when unknown
 * @param tokens  sorted, de-duplicated tokens
 */
public record FormFingerprint(int version, String domain, String path, List<String> tokens) {

    public static final int VERSION = 1;

    public FormFingerprint {
        domain = domain != null ? domain : "";
        path = path != null ? path : "";
        tokens = tokens != null ? List.copyOf(tokens) : List.of();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("v", version);
        map.put("domain", domain);
        map.put("path", path);
        map.put("tokens", tokens);
        return map;
    }

    /** Read a fingerprint stored in pattern data; anything unusable yields an empty fingerprint. */
    public static FormFingerprint fromMap(Object value) {
        if (!(value instanceof Map<?, ?> map)) {
            return new FormFingerprint(VERSION, "", "", List.of());
        }
        Object v = map.get("v");
        Object tokens = map.get("tokens");
        return new FormFingerprint(
                v instanceof Number n ? n.intValue() : VERSION,
                Objects.toString(map.get("domain"), ""),
                Objects.toString(map.get("path"), ""),
                tokens instanceof List<?> list ? list.stream().filter(Objects::nonNull).map(Object::toString).toList() : List.of());
    }
}
