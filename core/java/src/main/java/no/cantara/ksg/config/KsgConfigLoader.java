package no.cantara.ksg.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reads {@link KsgConfig} from the classpath resource {@value #DEFAULTS_RESOURCE}, optionally
 * overlaid by a user YAML file. Missing keys fall back to {@link KsgConfig#defaults()} with a
 * warning; a malformed file is an error.
 */
public final class KsgConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(KsgConfigLoader.class);

    public static final String DEFAULTS_RESOURCE = "ksg-defaults.yaml";

    private KsgConfigLoader() {}

    public static KsgConfig load() {
        return fromMap(readDefaults());
    }

    /** Defaults overlaid by {@code overlay}, key by key. */
    public static KsgConfig load(Path overlay) throws IOException {
        Objects.requireNonNull(overlay, "overlay");
        Map<String, Object> merged = readDefaults();
        deepMerge(merged, parse(Files.readString(overlay), overlay.toString()));
        return fromMap(merged);
    }

    static Map<String, Object> readDefaults() {
        try (InputStream in = KsgConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                log.warn("{} not found on classpath; using built-in defaults", DEFAULTS_RESOURCE);
                return new LinkedHashMap<>();
            }
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8), DEFAULTS_RESOURCE);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + DEFAULTS_RESOURCE, e);
        }
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> parse(String text, String source) {
        Object loaded;
        try {
            loaded = new Yaml(new SafeConstructor(new LoaderOptions())).load(text);
        } catch (YAMLException e) {
            throw new IllegalArgumentException("Invalid YAML in " + source + ": " + e.getMessage(), e);
        }
        if (loaded == null) {
            log.warn("Config {} is empty; using defaults", source);
            return new LinkedHashMap<>();
        }
        if (!(loaded instanceof Map<?, ?> m)) {
            throw new IllegalArgumentException("Config root must be a mapping: " + source);
        }
        return new LinkedHashMap<>((Map<String, Object>) m);
    }

    @SuppressWarnings("unchecked")
    static void deepMerge(Map<String, Object> base, Map<String, Object> overlay) {
        overlay.forEach((key, value) -> {
            if (value instanceof Map<?, ?> v && base.get(key) instanceof Map<?, ?> b) {
                Map<String, Object> nested = new LinkedHashMap<>((Map<String, Object>) b);
                deepMerge(nested, (Map<String, Object>) v);
                base.put(key, nested);
            } else {
                base.put(key, value);
            }
        });
    }

    static KsgConfig fromMap(Map<String, Object> root) {
        KsgConfig d = KsgConfig.defaults();
        Map<String, Object> patterns = section(root, "patterns");
        Map<String, Object> transfer = section(root, "transfer");
        Map<String, Object> generalization = section(root, "generalization");
        Map<String, Object> guards = section(root, "guards");
        return new KsgConfig(
                new KsgConfig.Patterns(
                        number(patterns, "patterns.default_similarity", d.patterns().defaultSimilarity()),
                        number(patterns, "patterns.min_similarity", d.patterns().minSimilarity()),
                        (int) number(patterns, "patterns.top_k", d.patterns().topK())),
                new KsgConfig.Transfer(
                        number(transfer, "transfer.min_field_score", d.transfer().minFieldScore()),
                        number(transfer, "transfer.persist_confidence", d.transfer().persistConfidence()),
                        number(transfer, "transfer.fallback_confidence", d.transfer().fallbackConfidence())),
                new KsgConfig.Generalization(
                        (int) number(generalization, "generalization.min_similar", d.generalization().minSimilar()),
                        number(generalization, "generalization.min_similarity", d.generalization().minSimilarity()),
                        number(generalization, "generalization.common_ratio", d.generalization().commonRatio())),
                new KsgConfig.Guards(
                        tokens(guards, "guards.true_tokens", d.guards().trueTokens()),
                        tokens(guards, "guards.false_tokens", d.guards().falseTokens())));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> root, String name) {
        Object value = root.get(name);
        if (value == null) {
            log.warn("Config missing section {} -> fallback to defaults", name);
            return Map.of();
        }
        if (!(value instanceof Map<?, ?> m)) {
            throw new IllegalArgumentException("Config section '" + name + "' must be a mapping");
        }
        return (Map<String, Object>) m;
    }

    private static double number(Map<String, Object> section, String path, double fallback) {
        Object value = section.get(path.substring(path.indexOf('.') + 1));
        if (value == null) {
            log.debug("Config missing field {} -> fallback to default: {}", path, fallback);
            return fallback;
        }
        if (!(value instanceof Number n)) {
            throw new IllegalArgumentException("Config field '" + path + "' must be a number, got '" + value + "'");
        }
        return n.doubleValue();
    }

    private static Set<String> tokens(Map<String, Object> section, String path, Set<String> fallback) {
        Object value = section.get(path.substring(path.indexOf('.') + 1));
        if (value == null) return fallback;
        if (!(value instanceof List<?> list)) {
            throw new IllegalArgumentException("Config field '" + path + "' must be a list");
        }
        Set<String> out = new LinkedHashSet<>();
        list.forEach(v -> out.add(String.valueOf(v)));
        return out;
    }
}
