package no.cantara.ksg.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static no.cantara.ksg.TestSupport.fixture;
import static org.junit.jupiter.api.Assertions.*;

class KsgConfigLoaderTest {

    @Test void bundledDefaultsMatchBuiltInDefaults() {
        assertEquals(KsgConfig.defaults(), KsgConfigLoader.load());
    }

    @Test void guardTokensAreReadAsStrings() {
        KsgConfig config = KsgConfigLoader.load();
        assertEquals(Set.of("true", "always", "yes"), config.guards().trueTokens());
        assertEquals(Set.of("false", "never", "no"), config.guards().falseTokens());
    }

    @Test void overlayReplacesOnlyTheKeysItNames() throws IOException {
        KsgConfig config = KsgConfigLoader.load(fixture("ksg-override.yaml"));

        assertEquals(0.8, config.transfer().persistConfidence());
        assertEquals(0.5, config.transfer().fallbackConfidence());
        assertEquals(Set.of("false", "skip"), config.guards().falseTokens());
        assertEquals(KsgConfig.defaults().guards().trueTokens(), config.guards().trueTokens());
        assertEquals(KsgConfig.defaults().patterns(), config.patterns());
    }

    @Test void missingSectionsFallBackToDefaults() {
        KsgConfig config = KsgConfigLoader.fromMap(Map.of("patterns", Map.of("top_k", 10)));
        assertEquals(10, config.patterns().topK());
        assertEquals(0.7, config.patterns().defaultSimilarity());
        assertEquals(KsgConfig.defaults().generalization(), config.generalization());
    }

    @Test void nonMappingRootIsRejected(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("bad.yaml");
        Files.writeString(file, "- just\n- a list\n");
        assertThrows(IllegalArgumentException.class, () -> KsgConfigLoader.load(file));
    }

    @Test void wrongTypesAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> KsgConfigLoader.fromMap(Map.of("transfer", Map.of("persist_confidence", "high"))));
        assertThrows(IllegalArgumentException.class,
                () -> KsgConfigLoader.fromMap(Map.of("guards", "none")));
        assertThrows(IllegalArgumentException.class,
                () -> KsgConfigLoader.parse("a: [unclosed", "inline"));
    }

    @Test void deepMergeKeepsSiblingKeys() {
        Map<String, Object> base = new LinkedHashMap<>(Map.of("transfer", Map.of("a", 1, "b", 2)));
        KsgConfigLoader.deepMerge(base, Map.of("transfer", Map.of("b", 3), "extra", true));
        assertEquals(Map.of("a", 1, "b", 3), base.get("transfer"));
        assertEquals(true, base.get("extra"));
    }
}
