package no.cantara.ksg.dag;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class KeywordGuardEvaluatorTest {

    private final KeywordGuardEvaluator guards = new KeywordGuardEvaluator();

    @Test void absentGuardAllows() {
        assertTrue(guards.allows(null, Map.of()));
        assertTrue(guards.allows("  ", Map.of()));
    }

    @Test void booleanGuardIsUsedDirectly() {
        assertTrue(guards.allows(true, Map.of()));
        assertFalse(guards.allows(false, Map.of()));
    }

    @Test void falseVocabularyBlocksCaseInsensitively() {
        assertFalse(guards.allows("false", Map.of()));
        assertFalse(guards.allows("NEVER", Map.of()));
        assertFalse(guards.allows(" No ", Map.of()));
    }

    @Test void trueVocabularyAllows() {
        assertTrue(guards.allows("Always", Map.of()));
        assertTrue(guards.allows("yes", Map.of()));
    }

    @Test void unknownStringAllows() {
        assertTrue(guards.allows("user is logged in", Map.of()));
    }

    @Test void vocabularyIsConfigurable() {
        KeywordGuardEvaluator custom = new KeywordGuardEvaluator(Set.of("on"), Set.of("Off"));
        assertFalse(custom.allows("off", Map.of()));
        assertTrue(custom.allows("false", Map.of()));
    }
}
