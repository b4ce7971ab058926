package no.cantara.ksg.procedure;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static no.cantara.ksg.TestSupport.fixture;
import static org.junit.jupiter.api.Assertions.*;

class ProcedureValidatorTest {

    private static Map<String, Object> step(String id, String tool, String... deps) {
        Map<String, Object> s = new HashMap<>();
        if (id != null) s.put("id", id);
        if (tool != null) s.put("tool", tool);
        s.put("params", Map.of());
        if (deps.length > 0) s.put("depends_on", List.of(deps));
        return s;
    }

    private static Map<String, Object> procedure(List<Map<String, Object>> steps) {
        Map<String, Object> p = new HashMap<>();
        p.put("name", "Test");
        p.put("description", "A test procedure");
        p.put("steps", new ArrayList<>(steps));
        return p;
    }

    private static boolean hasError(ProcedureValidator.ValidationResult r, String fragment) {
        return r.errors().stream().anyMatch(e -> e.message().contains(fragment));
    }

    // -----------------------------------------------------------------------
    // Valid input
    // -----------------------------------------------------------------------

    @Test
    void queuedLoginIsValid() throws IOException {
        ProcedureValidator.ValidationResult r = ProcedureValidator.validate(Files.readString(fixture("queued-login.yaml")));
        assertTrue(r.isValid(), r.errors().toString());
        assertFalse(r.hasWarnings());
    }

    @Test
    void missingParamsIsOnlyAWarning() {
        Map<String, Object> s = step("a", "web.get_dom");
        s.remove("params");
        ProcedureValidator.ValidationResult r = ProcedureValidator.validate(procedure(List.of(s)));
        assertTrue(r.isValid());
        assertTrue(r.warnings().stream().anyMatch(w -> w.contains("params")));
    }

    // -----------------------------------------------------------------------
    // Structural errors
    // -----------------------------------------------------------------------

    @Test
    void parseErrorIsSingleErrorAtRoot() {
        ProcedureValidator.ValidationResult r = ProcedureValidator.validate("{not json");
        assertEquals(1, r.errors().size());
        assertEquals("$", r.errors().get(0).path());
    }

    @Test
    void missingRootFieldsAreAllReported() {
        ProcedureValidator.ValidationResult r = ProcedureValidator.validate(new HashMap<>());
        assertEquals(3, r.errors().size());
        assertTrue(r.errors().stream().anyMatch(e -> e.path().equals("$.name")));
        assertTrue(r.errors().stream().anyMatch(e -> e.path().equals("$.description")));
        assertTrue(r.errors().stream().anyMatch(e -> e.path().equals("$.steps")));
    }

    @Test
    void emptyStepsIsError() {
        ProcedureValidator.ValidationResult r = ProcedureValidator.validate(procedure(List.of()));
        assertTrue(hasError(r, "must not be empty"));
    }

    @Test
    void stepWithoutIdOrToolReportsBoth() {
        ProcedureValidator.ValidationResult r = ProcedureValidator.validate(procedure(List.of(step(null, null))));
        assertTrue(r.errors().stream().anyMatch(e -> e.path().equals("$.steps[0].id")));
        assertTrue(r.errors().stream().anyMatch(e -> e.path().equals("$.steps[0].tool")));
    }

    @Test
    void duplicateIdNamesBothOccurrences() {
        ProcedureValidator.ValidationResult r = ProcedureValidator.validate(procedure(List.of(
                step("a", "t"), step("b", "t"), step("a", "t"))));
        ProcedureValidator.ValidationError e = r.errors().stream()
                .filter(x -> x.message().contains("duplicate")).findFirst().orElseThrow();
        assertEquals("$.steps[2].id", e.path());
        assertTrue(e.message().contains("$.steps[0]"));
    }

    @Test
    void unknownDependencyIsError() {
        ProcedureValidator.ValidationResult r = ProcedureValidator.validate(procedure(List.of(step("a", "t", "ghost"))));
        assertTrue(hasError(r, "unknown dependency 'ghost'"));
    }

    @Test
    void threeStepCycleIsReportedWithItsPath() throws IOException {
        ProcedureValidator.ValidationResult r = ProcedureValidator.validate(Files.readString(fixture("cyclic.yaml")));
        assertFalse(r.isValid());
        assertTrue(hasError(r, "Circular dependency detected: A -> B -> C -> A"), r.errors().toString());
    }

    @Test
    void selfDependencyIsCycle() {
        ProcedureValidator.ValidationResult r = ProcedureValidator.validate(procedure(List.of(step("a", "t", "a"))));
        assertTrue(hasError(r, "a -> a"));
    }

    @Test
    void allDefectsAreReportedTogether() {
        Map<String, Object> p = procedure(List.of(step("a", null, "b"), step("b", "t", "a"), step("c", "t", "ghost")));
        p.remove("description");
        ProcedureValidator.ValidationResult r = ProcedureValidator.validate(p);
        assertTrue(r.errors().stream().anyMatch(e -> e.path().equals("$.description")));
        assertTrue(r.errors().stream().anyMatch(e -> e.path().equals("$.steps[0].tool")));
        assertTrue(hasError(r, "unknown dependency"));
        assertTrue(hasError(r, "Circular dependency"));
    }

    @Test
    void nonMappingStepIsError() {
        Map<String, Object> p = procedure(List.of());
        p.put("steps", List.of("just text"));
        ProcedureValidator.ValidationResult r = ProcedureValidator.validate(p);
        assertTrue(hasError(r, "step must be a mapping"));
    }
}
