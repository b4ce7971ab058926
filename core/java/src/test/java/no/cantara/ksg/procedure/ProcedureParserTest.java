package no.cantara.ksg.procedure;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static no.cantara.ksg.TestSupport.fixture;
import static org.junit.jupiter.api.Assertions.*;

class ProcedureParserTest {

    // -----------------------------------------------------------------------
    // Text parsing
    // -----------------------------------------------------------------------

    @Test
    void parsesYamlFixture() throws IOException {
        Map<String, Object> data = ProcedureParser.parse(fixture("queued-login.yaml"));
        assertEquals("Queued Login", data.get("name"));
        assertEquals(3, ((List<?>) data.get("steps")).size());
    }

    @Test
    void parsesJsonFixture() throws IOException {
        Map<String, Object> data = ProcedureParser.parse(fixture("diamond.json"));
        assertEquals("Diamond", data.get("name"));
    }

    @Test
    void malformedJsonIsParseException() {
        assertThrows(ProcedureParser.ParseException.class, () -> ProcedureParser.parse("{\"name\": "));
    }

    @Test
    void scalarRootIsParseException() {
        ProcedureParser.ParseException e = assertThrows(ProcedureParser.ParseException.class,
                () -> ProcedureParser.parse("just a string"));
        assertTrue(e.getMessage().contains("mapping"));
    }

    @Test
    void blankTextIsParseException() {
        assertThrows(ProcedureParser.ParseException.class, () -> ProcedureParser.parse("  "));
    }

    // -----------------------------------------------------------------------
    // fromMap
    // -----------------------------------------------------------------------

    @Test
    void fromMapBuildsTypedSteps() throws IOException {
        ProcedureDescription p = ProcedureParser.fromMap(ProcedureParser.parse(fixture("queued-login.yaml")));
        assertEquals("Queued Login", p.name());
        assertEquals(List.of("login"), p.tags());
        StepDescriptor second = p.steps().get(1);
        assertEquals("step_2", second.id());
        assertEquals("form.autofill", second.tool());
        assertEquals("form", second.toolFamily());
        assertEquals(List.of("step_1"), second.dependsOn());
        assertEquals(1, second.order());
        assertEquals("stop", second.onFail());
        assertEquals(0, second.retries());
        assertEquals(2, p.dependencyCount());
    }

    @Test
    void singleDependencyScalarBecomesList() {
        ProcedureDescription p = ProcedureParser.fromMap(Map.of("name", "n", "description", "d",
                "steps", List.of(Map.of("id", "a", "tool", "t"), Map.of("id", "b", "tool", "t", "depends_on", "a"))));
        assertEquals(List.of("a"), p.steps().get(1).dependsOn());
    }

    @Test
    void fromMapWithoutStepsIsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> ProcedureParser.fromMap(Map.of("name", "n")));
    }

    @Test
    void fromMapWithStepWithoutIdIsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> ProcedureParser.fromMap(Map.of(
                "name", "n", "steps", List.of(Map.of("tool", "t")))));
    }
}
