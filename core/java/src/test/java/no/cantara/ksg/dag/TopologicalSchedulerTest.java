package no.cantara.ksg.dag;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TopologicalSchedulerTest {

    private final TopologicalScheduler scheduler = new TopologicalScheduler();

    private static GraphStep step(String id, int order, String... deps) {
        return new GraphStep(id, "noop", Map.of(), null, List.of(deps), order, null);
    }

    private static ProcedureGraph graph(GraphStep... steps) {
        return new ProcedureGraph("p", "test", List.of(steps));
    }

    @Test void chainRunsInDependencyOrder() {
        List<String> order = scheduler.schedule(graph(step("c", 0, "b"), step("b", 1, "a"), step("a", 2)));
        assertEquals(List.of("a", "b", "c"), order);
    }

    @Test void diamondPlacesBranchesBetweenRootAndJoin() {
        List<String> order = scheduler.schedule(graph(
                step("A", 0), step("B", 1, "A"), step("C", 2, "A"), step("D", 3, "B", "C")));
        assertTrue(order.equals(List.of("A", "B", "C", "D")) || order.equals(List.of("A", "C", "B", "D")), order.toString());
    }

    @Test void orderHintBreaksTies() {
        List<String> order = scheduler.schedule(graph(
                step("A", 0), step("B", 5, "A"), step("C", 1, "A"), step("D", 3, "B", "C")));
        assertEquals(List.of("A", "C", "B", "D"), order);
    }

    @Test void declarationOrderBreaksEqualOrderHints() {
        assertEquals(List.of("x", "y", "z"), scheduler.schedule(graph(step("x", 0), step("y", 0), step("z", 0))));
    }

    @Test void unknownDependenciesAreIgnored() {
        assertEquals(List.of("a", "b"), scheduler.schedule(graph(step("a", 0, "ghost"), step("b", 1, "a"))));
    }

    @Test void cycleRemainderIsAppendedByOrder() {
        List<String> order = scheduler.schedule(graph(step("free", 9), step("x", 2, "y"), step("y", 1, "x")));
        assertEquals(List.of("free", "y", "x"), order);
    }

    @Test void everyStepFollowsItsDependencies() {
        ProcedureGraph g = graph(step("e", 0, "c", "d"), step("d", 1, "b"), step("c", 2, "a"), step("b", 3, "a"), step("a", 4));
        List<String> order = scheduler.schedule(g);
        assertEquals(5, order.size());
        for (GraphStep s : g.steps()) {
            for (String dep : s.dependsOn()) {
                assertTrue(order.indexOf(dep) < order.indexOf(s.id()), dep + " before " + s.id());
            }
        }
    }
}
