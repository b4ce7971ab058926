package no.cantara.ksg.dag;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

/**
 * Kahn's algorithm with the ready set ordered by {@code order}, then declaration index.
 * Dependencies on unknown ids are ignored. Steps left over by a cycle are appended by
 * {@code order} rather than failing the run.
 */
public class TopologicalScheduler {

    public List<String> schedule(ProcedureGraph graph) {
        Map<String, GraphStep> steps = new LinkedHashMap<>();
        Map<String, Integer> index = new HashMap<>();
        for (GraphStep step : graph.steps()) {
            if (steps.putIfAbsent(step.id(), step) == null) {
                index.put(step.id(), index.size());
            }
        }

        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (GraphStep step : steps.values()) {
            int degree = 0;
            for (String dep : step.dependsOn().stream().distinct().toList()) {
                if (!steps.containsKey(dep)) continue;
                degree++;
                dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(step.id());
            }
            inDegree.put(step.id(), degree);
        }

        Comparator<String> byOrder = Comparator.<String>comparingInt(id -> steps.get(id).order())
                .thenComparingInt(index::get);
        PriorityQueue<String> ready = new PriorityQueue<>(byOrder);
        for (String id : steps.keySet()) {
            if (inDegree.get(id) == 0) ready.add(id);
        }

        List<String> order = new ArrayList<>();
        while (!ready.isEmpty()) {
            String id = ready.poll();
            order.add(id);
            for (String dependent : dependents.getOrDefault(id, List.of())) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (order.size() < steps.size()) {
            steps.keySet().stream()
                    .filter(id -> !order.contains(id))
                    .sorted(byOrder)
                    .forEach(order::add);
        }
        return order;
    }
}
