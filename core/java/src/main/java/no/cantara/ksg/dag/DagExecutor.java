package no.cantara.ksg.dag;

import no.cantara.ksg.model.Concept;
import no.cantara.ksg.model.Edge;
import no.cantara.ksg.model.Relations;
import no.cantara.ksg.model.ReservedKeys;
import no.cantara.ksg.store.GraphStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Loads a stored procedure, schedules its steps topologically, applies guards and hands each
 * resolved tool command to a caller-supplied callback. Nested sub-procedures are executed
 * recursively. The executor performs no tool side effects itself.
 *
 * <p>Steps are read from the concept's inline {@code dag}, {@code steps} or {@code children}
 * list when present, otherwise from concepts linked by {@code has_step} and {@code has_child}.
 * Items left inline under the other nesting keys ({@code sub_procedures}, {@code sub_concepts},
 * {@code nodes}) are not loaded. When the concept has no {@code dag}, {@code steps} or
 * {@code children} list, their promoted children are still reached through the
 * {@code has_step} edges recursive construction writes for them.
 */
public class DagExecutor {

    private static final Logger log = LoggerFactory.getLogger(DagExecutor.class);

    private static final List<String> INLINE_KEYS = List.of("dag", ReservedKeys.STEPS, ReservedKeys.CHILDREN);
    private static final Set<String> BOOKKEEPING_KEYS = Set.of(
            "uuid", ReservedKeys.ID, ReservedKeys.ORDER, ReservedKeys.GUARD, ReservedKeys.GUARD_TEXT);

    private final GraphStore store;
    private final GuardEvaluator guards;
    private final TopologicalScheduler scheduler = new TopologicalScheduler();

    public DagExecutor(GraphStore store) {
        this(store, new KeywordGuardEvaluator());
    }

    public DagExecutor(GraphStore store, GuardEvaluator guards) {
        this.store = Objects.requireNonNull(store, "store");
        this.guards = Objects.requireNonNull(guards, "guards");
    }

    // ── loading ───────────────────────────────────────────────────────────────────

    /** The uniform step graph of a stored concept, or empty when the concept does not exist. */
    public Optional<ProcedureGraph> load(String conceptUuid) {
        return store.findConcept(conceptUuid).map(this::load);
    }

    private ProcedureGraph load(Concept concept) {
        for (String key : INLINE_KEYS) {
            if (concept.props().get(key) instanceof List<?> items && !items.isEmpty()) {
                return new ProcedureGraph(concept.uuid(), concept.name(), inlineSteps(items));
            }
        }
        return new ProcedureGraph(concept.uuid(), concept.name(), linkedSteps(concept.uuid()));
    }

    private List<GraphStep> inlineSteps(List<?> items) {
        List<GraphStep> steps = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i) instanceof Map<?, ?> raw) {
                steps.add(toStep(asProps(raw), i, null));
            } else {
                log.warn("Ignoring inline step {} that is not a mapping", i);
            }
        }
        return steps;
    }

    private List<GraphStep> linkedSteps(String conceptUuid) {
        List<Edge> edges = new ArrayList<>(store.edgesFrom(conceptUuid, Relations.HAS_STEP));
        edges.addAll(store.edgesFrom(conceptUuid, Relations.HAS_CHILD));

        List<GraphStep> steps = new ArrayList<>();
        Map<String, String> idByUuid = new HashMap<>();
        for (Edge edge : edges) {
            Optional<Concept> child = store.findConcept(edge.toNode());
            if (child.isEmpty()) {
                log.warn("Procedure {} links to missing step concept {}", conceptUuid, edge.toNode());
                continue;
            }
            Concept stepConcept = child.get();
            Map<String, Object> props = new LinkedHashMap<>(stepConcept.props());
            props.putIfAbsent(ReservedKeys.ORDER, edge.order(steps.size()));
            props.putIfAbsent(ReservedKeys.ID, firstNonBlank(props.get(ReservedKeys.STEP_ID),
                    props.get(ReservedKeys.NAME), stepConcept.uuid()));
            if (toolOf(props) == null && !props.containsKey(ReservedKeys.CONCEPT_UUID) && hasSubSteps(stepConcept)) {
                props.put(ReservedKeys.CONCEPT_UUID, stepConcept.uuid());
            }
            GraphStep step = toStep(props, steps.size(), stepConcept.uuid());
            idByUuid.put(stepConcept.uuid(), step.id());
            steps.add(step);
        }

        // depends_on edges fill in steps that carry no depends_on list of their own
        List<GraphStep> resolved = new ArrayList<>();
        for (GraphStep step : steps) {
            if (!step.dependsOn().isEmpty()) {
                resolved.add(step);
                continue;
            }
            String stepUuid = idByUuid.entrySet().stream()
                    .filter(e -> e.getValue().equals(step.id()))
                    .map(Map.Entry::getKey)
                    .findFirst().orElse(null);
            List<String> deps = stepUuid == null ? List.of() : store.edgesFrom(stepUuid, Relations.DEPENDS_ON).stream()
                    .map(e -> idByUuid.get(e.toNode()))
                    .filter(Objects::nonNull)
                    .toList();
            resolved.add(deps.isEmpty() ? step : new GraphStep(step.id(), step.tool(), step.params(), step.guard(),
                    deps, step.order(), step.conceptUuid()));
        }
        return resolved;
    }

    private boolean hasSubSteps(Concept concept) {
        for (String key : INLINE_KEYS) {
            if (concept.props().get(key) instanceof List<?> items && !items.isEmpty()) return true;
        }
        return !store.edgesFrom(concept.uuid(), Relations.HAS_STEP).isEmpty()
                || !store.edgesFrom(concept.uuid(), Relations.HAS_CHILD).isEmpty();
    }

    @SuppressWarnings("unchecked")
    private static GraphStep toStep(Map<String, Object> props, int index, String fallbackId) {
        String id = firstNonBlank(props.get(ReservedKeys.ID), props.get(ReservedKeys.STEP_ID),
                props.get(ReservedKeys.NAME), fallbackId);
        if (id == null) id = "step_" + (index + 1);

        Object rawParams = props.containsKey(ReservedKeys.PARAMS) ? props.get(ReservedKeys.PARAMS) : props.get("metadata");
        Map<String, Object> params = new LinkedHashMap<>();
        if (rawParams instanceof Map<?, ?> p) {
            ((Map<String, Object>) p).forEach((k, v) -> {
                if (!BOOKKEEPING_KEYS.contains(k)) params.put(k, v);
            });
        }

        Object guard = props.get(ReservedKeys.GUARD) != null ? props.get(ReservedKeys.GUARD) : props.get(ReservedKeys.GUARD_TEXT);
        Object deps = props.get(ReservedKeys.DEPENDS_ON);
        List<String> dependsOn = deps instanceof List<?> list
                ? list.stream().filter(Objects::nonNull).map(Object::toString).toList()
                : deps != null ? List.of(deps.toString()) : List.of();
        int order = props.get(ReservedKeys.ORDER) instanceof Number n ? n.intValue() : index;
        String conceptUuid = firstNonBlank(props.get(ReservedKeys.CONCEPT_UUID));

        return new GraphStep(id, toolOf(props), params, guard, dependsOn, order, conceptUuid);
    }

    private static String toolOf(Map<String, Object> props) {
        return firstNonBlank(props.get(ReservedKeys.TOOL), props.get("commandtype"), props.get("command"));
    }

    // ── execution ─────────────────────────────────────────────────────────────────

    public ExecutionResult execute(String conceptUuid, Map<String, Object> context, Consumer<ToolCommand> enqueue) {
        Objects.requireNonNull(enqueue, "enqueue");
        return execute(conceptUuid, context != null ? context : Map.of(), enqueue, new LinkedHashSet<>());
    }

    private ExecutionResult execute(String conceptUuid, Map<String, Object> context, Consumer<ToolCommand> enqueue,
                                    Set<String> active) {
        Optional<ProcedureGraph> loaded = load(conceptUuid);
        if (loaded.isEmpty()) {
            log.warn("Cannot execute {}: concept not found", conceptUuid);
            return ExecutionResult.failed(conceptUuid, "Concept not found: " + conceptUuid);
        }
        ProcedureGraph graph = loaded.get();
        List<String> order = scheduler.schedule(graph);
        Map<String, GraphStep> byId = new LinkedHashMap<>();
        graph.steps().forEach(s -> byId.putIfAbsent(s.id(), s));

        List<ExecutionResult.ExecutedStep> executed = new ArrayList<>();
        List<String> pending = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        List<ExecutionResult.StepError> errors = new ArrayList<>();

        active.add(conceptUuid);
        try {
            for (String id : order) {
                GraphStep step = byId.get(id);
                if (!guards.allows(step.guard(), context)) {
                    log.debug("Step '{}' guard is false; skipping", id);
                    pending.add(id);
                    skipped.add(id);
                    continue;
                }
                StepResolution resolution = resolve(step);
                if (resolution instanceof StepResolution.Tool tool) {
                    enqueue.accept(tool.command());
                    executed.add(new ExecutionResult.ExecutedStep(id, tool.command(), null));
                } else if (resolution instanceof StepResolution.Nested nested) {
                    String target = nested.command().conceptUuid();
                    if (active.contains(target)) {
                        errors.add(new ExecutionResult.StepError(id, "Recursive reference to running procedure " + target));
                        continue;
                    }
                    ExecutionResult nestedResult = execute(target, context, enqueue, active);
                    executed.add(new ExecutionResult.ExecutedStep(id, nested.command(), nestedResult));
                } else if (resolution instanceof StepResolution.Unresolved unresolved) {
                    log.warn("Step '{}' in {}: {}", id, conceptUuid, unresolved.reason());
                    errors.add(new ExecutionResult.StepError(id, unresolved.reason()));
                }
            }
        } finally {
            active.remove(conceptUuid);
        }

        ExecutionResult.Status status = errors.isEmpty() ? ExecutionResult.Status.COMPLETED : ExecutionResult.Status.PARTIAL;
        log.info("Executed '{}' ({}): {} run, {} skipped, {} errors",
                graph.name(), conceptUuid, executed.size(), skipped.size(), errors.size());
        return new ExecutionResult(status, conceptUuid, executed, pending, skipped, errors, order, null);
    }

    StepResolution resolve(GraphStep step) {
        if (step.tool() != null) {
            return new StepResolution.Tool(ToolCommand.tool(step.tool(), step.params()));
        }
        if (step.conceptUuid() != null && store.findConcept(step.conceptUuid()).isPresent()) {
            return new StepResolution.Nested(ToolCommand.nested(step.conceptUuid()));
        }
        return new StepResolution.Unresolved(step.conceptUuid() != null
                ? "Nested procedure not found: " + step.conceptUuid()
                : "No tool or nested procedure to run");
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asProps(Map<?, ?> raw) {
        return (Map<String, Object>) raw;
    }

    private static String firstNonBlank(Object... values) {
        for (Object v : values) {
            if (v != null && !v.toString().isBlank()) return v.toString();
        }
        return null;
    }
}
