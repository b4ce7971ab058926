package no.cantara.ksg.procedure;

import no.cantara.ksg.EmbeddingFunction;
import no.cantara.ksg.Embeddings;
import no.cantara.ksg.model.Concept;
import no.cantara.ksg.model.Edge;
import no.cantara.ksg.model.GraphEntity;
import no.cantara.ksg.model.Kinds;
import no.cantara.ksg.model.Provenance;
import no.cantara.ksg.model.Relations;
import no.cantara.ksg.model.ReservedKeys;
import no.cantara.ksg.store.GraphStore;
import no.cantara.ksg.store.SearchFilters;
import no.cantara.ksg.store.SearchHit;
import no.cantara.ksg.store.UpsertResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Materializes procedure descriptions as graph entities: one {@code Procedure} concept, one
 * {@code Step} concept per step, {@code has_step} edges carrying {@code order}, and one
 * {@code depends_on} edge per declared dependency.
 *
 * <p>Writes are not transactional. A failed write is logged and reported in
 * {@link BuildResult#writeErrors()}; construction continues.
 */
public class ProcedureBuilder {

    private static final Logger log = LoggerFactory.getLogger(ProcedureBuilder.class);

    /**
     * Identifiers of a built procedure.
     *
     * @param procedureUuid       the Procedure concept
     * @param stepUuids           step concepts, in declaration order
     * @param stepIds             step ids, in declaration order
     * @param dependencyEdgeCount sum of all {@code depends_on} list lengths
     * @param writeErrors         messages of store writes that failed
     */
    public record BuildResult(String procedureUuid, List<String> stepUuids, List<String> stepIds,
                              int dependencyEdgeCount, List<String> writeErrors) {
        public BuildResult {
            stepUuids = List.copyOf(stepUuids);
            stepIds = List.copyOf(stepIds);
            writeErrors = List.copyOf(writeErrors);
        }
    }

    /** A stored procedure flattened for a runner that does not walk the graph itself. */
    public record ExecutionPlan(String procedureUuid, String name, List<StepDescriptor> steps) {
        public ExecutionPlan {
            steps = List.copyOf(steps);
        }
    }

    private final GraphStore store;
    private final EmbeddingFunction embeddingFunction;

    public ProcedureBuilder(GraphStore store, EmbeddingFunction embeddingFunction) {
        this.store = Objects.requireNonNull(store, "store");
        this.embeddingFunction = embeddingFunction;
    }

    public BuildResult createFromDescription(String text, Provenance provenance) {
        return createFromDescription(ProcedureParser.parse(text), provenance, true);
    }

    public BuildResult createFromDescription(Map<String, Object> data, Provenance provenance) {
        return createFromDescription(data, provenance, true);
    }

    /**
     * Build a procedure.
     *
     * @param validateFirst when {@code true}, an invalid description raises
     *                      {@link InvalidProcedureException} carrying every reported error; when
     *                      {@code false}, structurally unusable input raises {@link IllegalArgumentException}
     */
    public BuildResult createFromDescription(Map<String, Object> data, Provenance provenance, boolean validateFirst) {
        Objects.requireNonNull(data, "data");
        if (validateFirst) {
            ProcedureValidator.ValidationResult validation = ProcedureValidator.validate(data);
            if (!validation.isValid()) {
                throw new InvalidProcedureException(validation.errors());
            }
            validation.warnings().forEach(w -> log.debug("Procedure '{}': {}", data.get("name"), w));
        }
        return build(ProcedureParser.fromMap(data), provenance);
    }

    BuildResult build(ProcedureDescription description, Provenance provenance) {
        List<String> writeErrors = new ArrayList<>();

        List<String> labels = new ArrayList<>(List.of("procedure", "dag"));
        labels.addAll(description.tags());

        Map<String, Object> props = new LinkedHashMap<>();
        props.put(ReservedKeys.NAME, description.name());
        props.put(ReservedKeys.TITLE, description.name());
        props.put(ReservedKeys.DESCRIPTION, description.description());
        props.put("goal", description.goal() != null ? description.goal() : description.description());
        props.put("tags", description.tags());
        props.put("step_count", description.steps().size());
        props.put("is_dag", true);
        props.put("created_at", Instant.now().toString());
        props.put("metadata", description.metadata());

        List<Double> embedding = Embeddings.embedOrNull(embeddingFunction,
                joinText(description.name(), description.description()));
        Concept procedure = Concept.create(Kinds.PROCEDURE, labels, props, embedding);
        write(procedure, provenance, writeErrors);

        List<String> stepUuids = new ArrayList<>();
        List<String> stepIds = new ArrayList<>();
        Map<String, String> uuidById = new LinkedHashMap<>();

        List<StepDescriptor> steps = description.steps();
        for (int idx = 0; idx < steps.size(); idx++) {
            StepDescriptor step = steps.get(idx);
            Map<String, Object> stepProps = new LinkedHashMap<>();
            stepProps.put(ReservedKeys.STEP_ID, step.id());
            stepProps.put(ReservedKeys.NAME, step.name() != null ? step.name() : "Step " + (idx + 1));
            stepProps.put(ReservedKeys.TOOL, step.tool());
            stepProps.put(ReservedKeys.PARAMS, step.params());
            stepProps.put(ReservedKeys.ORDER, step.order());
            stepProps.put(ReservedKeys.DEPENDS_ON, step.dependsOn());
            stepProps.put(ReservedKeys.GUARD, step.guard());
            stepProps.put("on_fail", step.onFail());
            stepProps.put("retries", step.retries());
            stepProps.put(ReservedKeys.PROCEDURE_UUID, procedure.uuid());

            Concept stepConcept = Concept.create(Kinds.STEP, List.of("step", step.toolFamily()), stepProps);
            write(stepConcept, provenance, writeErrors);
            write(Edge.create(procedure.uuid(), stepConcept.uuid(), Relations.HAS_STEP,
                    Map.of(ReservedKeys.ORDER, step.order())), provenance, writeErrors);

            stepUuids.add(stepConcept.uuid());
            stepIds.add(step.id());
            uuidById.putIfAbsent(step.id(), stepConcept.uuid());
        }

        for (StepDescriptor step : steps) {
            for (String dep : step.dependsOn()) {
                String from = uuidById.get(step.id());
                String to = uuidById.get(dep);
                if (to == null) {
                    log.warn("Procedure '{}': step '{}' depends on unknown step '{}'; no edge written",
                            description.name(), step.id(), dep);
                    continue;
                }
                write(Edge.create(from, to, Relations.DEPENDS_ON,
                        Map.of("from_step", step.id(), "to_step", dep)), provenance, writeErrors);
            }
        }

        log.info("Built procedure '{}' ({}) with {} steps", description.name(), procedure.uuid(), steps.size());
        return new BuildResult(procedure.uuid(), stepUuids, stepIds, description.dependencyCount(), writeErrors);
    }

    /** Rebuild the description of a stored procedure, steps sorted by {@code order}. */
    public Optional<ProcedureDescription> getProcedure(String procedureUuid) {
        return store.findConcept(procedureUuid)
                .filter(c -> Kinds.PROCEDURE.equals(c.kind()))
                .map(c -> {
                    List<StepDescriptor> steps = loadSteps(procedureUuid);
                    Object tags = c.props().get("tags");
                    return new ProcedureDescription(c.name(), c.description(), c.stringProp("goal"),
                            ProcedureParser.stringList(tags), steps, c.mapProp("metadata"));
                });
    }

    public Optional<ExecutionPlan> toExecutionPlan(String procedureUuid) {
        return getProcedure(procedureUuid)
                .map(p -> new ExecutionPlan(procedureUuid, p.name(), p.steps()));
    }

    /** Stored procedures ranked by embedding similarity when available, otherwise by text overlap. */
    public List<SearchHit> searchProcedures(String query, int topK) {
        List<Double> queryEmbedding = Embeddings.embedOrNull(embeddingFunction, query);
        return store.search(query, topK, Map.of(SearchFilters.KIND, Kinds.PROCEDURE), queryEmbedding);
    }

    private List<StepDescriptor> loadSteps(String procedureUuid) {
        List<StepDescriptor> steps = new ArrayList<>();
        for (Edge edge : store.edgesFrom(procedureUuid, Relations.HAS_STEP)) {
            store.findConcept(edge.toNode()).ifPresent(step -> {
                Map<String, Object> raw = new LinkedHashMap<>(step.props());
                raw.putIfAbsent(ReservedKeys.ID, raw.get(ReservedKeys.STEP_ID));
                raw.putIfAbsent(ReservedKeys.ORDER, edge.order(steps.size()));
                steps.add(ProcedureParser.parseStep(raw, steps.size()));
            });
        }
        steps.sort(Comparator.comparingInt(StepDescriptor::order));
        return steps;
    }

    private void write(GraphEntity entity, Provenance provenance, List<String> writeErrors) {
        UpsertResult result = store.upsert(entity, provenance);
        if (!result.isSuccess()) {
            log.warn("Store write failed for {}: {}", entity.uuid(), result.message());
            writeErrors.add(entity.uuid() + ": " + result.message());
        }
    }

    private static String joinText(String a, String b) {
        return ((a != null ? a : "") + " " + (b != null ? b : "")).strip();
    }

    /** Instructions a reasoning layer can follow to emit a valid procedure description. */
    public static String promptInstructions() {
        return """
                Describe the procedure as a JSON object with these fields:
                  name         short title of the procedure (required)
                  description  what the procedure accomplishes (required)
                  goal         optional goal statement
                  tags         optional list of keywords
                  steps        non-empty list of steps (required)

                Each step has:
                  id           unique identifier within the procedure (required)
                  tool         the tool to invoke, e.g. web.get_dom (required)
                  params       map of tool parameters
                  depends_on   list of step ids that must complete first
                  guard        optional condition; false, never or no skips the step
                  on_fail      stop, skip, retry or ask_user
                  retries      retry budget when on_fail is retry

                The depends_on relation must not contain cycles.

                Example:
                """ + EXAMPLE_PROCEDURE;
    }

    static final String EXAMPLE_PROCEDURE = """
            {
              "name": "LinkedIn Login",
              "description": "Log in to LinkedIn with stored credentials",
              "tags": ["login", "linkedin"],
              "steps": [
                {"id": "open", "tool": "web.navigate", "params": {"url": "https://www.linkedin.com/login"}},
                {"id": "dom", "tool": "web.get_dom", "params": {}, "depends_on": ["open"]},
                {"id": "fill", "tool": "form.autofill", "params": {"fields": ["email", "password"]}, "depends_on": ["dom"]},
                {"id": "submit", "tool": "web.click_selector", "params": {"selector": "button[type=submit]"}, "depends_on": ["fill"]}
              ]
            }
            """;
}
