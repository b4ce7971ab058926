package no.cantara.ksg.concept;

import no.cantara.ksg.model.Concept;
import no.cantara.ksg.model.Provenance;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** The prototypes every knowledge graph starts with. Seeding is idempotent. */
public final class DefaultPrototypes {

    public static final String PERSON = "Person";
    public static final String EVENT = "Event";
    public static final String PROCEDURE = "Procedure";
    public static final String DAG = "DAG";
    public static final String FORM_PATTERN = "FormPattern";

    private record Seed(String name, String description, String context, List<String> labels) {}

    private static final List<Seed> SEEDS = List.of(
            new Seed(PERSON, "A human individual", "people", List.of("person", "human")),
            new Seed(EVENT, "Something that happens at a point in time", "time", List.of("event")),
            new Seed(PROCEDURE, "A reusable sequence of tool invocations", "procedures", List.of("procedure", "workflow")),
            new Seed(DAG, "A procedure whose steps form a dependency graph", "procedures", List.of("dag", "procedure")),
            new Seed(FORM_PATTERN, "A learned web form layout and how to fill it", "patterns", List.of("pattern", "form"))
    );

    private DefaultPrototypes() {}

    /**
     * Create any default prototype that does not exist yet.
     *
     * @return prototype uuid by name
     */
    public static Map<String, String> ensure(KnowledgeGraph graph, Provenance provenance) {
        Map<String, String> uuids = new LinkedHashMap<>();
        for (Seed seed : SEEDS) {
            Optional<Concept> existing = graph.findPrototype(seed.name());
            String uuid = existing.map(Concept::uuid).orElseGet(() -> graph.createPrototype(
                    seed.name(), seed.description(), seed.context(), seed.labels(), null, provenance, null));
            uuids.put(seed.name(), uuid);
        }
        return uuids;
    }
}
