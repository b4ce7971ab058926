package no.cantara.ksg.concept;

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
import no.cantara.ksg.vector.Vectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Prototype/concept layer over a {@link GraphStore}: prototypes, instances, fuzzy associations,
 * first-class relationships and recursive construction of hierarchical objects.
 */
public class KnowledgeGraph {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeGraph.class);

    /**
     * A concept created by {@link #createConceptRecursive}, with the concepts promoted beneath it.
     *
     * @param uuid     the created concept
     * @param children promoted nested items, in the order they were found
     * @param skipped  locations of nested items that could not be promoted, e.g. {@code steps[2]}
     */
    public record ConstructedConcept(String uuid, List<ConstructedConcept> children, List<String> skipped) {
        public ConstructedConcept {
            children = List.copyOf(children);
            skipped = List.copyOf(skipped);
        }
    }

    /** Identifiers of a first-class relationship. */
    public record RelationshipRef(String relationshipUuid, String fromEdgeUuid, String toEdgeUuid, String relType) {}

    private final GraphStore store;
    private final EmbeddingFunction embeddingFunction;

    public KnowledgeGraph(GraphStore store, EmbeddingFunction embeddingFunction) {
        this.store = Objects.requireNonNull(store, "store");
        this.embeddingFunction = embeddingFunction;
    }

    public GraphStore store() {
        return store;
    }

    // ── prototypes and concepts ───────────────────────────────────────────────────

    /**
     * Create a prototype. When {@code basePrototypeUuid} is given an {@code inherits_from} edge
     * links the new prototype to it.
     */
    public String createPrototype(String name, String description, String context, List<String> labels,
                                  List<Double> embedding, Provenance provenance, String basePrototypeUuid) {
        Objects.requireNonNull(name, "name");
        Map<String, Object> props = new LinkedHashMap<>();
        props.put(ReservedKeys.NAME, name);
        props.put(ReservedKeys.DESCRIPTION, description);
        props.put("context", context);
        props.put("labels", labels != null ? labels : List.of());
        props.put("isPrototype", true);

        List<Double> vector = !Vectors.isEmpty(embedding) ? embedding
                : Embeddings.embedOrNull(embeddingFunction, name + " " + (description != null ? description : ""));
        Concept prototype = Concept.create(Kinds.PROTOTYPE, labels != null ? labels : List.of(name), props, vector);
        write(prototype, provenance);
        if (basePrototypeUuid != null) {
            write(Edge.create(prototype.uuid(), basePrototypeUuid, Relations.INHERITS_FROM), provenance);
        }
        log.debug("Created prototype '{}' ({})", name, prototype.uuid());
        return prototype.uuid();
    }

    /** Look up a prototype by its exact name. */
    public Optional<Concept> findPrototype(String name) {
        return store.search(name, GraphStore.UNBOUNDED, Map.of(
                        SearchFilters.KIND, Kinds.PROTOTYPE,
                        SearchFilters.prop(ReservedKeys.NAME), name)).stream()
                .map(SearchHit::concept)
                .filter(Objects::nonNull)
                .findFirst();
    }

    /**
     * Create a concept instantiating {@code prototypeUuid}. The concept's props carry
     * {@code prototype_uuid} and an {@code instantiates} edge is written; the prototype is not
     * modified.
     */
    public String createConcept(String prototypeUuid, Map<String, Object> props, List<Double> embedding,
                                Provenance provenance) {
        return createConcept(UUID.randomUUID().toString(), prototypeUuid, props, embedding, provenance);
    }

    private String createConcept(String uuid, String prototypeUuid, Map<String, Object> props,
                                 List<Double> embedding, Provenance provenance) {
        Objects.requireNonNull(prototypeUuid, "prototypeUuid");
        Map<String, Object> conceptProps = new LinkedHashMap<>(props != null ? props : Map.of());
        conceptProps.put(ReservedKeys.PROTOTYPE_UUID, prototypeUuid);

        List<String> labels = new ArrayList<>();
        Object name = conceptProps.get(ReservedKeys.NAME);
        if (name != null) labels.add(name.toString());
        List<Double> vector = !Vectors.isEmpty(embedding) ? embedding : null;

        Concept concept = new Concept(uuid, Kinds.CONCEPT, labels, conceptProps, vector, null);
        write(concept, provenance);
        write(Edge.create(uuid, prototypeUuid, Relations.INSTANTIATES), provenance);
        return uuid;
    }

    // ── associations and relationships ────────────────────────────────────────────

    /**
     * Add a fuzzy association. {@code strength} is clamped to [0,1].
     *
     * @return the edge uuid
     */
    public String addAssociation(String fromUuid, String toUuid, String rel, double strength,
                                 Map<String, Object> props, Provenance provenance) {
        Map<String, Object> edgeProps = new LinkedHashMap<>(props != null ? props : Map.of());
        edgeProps.put(ReservedKeys.STRENGTH, Math.max(0.0, Math.min(1.0, strength)));
        Edge edge = Edge.create(fromUuid, toUuid, rel, edgeProps);
        write(edge, provenance);
        return edge.uuid();
    }

    /**
     * Create a relationship as a concept in its own right, so it can carry properties and an
     * embedding and be searched. It is linked to its endpoints by {@code rel_from} and
     * {@code rel_to} edges.
     */
    public RelationshipRef createRelationship(String fromUuid, String toUuid, String relType,
                                              Map<String, Object> properties, List<Double> embedding,
                                              Provenance provenance) {
        Objects.requireNonNull(relType, "relType");
        Map<String, Object> props = new LinkedHashMap<>(properties != null ? properties : Map.of());
        props.put("rel_type", relType);
        props.put("from_uuid", fromUuid);
        props.put("to_uuid", toUuid);
        props.putIfAbsent(ReservedKeys.NAME, relType);

        List<Double> vector = !Vectors.isEmpty(embedding) ? embedding : Embeddings.embedOrNull(embeddingFunction, relType);
        Concept relationship = Concept.create(Kinds.RELATIONSHIP, List.of("relationship", relType), props, vector);
        write(relationship, provenance);

        Edge from = Edge.create(relationship.uuid(), fromUuid, Relations.REL_FROM);
        Edge to = Edge.create(relationship.uuid(), toUuid, Relations.REL_TO);
        write(from, provenance);
        write(to, provenance);
        return new RelationshipRef(relationship.uuid(), from.uuid(), to.uuid(), relType);
    }

    /**
     * Search first-class relationships, optionally restricted to one type. {@code minSimilarity}
     * only applies when the query could be embedded.
     */
    public List<SearchHit> searchRelationships(String query, String relType, int topK, double minSimilarity) {
        Map<String, Object> filters = new LinkedHashMap<>();
        filters.put(SearchFilters.KIND, Kinds.RELATIONSHIP);
        if (relType != null) {
            filters.put(SearchFilters.prop("rel_type"), relType);
        }
        List<Double> queryEmbedding = Embeddings.embedOrNull(embeddingFunction, query);
        List<SearchHit> hits = store.search(query, topK, filters, queryEmbedding);
        if (queryEmbedding == null) {
            return hits;
        }
        return hits.stream().filter(h -> h.score() >= minSimilarity).toList();
    }

    // ── recursive construction ────────────────────────────────────────────────────

    /**
     * Create a concept from a hierarchical object, promoting nested items found under the
     * {@link NestedItem#NESTING_KEYS} to their own concepts.
     *
     * <p>Promoted items are linked {@code has_child} (under {@code children}) or {@code has_step}
     * (elsewhere) with their {@code order}, and replaced in the parent's props by a reference
     * carrying {@code concept_uuid}. Items that stay inline are left untouched. A promoted item
     * without a usable name or prototype is skipped and kept inline.
     */
    public ConstructedConcept createConceptRecursive(String prototypeUuid, Map<String, Object> object,
                                                     List<Double> embedding, Provenance provenance) {
        Objects.requireNonNull(prototypeUuid, "prototypeUuid");
        Objects.requireNonNull(object, "object");
        return construct(prototypeUuid, object, embedding, provenance);
    }

    private ConstructedConcept construct(String prototypeUuid, Map<String, Object> object,
                                         List<Double> embedding, Provenance provenance) {
        String uuid = UUID.randomUUID().toString();
        Map<String, Object> props = new LinkedHashMap<>(object);
        List<ConstructedConcept> children = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        List<Edge> childEdges = new ArrayList<>();

        for (String key : NestedItem.NESTING_KEYS) {
            if (!(props.get(key) instanceof List<?> items)) {
                continue;
            }
            String rel = ReservedKeys.CHILDREN.equals(key) ? Relations.HAS_CHILD : Relations.HAS_STEP;
            List<Object> inline = new ArrayList<>();
            for (int i = 0; i < items.size(); i++) {
                Object raw = items.get(i);
                NestedItem item = NestedItem.classify(raw);
                if (item instanceof NestedItem.Malformed malformed) {
                    log.warn("Skipping {}[{}]: {}", key, i, malformed.reason());
                    skipped.add(key + "[" + i + "]");
                    inline.add(raw);
                    continue;
                }
                if (!NestedItem.promotes(key, item)) {
                    inline.add(raw);
                    continue;
                }
                Map<String, Object> data = dataOf(item);
                String name = item instanceof NestedItem.Atomic atomic && nameOf(data) == null
                        ? atomic.tool() : nameOf(data);
                String childPrototype = data.get(ReservedKeys.PROTOTYPE_UUID) instanceof String p && !p.isBlank()
                        ? p : prototypeUuid;
                if (name == null) {
                    log.warn("Skipping {}[{}]: no name or id to identify the nested concept", key, i);
                    skipped.add(key + "[" + i + "]");
                    inline.add(raw);
                    continue;
                }
                int order = data.get(ReservedKeys.ORDER) instanceof Number n ? n.intValue() : i;

                Map<String, Object> childObject = new LinkedHashMap<>(data);
                childObject.putIfAbsent(ReservedKeys.NAME, name);
                List<Double> childEmbedding = Vectors.fromObject(childObject.remove("embedding"));
                if (childEmbedding.isEmpty()) {
                    childEmbedding = Embeddings.embedOrNull(embeddingFunction, embeddingText(childObject));
                }
                ConstructedConcept child = construct(childPrototype, childObject, childEmbedding, provenance);
                children.add(child);
                childEdges.add(Edge.create(uuid, child.uuid(), rel, Map.of(ReservedKeys.ORDER, order)));
                inline.add(reference(item, data, name, order, child.uuid()));
            }
            props.put(key, inline);
        }

        createConcept(uuid, prototypeUuid, props, embedding, provenance);
        for (Edge edge : childEdges) {
            write(edge, provenance);
        }
        return new ConstructedConcept(uuid, children, skipped);
    }

    private static Map<String, Object> dataOf(NestedItem item) {
        if (item instanceof NestedItem.Atomic atomic) return atomic.data();
        if (item instanceof NestedItem.Composite composite) return composite.data();
        throw new IllegalStateException("No data for " + item);
    }

    /** The inline stand-in for a promoted item; the executor follows {@code concept_uuid}. */
    private static Map<String, Object> reference(NestedItem item, Map<String, Object> data, String name,
                                                 int order, String conceptUuid) {
        Map<String, Object> ref = new LinkedHashMap<>();
        ref.put(ReservedKeys.ID, data.get(ReservedKeys.ID) != null ? data.get(ReservedKeys.ID).toString() : name);
        ref.put(ReservedKeys.NAME, name);
        ref.put(ReservedKeys.ORDER, order);
        ref.put(ReservedKeys.CONCEPT_UUID, conceptUuid);
        for (String key : List.of(ReservedKeys.DEPENDS_ON, ReservedKeys.GUARD)) {
            if (data.containsKey(key)) ref.put(key, data.get(key));
        }
        if (item instanceof NestedItem.Atomic atomic) {
            ref.put(ReservedKeys.TOOL, atomic.tool());
            ref.put(ReservedKeys.PARAMS, data.getOrDefault(ReservedKeys.PARAMS, Map.of()));
        }
        return ref;
    }

    private static String nameOf(Map<String, Object> data) {
        for (String key : List.of(ReservedKeys.NAME, ReservedKeys.TITLE, ReservedKeys.ID)) {
            Object v = data.get(key);
            if (v != null && !v.toString().isBlank()) return v.toString();
        }
        return null;
    }

    private static String embeddingText(Map<String, Object> data) {
        Object description = data.get(ReservedKeys.DESCRIPTION);
        return data.get(ReservedKeys.NAME) + (description != null ? " " + description : "");
    }

    private void write(GraphEntity entity, Provenance provenance) {
        UpsertResult result = store.upsert(entity, provenance);
        if (!result.isSuccess()) {
            log.warn("Store write failed for {}: {}", entity.uuid(), result.message());
        }
    }
}
