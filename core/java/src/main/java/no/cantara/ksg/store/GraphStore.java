package no.cantara.ksg.store;

import no.cantara.ksg.model.Concept;
import no.cantara.ksg.model.Edge;
import no.cantara.ksg.model.GraphEntity;
import no.cantara.ksg.model.Provenance;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The persistence contract the core depends on. Backends (graph database, vector database,
 * in-memory) implement the two operations; everything else is derived from them.
 *
 * <p>Implementations must not throw from {@link #upsert}: failures come back as an
 * {@link UpsertResult} with status {@code error}. Multiple calls are not atomic; a concept may be
 * written without its edges if a later call fails.
 *
 * <p>Concurrent read-modify-write of a concept's props (for example centroid bookkeeping) needs
 * last-writer-wins semantics or an external lock; the core does no optimistic concurrency control.
 */
public interface GraphStore {

    int UNBOUNDED = Integer.MAX_VALUE;

    /** Insert or replace a concept or edge by uuid. */
    UpsertResult upsert(GraphEntity entity, Provenance provenance);

    /**
     * Ranked search.
     *
     * @param queryText      free text, may be empty
     * @param topK           maximum number of hits
     * @param filters        exact-match filters, see {@link SearchFilters}; may be {@code null}
     * @param queryEmbedding when given, ranking must be similarity based; may be {@code null}
     */
    List<SearchHit> search(String queryText, int topK, Map<String, Object> filters, List<Double> queryEmbedding);

    // ── derived lookups ───────────────────────────────────────────────────────────

    default List<SearchHit> search(String queryText, int topK, Map<String, Object> filters) {
        return search(queryText, topK, filters, null);
    }

    default Optional<Concept> findConcept(String uuid) {
        if (uuid == null || uuid.isBlank()) return Optional.empty();
        return search("", 1, Map.of(SearchFilters.UUID, uuid)).stream()
                .map(SearchHit::concept)
                .filter(c -> c != null && uuid.equals(c.uuid()))
                .findFirst();
    }

    /** Outgoing edges of {@code fromNode} with the given rel, sorted by their {@code order} hint. */
    default List<Edge> edgesFrom(String fromNode, String rel) {
        return edges(Map.of(
                SearchFilters.ENTITY, SearchFilters.EDGE_ENTITY,
                SearchFilters.FROM_NODE, fromNode,
                SearchFilters.REL, rel));
    }

    default List<Edge> edgesTo(String toNode, String rel) {
        return edges(Map.of(
                SearchFilters.ENTITY, SearchFilters.EDGE_ENTITY,
                SearchFilters.TO_NODE, toNode,
                SearchFilters.REL, rel));
    }

    private List<Edge> edges(Map<String, Object> filters) {
        return search("", UNBOUNDED, filters).stream()
                .map(SearchHit::edge)
                .filter(e -> e != null)
                .sorted(Comparator.comparingInt(e -> e.order(Integer.MAX_VALUE)))
                .toList();
    }
}
