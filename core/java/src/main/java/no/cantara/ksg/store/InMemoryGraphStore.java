package no.cantara.ksg.store;

import no.cantara.ksg.model.Concept;
import no.cantara.ksg.model.Edge;
import no.cantara.ksg.model.GraphEntity;
import no.cantara.ksg.model.Provenance;
import no.cantara.ksg.vector.Vectors;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reference {@link GraphStore} held entirely in memory. Used by the CLI and tests, and as the
 * behavioural baseline for real backends.
 *
 * <p>Ranking: cosine similarity when a query embedding is given; otherwise the share of query
 * tokens found in a concept's name, labels and description. Candidates with no overlap are still
 * returned (after the ones that do overlap) so text-only callers see every filtered match.
 */
public class InMemoryGraphStore implements GraphStore {

    /** One recorded write, kept for audit. */
    public record WriteRecord(String uuid, Provenance provenance) {}

    private final Map<String, Concept> concepts = new LinkedHashMap<>();
    private final Map<String, Edge> edges = new LinkedHashMap<>();
    private final List<WriteRecord> writes = new ArrayList<>();

    @Override
    public synchronized UpsertResult upsert(GraphEntity entity, Provenance provenance) {
        if (entity == null) {
            return UpsertResult.error(null, "entity is required");
        }
        if (entity instanceof Concept c) {
            concepts.put(c.uuid(), c);
        } else if (entity instanceof Edge e) {
            edges.put(e.uuid(), e);
        }
        writes.add(new WriteRecord(entity.uuid(), provenance));
        return UpsertResult.success(entity.uuid());
    }

    @Override
    public synchronized List<SearchHit> search(String queryText, int topK, Map<String, Object> filters,
                                               List<Double> queryEmbedding) {
        if (topK <= 0) return List.of();
        Map<String, Object> f = filters != null ? filters : Map.of();
        boolean edgeSearch = SearchFilters.EDGE_ENTITY.equals(f.get(SearchFilters.ENTITY));

        List<SearchHit> hits = new ArrayList<>();
        if (edgeSearch) {
            for (Edge e : edges.values()) {
                if (matches(e, f)) hits.add(new SearchHit(e, 1.0));
            }
        } else {
            Set<String> queryTokens = tokens(queryText);
            for (Concept c : concepts.values()) {
                if (!matches(c, f)) continue;
                double score = !Vectors.isEmpty(queryEmbedding)
                        ? Vectors.cosine(queryEmbedding, c.embedding())
                        : textScore(queryTokens, c);
                hits.add(new SearchHit(c, score));
            }
            hits.sort(Comparator.comparingDouble(SearchHit::score).reversed());
        }
        return hits.size() > topK ? List.copyOf(hits.subList(0, topK)) : List.copyOf(hits);
    }

    // ── inspection (tests, CLI) ───────────────────────────────────────────────────

    public synchronized Collection<Concept> concepts() {
        return List.copyOf(concepts.values());
    }

    public synchronized Collection<Edge> edges() {
        return List.copyOf(edges.values());
    }

    public synchronized List<WriteRecord> writes() {
        return List.copyOf(writes);
    }

    // ── helpers ───────────────────────────────────────────────────────────────────

    private static boolean matches(Concept c, Map<String, Object> filters) {
        for (Map.Entry<String, Object> f : filters.entrySet()) {
            String key = f.getKey();
            Object expected = f.getValue();
            Object actual;
            switch (key) {
                case SearchFilters.ENTITY -> {
                    if (!SearchFilters.CONCEPT_ENTITY.equals(expected)) return false;
                    continue;
                }
                case SearchFilters.UUID -> actual = c.uuid();
                case SearchFilters.KIND -> actual = c.kind();
                case SearchFilters.STATUS -> actual = c.status();
                default -> {
                    if (!key.startsWith(SearchFilters.PROPS_PREFIX)) return false;
                    actual = c.props().get(key.substring(SearchFilters.PROPS_PREFIX.length()));
                }
            }
            if (!Objects.equals(expected, actual)) return false;
        }
        return true;
    }

    private static boolean matches(Edge e, Map<String, Object> filters) {
        for (Map.Entry<String, Object> f : filters.entrySet()) {
            String key = f.getKey();
            Object actual;
            switch (key) {
                case SearchFilters.ENTITY -> {
                    continue;
                }
                case SearchFilters.UUID -> actual = e.uuid();
                case SearchFilters.REL -> actual = e.rel();
                case SearchFilters.FROM_NODE -> actual = e.fromNode();
                case SearchFilters.TO_NODE -> actual = e.toNode();
                default -> {
                    if (!key.startsWith(SearchFilters.PROPS_PREFIX)) return false;
                    actual = e.props().get(key.substring(SearchFilters.PROPS_PREFIX.length()));
                }
            }
            if (!Objects.equals(f.getValue(), actual)) return false;
        }
        return true;
    }

    private static double textScore(Set<String> queryTokens, Concept c) {
        if (queryTokens.isEmpty()) return 0.0;
        StringBuilder text = new StringBuilder();
        text.append(c.name() != null ? c.name() : "").append(' ');
        c.labels().forEach(l -> text.append(l).append(' '));
        if (c.description() != null) text.append(c.description());
        Set<String> conceptTokens = tokens(text.toString());
        long found = queryTokens.stream().filter(conceptTokens::contains).count();
        return (double) found / queryTokens.size();
    }

    private static Set<String> tokens(String text) {
        Set<String> out = new HashSet<>();
        if (text == null) return out;
        for (String t : text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }
}
