package no.cantara.ksg.pattern;

import no.cantara.ksg.EmbeddingFunction;
import no.cantara.ksg.Embeddings;
import no.cantara.ksg.concept.DefaultPrototypes;
import no.cantara.ksg.concept.KnowledgeGraph;
import no.cantara.ksg.model.Concept;
import no.cantara.ksg.model.Edge;
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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Stores learned patterns and ranks them against a page fingerprint.
 *
 * <p>A pattern is a {@code Pattern} concept with {@code source="pattern-origin"} whose
 * {@code pattern_data} holds the fingerprint and detection results.
 */
public class PatternLibrary {

    private static final Logger log = LoggerFactory.getLogger(PatternLibrary.class);

    public static final String PATTERN_SOURCE = "pattern-origin";

    static final double DOMAIN_WEIGHT = 2.0;
    static final double TYPE_WEIGHT = 0.5;

    private final KnowledgeGraph graph;
    private final EmbeddingFunction embeddingFunction;

    public PatternLibrary(KnowledgeGraph graph, EmbeddingFunction embeddingFunction) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.embeddingFunction = embeddingFunction;
    }

    /**
     * Store a pattern. Without an explicit embedding, one is derived from the name and form type
     * when an embedding function is configured. The pattern inherits from the {@code FormPattern}
     * prototype when it exists.
     *
     * @return the new pattern's uuid
     */
    public String storePattern(String name, Map<String, Object> patternData, List<Double> embedding,
                               Provenance provenance) {
        Objects.requireNonNull(name, "name");
        Map<String, Object> data = new LinkedHashMap<>(patternData != null ? patternData : Map.of());

        Map<String, Object> props = new LinkedHashMap<>();
        props.put(ReservedKeys.NAME, name);
        props.put(ReservedKeys.SOURCE, PATTERN_SOURCE);
        props.put(ReservedKeys.PATTERN_DATA, data);
        if (data.get(ReservedKeys.FORM_TYPE) != null) {
            props.put(ReservedKeys.FORM_TYPE, data.get(ReservedKeys.FORM_TYPE));
        }
        Optional<Concept> prototype = graph.findPrototype(DefaultPrototypes.FORM_PATTERN);
        prototype.ifPresent(p -> props.put(ReservedKeys.PROTOTYPE_UUID, p.uuid()));

        List<Double> vector = embedding != null && !embedding.isEmpty() ? embedding
                : Embeddings.embedOrNull(embeddingFunction, name + " " + Objects.toString(data.get(ReservedKeys.FORM_TYPE), ""));
        Concept pattern = Concept.create(Kinds.PATTERN, List.of("pattern", name), props, vector);
        write(pattern.uuid(), graph.store().upsert(pattern, provenance));
        prototype.ifPresent(p -> write(pattern.uuid(), graph.store().upsert(
                Edge.create(pattern.uuid(), p.uuid(), Relations.INHERITS_FROM), provenance)));
        log.debug("Stored pattern '{}' ({})", name, pattern.uuid());
        return pattern.uuid();
    }

    /** Fingerprint the page and store a pattern named {@code <domain>:<formType>}. */
    public String storeFingerprintedPattern(String url, String html, String formType, List<?> fields,
                                            List<Double> embedding, Provenance provenance) {
        FormFingerprint fingerprint = Fingerprinter.fingerprint(url, html);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(ReservedKeys.FORM_TYPE, formType);
        data.put(ReservedKeys.FIELDS, fields != null ? fields : List.of());
        data.put(ReservedKeys.FINGERPRINT, fingerprint.toMap());
        data.put(ReservedKeys.URL, url);
        String name = (fingerprint.domain().isEmpty() ? "unknown" : fingerprint.domain()) + ":" + formType;
        return storePattern(name, data, embedding, provenance);
    }

    /** All stored patterns. */
    public List<Concept> patterns() {
        return graph.store().search("", GraphStore.UNBOUNDED,
                        Map.of(SearchFilters.prop(ReservedKeys.SOURCE), PATTERN_SOURCE)).stream()
                .map(SearchHit::concept)
                .filter(Objects::nonNull)
                .toList();
    }

    /**
     * Rank stored patterns against the page. Score is {@code 2 x domain match + 0.5 x form-type
     * match + jaccard(tokens)}; equal scores keep store order.
     */
    public List<PatternMatch> findBestPattern(String url, String html, String formType, int topK) {
        FormFingerprint query = Fingerprinter.fingerprint(url, html);
        List<PatternMatch> matches = new ArrayList<>();
        for (Concept pattern : patterns()) {
            Map<String, Object> data = pattern.mapProp(ReservedKeys.PATTERN_DATA);
            FormFingerprint candidate = FormFingerprint.fromMap(data.get(ReservedKeys.FINGERPRINT));
            boolean domainMatch = !query.domain().isEmpty() && query.domain().equals(candidate.domain());
            boolean typeMatch = formType != null && formType.equals(data.get(ReservedKeys.FORM_TYPE));
            double score = (domainMatch ? DOMAIN_WEIGHT : 0.0)
                    + (typeMatch ? TYPE_WEIGHT : 0.0)
                    + jaccard(query.tokens(), candidate.tokens());
            matches.add(new PatternMatch(score, pattern, data));
        }
        matches.sort(Comparator.comparingDouble(PatternMatch::score).reversed());
        return matches.size() > topK ? List.copyOf(matches.subList(0, Math.max(topK, 0))) : List.copyOf(matches);
    }

    /** {@code |a ∩ b| / |a ∪ b|}, 0 when both are empty. */
    static double jaccard(List<String> a, List<String> b) {
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        if (union.isEmpty()) return 0.0;
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(new HashSet<>(b));
        return (double) intersection.size() / union.size();
    }

    private static void write(String uuid, UpsertResult result) {
        if (!result.isSuccess()) {
            log.warn("Store write failed for pattern {}: {}", uuid, result.message());
        }
    }
}
