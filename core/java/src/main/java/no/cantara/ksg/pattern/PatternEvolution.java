package no.cantara.ksg.pattern;

import no.cantara.ksg.EmbeddingFunction;
import no.cantara.ksg.Embeddings;
import no.cantara.ksg.ReasoningFunction;
import no.cantara.ksg.concept.KnowledgeGraph;
import no.cantara.ksg.config.KsgConfig;
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
import no.cantara.ksg.vector.Vectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Finds similar patterns, adapts a pattern to a new page, records successes and merges
 * recurring successful patterns into a generalized parent.
 */
public class PatternEvolution {

    private static final Logger log = LoggerFactory.getLogger(PatternEvolution.class);

    public static final String GENERALIZED = "generalized";

    private static final Set<String> STOPWORDS = Set.of(
            "a", "an", "and", "the", "of", "for", "to", "in", "on", "with", "at", "by", "from", "or",
            "pattern", "patterns", "page", "www", "com");

    public record SimilarPattern(Concept concept, double similarity) {}

    public enum TransferMode {
        /** Name-based field mapping, no reasoning function configured. */
        HEURISTIC,
        /** Mapping supplied by the reasoning function. */
        REASONED,
        /** The reasoning function failed or replied with something unusable; heuristic mapping used. */
        DEGRADED,
        /** Source pattern not found. */
        FAILED
    }

    /**
     * @param newPatternUuid set when the adapted pattern was stored
     * @param error          set when {@code mode} is {@code FAILED}
     */
    public record TransferResult(TransferMode mode, Map<String, Object> adaptedPattern, Map<String, String> fieldMapping,
                                 double confidence, String newPatternUuid, String error) {

        static TransferResult failed(String error) {
            return new TransferResult(TransferMode.FAILED, null, Map.of(), 0.0, null, error);
        }

        public boolean persisted() {
            return newPatternUuid != null;
        }
    }

    public record SuccessRecord(int successCount, String lastSuccessAt, String error) {}

    public record GeneralizationResult(String generalizedUuid, String name, String description,
                                       List<String> exemplarUuids) {
        public GeneralizationResult {
            exemplarUuids = List.copyOf(exemplarUuids);
        }

        public int exemplarCount() {
            return exemplarUuids.size();
        }
    }

    private final KnowledgeGraph graph;
    private final PatternLibrary library;
    private final EmbeddingFunction embeddingFunction;
    private final KsgConfig config;
    private final FieldMapper fieldMapper;

    public PatternEvolution(KnowledgeGraph graph, PatternLibrary library, EmbeddingFunction embeddingFunction,
                            KsgConfig config) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.library = Objects.requireNonNull(library, "library");
        this.embeddingFunction = embeddingFunction;
        this.config = Objects.requireNonNull(config, "config");
        this.fieldMapper = new FieldMapper(config.transfer().minFieldScore());
    }

    private GraphStore store() {
        return graph.store();
    }

    // ── similarity search ─────────────────────────────────────────────────────────

    public List<SimilarPattern> findSimilarPatterns(String query) {
        return findSimilarPatterns(query, null, config.patterns().topK(), config.patterns().minSimilarity(), List.of());
    }

    /**
     * Patterns similar to {@code query}. Without an embedding on either side a candidate is given
     * the configured default similarity, so text-only stores remain usable.
     *
     * @param patternType only patterns with this form type, or {@code null} for all
     * @param exclude     uuids to leave out
     */
    public List<SimilarPattern> findSimilarPatterns(String query, String patternType, int topK, double minSimilarity,
                                                    List<String> exclude) {
        List<Double> queryEmbedding = Embeddings.embedOrNull(embeddingFunction, query);
        Set<String> excluded = new LinkedHashSet<>(exclude != null ? exclude : List.of());
        List<SimilarPattern> similar = new ArrayList<>();
        for (SearchHit hit : store().search(query, GraphStore.UNBOUNDED,
                Map.of(SearchFilters.prop(ReservedKeys.SOURCE), PatternLibrary.PATTERN_SOURCE), queryEmbedding)) {
            Concept pattern = hit.concept();
            if (pattern == null || excluded.contains(pattern.uuid())) continue;
            if (patternType != null && !patternType.equals(formType(pattern))) continue;
            double similarity = similarity(queryEmbedding, pattern.embedding());
            if (similarity >= minSimilarity) {
                similar.add(new SimilarPattern(pattern, similarity));
            }
        }
        similar.sort(Comparator.comparingDouble(SimilarPattern::similarity).reversed());
        return similar.size() > topK ? List.copyOf(similar.subList(0, Math.max(topK, 0))) : List.copyOf(similar);
    }

    private double similarity(List<Double> a, List<Double> b) {
        if (Vectors.isEmpty(a) || Vectors.isEmpty(b)) {
            return config.patterns().defaultSimilarity();
        }
        return Vectors.cosine(a, b);
    }

    // ── transfer ──────────────────────────────────────────────────────────────────

    /**
     * Adapt a stored pattern to a new context. {@code targetContext} may carry {@code fields},
     * {@code url} and {@code name}. The adapted pattern is stored, and linked from its source by a
     * {@code transferred_to} edge, when the confidence reaches the configured threshold.
     *
     * @param reasoning optional; when absent or when its reply cannot be used, fields are mapped
     *                  by name
     */
    public TransferResult transferPattern(String sourceUuid, Map<String, Object> targetContext,
                                          ReasoningFunction reasoning, Provenance provenance) {
        Optional<Concept> found = store().findConcept(sourceUuid);
        if (found.isEmpty()) {
            return TransferResult.failed("Source pattern not found: " + sourceUuid);
        }
        Concept source = found.get();
        Map<String, Object> context = targetContext != null ? targetContext : Map.of();
        Map<String, Object> sourceData = source.mapProp(ReservedKeys.PATTERN_DATA);
        List<String> sourceFields = fieldNames(sourceData.get(ReservedKeys.SELECTORS) instanceof Map<?, ?> selectors
                ? new ArrayList<>(selectors.keySet()) : sourceData.get(ReservedKeys.FIELDS));
        List<String> targetFields = fieldNames(context.get(ReservedKeys.FIELDS));

        TransferMode mode;
        Map<String, String> mapping;
        double confidence;
        if (reasoning == null) {
            FieldMapper.FieldMapping heuristic = fieldMapper.map(sourceFields, targetFields);
            mode = TransferMode.HEURISTIC;
            mapping = heuristic.mapping();
            confidence = heuristic.confidence();
        } else {
            Optional<Map<String, Object>> reply = askForMapping(reasoning, source, sourceFields, targetFields);
            Map<String, String> reasoned = reply.map(r -> stringMap(r.get("field_mapping"))).orElse(null);
            if (reasoned != null) {
                mode = TransferMode.REASONED;
                mapping = reasoned;
                confidence = reply.get().get(ReservedKeys.CONFIDENCE) instanceof Number n
                        ? Math.max(0.0, Math.min(1.0, n.doubleValue()))
                        : config.transfer().fallbackConfidence();
            } else {
                log.warn("Reasoning reply for transfer of {} unusable; falling back to name matching", sourceUuid);
                mode = TransferMode.DEGRADED;
                mapping = fieldMapper.map(sourceFields, targetFields).mapping();
                confidence = config.transfer().fallbackConfidence();
            }
        }

        Map<String, Object> adapted = adapt(sourceData, mapping, context, sourceUuid, confidence);
        String newUuid = null;
        if (confidence >= config.transfer().persistConfidence()) {
            String name = Objects.toString(context.get(ReservedKeys.NAME), source.name() + " (transferred)");
            newUuid = library.storePattern(name, adapted, null, provenance);
            Map<String, Object> edgeProps = new LinkedHashMap<>();
            edgeProps.put("field_mapping", mapping);
            edgeProps.put(ReservedKeys.CONFIDENCE, confidence);
            graph.addAssociation(sourceUuid, newUuid, Relations.TRANSFERRED_TO, confidence, edgeProps, provenance);
            log.info("Transferred pattern {} to {} ({}, confidence {})", sourceUuid, newUuid, mode, confidence);
        } else {
            log.debug("Transfer of {} not stored: confidence {} below {}", sourceUuid, confidence,
                    config.transfer().persistConfidence());
        }
        return new TransferResult(mode, adapted, mapping, confidence, newUuid, null);
    }

    private Optional<Map<String, Object>> askForMapping(ReasoningFunction reasoning, Concept source,
                                                        List<String> sourceFields, List<String> targetFields) {
        String prompt = "Map the fields of a new form to the fields of a known form.\n"
                + "Known form: " + source.name() + "\n"
                + "Known fields: " + sourceFields + "\n"
                + "New fields: " + targetFields + "\n"
                + "Reply with JSON: {\"field_mapping\": {\"<new field>\": \"<known field>\"}, "
                + "\"confidence\": <0..1>, \"reasoning\": \"...\"}";
        try {
            return ReasoningReply.parse(reasoning.reason(prompt));
        } catch (RuntimeException e) {
            log.warn("Reasoning function failed: {}", e.toString());
            return Optional.empty();
        }
    }

    /** Source pattern data with selectors, steps and URL rewritten for the target fields. */
    @SuppressWarnings("unchecked")
    static Map<String, Object> adapt(Map<String, Object> sourceData, Map<String, String> mapping,
                                     Map<String, Object> context, String sourceUuid, double confidence) {
        Map<String, Object> adapted = new LinkedHashMap<>(sourceData);
        adapted.remove(ReservedKeys.SUCCESS_COUNT);
        adapted.remove(ReservedKeys.LAST_SUCCESS_AT);

        if (sourceData.get(ReservedKeys.SELECTORS) instanceof Map<?, ?> selectors) {
            Map<String, Object> adaptedSelectors = new LinkedHashMap<>();
            mapping.forEach((target, src) -> {
                Object selector = selectors.get(src);
                if (selector != null) {
                    adaptedSelectors.put(target, substitute(selector.toString(), src, target));
                }
            });
            adapted.put(ReservedKeys.SELECTORS, adaptedSelectors);
        }
        if (sourceData.get(ReservedKeys.STEPS) instanceof List<?> steps) {
            List<Object> adaptedSteps = new ArrayList<>();
            for (Object step : steps) {
                adaptedSteps.add(step instanceof Map<?, ?> m ? substituteAll((Map<String, Object>) m, mapping) : step);
            }
            adapted.put(ReservedKeys.STEPS, adaptedSteps);
        }
        if (context.get(ReservedKeys.URL) != null) {
            adapted.put(ReservedKeys.URL, context.get(ReservedKeys.URL).toString());
        }
        if (context.get(ReservedKeys.FIELDS) != null) {
            adapted.put(ReservedKeys.FIELDS, context.get(ReservedKeys.FIELDS));
        }
        adapted.put("transferred_from", sourceUuid);
        adapted.put("field_mapping", new LinkedHashMap<>(mapping));
        adapted.put(ReservedKeys.CONFIDENCE, confidence);
        return adapted;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> substituteAll(Map<String, Object> template, Map<String, String> mapping) {
        Map<String, Object> out = new LinkedHashMap<>();
        template.forEach((key, value) -> {
            if (value instanceof String s) {
                String replaced = s;
                for (Map.Entry<String, String> e : mapping.entrySet()) {
                    replaced = substitute(replaced, e.getValue(), e.getKey());
                }
                out.put(key, replaced);
            } else if (value instanceof Map<?, ?> nested) {
                out.put(key, substituteAll((Map<String, Object>) nested, mapping));
            } else {
                out.put(key, value);
            }
        });
        return out;
    }

    private static String substitute(String template, String sourceField, String targetField) {
        return sourceField.equals(targetField) ? template : template.replace(sourceField, targetField);
    }

    // ── success recording ─────────────────────────────────────────────────────────

    public SuccessRecord recordPatternSuccess(String patternUuid, Map<String, Object> context, Provenance provenance) {
        Optional<Concept> found = store().findConcept(patternUuid);
        if (found.isEmpty()) {
            return new SuccessRecord(0, null, "Pattern not found: " + patternUuid);
        }
        Concept pattern = found.get();
        int count = successCount(pattern) + 1;
        String now = Instant.now().toString();

        Map<String, Object> props = pattern.mutableProps();
        props.put(ReservedKeys.SUCCESS_COUNT, count);
        props.put(ReservedKeys.LAST_SUCCESS_AT, now);
        if (context != null && !context.isEmpty()) {
            props.put("last_success_context", new LinkedHashMap<>(context));
        }
        if (props.get(ReservedKeys.PATTERN_DATA) instanceof Map) {
            Map<String, Object> updated = new LinkedHashMap<>(pattern.mapProp(ReservedKeys.PATTERN_DATA));
            updated.put(ReservedKeys.SUCCESS_COUNT, count);
            props.put(ReservedKeys.PATTERN_DATA, updated);
        }
        UpsertResult result = store().upsert(pattern.withProps(props), provenance);
        if (!result.isSuccess()) {
            log.warn("Success for {} not stored: {}", patternUuid, result.message());
            return new SuccessRecord(count - 1, null, result.message());
        }
        return new SuccessRecord(count, now, null);
    }

    static int successCount(Concept concept) {
        return concept.props().get(ReservedKeys.SUCCESS_COUNT) instanceof Number n ? n.intValue() : 0;
    }

    // ── generalization ────────────────────────────────────────────────────────────

    public Optional<GeneralizationResult> autoGeneralize(String patternUuid, ReasoningFunction reasoning,
                                                         Provenance provenance) {
        return autoGeneralize(patternUuid, config.generalization().minSimilar(),
                config.generalization().minSimilarity(), reasoning, provenance);
    }

    /**
     * Merge {@code patternUuid} and its similar, successful peers into a generalized parent.
     * Returns empty, creating nothing, when the pattern is itself generalized or already has a
     * generalized parent, or when fewer than {@code minSimilar - 1} qualifying peers exist.
     */
    public Optional<GeneralizationResult> autoGeneralize(String patternUuid, int minSimilar, double minSimilarity,
                                                         ReasoningFunction reasoning, Provenance provenance) {
        Optional<Concept> found = store().findConcept(patternUuid);
        if (found.isEmpty()) {
            log.debug("Cannot generalize {}: not found", patternUuid);
            return Optional.empty();
        }
        Concept trigger = found.get();
        if (isGeneralized(trigger)) {
            log.debug("{} is already generalized", patternUuid);
            return Optional.empty();
        }

        List<Concept> peers = new ArrayList<>();
        for (Concept candidate : library.patterns()) {
            if (candidate.uuid().equals(patternUuid) || isGeneralized(candidate)) continue;
            if (successCount(candidate) <= 0) continue;
            if (similarity(trigger.embedding(), candidate.embedding()) >= minSimilarity) {
                peers.add(candidate);
            }
        }
        if (peers.size() < minSimilar - 1) {
            log.debug("Not generalizing {}: {} similar successful peers, need {}", patternUuid, peers.size(), minSimilar - 1);
            return Optional.empty();
        }

        List<Concept> exemplars = new ArrayList<>();
        exemplars.add(trigger);
        exemplars.addAll(peers);
        List<String> names = exemplars.stream().map(Concept::name).filter(Objects::nonNull).toList();

        String[] naming = nameGeneralization(names, reasoning);
        List<Double> sum = List.of();
        int counted = 0;
        for (Concept c : exemplars) {
            if (!c.hasEmbedding() || (!sum.isEmpty() && sum.size() != c.embedding().size())) continue;
            sum = Vectors.add(sum, c.embedding());
            counted++;
        }
        List<Double> mean = counted == 0 ? null : Vectors.scale(sum, 1.0 / counted);

        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("common_selectors", commonSelectors(exemplars, config.generalization().commonRatio()));
        extra.put("common_steps", commonSteps(exemplars, config.generalization().commonRatio()));
        String formType = formType(trigger);
        if (formType != null && exemplars.stream().allMatch(c -> formType.equals(formType(c)))) {
            extra.put(ReservedKeys.FORM_TYPE, formType);
        }
        if (mean != null) {
            extra.put(ReservedKeys.EMBEDDING_SUM, sum);
            extra.put(ReservedKeys.EXEMPLAR_COUNT, counted);
        }

        List<String> exemplarUuids = exemplars.stream().map(Concept::uuid).toList();
        String parent = generalizeConcepts(exemplarUuids, naming[0], naming[1], mean, null, extra, provenance);
        log.info("Generalized {} patterns into '{}' ({})", exemplarUuids.size(), naming[0], parent);
        return Optional.of(new GeneralizationResult(parent, naming[0], naming[1], exemplarUuids));
    }

    /**
     * Create a generalized parent over the exemplars: {@code has_exemplar} edges parent to each
     * exemplar carrying {@code order}, and {@code generalized_by} edges back.
     *
     * @param prototypeUuid optional prototype the parent instantiates
     * @param extraProps    additional props for the parent, may be {@code null}
     * @return the parent's uuid
     */
    public String generalizeConcepts(List<String> exemplarUuids, String name, String description,
                                     List<Double> embedding, String prototypeUuid, Map<String, Object> extraProps,
                                     Provenance provenance) {
        Objects.requireNonNull(exemplarUuids, "exemplarUuids");
        Map<String, Object> props = new LinkedHashMap<>();
        props.put(ReservedKeys.NAME, name);
        props.put(ReservedKeys.DESCRIPTION, description);
        props.put(ReservedKeys.TYPE, GENERALIZED);
        props.put("exemplar_count", exemplarUuids.size());
        if (extraProps != null) props.putAll(extraProps);
        if (prototypeUuid != null) props.put(ReservedKeys.PROTOTYPE_UUID, prototypeUuid);

        Concept parent = Concept.create(Kinds.CONCEPT, List.of(GENERALIZED, Objects.toString(name, GENERALIZED)),
                props, embedding != null && !embedding.isEmpty() ? embedding : null);
        write(parent.uuid(), store().upsert(parent, provenance));
        if (prototypeUuid != null) {
            write(parent.uuid(), store().upsert(Edge.create(parent.uuid(), prototypeUuid, Relations.INSTANTIATES), provenance));
        }
        for (int i = 0; i < exemplarUuids.size(); i++) {
            String exemplar = exemplarUuids.get(i);
            write(exemplar, store().upsert(Edge.create(parent.uuid(), exemplar, Relations.HAS_EXEMPLAR,
                    Map.of(ReservedKeys.ORDER, i)), provenance));
            write(exemplar, store().upsert(Edge.create(exemplar, parent.uuid(), Relations.GENERALIZED_BY,
                    Map.of("generalized_name", Objects.toString(name, ""))), provenance));
        }
        return parent.uuid();
    }

    /** The best generalized concept for {@code query}, if any exists. */
    public Optional<SimilarPattern> findGeneralizedPattern(String query) {
        List<Double> queryEmbedding = Embeddings.embedOrNull(embeddingFunction, query);
        return store().search(query, 1, Map.of(SearchFilters.prop(ReservedKeys.TYPE), GENERALIZED), queryEmbedding)
                .stream()
                .filter(hit -> hit.concept() != null)
                .map(hit -> new SimilarPattern(hit.concept(), hit.score()))
                .findFirst();
    }

    private boolean isGeneralized(Concept concept) {
        return GENERALIZED.equals(concept.props().get(ReservedKeys.TYPE))
                || !store().edgesFrom(concept.uuid(), Relations.GENERALIZED_BY).isEmpty();
    }

    private String[] nameGeneralization(List<String> names, ReasoningFunction reasoning) {
        if (reasoning != null) {
            String prompt = "These patterns were all used successfully: " + names + "\n"
                    + "Name the general pattern they share. Reply with JSON: "
                    + "{\"name\": \"...\", \"description\": \"...\"}";
            try {
                Optional<Map<String, Object>> reply = ReasoningReply.parse(reasoning.reason(prompt));
                if (reply.isPresent() && reply.get().get(ReservedKeys.NAME) instanceof String n && !n.isBlank()) {
                    Object d = reply.get().get(ReservedKeys.DESCRIPTION);
                    return new String[]{n, d != null ? d.toString() : defaultDescription(names)};
                }
                log.warn("Reasoning reply for generalization naming unusable; deriving name from exemplars");
            } catch (RuntimeException e) {
                log.warn("Reasoning function failed: {}", e.toString());
            }
        }
        String common = extractCommonPattern(names);
        return new String[]{common.isEmpty() ? "Generalized Pattern" : "Generalized " + common, defaultDescription(names)};
    }

    private static String defaultDescription(List<String> names) {
        return "Generalized from " + names.size() + " patterns: " + String.join(", ", names);
    }

    /** Words shared by every name, minus stopwords, capitalized in first-name order. */
    static String extractCommonPattern(List<String> names) {
        if (names.isEmpty()) return "";
        Set<String> common = null;
        for (String name : names) {
            Set<String> words = new LinkedHashSet<>(words(name));
            if (common == null) {
                common = words;
            } else {
                common.retainAll(words);
            }
        }
        List<String> out = new ArrayList<>();
        for (String word : common) {
            if (STOPWORDS.contains(word)) continue;
            out.add(Character.toUpperCase(word.charAt(0)) + word.substring(1));
        }
        return String.join(" ", out);
    }

    private static List<String> words(String text) {
        List<String> out = new ArrayList<>();
        for (String t : text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }

    /** Selector keys present in at least {@code ratio} of the exemplars, with their first value. */
    static Map<String, Object> commonSelectors(List<Concept> exemplars, double ratio) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        Map<String, Object> firstValue = new LinkedHashMap<>();
        for (Concept c : exemplars) {
            if (c.mapProp(ReservedKeys.PATTERN_DATA).get(ReservedKeys.SELECTORS) instanceof Map<?, ?> selectors) {
                selectors.forEach((k, v) -> {
                    counts.merge(k.toString(), 1, Integer::sum);
                    firstValue.putIfAbsent(k.toString(), v);
                });
            }
        }
        Map<String, Object> common = new LinkedHashMap<>();
        counts.forEach((key, n) -> {
            if (n >= ratio * exemplars.size()) common.put(key, firstValue.get(key));
        });
        return common;
    }

    /** Steps (compared by value) present in at least {@code ratio} of the exemplars, in first-seen order. */
    static List<Object> commonSteps(List<Concept> exemplars, double ratio) {
        Map<Object, Integer> counts = new LinkedHashMap<>();
        for (Concept c : exemplars) {
            if (c.mapProp(ReservedKeys.PATTERN_DATA).get(ReservedKeys.STEPS) instanceof List<?> steps) {
                new LinkedHashSet<Object>(steps).forEach(s -> counts.merge(s, 1, Integer::sum));
            }
        }
        List<Object> common = new ArrayList<>();
        counts.forEach((step, n) -> {
            if (n >= ratio * exemplars.size()) common.add(step);
        });
        return common;
    }

    // ── helpers ───────────────────────────────────────────────────────────────────

    private static String formType(Concept pattern) {
        Object direct = pattern.props().get(ReservedKeys.FORM_TYPE);
        if (direct != null) return direct.toString();
        Object nested = pattern.mapProp(ReservedKeys.PATTERN_DATA).get(ReservedKeys.FORM_TYPE);
        return nested != null ? nested.toString() : null;
    }

    /** Field names from a list of strings or of maps carrying {@code name}, {@code id} or {@code type}. */
    static List<String> fieldNames(Object value) {
        if (!(value instanceof List<?> list)) return List.of();
        List<String> names = new ArrayList<>();
        for (Object item : list) {
            if (item instanceof Map<?, ?> m) {
                Object name = m.get("name") != null ? m.get("name") : m.get("id") != null ? m.get("id") : m.get("type");
                if (name != null) names.add(name.toString());
            } else if (item != null) {
                names.add(item.toString());
            }
        }
        return names;
    }

    private static Map<String, String> stringMap(Object value) {
        if (!(value instanceof Map<?, ?> m)) return null;
        Map<String, String> out = new LinkedHashMap<>();
        m.forEach((k, v) -> {
            if (k != null && v != null) out.put(k.toString(), v.toString());
        });
        return out;
    }

    private static void write(String uuid, UpsertResult result) {
        if (!result.isSuccess()) {
            log.warn("Store write failed for {}: {}", uuid, result.message());
        }
    }
}
