package no.cantara.ksg.pattern;

import no.cantara.ksg.EmbeddingFunction;
import no.cantara.ksg.ReasoningFunction;
import no.cantara.ksg.concept.KnowledgeGraph;
import no.cantara.ksg.config.KsgConfig;
import no.cantara.ksg.model.Concept;
import no.cantara.ksg.model.Edge;
import no.cantara.ksg.model.Relations;
import no.cantara.ksg.model.ReservedKeys;
import no.cantara.ksg.store.InMemoryGraphStore;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static no.cantara.ksg.TestSupport.PROV;
import static org.junit.jupiter.api.Assertions.*;

class PatternEvolutionTest {

    private static final List<Double> LOGIN = List.of(1.0, 0.0, 0.0);
    private static final List<Double> CHECKOUT = List.of(0.0, 0.0, 1.0);

    /** "login" queries point along the first axis, everything else along the third. */
    private static final EmbeddingFunction AXES = text -> text.toLowerCase().contains("login") ? LOGIN : CHECKOUT;

    private final InMemoryGraphStore store = new InMemoryGraphStore();
    private final KnowledgeGraph graph = new KnowledgeGraph(store, AXES);
    private final PatternLibrary library = new PatternLibrary(graph, AXES);
    private final PatternEvolution evolution = new PatternEvolution(graph, library, AXES, KsgConfig.defaults());

    private String loginPattern(String name, List<Double> embedding) {
        return library.storePattern(name, Map.of(
                "form_type", "login",
                "selectors", Map.of("email", "#email", "password", "#password"),
                "steps", List.of(
                        Map.of("action", "fill", "selector", "#email", "field", "email"),
                        Map.of("action", "fill", "selector", "#password", "field", "password"),
                        Map.of("action", "click", "selector", "button[type=submit]"))),
                embedding, PROV);
    }

    private String checkoutPattern() {
        return library.storePattern("Card Checkout", Map.of("form_type", "checkout", "fields", List.of("card_number", "cvc")),
                CHECKOUT, PROV);
    }

    private long generalizedCount() {
        return store.concepts().stream().filter(c -> PatternEvolution.GENERALIZED.equals(c.props().get(ReservedKeys.TYPE))).count();
    }

    // ── similarity ────────────────────────────────────────────────────────────────

    @Test void similarPatternsAreRankedByCosine() {
        String exact = loginPattern("Example Login", LOGIN);
        String near = loginPattern("Other Login", List.of(0.9, 0.1, 0.0));
        checkoutPattern();

        List<PatternEvolution.SimilarPattern> similar = evolution.findSimilarPatterns("login form");

        assertEquals(List.of(exact, near), similar.stream().map(s -> s.concept().uuid()).toList());
        assertEquals(1.0, similar.get(0).similarity(), 1e-9);
    }

    @Test void excludedAndOtherTypesAreLeftOut() {
        String exact = loginPattern("Example Login", LOGIN);
        String near = loginPattern("Other Login", List.of(0.9, 0.1, 0.0));

        List<PatternEvolution.SimilarPattern> similar = evolution.findSimilarPatterns("login", "login", 5, 0.5, List.of(exact));
        assertEquals(List.of(near), similar.stream().map(s -> s.concept().uuid()).toList());

        assertTrue(evolution.findSimilarPatterns("login", "checkout", 5, 0.0, List.of()).isEmpty());
    }

    @Test void withoutEmbeddingsEveryPatternGetsDefaultSimilarity() {
        KnowledgeGraph plainGraph = new KnowledgeGraph(store, null);
        PatternLibrary plainLibrary = new PatternLibrary(plainGraph, null);
        PatternEvolution plain = new PatternEvolution(plainGraph, plainLibrary, null, KsgConfig.defaults());
        plainLibrary.storePattern("A", Map.of(), null, PROV);
        plainLibrary.storePattern("B", Map.of(), null, PROV);

        List<PatternEvolution.SimilarPattern> similar = plain.findSimilarPatterns("anything");

        assertEquals(2, similar.size());
        assertTrue(similar.stream().allMatch(s -> s.similarity() == 0.7));
        assertTrue(plain.findSimilarPatterns("anything", null, 5, 0.8, List.of()).isEmpty());
    }

    // ── transfer ──────────────────────────────────────────────────────────────────

    @Test void transferOfMissingPatternFails() {
        PatternEvolution.TransferResult result = evolution.transferPattern("missing", Map.of(), null, PROV);
        assertEquals(PatternEvolution.TransferMode.FAILED, result.mode());
        assertFalse(result.persisted());
        assertTrue(result.error().contains("missing"));
    }

    @Test void heuristicTransferRewritesSelectorsAndSteps() {
        String source = loginPattern("Example Login", LOGIN);

        PatternEvolution.TransferResult result = evolution.transferPattern(source, Map.of(
                "fields", List.of(Map.of("name", "user_email"), "password"),
                "url", "https://other.com/signin"), null, PROV);

        assertEquals(PatternEvolution.TransferMode.HEURISTIC, result.mode());
        assertEquals(Map.of("user_email", "email", "password", "password"), result.fieldMapping());
        assertEquals((5.0 / 9.0 + 1.0) / 2, result.confidence(), 1e-9);

        Map<String, Object> adapted = result.adaptedPattern();
        assertEquals(Map.of("user_email", "#user_email", "password", "#password"), adapted.get("selectors"));
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> steps = (List<Map<String, Object>>) adapted.get("steps");
        assertEquals("#user_email", steps.get(0).get("selector"));
        assertEquals("user_email", steps.get(0).get("field"));
        assertEquals("button[type=submit]", steps.get(2).get("selector"));
        assertEquals("https://other.com/signin", adapted.get("url"));
        assertEquals(source, adapted.get("transferred_from"));

        assertTrue(result.persisted());
        List<Edge> transfers = store.edgesFrom(source, Relations.TRANSFERRED_TO);
        assertEquals(1, transfers.size());
        assertEquals(result.newPatternUuid(), transfers.get(0).toNode());
        assertEquals(result.confidence(), transfers.get(0).strength(), 1e-9);
    }

    @Test void lowConfidenceTransferIsReturnedButNotStored() {
        String source = loginPattern("Example Login", LOGIN);
        int before = library.patterns().size();

        PatternEvolution.TransferResult result = evolution.transferPattern(source, Map.of("fields", List.of("phone")), null, PROV);

        assertEquals(0.0, result.confidence());
        assertNotNull(result.adaptedPattern());
        assertFalse(result.persisted());
        assertEquals(before, library.patterns().size());
    }

    @Test void reasonedTransferUsesReplyMapping() {
        String source = checkoutPattern();
        ReasoningFunction llm = prompt -> "{\"field_mapping\": {\"cc_number\": \"card_number\"}, \"confidence\": 0.9}";

        PatternEvolution.TransferResult result = evolution.transferPattern(source,
                Map.of("fields", List.of("cc_number"), "name", "Shop Checkout"), llm, PROV);

        assertEquals(PatternEvolution.TransferMode.REASONED, result.mode());
        assertEquals(Map.of("cc_number", "card_number"), result.fieldMapping());
        assertEquals(0.9, result.confidence(), 1e-9);
        assertTrue(result.persisted());
        assertEquals("Shop Checkout", store.findConcept(result.newPatternUuid()).orElseThrow().name());
        assertEquals(0.9, store.edgesFrom(source, Relations.TRANSFERRED_TO).get(0).strength(), 1e-9);
    }

    @Test void unusableReplyDegradesToNameMatching() {
        String source = checkoutPattern();

        PatternEvolution.TransferResult garbled = evolution.transferPattern(source,
                Map.of("fields", List.of("card-number")), prompt -> "I think card number maps to cc", PROV);
        PatternEvolution.TransferResult failing = evolution.transferPattern(source,
                Map.of("fields", List.of("card-number")), prompt -> { throw new IllegalStateException("offline"); }, PROV);

        for (PatternEvolution.TransferResult result : List.of(garbled, failing)) {
            assertEquals(PatternEvolution.TransferMode.DEGRADED, result.mode());
            assertEquals(Map.of("card-number", "card_number"), result.fieldMapping());
            assertEquals(0.5, result.confidence());
            assertFalse(result.persisted());
        }
    }

    // ── success ───────────────────────────────────────────────────────────────────

    @Test void successesAreCounted() {
        String uuid = loginPattern("Example Login", LOGIN);

        assertEquals(1, evolution.recordPatternSuccess(uuid, Map.of("url", "https://example.com"), PROV).successCount());
        PatternEvolution.SuccessRecord second = evolution.recordPatternSuccess(uuid, null, PROV);

        assertEquals(2, second.successCount());
        assertNotNull(second.lastSuccessAt());
        Concept stored = store.findConcept(uuid).orElseThrow();
        assertEquals(2, stored.props().get(ReservedKeys.SUCCESS_COUNT));
        assertEquals(2, stored.mapProp(ReservedKeys.PATTERN_DATA).get(ReservedKeys.SUCCESS_COUNT));
        assertEquals(Map.of("url", "https://example.com"), stored.props().get("last_success_context"));
    }

    @Test void successOnMissingPatternIsReported() {
        PatternEvolution.SuccessRecord record = evolution.recordPatternSuccess("missing", Map.of(), PROV);
        assertEquals(0, record.successCount());
        assertNull(record.lastSuccessAt());
        assertNotNull(record.error());
    }

    // ── generalization ────────────────────────────────────────────────────────────

    @Test void tooFewSuccessfulPeersGeneralizeNothing() {
        String trigger = loginPattern("example.com:login", LOGIN);
        loginPattern("other.com:login", LOGIN); // similar but never succeeded
        evolution.recordPatternSuccess(trigger, null, PROV);

        assertTrue(evolution.autoGeneralize(trigger, null, PROV).isEmpty());
        assertEquals(0, generalizedCount());
    }

    @Test void similarSuccessfulPatternsAreGeneralized() {
        String trigger = loginPattern("example.com:login", LOGIN);
        String second = loginPattern("other.com:login", LOGIN);
        String third = loginPattern("third.org:login", LOGIN);
        for (String uuid : List.of(trigger, second, third)) {
            evolution.recordPatternSuccess(uuid, null, PROV);
        }

        PatternEvolution.GeneralizationResult result = evolution.autoGeneralize(trigger, 3, 0.1, null, PROV).orElseThrow();

        assertEquals(3, result.exemplarCount());
        assertEquals(trigger, result.exemplarUuids().get(0));
        assertEquals("Generalized Login", result.name());

        Concept parent = store.findConcept(result.generalizedUuid()).orElseThrow();
        assertEquals(PatternEvolution.GENERALIZED, parent.props().get(ReservedKeys.TYPE));
        assertEquals("login", parent.props().get(ReservedKeys.FORM_TYPE));
        assertEquals(LOGIN, parent.embedding());
        assertEquals(Map.of("email", "#email", "password", "#password"), parent.props().get("common_selectors"));
        assertEquals(3, ((List<?>) parent.props().get("common_steps")).size());
        assertEquals(3, store.edgesFrom(parent.uuid(), Relations.HAS_EXEMPLAR).size());
        for (String uuid : List.of(trigger, second, third)) {
            assertEquals(parent.uuid(), store.edgesFrom(uuid, Relations.GENERALIZED_BY).get(0).toNode());
        }
    }

    @Test void alreadyGeneralizedPatternsAreNotGeneralizedAgain() {
        String trigger = loginPattern("example.com:login", LOGIN);
        String peer = loginPattern("other.com:login", LOGIN);
        evolution.recordPatternSuccess(peer, null, PROV);
        String parent = evolution.autoGeneralize(trigger, null, PROV).orElseThrow().generalizedUuid();

        assertTrue(evolution.autoGeneralize(trigger, null, PROV).isEmpty());
        assertTrue(evolution.autoGeneralize(parent, null, PROV).isEmpty());
        assertEquals(1, generalizedCount());
    }

    @Test void reasoningNamesTheGeneralization() {
        String trigger = loginPattern("example.com:login", LOGIN);
        String peer = loginPattern("other.com:login", LOGIN);
        evolution.recordPatternSuccess(peer, null, PROV);

        Optional<PatternEvolution.GeneralizationResult> result = evolution.autoGeneralize(trigger,
                prompt -> "{\"name\": \"Email Login\", \"description\": \"Email and password sign-in\"}", PROV);

        assertEquals("Email Login", result.orElseThrow().name());
        assertEquals("Email and password sign-in", result.get().description());
    }

    @Test void generalizeConceptsLinksPrototype() {
        String prototype = graph.createPrototype("LoginForm", "Any login form", "patterns", List.of(), null, PROV, null);
        String a = loginPattern("a", LOGIN);

        String parent = evolution.generalizeConcepts(List.of(a), "Logins", "All logins", null, prototype, null, PROV);

        assertEquals(prototype, store.edgesFrom(parent, Relations.INSTANTIATES).get(0).toNode());
        assertEquals(1, store.findConcept(parent).orElseThrow().props().get("exemplar_count"));
    }

    @Test void generalizedPatternIsFoundByQuery() {
        assertTrue(evolution.findGeneralizedPattern("login").isEmpty());

        String trigger = loginPattern("example.com:login", LOGIN);
        String peer = loginPattern("other.com:login", LOGIN);
        evolution.recordPatternSuccess(peer, null, PROV);
        String parent = evolution.autoGeneralize(trigger, null, PROV).orElseThrow().generalizedUuid();

        assertEquals(parent, evolution.findGeneralizedPattern("login page").orElseThrow().concept().uuid());
    }

    @Test void commonWordsOfNamesAreExtracted() {
        assertEquals("Login Form", PatternEvolution.extractCommonPattern(
                List.of("Login Form - example.com", "login form for other.com")));
        assertEquals("Login", PatternEvolution.extractCommonPattern(List.of("example.com:login", "other.com:login")));
        assertEquals("", PatternEvolution.extractCommonPattern(List.of("alpha", "beta")));
    }
}
