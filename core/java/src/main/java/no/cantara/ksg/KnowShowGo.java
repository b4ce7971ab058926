package no.cantara.ksg;

import no.cantara.ksg.centroid.CentroidTracker;
import no.cantara.ksg.concept.DefaultPrototypes;
import no.cantara.ksg.concept.KnowledgeGraph;
import no.cantara.ksg.config.KsgConfig;
import no.cantara.ksg.dag.DagExecutor;
import no.cantara.ksg.dag.KeywordGuardEvaluator;
import no.cantara.ksg.model.Provenance;
import no.cantara.ksg.pattern.PatternEvolution;
import no.cantara.ksg.pattern.PatternLibrary;
import no.cantara.ksg.procedure.ProcedureBuilder;
import no.cantara.ksg.store.GraphStore;
import no.cantara.ksg.store.InMemoryGraphStore;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Wires the components over one store. The embedding function is optional.
 */
public class KnowShowGo {

    private final GraphStore store;
    private final KnowledgeGraph graph;
    private final ProcedureBuilder procedures;
    private final DagExecutor executor;
    private final CentroidTracker centroids;
    private final PatternLibrary patterns;
    private final PatternEvolution evolution;

    public KnowShowGo(GraphStore store, EmbeddingFunction embeddingFunction, KsgConfig config) {
        this.store = Objects.requireNonNull(store, "store");
        Objects.requireNonNull(config, "config");
        this.graph = new KnowledgeGraph(store, embeddingFunction);
        this.procedures = new ProcedureBuilder(store, embeddingFunction);
        this.executor = new DagExecutor(store,
                new KeywordGuardEvaluator(config.guards().trueTokens(), config.guards().falseTokens()));
        this.centroids = new CentroidTracker(store);
        this.patterns = new PatternLibrary(graph, embeddingFunction);
        this.evolution = new PatternEvolution(graph, patterns, embeddingFunction, config);
    }

    /** An in-memory instance with default config and the default prototypes seeded. */
    public static KnowShowGo inMemory(EmbeddingFunction embeddingFunction) {
        KnowShowGo ksg = new KnowShowGo(new InMemoryGraphStore(), embeddingFunction, KsgConfig.defaults());
        ksg.seedPrototypes(Provenance.of("system", "bootstrap"));
        return ksg;
    }

    public Map<String, String> seedPrototypes(Provenance provenance) {
        return DefaultPrototypes.ensure(graph, provenance);
    }

    /**
     * Record a successful use of a pattern and try to fold it, with its similar successful peers,
     * into a generalized pattern.
     */
    public Optional<PatternEvolution.GeneralizationResult> recordSuccess(String patternUuid, Map<String, Object> context,
                                                                         ReasoningFunction reasoning,
                                                                         Provenance provenance) {
        PatternEvolution.SuccessRecord success = evolution.recordPatternSuccess(patternUuid, context, provenance);
        if (success.error() != null) {
            return Optional.empty();
        }
        return evolution.autoGeneralize(patternUuid, reasoning, provenance);
    }

    public GraphStore store() { return store; }
    public KnowledgeGraph graph() { return graph; }
    public ProcedureBuilder procedures() { return procedures; }
    public DagExecutor executor() { return executor; }
    public CentroidTracker centroids() { return centroids; }
    public PatternLibrary patterns() { return patterns; }
    public PatternEvolution evolution() { return evolution; }
}
