package no.cantara.ksg.centroid;

import no.cantara.ksg.model.Concept;
import no.cantara.ksg.model.Kinds;
import no.cantara.ksg.model.Relations;
import no.cantara.ksg.model.ReservedKeys;
import no.cantara.ksg.store.InMemoryGraphStore;
import no.cantara.ksg.vector.Vectors;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static no.cantara.ksg.TestSupport.PROV;
import static org.junit.jupiter.api.Assertions.*;

class CentroidTrackerTest {

    private final InMemoryGraphStore store = new InMemoryGraphStore();
    private final CentroidTracker tracker = new CentroidTracker(store);

    private String concept(List<Double> embedding) {
        Concept c = Concept.create(Kinds.CONCEPT, List.of(), Map.of("name", "Login Form"), embedding);
        store.upsert(c, PROV);
        return c.uuid();
    }

    @Test void existingEmbeddingCountsAsFirstExemplar() {
        String uuid = concept(List.of(1.0, 0.0));

        CentroidTracker.ExemplarUpdate update = tracker.addExemplar(uuid, List.of(0.0, 1.0), null, PROV);

        assertTrue(update.updated());
        assertEquals(2, update.exemplarCount());
        assertEquals(Math.sqrt(0.5), update.embeddingDrift(), 1e-9);
        assertEquals(List.of(0.5, 0.5), tracker.centroid(uuid).orElseThrow());
    }

    @Test void runningSumIsStoredInProps() {
        String uuid = concept(List.of(1.0, 0.0));
        tracker.addExemplar(uuid, List.of(0.0, 1.0), null, PROV);

        Map<String, Object> props = store.findConcept(uuid).orElseThrow().props();
        assertEquals(List.of(1.0, 1.0), Vectors.fromObject(props.get(ReservedKeys.EMBEDDING_SUM)));
        assertEquals(2, props.get(ReservedKeys.EXEMPLAR_COUNT));
    }

    @Test void firstExemplarOfBareConceptBecomesCentroid() {
        String uuid = concept(null);

        CentroidTracker.ExemplarUpdate update = tracker.addExemplar(uuid, List.of(0.3, 0.4), null, PROV);

        assertEquals(1, update.exemplarCount());
        assertEquals(0.0, update.embeddingDrift());
        assertEquals(List.of(0.3, 0.4), tracker.centroid(uuid).orElseThrow());
    }

    @Test void centroidConvergesTowardRepeatedExemplar() {
        String uuid = concept(List.of(1.0, 0.0));
        List<Double> target = List.of(0.0, 1.0);

        CentroidTracker.ExemplarUpdate last = null;
        for (int i = 0; i < 9; i++) {
            last = tracker.addExemplar(uuid, target, null, PROV);
        }

        assertEquals(10, last.exemplarCount());
        assertTrue(Vectors.cosine(tracker.centroid(uuid).orElseThrow(), target) > 0.99);
        assertTrue(last.embeddingDrift() > 0.99, "late exemplars barely move the centroid");
    }

    @Test void missingConceptIsReported() {
        CentroidTracker.ExemplarUpdate update = tracker.addExemplar("nope", List.of(1.0), null, PROV);
        assertFalse(update.updated());
        assertTrue(update.error().contains("nope"));
    }

    @Test void emptyAndMismatchedExemplarsAreRejected() {
        String uuid = concept(List.of(1.0, 0.0));

        assertFalse(tracker.addExemplar(uuid, List.of(), null, PROV).updated());
        CentroidTracker.ExemplarUpdate mismatch = tracker.addExemplar(uuid, List.of(1.0, 0.0, 0.0), null, PROV);
        assertFalse(mismatch.updated());
        assertEquals(1, mismatch.exemplarCount());
        assertEquals(List.of(1.0, 0.0), tracker.centroid(uuid).orElseThrow());
    }

    // ── recomputation ─────────────────────────────────────────────────────────────

    @Test void recomputeUsesLinkedExemplars() {
        String uuid = concept(null);
        String first = concept(List.of(1.0, 0.0));
        String second = concept(List.of(0.0, 1.0));
        tracker.addExemplar(uuid, List.of(1.0, 0.0), first, PROV);
        tracker.addExemplar(uuid, List.of(0.0, 1.0), second, PROV);
        assertEquals(2, store.edgesFrom(uuid, Relations.HAS_EXEMPLAR).size());

        // drift the stored sum, then rebuild it from the graph
        Concept stale = store.findConcept(uuid).orElseThrow();
        Map<String, Object> props = stale.mutableProps();
        props.put(ReservedKeys.EMBEDDING_SUM, List.of(9.0, 9.0));
        props.put(ReservedKeys.EXEMPLAR_COUNT, 7);
        store.upsert(stale.withProps(props).withEmbedding(List.of(1.0, 1.0)), PROV);

        CentroidTracker.Recomputation result = tracker.recomputeCentroid(uuid, PROV);

        assertTrue(result.recomputed());
        assertEquals(2, result.exemplarCount());
        assertEquals(List.of(0.5, 0.5), tracker.centroid(uuid).orElseThrow());
    }

    @Test void recomputeWithoutExemplarsFails() {
        CentroidTracker.Recomputation result = tracker.recomputeCentroid(concept(List.of(1.0)), PROV);
        assertFalse(result.recomputed());
        assertNotNull(result.error());
    }
}
