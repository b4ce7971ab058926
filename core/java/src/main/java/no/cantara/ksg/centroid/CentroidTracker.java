package no.cantara.ksg.centroid;

import no.cantara.ksg.model.Concept;
import no.cantara.ksg.model.Edge;
import no.cantara.ksg.model.Provenance;
import no.cantara.ksg.model.Relations;
import no.cantara.ksg.model.ReservedKeys;
import no.cantara.ksg.store.GraphStore;
import no.cantara.ksg.store.UpsertResult;
import no.cantara.ksg.vector.Vectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Keeps a concept's embedding at the mean of its exemplars. The running sum and count live in
 * the concept's props under {@value ReservedKeys#EMBEDDING_SUM} and
 * {@value ReservedKeys#EXEMPLAR_COUNT}; the visible embedding is always {@code sum / count}.
 *
 * <p>Updates are read-modify-write against the store. Concurrent callers need the store to be
 * last-writer-wins or an external lock.
 */
public class CentroidTracker {

    private static final Logger log = LoggerFactory.getLogger(CentroidTracker.class);

    /**
     * @param updated        whether the concept was rewritten
     * @param exemplarCount  exemplars folded into the centroid so far
     * @param embeddingDrift cosine similarity between the old and new centroid; 1.0 means no change
     * @param error          reason when not updated, otherwise {@code null}
     */
    public record ExemplarUpdate(boolean updated, int exemplarCount, double embeddingDrift, String error) {}

    public record Recomputation(boolean recomputed, int exemplarCount, String error) {}

    private final GraphStore store;

    public CentroidTracker(GraphStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * Fold one exemplar embedding into the concept's centroid. When {@code exemplarUuid} is
     * given a {@code has_exemplar} edge is added for later recomputation.
     */
    public ExemplarUpdate addExemplar(String conceptUuid, List<Double> exemplarEmbedding, String exemplarUuid,
                                      Provenance provenance) {
        Optional<Concept> found = store.findConcept(conceptUuid);
        if (found.isEmpty()) {
            return new ExemplarUpdate(false, 0, 0.0, "Concept not found: " + conceptUuid);
        }
        Concept concept = found.get();
        Map<String, Object> props = concept.mutableProps();

        List<Double> sum = Vectors.fromObject(props.get(ReservedKeys.EMBEDDING_SUM));
        int count = props.get(ReservedKeys.EXEMPLAR_COUNT) instanceof Number n ? n.intValue() : 0;
        if (sum.isEmpty() || count <= 0) {
            // an existing embedding counts as the first exemplar
            sum = concept.hasEmbedding() ? concept.embedding() : List.of();
            count = concept.hasEmbedding() ? 1 : 0;
        }

        if (Vectors.isEmpty(exemplarEmbedding)) {
            return new ExemplarUpdate(false, count, 1.0, "Exemplar embedding is empty");
        }
        if (!sum.isEmpty() && sum.size() != exemplarEmbedding.size()) {
            log.warn("Exemplar for {} has dimension {}, centroid has {}; ignoring",
                    conceptUuid, exemplarEmbedding.size(), sum.size());
            return new ExemplarUpdate(false, count, 1.0, "Embedding dimension mismatch");
        }

        List<Double> newSum = Vectors.add(sum, exemplarEmbedding);
        int newCount = count + 1;
        List<Double> newCentroid = Vectors.scale(newSum, 1.0 / newCount);
        double drift = concept.hasEmbedding() ? Vectors.cosine(concept.embedding(), newCentroid) : 0.0;

        props.put(ReservedKeys.EMBEDDING_SUM, newSum);
        props.put(ReservedKeys.EXEMPLAR_COUNT, newCount);
        UpsertResult result = store.upsert(concept.withProps(props).withEmbedding(newCentroid), provenance);
        if (!result.isSuccess()) {
            log.warn("Centroid update for {} not stored: {}", conceptUuid, result.message());
            return new ExemplarUpdate(false, count, 1.0, result.message());
        }

        if (exemplarUuid != null) {
            UpsertResult edge = store.upsert(Edge.create(conceptUuid, exemplarUuid, Relations.HAS_EXEMPLAR,
                    Map.of(ReservedKeys.ORDER, newCount - 1)), provenance);
            if (!edge.isSuccess()) {
                log.warn("has_exemplar edge {} -> {} not stored: {}", conceptUuid, exemplarUuid, edge.message());
            }
        }
        log.debug("Centroid of {} now averages {} exemplars (drift {})", conceptUuid, newCount, drift);
        return new ExemplarUpdate(true, newCount, drift, null);
    }

    /** Rebuild the running sum and count from the embeddings of all linked exemplars. */
    public Recomputation recomputeCentroid(String conceptUuid, Provenance provenance) {
        Optional<Concept> found = store.findConcept(conceptUuid);
        if (found.isEmpty()) {
            return new Recomputation(false, 0, "Concept not found: " + conceptUuid);
        }

        List<Double> sum = List.of();
        int count = 0;
        for (Edge edge : store.edgesFrom(conceptUuid, Relations.HAS_EXEMPLAR)) {
            List<Double> v = store.findConcept(edge.toNode()).map(Concept::embedding).orElse(null);
            if (Vectors.isEmpty(v) || (!sum.isEmpty() && v.size() != sum.size())) continue;
            sum = Vectors.add(sum, v);
            count++;
        }
        if (count == 0) {
            return new Recomputation(false, 0, "No exemplar embeddings linked to " + conceptUuid);
        }

        Concept concept = found.get();
        Map<String, Object> props = concept.mutableProps();
        props.put(ReservedKeys.EMBEDDING_SUM, new ArrayList<>(sum));
        props.put(ReservedKeys.EXEMPLAR_COUNT, count);
        UpsertResult result = store.upsert(concept.withProps(props).withEmbedding(Vectors.scale(sum, 1.0 / count)),
                provenance);
        if (!result.isSuccess()) {
            return new Recomputation(false, count, result.message());
        }
        return new Recomputation(true, count, null);
    }

    public Optional<List<Double>> centroid(String conceptUuid) {
        return store.findConcept(conceptUuid)
                .filter(Concept::hasEmbedding)
                .map(Concept::embedding);
    }
}
