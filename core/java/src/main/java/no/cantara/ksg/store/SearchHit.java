package no.cantara.ksg.store;

import no.cantara.ksg.model.Concept;
import no.cantara.ksg.model.Edge;
import no.cantara.ksg.model.GraphEntity;

/**
 * One ranked search result.
 *
 * @param entity the stored concept or edge
 * @param score  backend-specific relevance; cosine similarity when a query embedding was given
 */
public record SearchHit(GraphEntity entity, double score) {

    public Concept concept() {
        return entity instanceof Concept c ? c : null;
    }

    public Edge edge() {
        return entity instanceof Edge e ? e : null;
    }
}
