package no.cantara.ksg.model;

import java.util.Map;

/**
 * Anything the graph store can hold: a node ({@link Concept}) or a directed edge ({@link Edge}).
 */
public sealed interface GraphEntity permits Concept, Edge {

    String uuid();

    Map<String, Object> props();
}
