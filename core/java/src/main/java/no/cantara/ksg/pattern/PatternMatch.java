package no.cantara.ksg.pattern;

import no.cantara.ksg.model.Concept;

import java.util.Map;

/** A stored pattern ranked against a query fingerprint. */
public record PatternMatch(double score, Concept concept, Map<String, Object> patternData) {}
