package no.cantara.ksg.model;

/**
 * Relationship types written by the core. Any other string is a free-form fuzzy association.
 */
public final class Relations {

    private Relations() {}

    public static final String INSTANTIATES = "instantiates";
    public static final String INHERITS_FROM = "inherits_from";
    public static final String HAS_STEP = "has_step";
    public static final String HAS_CHILD = "has_child";
    public static final String DEPENDS_ON = "depends_on";
    public static final String HAS_EXEMPLAR = "has_exemplar";
    public static final String GENERALIZED_BY = "generalized_by";
    public static final String HAS_A = "has_a";
    public static final String HAS_PROPERTY = "has_property";
    public static final String TRANSFERRED_TO = "transferred_to";

    // first-class relationship nodes are wired with these two
    public static final String REL_FROM = "rel_from";
    public static final String REL_TO = "rel_to";
}
