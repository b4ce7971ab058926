package no.cantara.ksg.store;

/**
 * Filter keys understood by {@link GraphStore#search}. All filters are exact matches on shallow fields.
 * A key of the form {@code props.<name>} matches a top-level property.
 */
public final class SearchFilters {

    private SearchFilters() {}

    /** {@value #CONCEPT_ENTITY} (the default) or {@value #EDGE_ENTITY}. */
    public static final String ENTITY = "entity";
    public static final String CONCEPT_ENTITY = "concept";
    public static final String EDGE_ENTITY = "edge";

    public static final String UUID = "uuid";
    public static final String KIND = "kind";
    public static final String STATUS = "status";
    public static final String REL = "rel";
    public static final String FROM_NODE = "from_node";
    public static final String TO_NODE = "to_node";

    public static final String PROPS_PREFIX = "props.";

    public static String prop(String name) {
        return PROPS_PREFIX + name;
    }
}
