package no.cantara.ksg.model;

/**
 * Well-known concept kinds. Kinds are open strings; these are the ones the core creates or looks for.
 */
public final class Kinds {

    private Kinds() {}

    public static final String PROTOTYPE = "Prototype";
    public static final String CONCEPT = "Concept";
    public static final String RELATIONSHIP = "Relationship";
    public static final String PROCEDURE = "Procedure";
    public static final String STEP = "Step";
    public static final String PATTERN = "Pattern";
}
