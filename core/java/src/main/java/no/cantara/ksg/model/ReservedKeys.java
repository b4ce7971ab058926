package no.cantara.ksg.model;

/**
 * The property keys core algorithms read and write. Everything else in a props map is opaque payload.
 */
public final class ReservedKeys {

    private ReservedKeys() {}

    // descriptive
    public static final String NAME = "name";
    public static final String TITLE = "title";
    public static final String DESCRIPTION = "description";
    public static final String TYPE = "type";
    public static final String SOURCE = "source";

    // structure
    public static final String PROTOTYPE_UUID = "prototype_uuid";
    public static final String CONCEPT_UUID = "concept_uuid";
    public static final String PROCEDURE_UUID = "procedure_uuid";
    public static final String STEPS = "steps";
    public static final String CHILDREN = "children";
    public static final String STEP_ID = "step_id";
    public static final String ID = "id";
    public static final String TOOL = "tool";
    public static final String PARAMS = "params";
    public static final String DEPENDS_ON = "depends_on";
    public static final String ORDER = "order";
    public static final String GUARD = "guard";
    public static final String GUARD_TEXT = "guard_text";

    // edges
    public static final String STRENGTH = "strength";

    // centroid bookkeeping
    public static final String EMBEDDING_SUM = "_embedding_sum";
    public static final String EXEMPLAR_COUNT = "_exemplar_count";

    // patterns
    public static final String PATTERN_DATA = "pattern_data";
    public static final String SUCCESS_COUNT = "success_count";
    public static final String LAST_SUCCESS_AT = "last_success_at";
    public static final String FINGERPRINT = "fingerprint";
    public static final String FORM_TYPE = "form_type";
    public static final String FIELDS = "fields";
    public static final String SELECTORS = "selectors";
    public static final String URL = "url";
    public static final String CONFIDENCE = "confidence";
}
