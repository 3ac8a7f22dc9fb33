package no.cantara.registry;

/**
 * A dataset manifest violates a structural rule. The owning package is
 * excluded from the catalog.
 */
public class DatasetValidationException extends IllegalArgumentException {

    public enum Kind {
        /** The dataset id contains a hyphen. */
        INVALID_IDENTIFIER,
        /** Pipeline files are shipped but no pipeline is referenced. */
        UNUSED_PIPELINES,
        /** The referenced pipeline has no json or yml file. */
        MISSING_PIPELINE,
        /** A required manifest field is absent or blank. */
        MISSING_FIELD
    }

    private final Kind kind;
    private final String datasetId;

    public DatasetValidationException(Kind kind, String datasetId, String message) {
        super(message);
        this.kind = kind;
        this.datasetId = datasetId;
    }

    public Kind kind() {
        return kind;
    }

    public String datasetId() {
        return datasetId;
    }
}
