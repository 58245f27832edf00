package villagecompute.curator.services;

/**
 * Pipeline position of a transform step. Carried in {@link villagecompute.curator.exceptions.TransformException} and
 * the {@code stage} metric tag.
 */
public enum TransformStage {

    /** Applied to each item before distribution. */
    GLOBAL("global"),

    /** Applied to the content sent to one distributor only. */
    DISTRIBUTOR("distributor"),

    /** Applied once to the collected array of a recap batch. */
    BATCH("batch");

    private final String label;

    TransformStage(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
