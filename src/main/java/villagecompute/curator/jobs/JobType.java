package villagecompute.curator.jobs;

/**
 * Kinds of scheduled jobs. Each value is dispatched to the {@link JobHandler} that reports it from
 * {@link JobHandler#handlesType()}.
 */
public enum JobType {

    /**
     * Periodic batch of a feed's approved submissions pushed through the recap pipeline.
     */
    RECAP("Feed recap"),

    /**
     * Jobs created through the management API for handlers outside the core set. Executions fail until a handler is
     * registered.
     */
    CUSTOM("Custom job");

    private final String description;

    JobType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
