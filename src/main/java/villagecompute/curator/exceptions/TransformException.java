package villagecompute.curator.exceptions;

import villagecompute.curator.services.TransformStage;

/**
 * Failure of a single transform step.
 *
 * <p>
 * Carries the plugin name, the pipeline stage and the zero-based index of the failing step so callers can log exactly
 * which part of a feed's configuration misbehaved. Callers in the pipeline catch this and continue with the
 * untransformed content.
 */
public class TransformException extends RuntimeException {

    private final String plugin;
    private final TransformStage stage;
    private final int stepIndex;

    public TransformException(String plugin, TransformStage stage, int stepIndex, String reason) {
        this(plugin, stage, stepIndex, reason, null);
    }

    public TransformException(String plugin, TransformStage stage, int stepIndex, String reason, Throwable cause) {
        super(String.format("Transform \"%s\" failed at %s stage, step %d: %s", plugin, stage.label(), stepIndex,
                reason), cause);
        this.plugin = plugin;
        this.stage = stage;
        this.stepIndex = stepIndex;
    }

    public String getPlugin() {
        return plugin;
    }

    public TransformStage getStage() {
        return stage;
    }

    public int getStepIndex() {
        return stepIndex;
    }
}
