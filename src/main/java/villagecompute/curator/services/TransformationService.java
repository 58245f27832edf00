package villagecompute.curator.services;

import java.util.List;

import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.curator.exceptions.TransformException;
import villagecompute.curator.plugins.PluginRegistry;
import villagecompute.curator.plugins.TransformConfig;
import villagecompute.curator.plugins.Transformer;

/**
 * Applies a list of transform steps to a content value.
 *
 * <p>
 * Steps run in list order, each seeing the output of the previous one. When both the running value and a step's
 * result are JSON objects the result is shallow-merged over the running value (keys from the result win); any other
 * result replaces it. Transformers receive a copy of the running value, so the caller's content is never mutated.
 */
@ApplicationScoped
public class TransformationService {

    private static final Logger LOG = Logger.getLogger(TransformationService.class);

    @Inject
    PluginRegistry pluginRegistry;

    /**
     * Runs {@code steps} over {@code content}.
     *
     * @param content
     *            input value, left untouched
     * @param steps
     *            transform steps; null or empty returns {@code content} as is
     * @param stage
     *            pipeline stage, reported in failures
     * @return transformed value
     * @throws TransformException
     *             if a plugin is unknown, throws, or returns null
     */
    public JsonNode applyTransforms(JsonNode content, List<TransformConfig> steps, TransformStage stage) {
        JsonNode current = content != null ? content : NullNode.getInstance();
        if (steps == null || steps.isEmpty()) {
            return current;
        }

        for (int i = 0; i < steps.size(); i++) {
            TransformConfig step = steps.get(i);
            JsonNode output;
            try {
                Transformer transformer = pluginRegistry.transformer(step.plugin());
                LOG.debugf("Applying %s transform %d/%d: %s", stage.label(), i + 1, steps.size(), step.plugin());
                output = transformer.transform(current.deepCopy(), step.config());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransformException(step.plugin(), stage, i, "Interrupted", e);
            } catch (Exception e) {
                throw new TransformException(step.plugin(), stage, i, describe(e), e);
            }

            if (output == null || output.isNull() || output.isMissingNode()) {
                throw new TransformException(step.plugin(), stage, i, "Transform returned null");
            }
            current = combine(current, output);
        }
        return current;
    }

    /**
     * Shallow-merges two objects, otherwise returns {@code next}.
     */
    static JsonNode combine(JsonNode previous, JsonNode next) {
        if (previous.isObject() && next.isObject()) {
            ObjectNode merged = ((ObjectNode) previous).deepCopy();
            merged.setAll((ObjectNode) next);
            return merged;
        }
        return next;
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
