package villagecompute.curator.services;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.JsonNode;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.curator.exceptions.ProcessorException;
import villagecompute.curator.exceptions.TransformException;
import villagecompute.curator.plugins.Distributor;
import villagecompute.curator.plugins.DistributorConfig;
import villagecompute.curator.plugins.PluginRegistry;

/**
 * Fans a content value out to the configured distributors.
 *
 * <p>
 * Distributors run sequentially in list order, each at most once. Each one first applies its own transform steps to
 * its private copy of the content (falling back to the shared content when they fail), then publishes. A failing
 * distributor is logged and skipped; the call only fails when no distributor succeeded.
 *
 * <p>
 * <b>Metrics:</b> {@code curator_distributions_total{plugin, result}} and
 * {@code curator_transform_failures_total{stage="distributor"}}.
 */
@ApplicationScoped
public class DistributionService {

    private static final Logger LOG = Logger.getLogger(DistributionService.class);

    @Inject
    PluginRegistry pluginRegistry;

    @Inject
    TransformationService transformationService;

    @Inject
    MeterRegistry meterRegistry;

    /**
     * Distributes {@code content} to every entry of {@code distributors}.
     *
     * @return names of the distributors that succeeded and failed
     * @throws ProcessorException
     *             if {@code distributors} is empty, if every distributor failed, or if the calling thread is
     *             interrupted
     */
    public DistributionReport distribute(JsonNode content, List<DistributorConfig> distributors) {
        if (distributors == null || distributors.isEmpty()) {
            throw new ProcessorException("No distributors configured");
        }

        List<String> succeeded = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();
        List<Exception> failures = new ArrayList<>();

        for (DistributorConfig target : distributors) {
            JsonNode payload = applyDistributorTransforms(content, target);
            try {
                Distributor distributor = pluginRegistry.distributor(target.plugin());
                distributor.distribute(payload, target.config());
                succeeded.add(target.plugin());
                countDistribution(target.plugin(), "success");
                LOG.debugf("Distributor %s succeeded", target.plugin());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ProcessorException("Distribution interrupted at " + target.plugin(), e);
            } catch (Exception e) {
                failed.put(target.plugin(), e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
                failures.add(e);
                countDistribution(target.plugin(), "failure");
                LOG.errorf(e, "Distributor %s failed", target.plugin());
            }
        }

        if (succeeded.isEmpty()) {
            ProcessorException aggregate = new ProcessorException(
                    "All distributors failed: " + String.join(", ", failed.keySet()), failures.get(0));
            failures.stream().skip(1).forEach(aggregate::addSuppressed);
            throw aggregate;
        }
        if (!failed.isEmpty()) {
            LOG.warnf("Distribution partially failed: %d succeeded, %d failed (%s)", succeeded.size(), failed.size(),
                    failed.keySet());
        }
        return new DistributionReport(succeeded, failed);
    }

    private JsonNode applyDistributorTransforms(JsonNode content, DistributorConfig target) {
        if (target.transform().isEmpty()) {
            return content;
        }
        try {
            return transformationService.applyTransforms(content, target.transform(), TransformStage.DISTRIBUTOR);
        } catch (TransformException e) {
            meterRegistry.counter("curator_transform_failures_total", "stage", TransformStage.DISTRIBUTOR.label())
                    .increment();
            LOG.warnf("Distributor %s transforms failed, sending untransformed content: %s", target.plugin(),
                    e.getMessage());
            return content;
        }
    }

    private void countDistribution(String plugin, String result) {
        meterRegistry.counter("curator_distributions_total", "plugin", plugin, "result", result).increment();
    }
}
