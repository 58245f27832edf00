package villagecompute.curator.services;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.curator.exceptions.ProcessorException;
import villagecompute.curator.exceptions.TransformException;
import villagecompute.curator.plugins.TransformConfig;

/**
 * Entry point of the content pipeline: transform, then distribute.
 *
 * <p>
 * Transform failures never stop a run. A failing GLOBAL step leaves the item untransformed, a failing BATCH step
 * leaves the collected array untransformed, and per-distributor failures are isolated by {@link DistributionService}.
 * Only missing distributors or a total distribution failure surface as {@link ProcessorException}.
 *
 * <p>
 * In {@link #processBatch} the per-item transforms run concurrently on a fixed pool sized by
 * {@code curator.pipeline.batch-parallelism}; the collected array keeps the input order.
 */
@ApplicationScoped
public class ProcessorService {

    private static final Logger LOG = Logger.getLogger(ProcessorService.class);

    @Inject
    TransformationService transformationService;

    @Inject
    DistributionService distributionService;

    @Inject
    MeterRegistry meterRegistry;

    @ConfigProperty(
            name = "curator.pipeline.batch-parallelism",
            defaultValue = "8")
    int batchParallelism;

    private ExecutorService batchExecutor;

    @PostConstruct
    void init() {
        AtomicInteger threadCount = new AtomicInteger();
        batchExecutor = Executors.newFixedThreadPool(Math.max(1, batchParallelism), runnable -> {
            Thread thread = new Thread(runnable, "pipeline-batch-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @PreDestroy
    void shutdown() {
        if (batchExecutor != null) {
            batchExecutor.shutdownNow();
        }
    }

    /**
     * Processes a single content item.
     *
     * @throws ProcessorException
     *             if no distributors are configured or all of them failed
     */
    public DistributionReport process(JsonNode content, ProcessConfig config) {
        requireDistributors(config);
        JsonNode processed = transformOrFallback(content, config.transform(), TransformStage.GLOBAL);
        return distributionService.distribute(processed, config.distribute());
    }

    /**
     * Processes a batch of items as a single distributed array.
     *
     * @throws ProcessorException
     *             if no distributors are configured or all of them failed
     */
    public DistributionReport processBatch(List<JsonNode> items, ProcessConfig config) {
        requireDistributors(config);

        List<CompletableFuture<JsonNode>> transformed = items.stream()
                .map(item -> CompletableFuture.supplyAsync(
                        () -> transformOrFallback(item, config.transform(), TransformStage.GLOBAL), batchExecutor))
                .toList();

        ArrayNode collected = JsonNodeFactory.instance.arrayNode(items.size());
        transformed.forEach(future -> collected.add(future.join()));
        LOG.debugf("Transformed %d batch items", collected.size());

        JsonNode batch = transformOrFallback(collected, config.batchTransform(), TransformStage.BATCH);
        return distributionService.distribute(batch, config.distribute());
    }

    private JsonNode transformOrFallback(JsonNode content, List<TransformConfig> steps, TransformStage stage) {
        if (steps.isEmpty()) {
            return content;
        }
        try {
            return transformationService.applyTransforms(content, steps, stage);
        } catch (TransformException e) {
            meterRegistry.counter("curator_transform_failures_total", "stage", stage.label()).increment();
            LOG.warnf("%s; continuing with untransformed content", e.getMessage());
            return content;
        }
    }

    private static void requireDistributors(ProcessConfig config) {
        if (config == null || config.distribute().isEmpty()) {
            throw new ProcessorException("No distributors configured");
        }
    }
}
