package villagecompute.curator.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import villagecompute.curator.exceptions.ProcessorException;
import villagecompute.curator.plugins.Distributor;
import villagecompute.curator.plugins.DistributorConfig;
import villagecompute.curator.plugins.PluginRegistry;
import villagecompute.curator.plugins.Transformer;
import villagecompute.curator.testing.RecordingDistributor;

class DistributionServiceTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private DistributionService service;
    private SimpleMeterRegistry meterRegistry;
    private RecordingDistributor slack;
    private RecordingDistributor broken;

    @BeforeEach
    void setUp() {
        slack = new RecordingDistributor("slack");
        broken = new RecordingDistributor("broken", new IllegalStateException("webhook rejected"));
        List<Transformer> transformers = List.of();
        List<Distributor> distributors = List.of(slack, broken);
        PluginRegistry registry = new PluginRegistry(transformers, distributors);

        TransformationService transformationService = new TransformationService();
        transformationService.pluginRegistry = registry;

        meterRegistry = new SimpleMeterRegistry();
        service = new DistributionService();
        service.pluginRegistry = registry;
        service.transformationService = transformationService;
        service.meterRegistry = meterRegistry;
    }

    private static ObjectNode content() {
        return MAPPER.createObjectNode().put("title", "Weekly recap");
    }

    @Test
    void testDistribute_emptyList_throws() {
        ProcessorException e = assertThrows(ProcessorException.class, () -> service.distribute(content(), List.of()));
        assertEquals("No distributors configured", e.getMessage());
    }

    @Test
    void testDistribute_countsSuccessAndFailurePerPlugin() {
        DistributionReport report = service.distribute(content(),
                List.of(DistributorConfig.of("broken"), DistributorConfig.of("slack"), DistributorConfig.of("slack")));

        assertEquals(List.of("slack", "slack"), report.succeeded());
        assertEquals(2, slack.calls());
        assertEquals(2.0,
                meterRegistry.counter("curator_distributions_total", "plugin", "slack", "result", "success").count());
        assertEquals(1.0,
                meterRegistry.counter("curator_distributions_total", "plugin", "broken", "result", "failure").count());
    }

    @Test
    void testDistribute_unknownPlugin_isRecordedAsFailure() {
        DistributionReport report = service.distribute(content(),
                List.of(DistributorConfig.of("carrier-pigeon"), DistributorConfig.of("slack")));

        assertEquals(List.of("slack"), report.succeeded());
        assertTrue(report.failed().get("carrier-pigeon").contains("Unknown distributor plugin"));
    }

    @Test
    void testDistribute_passesDistributorConfig() {
        RecordingDistributor configAware = new RecordingDistributor("config-aware") {
            @Override
            public void distribute(JsonNode input, Map<String, Object> config) {
                super.distribute(MAPPER.valueToTree(config), config);
            }
        };
        List<Transformer> transformers = List.of();
        List<Distributor> distributors = List.of(configAware);
        service.pluginRegistry = new PluginRegistry(transformers, distributors);

        service.distribute(content(), List.of(new DistributorConfig("config-aware", Map.of("channel", "#news"), null)));

        assertEquals("#news", configAware.received().get(0).get("channel").asText());
    }

    @Test
    void testDistribute_interrupted_stopsFanOut() {
        Distributor interrupting = new Distributor() {
            @Override
            public String name() {
                return "interrupting";
            }

            @Override
            public void distribute(JsonNode content, Map<String, Object> config)
                    throws Exception {
                throw new InterruptedException("shutdown");
            }
        };
        List<Transformer> transformers = List.of();
        List<Distributor> distributors = List.of(interrupting, slack);
        service.pluginRegistry = new PluginRegistry(transformers, distributors);

        try {
            assertThrows(ProcessorException.class, () -> service.distribute(content(),
                    List.of(DistributorConfig.of("interrupting"), DistributorConfig.of("slack"))));
            assertEquals(0, slack.calls());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }
}
