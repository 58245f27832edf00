package villagecompute.curator.plugins;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import villagecompute.curator.exceptions.ValidationException;
import villagecompute.curator.testing.RecordingDistributor;
import villagecompute.curator.testing.StubTransformer;

class PluginRegistryTest {

    private static final StubTransformer.Body IDENTITY = (input, config) -> input;

    @Test
    void testLookup_byName() {
        StubTransformer summarize = new StubTransformer("summarize", IDENTITY);
        RecordingDistributor email = new RecordingDistributor("email");
        List<Transformer> transformers = List.of(summarize);
        List<Distributor> distributors = List.of(email);

        PluginRegistry registry = new PluginRegistry(transformers, distributors);

        assertSame(summarize, registry.transformer("summarize"));
        assertSame(email, registry.distributor("email"));
        assertEquals(Set.of("summarize"), registry.transformerNames());
        assertEquals(Set.of("email"), registry.distributorNames());
    }

    @Test
    void testLookup_unknownName_throwsValidation() {
        List<Transformer> transformers = List.of();
        List<Distributor> distributors = List.of();
        PluginRegistry registry = new PluginRegistry(transformers, distributors);

        ValidationException transformer = assertThrows(ValidationException.class, () -> registry.transformer("nope"));
        ValidationException distributor = assertThrows(ValidationException.class, () -> registry.distributor("nope"));

        assertEquals("Unknown transformer plugin: nope", transformer.getMessage());
        assertEquals("Unknown distributor plugin: nope", distributor.getMessage());
    }

    @Test
    void testConstruct_duplicateTransformerName_fails() {
        List<Transformer> transformers = List.of(new StubTransformer("dedupe", IDENTITY),
                new StubTransformer("dedupe", IDENTITY));
        List<Distributor> distributors = List.of();

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> new PluginRegistry(transformers, distributors));
        assertTrue(e.getMessage().contains("dedupe"));
    }

    @Test
    void testConstruct_sameNameAcrossKinds_isAllowed() {
        List<Transformer> transformers = List.of(new StubTransformer("notion", IDENTITY));
        List<Distributor> distributors = List.of(new RecordingDistributor("notion"));

        PluginRegistry registry = new PluginRegistry(transformers, distributors);

        assertEquals("notion", registry.transformer("notion").name());
        assertEquals("notion", registry.distributor("notion").name());
    }
}
