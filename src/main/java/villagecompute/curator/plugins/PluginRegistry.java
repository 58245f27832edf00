package villagecompute.curator.plugins;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import villagecompute.curator.exceptions.ValidationException;

/**
 * Name-indexed lookup of the {@link Transformer} and {@link Distributor} beans present at startup. Two plugins of the
 * same kind sharing a name fail startup with {@link IllegalStateException}.
 */
@ApplicationScoped
public class PluginRegistry {

    private static final Logger LOG = Logger.getLogger(PluginRegistry.class);

    private final Map<String, Transformer> transformers;
    private final Map<String, Distributor> distributors;

    @Inject
    public PluginRegistry(Instance<Transformer> transformers, Instance<Distributor> distributors) {
        this((Iterable<Transformer>) transformers, (Iterable<Distributor>) distributors);
    }

    public PluginRegistry(Iterable<Transformer> transformers, Iterable<Distributor> distributors) {
        this.transformers = index(transformers, Transformer::name, "transformer");
        this.distributors = index(distributors, Distributor::name, "distributor");
        LOG.infof("Initialized PluginRegistry with %d transformers and %d distributors", this.transformers.size(),
                this.distributors.size());
    }

    private static <T> Map<String, T> index(Iterable<T> plugins, Function<T, String> nameOf, String kind) {
        Map<String, T> registry = new HashMap<>();
        for (T plugin : plugins) {
            String name = nameOf.apply(plugin);
            T existing = registry.putIfAbsent(name, plugin);
            if (existing != null) {
                throw new IllegalStateException("Duplicate " + kind + " plugins registered for name '" + name + "': "
                        + existing.getClass().getName() + " and " + plugin.getClass().getName());
            }
            LOG.debugf("Registered %s plugin %s (%s)", kind, name, plugin.getClass().getSimpleName());
        }
        return Collections.unmodifiableMap(registry);
    }

    /**
     * @throws ValidationException
     *             if no transformer is registered under {@code name}
     */
    public Transformer transformer(String name) {
        Transformer transformer = transformers.get(name);
        if (transformer == null) {
            throw new ValidationException("Unknown transformer plugin: " + name);
        }
        return transformer;
    }

    /**
     * @throws ValidationException
     *             if no distributor is registered under {@code name}
     */
    public Distributor distributor(String name) {
        Distributor distributor = distributors.get(name);
        if (distributor == null) {
            throw new ValidationException("Unknown distributor plugin: " + name);
        }
        return distributor;
    }

    public Set<String> transformerNames() {
        return transformers.keySet();
    }

    public Set<String> distributorNames() {
        return distributors.keySet();
    }
}
