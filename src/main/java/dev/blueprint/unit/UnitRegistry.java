package dev.blueprint.unit;

import dev.blueprint.exception.PipelineConfigurationException;
import dev.blueprint.exception.UnitNotRegisteredException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Name → unit table. Instances are built lazily on first {@link #resolve} and reused for the
 * lifetime of the registry. One registry per process, injected where needed.
 */
public class UnitRegistry {

    private static final Logger log = LoggerFactory.getLogger(UnitRegistry.class);

    private final Map<String, Supplier<? extends PipelineUnit>> factories = new ConcurrentHashMap<>();
    private final Map<String, PipelineUnit> instances = new ConcurrentHashMap<>();

    public void register(String name, Supplier<? extends PipelineUnit> factory) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("unit name required");
        if (factory == null) throw new IllegalArgumentException("factory required for " + name);
        if (factories.putIfAbsent(name, factory) != null)
            throw new IllegalStateException("Unit already registered: " + name);
        log.info("Registered unit: {}", name);
    }

    /**
     * @throws UnitNotRegisteredException if no factory exists for {@code name}
     */
    public PipelineUnit resolve(String name) {
        Supplier<? extends PipelineUnit> factory = factories.get(name);
        if (factory == null) throw new UnitNotRegisteredException(name);
        return instances.computeIfAbsent(name, n -> {
            PipelineUnit unit = factory.get();
            if (unit == null) throw new PipelineConfigurationException("Factory for unit " + n + " returned null");
            log.debug("Instantiated unit {} ({})", n, unit.getClass().getSimpleName());
            return unit;
        });
    }

    public boolean isRegistered(String name) {
        return name != null && factories.containsKey(name);
    }

    public Set<String> registeredNames() {
        return new TreeSet<>(factories.keySet());
    }

    public boolean isEmpty() {
        return factories.isEmpty();
    }
}
