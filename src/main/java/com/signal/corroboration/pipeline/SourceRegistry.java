package com.signal.corroboration.pipeline;

import com.signal.corroboration.source.SourceAdapter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Ordered map of source id to adapter factory. A factory is invoked once per run, so every
 * run gets fresh adapters (and fresh fetchers where the factory creates them).
 */
public class SourceRegistry {

    private final Map<String, Supplier<? extends SourceAdapter>> factories = new LinkedHashMap<>();

    /**
     * @throws IllegalArgumentException if the id is already registered
     */
    public SourceRegistry register(String id, Supplier<? extends SourceAdapter> factory) {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(factory, "factory is required");
        if (factories.putIfAbsent(id, factory) != null) {
            throw new IllegalArgumentException("Source already registered: " + id);
        }
        return this;
    }

    public boolean contains(String id) {
        return factories.containsKey(id);
    }

    public Optional<Supplier<? extends SourceAdapter>> factory(String id) {
        return Optional.ofNullable(factories.get(id));
    }

    /**
     * Registered ids in registration order.
     */
    public List<String> ids() {
        return List.copyOf(factories.keySet());
    }

    public int size() {
        return factories.size();
    }
}
