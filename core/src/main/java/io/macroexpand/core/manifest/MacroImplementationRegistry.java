package io.macroexpand.core.manifest;

import io.macroexpand.core.spi.MacroImplementation;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of macro implementations that manifests refer to by id. Thread-safe: registration and
 * lookup can happen concurrently.
 */
public final class MacroImplementationRegistry {

    private final Map<String, MacroImplementation> implementations = new ConcurrentHashMap<>();

    /**
     * Registers an implementation. An implementation with the same id is replaced.
     *
     * @throws NullPointerException     if implementation or its id is null
     * @throws IllegalArgumentException if the id is empty
     */
    public void register(MacroImplementation implementation) {
        if (implementation == null) {
            throw new NullPointerException("implementation must not be null");
        }
        String id = implementation.id();
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("implementation id must not be null or empty");
        }
        implementations.put(id, implementation);
    }

    public Optional<MacroImplementation> getImplementation(String id) {
        return Optional.ofNullable(implementations.get(id));
    }

    public boolean hasImplementation(String id) {
        return implementations.containsKey(id);
    }

    public int size() {
        return implementations.size();
    }
}
