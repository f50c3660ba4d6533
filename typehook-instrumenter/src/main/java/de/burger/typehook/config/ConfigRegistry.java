package de.burger.typehook.config;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Assigns each distinct {@link InstrumentationConfig} instance a stable integer id. Emitted hooks
 * carry the id and the runtime side resolves it back through {@link #lookup(int)}.
 * Shared by concurrent instrumentation runs, hence synchronized.
 *
 * <p>Registered configs are held strongly and never released: ids are baked into emitted code,
 * which may run at any later point, so an id must stay resolvable for the life of the registry.
 * Callers should reuse config instances rather than building one per module.
 */
public final class ConfigRegistry {

    private static final ConfigRegistry SHARED = new ConfigRegistry();

    private final Map<InstrumentationConfig, Integer> ids = new IdentityHashMap<>();
    private final List<InstrumentationConfig> configs = new ArrayList<>();

    public static ConfigRegistry shared() {
        return SHARED;
    }

    /** Id of {@code config}, registering it on first sight. Same instance, same id. */
    public synchronized int register(InstrumentationConfig config) {
        Objects.requireNonNull(config, "config");
        Integer known = ids.get(config);
        if (known != null) {
            return known;
        }
        int id = configs.size();
        configs.add(config);
        ids.put(config, id);
        return id;
    }

    public synchronized Optional<InstrumentationConfig> lookup(int id) {
        if (id < 0 || id >= configs.size()) {
            return Optional.empty();
        }
        return Optional.of(configs.get(id));
    }

    public synchronized int size() {
        return configs.size();
    }
}
