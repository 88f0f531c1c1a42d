package com.jupiter.query.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registry of the query providers available in this process, keyed by backend.
 * Built once at startup and read-only afterwards.
 */
public class ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final Map<QueryBackend, QueryProvider> providers;

    public ProviderRegistry(Collection<? extends QueryProvider> providers) {
        EnumMap<QueryBackend, QueryProvider> registered = new EnumMap<>(QueryBackend.class);
        for (QueryProvider provider : providers) {
            QueryBackend backend = provider.backend();
            if (backend == QueryBackend.AUTO) {
                throw new IllegalArgumentException("Provider cannot be registered under the auto selector");
            }
            if (registered.putIfAbsent(backend, provider) != null) {
                throw new IllegalArgumentException("Duplicate provider for backend " + backend);
            }
            log.info("Registered query provider {} ({})", backend, provider.getClass().getSimpleName());
        }
        this.providers = Collections.unmodifiableMap(registered);
    }

    public static ProviderRegistry of(QueryProvider... providers) {
        return new ProviderRegistry(List.of(providers));
    }

    public Optional<QueryProvider> get(QueryBackend backend) {
        return Optional.ofNullable(providers.get(backend));
    }

    public boolean isRegistered(QueryBackend backend) {
        return providers.containsKey(backend);
    }

    /**
     * @return registered backends in declaration order
     */
    public Set<QueryBackend> backends() {
        return providers.keySet();
    }
}
