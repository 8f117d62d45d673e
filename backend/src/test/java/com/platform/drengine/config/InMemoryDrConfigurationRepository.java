package com.platform.drengine.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryDrConfigurationRepository implements DrConfigurationRepository {

    private final Map<String, DrConfiguration> configurations = new ConcurrentHashMap<>();

    @Override
    public DrConfiguration save(DrConfiguration configuration) {
        long version = configuration.getVersion() == null ? 0 : configuration.getVersion() + 1;
        DrConfiguration saved = configuration.toBuilder().version(version).build();
        configurations.put(saved.getScopeKey(), saved);
        return saved;
    }

    @Override
    public Optional<DrConfiguration> findByScope(String scopeKey) {
        return Optional.ofNullable(configurations.get(scopeKey));
    }

    @Override
    public List<DrConfiguration> findAll() {
        return new ArrayList<>(configurations.values());
    }
}
