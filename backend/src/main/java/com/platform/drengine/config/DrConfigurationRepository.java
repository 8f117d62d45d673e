package com.platform.drengine.config;

import java.util.List;
import java.util.Optional;

public interface DrConfigurationRepository {

    DrConfiguration save(DrConfiguration configuration);

    Optional<DrConfiguration> findByScope(String scopeKey);

    List<DrConfiguration> findAll();
}
