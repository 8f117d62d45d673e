package com.platform.drengine.persistence.adapter;

import com.platform.drengine.config.DrConfiguration;
import com.platform.drengine.config.DrConfigurationRepository;
import com.platform.drengine.persistence.EntityMappers;
import com.platform.drengine.persistence.entity.DrConfigurationEntity;
import com.platform.drengine.persistence.repository.DrConfigurationJpaRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Component
public class JpaDrConfigurationRepository implements DrConfigurationRepository {
    
    private final DrConfigurationJpaRepository jpaRepository;
    private final EntityMappers mappers;
    
    public JpaDrConfigurationRepository(DrConfigurationJpaRepository jpaRepository, EntityMappers mappers) {
        this.jpaRepository = jpaRepository;
        this.mappers = mappers;
    }
    
    @Override
    @Transactional
    public DrConfiguration save(DrConfiguration configuration) {
        DrConfigurationEntity saved = jpaRepository.save(mappers.toEntity(configuration));
        return mappers.toDomain(saved);
    }
    
    @Override
    @Transactional(readOnly = true)
    public Optional<DrConfiguration> findByScope(String scopeKey) {
        return jpaRepository.findById(scopeKey).map(mappers::toDomain);
    }
    
    @Override
    @Transactional(readOnly = true)
    public List<DrConfiguration> findAll() {
        return jpaRepository.findAll().stream().map(mappers::toDomain).toList();
    }
}
