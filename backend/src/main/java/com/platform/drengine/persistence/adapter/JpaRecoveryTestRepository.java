package com.platform.drengine.persistence.adapter;

import com.platform.drengine.persistence.EntityMappers;
import com.platform.drengine.persistence.entity.RecoveryTestEntity;
import com.platform.drengine.persistence.repository.RecoveryTestJpaRepository;
import com.platform.drengine.recoverytest.RecoveryTest;
import com.platform.drengine.recoverytest.RecoveryTestRepository;
import com.platform.drengine.recoverytest.TestStatus;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Component
public class JpaRecoveryTestRepository implements RecoveryTestRepository {
    
    private final RecoveryTestJpaRepository jpaRepository;
    private final EntityMappers mappers;
    
    public JpaRecoveryTestRepository(RecoveryTestJpaRepository jpaRepository, EntityMappers mappers) {
        this.jpaRepository = jpaRepository;
        this.mappers = mappers;
    }
    
    @Override
    @Transactional
    public RecoveryTest save(RecoveryTest test) {
        RecoveryTestEntity entity = mappers.toEntity(test);
        if (entity.getVersion() == null) {
            entity.setVersion(jpaRepository.findById(entity.getId()).map(RecoveryTestEntity::getVersion).orElse(null));
        }
        return mappers.toDomain(jpaRepository.save(entity));
    }
    
    @Override
    @Transactional(readOnly = true)
    public Optional<RecoveryTest> findById(UUID id) {
        return jpaRepository.findById(id.toString()).map(mappers::toDomain);
    }
    
    @Override
    @Transactional(readOnly = true)
    public List<RecoveryTest> findAll() {
        return jpaRepository.findAll().stream().map(mappers::toDomain).toList();
    }
    
    @Override
    @Transactional(readOnly = true)
    public List<RecoveryTest> findByStatus(TestStatus status) {
        return jpaRepository.findByStatus(status).stream().map(mappers::toDomain).toList();
    }
    
    @Override
    @Transactional(readOnly = true)
    public List<RecoveryTest> findScheduledBetween(Instant from, Instant to) {
        return jpaRepository.findByScheduledForGreaterThanEqualAndScheduledForBeforeOrderByScheduledForAsc(from, to).stream()
            .map(mappers::toDomain)
            .toList();
    }
    
    @Override
    @Transactional(readOnly = true)
    public List<RecoveryTest> findCompletedBetween(Instant from, Instant to) {
        return jpaRepository.findByCompletedAtGreaterThanEqualAndCompletedAtBefore(from, to).stream()
            .map(mappers::toDomain)
            .toList();
    }
}
