package com.platform.drengine.persistence.adapter;

import com.platform.drengine.health.HealthSnapshot;
import com.platform.drengine.health.HealthSnapshotRepository;
import com.platform.drengine.persistence.EntityMappers;
import com.platform.drengine.persistence.repository.HealthSnapshotJpaRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Component
public class JpaHealthSnapshotRepository implements HealthSnapshotRepository {
    
    private final HealthSnapshotJpaRepository jpaRepository;
    private final EntityMappers mappers;
    
    public JpaHealthSnapshotRepository(HealthSnapshotJpaRepository jpaRepository, EntityMappers mappers) {
        this.jpaRepository = jpaRepository;
        this.mappers = mappers;
    }
    
    @Override
    @Transactional
    public HealthSnapshot save(HealthSnapshot snapshot) {
        return mappers.toDomain(jpaRepository.save(mappers.toEntity(snapshot)));
    }
    
    @Override
    @Transactional(readOnly = true)
    public Optional<HealthSnapshot> findLatest(String primaryRegion) {
        return jpaRepository.findFirstByPrimaryRegionOrderByCapturedAtDesc(primaryRegion).map(mappers::toDomain);
    }
    
    @Override
    @Transactional(readOnly = true)
    public List<HealthSnapshot> findBetween(String primaryRegion, Instant from, Instant to) {
        return jpaRepository
            .findByPrimaryRegionAndCapturedAtGreaterThanEqualAndCapturedAtBeforeOrderByCapturedAtAsc(primaryRegion, from, to)
            .stream()
            .map(mappers::toDomain)
            .toList();
    }
    
    @Override
    @Transactional
    public int deleteCapturedBefore(Instant cutoff) {
        return jpaRepository.deleteCapturedBefore(cutoff);
    }
}
