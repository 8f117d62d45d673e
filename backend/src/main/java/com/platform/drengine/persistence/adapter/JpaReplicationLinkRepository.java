package com.platform.drengine.persistence.adapter;

import com.platform.drengine.persistence.EntityMappers;
import com.platform.drengine.persistence.entity.ReplicationLinkEntity;
import com.platform.drengine.persistence.repository.ReplicationLinkJpaRepository;
import com.platform.drengine.replication.ReplicationLink;
import com.platform.drengine.replication.ReplicationLinkRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Component
public class JpaReplicationLinkRepository implements ReplicationLinkRepository {
    
    private final ReplicationLinkJpaRepository jpaRepository;
    private final EntityMappers mappers;
    
    public JpaReplicationLinkRepository(ReplicationLinkJpaRepository jpaRepository, EntityMappers mappers) {
        this.jpaRepository = jpaRepository;
        this.mappers = mappers;
    }
    
    @Override
    @Transactional
    public ReplicationLink save(ReplicationLink link) {
        ReplicationLinkEntity entity = mappers.toEntity(link);
        if (entity.getVersion() == null) {
            entity.setVersion(jpaRepository.findById(entity.getId()).map(ReplicationLinkEntity::getVersion).orElse(null));
        }
        return mappers.toDomain(jpaRepository.save(entity));
    }
    
    @Override
    @Transactional(readOnly = true)
    public Optional<ReplicationLink> findById(UUID id) {
        return jpaRepository.findById(id.toString()).map(mappers::toDomain);
    }
    
    @Override
    @Transactional(readOnly = true)
    public Optional<ReplicationLink> findByPair(String primaryRegion, String replicaRegion) {
        return jpaRepository.findByPrimaryRegionAndReplicaRegion(primaryRegion, replicaRegion).map(mappers::toDomain);
    }
    
    @Override
    @Transactional(readOnly = true)
    public List<ReplicationLink> findByPrimaryRegion(String primaryRegion) {
        return jpaRepository.findByPrimaryRegion(primaryRegion).stream().map(mappers::toDomain).toList();
    }
    
    @Override
    @Transactional(readOnly = true)
    public List<ReplicationLink> findAll() {
        return jpaRepository.findAll().stream().map(mappers::toDomain).toList();
    }
}
