package com.platform.drengine.persistence.repository;

import com.platform.drengine.persistence.entity.ReplicationLinkEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ReplicationLinkJpaRepository extends JpaRepository<ReplicationLinkEntity, String> {
    
    Optional<ReplicationLinkEntity> findByPrimaryRegionAndReplicaRegion(String primaryRegion, String replicaRegion);
    
    List<ReplicationLinkEntity> findByPrimaryRegion(String primaryRegion);
}
