package com.platform.drengine.persistence.repository;

import com.platform.drengine.persistence.entity.HealthSnapshotEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA repository for health snapshots.
 */
@Repository
public interface HealthSnapshotJpaRepository extends JpaRepository<HealthSnapshotEntity, String> {
    
    Optional<HealthSnapshotEntity> findFirstByPrimaryRegionOrderByCapturedAtDesc(String primaryRegion);
    
    List<HealthSnapshotEntity> findByPrimaryRegionAndCapturedAtGreaterThanEqualAndCapturedAtBeforeOrderByCapturedAtAsc(
        String primaryRegion, Instant from, Instant to);
    
    @Modifying
    @Query("DELETE FROM HealthSnapshotEntity s WHERE s.capturedAt < :cutoff")
    int deleteCapturedBefore(@Param("cutoff") Instant cutoff);
}
